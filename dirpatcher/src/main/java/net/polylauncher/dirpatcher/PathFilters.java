/*
 * Copyright (c) Forge Development LLC
 * SPDX-License-Identifier: LGPL-2.1-only
 */
package net.polylauncher.dirpatcher;

import java.util.Collection;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Ant-style path filters for selecting which files of a tree take part in diffing.
 */
public final class PathFilters {
    private static final String REGEX_SPECIAL = "\\[](){}+|^$.";

    private PathFilters() {
    }

    /**
     * Combines include and exclude patterns: a path passes if it matches any include (or there are none)
     * and matches no exclude.
     */
    public static Predicate<String> create(Collection<String> includes, Collection<String> excludes) {
        Predicate<String> included = includes.isEmpty() ? path -> true : compile(includes);
        Predicate<String> excluded = excludes.isEmpty() ? path -> false : compile(excludes);
        return included.and(excluded.negate());
    }

    public static Predicate<String> compile(Collection<String> patterns) {
        return Pattern.compile(toRegex(patterns)).asPredicate();
    }

    /**
     * Translates Ant-style patterns into a single anchored regular expression.
     * <ul>
     * <li>{@code ?} matches one character other than {@code /}</li>
     * <li>{@code *} matches any run of characters within a segment</li>
     * <li>{@code **} matches any number of segments, {@code **}{@code /} also matches none</li>
     * </ul>
     */
    public static String toRegex(Collection<String> patterns) {
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Can't build an empty filter");
        }

        StringBuilder regex = new StringBuilder("^(?:");
        String separator = "";
        for (String pattern : patterns) {
            regex.append(separator);
            separator = "|";
            appendPattern(regex, pattern);
        }
        return regex.append(")$").toString();
    }

    private static void appendPattern(StringBuilder regex, String pattern) {
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (pattern.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
            } else if (pattern.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                if (REGEX_SPECIAL.indexOf(c) != -1) {
                    regex.append('\\');
                }
                regex.append(c);
                i++;
            }
        }
    }
}
