package net.polylauncher.dirpatcher;

import java.nio.file.Path;

/**
 * A file path relative to the root of a directory tree, always separated by {@code /} and never starting with one.
 * <p>
 * Normalization only concerns separators. {@code .} and {@code ..} segments are kept as-is, they are rejected when
 * a package is applied.
 */
public final class RelativePath implements Comparable<RelativePath> {
    private final String path;

    private RelativePath(String path) {
        this.path = path;
    }

    /**
     * Creates a path from user input, treating both {@code /} and {@code \} as separators.
     */
    public static RelativePath of(String path) {
        return ofStored(path.replace('\\', '/'));
    }

    /**
     * Creates the relative path of {@code file} below {@code root}. File names are kept as they are, including any
     * backslashes, since they can never contain the separator of their own filesystem.
     */
    public static RelativePath of(Path root, Path file) {
        Path relative = root.relativize(file);
        StringBuilder joined = new StringBuilder();
        for (Path name : relative) {
            if (joined.length() > 0) {
                joined.append('/');
            }
            joined.append(name.toString());
        }
        return ofStored(joined.toString());
    }

    /**
     * Creates a path from its stored form, which already uses {@code /} as its only separator.
     */
    static RelativePath ofStored(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        String normalized = path.substring(start);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Relative path cannot be empty: '" + path + "'");
        }
        return new RelativePath(normalized);
    }

    /**
     * Resolves this path against a directory using the separator of the directory's filesystem.
     */
    public Path resolveAgainst(Path directory) {
        Path result = directory;
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                result = result.resolve(segment);
            }
        }
        return result;
    }

    @Override
    public int compareTo(RelativePath other) {
        return path.compareTo(other.path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return path.equals(((RelativePath) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
