/*
 * Copyright (c) Forge Development LLC
 * SPDX-License-Identifier: LGPL-2.1-only
 */
package net.polylauncher.dirpatcher;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import joptsimple.OptionSpecBuilder;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

public class ConsoleTool {
    public static final boolean DEBUG = Boolean.getBoolean("net.polylauncher.dirpatcher.debug");
    private static final int FINGERPRINT_DISPLAY_LENGTH = 16;

    public static void main(String[] args) throws IOException {
        OptionParser parser = new OptionParser();
        //Mode flags
        OptionSpecBuilder diffO = parser.accepts("diff", "Create a patch file from two directories");
        OptionSpecBuilder patchO = parser.accepts("patch", "Apply a patch file to a directory");
        OptionSpecBuilder listO = parser.accepts("list", "Print the entries of a patch file");

        parser.mutuallyExclusive(diffO, patchO, listO);

        // Diff arguments
        OptionSpec<File> beforeO = parser.accepts("before", "Directory in its old state").availableIf(diffO).requiredIf(diffO).withRequiredArg().ofType(File.class);
        OptionSpec<File> afterO = parser.accepts("after", "Directory in its new state").availableIf(diffO).requiredIf(diffO).withRequiredArg().ofType(File.class);
        OptionSpec<File> outputO = parser.accepts("output", "Patch file to write").availableIf(diffO).requiredIf(diffO).withRequiredArg().ofType(File.class);
        OptionSpec<String> includeO = parser.accepts("include", "Only diff paths matching this Ant-style pattern").availableIf(diffO).withRequiredArg().ofType(String.class);
        OptionSpec<String> excludeO = parser.accepts("exclude", "Skip paths matching this Ant-style pattern").availableIf(diffO).withRequiredArg().ofType(String.class);
        OptionSpec<Integer> threadsO = parser.accepts("threads", "Number of threads used for diffing").availableIf(diffO).withRequiredArg().ofType(Integer.class).defaultsTo(1);
        OptionSpec<Void> rejectSymlinksO = parser.accepts("reject-symlinks", "Fail instead of skipping symbolic links").availableIf(diffO);

        // Apply arguments
        OptionSpec<File> patchesO = parser.accepts("patches", "Patch file to apply or list").requiredIf(patchO, listO).withRequiredArg().ofType(File.class);
        OptionSpec<File> targetO = parser.accepts("target", "Directory to patch in place").availableIf(patchO).requiredIf(patchO).withRequiredArg().ofType(File.class);

        OptionSpec<Void> helpO = parser.acceptsAll(Arrays.asList("?", "help")).forHelp();

        try {
            OptionSet options = parser.parse(args);

            if (options.has(helpO)) {
                parser.printHelpOn(System.out);
                return;
            }

            if (options.has(listO)) {
                listPatchPackage(options.valueOf(patchesO), System.out);
            } else if (options.has(diffO)) {
                File before = options.valueOf(beforeO);
                File after = options.valueOf(afterO);
                File output = options.valueOf(outputO).getAbsoluteFile();
                int threads = options.valueOf(threadsO);
                if (threads < 1) {
                    log("--threads must be at least 1, got " + threads);
                    parser.printHelpOn(System.out);
                    return;
                }

                DiffOptions diffOptions = new DiffOptions();
                diffOptions.setPathFilter(PathFilters.create(options.valuesOf(includeO), options.valuesOf(excludeO)));
                diffOptions.setThreads(threads);
                diffOptions.setSymlinkHandling(options.has(rejectSymlinksO) ? SymlinkHandling.REJECT : SymlinkHandling.SKIP);

                log("Generating: ");
                log("  Before:  " + before);
                log("  After:   " + after);
                log("  Output:  " + output);
                log("Diff Options: ");
                log("  Includes: " + options.valuesOf(includeO));
                log("  Excludes: " + options.valuesOf(excludeO));
                log("  Threads:  " + diffOptions.getThreads());
                log("  Symlinks: " + diffOptions.getSymlinkHandling());

                DirectoryPatcher.createPatch(output.toPath(), before.toPath(), after.toPath(), diffOptions);
            } else if (options.has(patchO)) {
                File patchFile = options.valueOf(patchesO);
                File target = options.valueOf(targetO);

                long start = System.currentTimeMillis();

                log("Applying: ");
                log("  Patch:   " + patchFile);
                log("  Target:  " + target);

                DirectoryPatcher.applyPatch(patchFile.toPath(), target.toPath());

                debug("Completed in " + (System.currentTimeMillis() - start) + "ms");
            } else {
                parser.printHelpOn(System.out);
            }
        } catch (OptionException e) {
            parser.printHelpOn(System.out);
            e.printStackTrace();
        }
    }

    static void listPatchPackage(File patchFile, PrintStream out) throws IOException {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"Path", "Operation", "Before Fingerprint", "Size"});

        try (PatchPackageReader reader = new PatchPackageReader(patchFile.toPath())) {
            out.println("Format version: " + Integer.toUnsignedString(reader.getFormatVersion()));
            out.println("Entries: " + reader.getEntryCount());
            out.println();

            List<PatchEntry> modifications = new ArrayList<>();
            for (PatchEntry entry : reader) {
                String fingerprint = "";
                if (entry.getOperation() == PatchOperation.MODIFY) {
                    fingerprint = entry.getDelta().getBeforeFingerprint().toString().substring(0, FINGERPRINT_DISPLAY_LENGTH);
                    modifications.add(entry);
                }
                String size = entry.getOperation() != PatchOperation.REMOVE ? String.valueOf(entry.getPayloadSize()) : "";
                rows.add(new String[]{entry.getRelativePath().toString(), entry.getOperation().name(), fingerprint, size});
            }

            printMarkdownTable(rows, out);
            out.println();

            // Sort by delta size in descending order. Skip ADD since their size is obvious.
            modifications.sort(Comparator.comparingInt(PatchEntry::getPayloadSize).reversed());
            out.println("Largest MODIFY patches:");
            out.println();
            List<String[]> maxSizeRows = new ArrayList<>(11);
            maxSizeRows.add(new String[]{"Target Path", "Size"});
            for (int i = 0; i < Math.min(10, modifications.size()); i++) {
                PatchEntry entry = modifications.get(i);
                maxSizeRows.add(new String[]{entry.getRelativePath().toString(), String.valueOf(entry.getPayloadSize())});
            }
            printMarkdownTable(maxSizeRows, out);
        }
    }

    private static void printMarkdownTable(List<String[]> rows, PrintStream out) {
        // Determine col widths
        int[] colWidths = new int[rows.get(0).length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                colWidths[i] = Math.max(colWidths[i], row[i].length());
            }
        }

        boolean printingHeaderRow = true;
        for (String[] row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.length; i++) {
                line.append("| ").append(row[i]).append(repeat(' ', colWidths[i] - row[i].length())).append(' ');
            }
            out.println(line.append('|'));
            if (printingHeaderRow) {
                StringBuilder separator = new StringBuilder();
                for (int colWidth : colWidths) {
                    separator.append("| ").append(repeat('-', colWidth)).append(' ');
                }
                out.println(separator.append('|'));
                printingHeaderRow = false;
            }
        }
    }

    private static String repeat(char ch, int repeat) {
        char[] buffer = new char[repeat];
        Arrays.fill(buffer, ch);
        return String.valueOf(buffer);
    }

    public static void log(String message) {
        System.out.println(message);
    }

    public static void debug(String message) {
        if (DEBUG) {
            log(message);
        }
    }
}
