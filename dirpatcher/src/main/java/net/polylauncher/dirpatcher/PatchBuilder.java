/*
 * Copyright (c) Forge Development LLC
 * SPDX-License-Identifier: LGPL-2.1-only
 */
package net.polylauncher.dirpatcher;

import net.polylauncher.cliutils.progress.ProgressManager;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Computes the {@link PatchPackage} that moves a directory tree from its before state to its after state.
 * <p>
 * The whole package is assembled in memory; nothing is written when any file fails to be read or diffed.
 */
public final class PatchBuilder {
    private final DiffOptions options;
    private final ContentDiffer differ;
    private final TreeScanner scanner;

    public PatchBuilder(DiffOptions options) {
        this(options, new GDiffContentDiffer());
    }

    public PatchBuilder(DiffOptions options, ContentDiffer differ) {
        this.options = options;
        this.differ = differ;
        this.scanner = new TreeScanner(options.getSymlinkHandling());
    }

    private static class DiffTask {
        private final RelativePath path;
        @Nullable
        private final Path beforeFile;
        @Nullable
        private final Path afterFile;

        DiffTask(RelativePath path, @Nullable Path beforeFile, @Nullable Path afterFile) {
            this.path = path;
            this.beforeFile = beforeFile;
            this.afterFile = afterFile;
        }

        /**
         * @return the entry for this path, or null if the file is unchanged
         */
        @Nullable
        PatchEntry createEntry(ContentDiffer differ) throws IOException {
            if (beforeFile != null && afterFile != null) {
                byte[] beforeContent = read(beforeFile);
                byte[] afterContent = read(afterFile);
                if (Arrays.equals(beforeContent, afterContent)) {
                    return null; // The content matches, no need to diff
                }
                FileDelta delta;
                try {
                    delta = differ.diff(beforeContent, afterContent);
                } catch (IOException | RuntimeException e) {
                    throw PatchException.forEntry(PatchException.Reason.DIFF, path, "Failed to compute diff for file: " + path, e);
                }
                return PatchEntry.createModify(path, delta);
            } else if (beforeFile != null) {
                return PatchEntry.createRemove(path);
            } else if (afterFile != null) {
                return PatchEntry.createAdd(path, read(afterFile));
            }
            return null; // In neither tree, cannot happen for scanned paths
        }

        private byte[] read(Path file) throws PatchException {
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                throw PatchException.forEntry(PatchException.Reason.IO, path, "Failed to read file: " + file, e);
            }
        }
    }

    public PatchPackage build(Path beforeRoot, Path afterRoot) throws IOException {
        SortedSet<RelativePath> beforePaths = scanner.scan(beforeRoot);
        SortedSet<RelativePath> afterPaths = scanner.scan(afterRoot);

        SortedSet<RelativePath> allPaths = new TreeSet<>(beforePaths);
        allPaths.addAll(afterPaths);

        List<DiffTask> tasks = new ArrayList<>(allPaths.size());
        for (RelativePath path : allPaths) {
            if (!options.getPathFilter().test(path.toString())) {
                debug("Excluding " + path);
                continue;
            }
            if (!PatchPackageWriter.isEncodable(path)) {
                throw PatchException.forEntry(PatchException.Reason.IO, path, "Path cannot be stored in a patch package: " + path);
            }
            tasks.add(new DiffTask(
                    path,
                    beforePaths.contains(path) ? path.resolveAgainst(beforeRoot) : null,
                    afterPaths.contains(path) ? path.resolveAgainst(afterRoot) : null
            ));
        }

        log("Processing " + tasks.size() + " diff tasks");

        ProgressManager progress = options.getProgress();
        progress.setStep("Diffing files");
        progress.setMaxProgress(tasks.size());

        List<PatchEntry> entries = options.getThreads() > 1 ? diffParallel(tasks, progress) : diffSequential(tasks, progress);

        Map<PatchOperation, Integer> counts = new EnumMap<>(PatchOperation.class);
        for (PatchEntry entry : entries) {
            counts.merge(entry.getOperation(), 1, Integer::sum);
        }
        log("Built patch package: " + counts.getOrDefault(PatchOperation.ADD, 0) + " added, "
                + counts.getOrDefault(PatchOperation.MODIFY, 0) + " modified, "
                + counts.getOrDefault(PatchOperation.REMOVE, 0) + " removed, "
                + (tasks.size() - entries.size()) + " unchanged");

        return new PatchPackage(options.getFormatVersion(), entries);
    }

    private List<PatchEntry> diffSequential(List<DiffTask> tasks, ProgressManager progress) throws IOException {
        List<PatchEntry> entries = new ArrayList<>(tasks.size());
        int done = 0;
        for (DiffTask task : tasks) {
            addEntry(entries, task.createEntry(differ));
            progress.setProgress(++done);
        }
        return entries;
    }

    private List<PatchEntry> diffParallel(List<DiffTask> tasks, ProgressManager progress) throws IOException {
        ExecutorService executor = Executors.newFixedThreadPool(options.getThreads());
        try {
            List<CompletableFuture<PatchEntry>> futures = new ArrayList<>(tasks.size());
            for (DiffTask task : tasks) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return task.createEntry(differ);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }, executor));
            }

            // Collect in task order so the package does not depend on scheduling
            List<PatchEntry> entries = new ArrayList<>(tasks.size());
            int done = 0;
            for (CompletableFuture<PatchEntry> future : futures) {
                PatchEntry entry;
                try {
                    entry = future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while waiting on an off-thread diff.", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof UncheckedIOException) {
                        throw ((UncheckedIOException) cause).getCause();
                    }
                    if (cause instanceof IOException) {
                        throw (IOException) cause;
                    }
                    throw new IOException("An off-thread diff failed.", cause);
                }
                addEntry(entries, entry);
                progress.setProgress(++done);
            }
            return entries;
        } finally {
            executor.shutdownNow();
        }
    }

    private static void addEntry(List<PatchEntry> entries, @Nullable PatchEntry entry) {
        if (entry != null) {
            debug("  " + entry);
            entries.add(entry);
        }
    }

    private static void log(String message) {
        ConsoleTool.log(message);
    }

    private static void debug(String message) {
        ConsoleTool.debug(message);
    }
}
