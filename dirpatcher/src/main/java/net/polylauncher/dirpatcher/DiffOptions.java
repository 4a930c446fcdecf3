package net.polylauncher.dirpatcher;

import net.polylauncher.cliutils.progress.ProgressManager;
import net.polylauncher.cliutils.progress.ProgressReporter;

import java.util.function.Predicate;

public final class DiffOptions {
    /**
     * Format version stamped onto built packages.
     */
    private int formatVersion = PackageCodec.CURRENT_FORMAT_VERSION;

    /**
     * Optional predicate that will be tested against every relative path from the before and after tree to
     * determine whether the path participates in diffing.
     */
    private Predicate<String> pathFilter = path -> true;

    /**
     * Number of threads used to read and diff files. Entries are always emitted in path order.
     */
    private int threads = 1;

    private SymlinkHandling symlinkHandling = SymlinkHandling.SKIP;

    private ProgressManager progress = ProgressReporter.getDefault();

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    public Predicate<String> getPathFilter() {
        return pathFilter;
    }

    public void setPathFilter(Predicate<String> pathFilter) {
        this.pathFilter = pathFilter;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("At least one thread is required: " + threads);
        }
        this.threads = threads;
    }

    public SymlinkHandling getSymlinkHandling() {
        return symlinkHandling;
    }

    public void setSymlinkHandling(SymlinkHandling symlinkHandling) {
        this.symlinkHandling = symlinkHandling;
    }

    public ProgressManager getProgress() {
        return progress;
    }

    public void setProgress(ProgressManager progress) {
        this.progress = progress;
    }
}
