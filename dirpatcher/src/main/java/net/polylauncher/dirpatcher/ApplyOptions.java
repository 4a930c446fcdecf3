package net.polylauncher.dirpatcher;

import net.polylauncher.cliutils.progress.ProgressManager;
import net.polylauncher.cliutils.progress.ProgressReporter;

public final class ApplyOptions {
    /**
     * The only package format version that will be applied.
     */
    private int formatVersion = PackageCodec.CURRENT_FORMAT_VERSION;

    private ProgressManager progress = ProgressReporter.getDefault();

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    public ProgressManager getProgress() {
        return progress;
    }

    public void setProgress(ProgressManager progress) {
        this.progress = progress;
    }
}
