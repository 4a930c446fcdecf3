package net.polylauncher.dirpatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, versioned collection of {@link PatchEntry entries} that moves a directory tree from one state to
 * another. Packages are immutable once created.
 */
public final class PatchPackage {
    private final int formatVersion;
    private final List<PatchEntry> entries;

    public PatchPackage(int formatVersion, List<PatchEntry> entries) {
        if (formatVersion < 0) {
            throw new IllegalArgumentException("Format version must be an unsigned value: " + formatVersion);
        }
        this.formatVersion = formatVersion;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    /**
     * The entries in the order they must be applied.
     */
    public List<PatchEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
