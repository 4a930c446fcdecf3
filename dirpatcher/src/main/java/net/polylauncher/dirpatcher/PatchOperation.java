package net.polylauncher.dirpatcher;

/**
 * What a {@link PatchEntry} does to its file.
 */
public enum PatchOperation {
    /**
     * The file is new and is written with the full content carried by the entry.
     */
    ADD,
    /**
     * The file exists in both states and is rewritten by replaying a delta.
     */
    MODIFY,
    /**
     * The file no longer exists and is deleted.
     */
    REMOVE
}
