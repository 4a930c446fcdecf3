package net.polylauncher.dirpatcher;

import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * Thrown when building, encoding, decoding or applying a patch package fails.
 * <p>
 * The {@link #getReason() reason} tells callers what kind of failure occurred; where the failure concerns a
 * single file, {@link #getRelativePath()} names it.
 */
public class PatchException extends IOException {
    public enum Reason {
        /**
         * Reading, writing or traversing the filesystem failed.
         */
        IO,
        /**
         * Computing or replaying a content delta failed.
         */
        DIFF,
        /**
         * The serialized package is malformed.
         */
        CORRUPT_PACKAGE,
        /**
         * The package uses a format version that is not supported.
         */
        UNSUPPORTED_VERSION,
        /**
         * An entry path resolves outside the target directory.
         */
        PATH_ESCAPE,
        /**
         * A path component is, or would overwrite, a symbolic link.
         */
        SYMLINK_REFUSED,
        /**
         * A content fingerprint did not match before or after applying a delta.
         */
        INTEGRITY_MISMATCH
    }

    private final Reason reason;
    @Nullable
    private final String relativePath;

    public PatchException(Reason reason, String message) {
        this(reason, null, message, null);
    }

    public PatchException(Reason reason, String message, @Nullable Throwable cause) {
        this(reason, null, message, cause);
    }

    public PatchException(Reason reason, @Nullable String relativePath, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.relativePath = relativePath;
    }

    static PatchException forEntry(Reason reason, RelativePath path, String message) {
        return new PatchException(reason, path.toString(), message, null);
    }

    static PatchException forEntry(Reason reason, RelativePath path, String message, Throwable cause) {
        return new PatchException(reason, path.toString(), message, cause);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the relative path of the entry or file the failure concerns, or null if it is not specific to one
     */
    @Nullable
    public String getRelativePath() {
        return relativePath;
    }
}
