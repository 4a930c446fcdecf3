package net.polylauncher.dirpatcher;

import java.io.IOException;

/**
 * Computes and replays binary deltas between two versions of a file.
 */
public interface ContentDiffer {
    /**
     * Computes the delta turning {@code before} into {@code after}.
     */
    FileDelta diff(byte[] before, byte[] after) throws IOException;

    /**
     * Reconstructs the new content of a file from its old content and a delta.
     * Fingerprints are not verified here, that is up to the caller.
     */
    byte[] applyDelta(byte[] before, FileDelta delta) throws IOException;

    Fingerprint fingerprint(byte[] content);
}
