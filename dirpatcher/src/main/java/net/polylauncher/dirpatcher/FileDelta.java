package net.polylauncher.dirpatcher;

/**
 * The difference between two versions of a file, together with the fingerprints of both versions.
 * The payload format is owned by the {@link ContentDiffer} that produced it.
 */
public final class FileDelta {
    private final byte[] payload;
    private final Fingerprint beforeFingerprint;
    private final Fingerprint afterFingerprint;

    public FileDelta(byte[] payload, Fingerprint beforeFingerprint, Fingerprint afterFingerprint) {
        this.payload = payload;
        this.beforeFingerprint = beforeFingerprint;
        this.afterFingerprint = afterFingerprint;
    }

    public byte[] getPayload() {
        return payload;
    }

    public Fingerprint getBeforeFingerprint() {
        return beforeFingerprint;
    }

    public Fingerprint getAfterFingerprint() {
        return afterFingerprint;
    }
}
