package net.polylauncher.dirpatcher;

import com.nothome.delta.Delta;
import com.nothome.delta.GDiffPatcher;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes GDIFF deltas using javaxdelta and fingerprints content with SHA-256.
 */
public class GDiffContentDiffer implements ContentDiffer {
    public static final String FINGERPRINT_ALGORITHM = "SHA-256";
    public static final int FINGERPRINT_LENGTH = 32;

    @Override
    public FileDelta diff(byte[] before, byte[] after) throws IOException {
        byte[] payload = new Delta().compute(before, after);
        return new FileDelta(payload, fingerprint(before), fingerprint(after));
    }

    @Override
    public byte[] applyDelta(byte[] before, FileDelta delta) throws IOException {
        return new GDiffPatcher().patch(before, delta.getPayload());
    }

    @Override
    public Fingerprint fingerprint(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(FINGERPRINT_ALGORITHM);
            return Fingerprint.of(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new Error(e); // Standard JCA algorithm is missing
        }
    }
}
