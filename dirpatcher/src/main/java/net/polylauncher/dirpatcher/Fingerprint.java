package net.polylauncher.dirpatcher;

import java.util.Arrays;

/**
 * Content hash of a file, used to detect drift between the state a patch was built against and the state it is
 * applied to.
 */
public final class Fingerprint {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] digest;

    private Fingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static Fingerprint of(byte[] digest) {
        if (digest.length == 0) {
            throw new IllegalArgumentException("Fingerprint digest cannot be empty");
        }
        return new Fingerprint(digest.clone());
    }

    public byte[] getBytes() {
        return digest.clone();
    }

    public int length() {
        return digest.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(digest, ((Fingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        char[] chars = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            chars[i * 2] = HEX[(digest[i] >> 4) & 0xF];
            chars[i * 2 + 1] = HEX[digest[i] & 0xF];
        }
        return new String(chars);
    }
}
