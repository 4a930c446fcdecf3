package net.polylauncher.dirpatcher;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;

/**
 * Converts {@link PatchPackage patch packages} to and from their binary form.
 * <p>
 * Encoding is deterministic: the same package always produces the same bytes.
 */
public final class PackageCodec {
    /**
     * The format version written by this codec and the only one it can read.
     */
    public static final int CURRENT_FORMAT_VERSION = PatchPackageConstants.CURRENT_FORMAT_VERSION;

    private PackageCodec() {
    }

    public static boolean isSupportedVersion(int formatVersion) {
        return PatchPackageConstants.isSupportedVersion(formatVersion);
    }

    public static byte[] encode(PatchPackage patchPackage) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PatchPackageWriter writer = new PatchPackageWriter(out, patchPackage.getFormatVersion())) {
            for (PatchEntry entry : patchPackage.getEntries()) {
                writer.write(entry);
            }
        }
        return out.toByteArray();
    }

    /**
     * Fully decodes a package, validating its structure.
     *
     * @throws PatchException with {@link PatchException.Reason#CORRUPT_PACKAGE} for malformed input, or
     *                        {@link PatchException.Reason#UNSUPPORTED_VERSION} for an unknown format version
     */
    public static PatchPackage decode(byte[] data) throws IOException {
        try (PatchPackageReader reader = new PatchPackageReader(new ByteArrayInputStream(data))) {
            return reader.readPackage();
        }
    }

    /**
     * Reads only the format version from the package header, without looking at the entries.
     * The version is returned even if it is not supported.
     */
    public static int peekFormatVersion(byte[] data) throws IOException {
        return PatchPackageReader.readFormatVersion(new DataInputStream(new ByteArrayInputStream(data)));
    }
}
