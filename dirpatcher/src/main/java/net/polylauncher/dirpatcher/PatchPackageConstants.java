package net.polylauncher.dirpatcher;

import java.nio.charset.StandardCharsets;

/**
 * Package-private constants shared between PatchPackageWriter and PatchPackageReader.
 */
class PatchPackageConstants {
    // File signature
    static final byte[] PACKAGE_SIGNATURE = "DIRPATCH".getBytes(StandardCharsets.US_ASCII);

    static final int CURRENT_FORMAT_VERSION = 1;

    // signature, format version, entry count, body length
    static final int HEADER_LENGTH = PACKAGE_SIGNATURE.length + 4 + 4 + 8;

    // Entry type constants
    static final int ENTRY_TYPE_ADD = 0;
    static final int ENTRY_TYPE_MODIFY = 1;
    static final int ENTRY_TYPE_REMOVE = 2;

    // type byte, path length, at least one path byte
    static final int MIN_ENTRY_LENGTH = 1 + 2 + 1;

    static final int FINGERPRINT_LENGTH = GDiffContentDiffer.FINGERPRINT_LENGTH;
    static final int MAX_PATH_LENGTH = 0xFFFF;

    // The body is buffered as a single array when written
    static final long MAX_BODY_LENGTH = Integer.MAX_VALUE;

    // Payloads are read in chunks of this size so a declared length is never allocated up front
    static final int READ_CHUNK_SIZE = 64 * 1024;

    // Decoder memory limit in KiB, well above what the default LZMA2 preset needs
    static final int LZMA_MEMORY_LIMIT = 64 * 1024;

    private PatchPackageConstants() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    static boolean isSupportedVersion(int formatVersion) {
        return formatVersion == CURRENT_FORMAT_VERSION;
    }

    static boolean isValidPathCharacter(int codePoint) {
        return codePoint != 0;
    }
}
