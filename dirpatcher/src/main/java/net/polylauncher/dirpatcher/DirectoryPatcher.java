package net.polylauncher.dirpatcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry points for creating and applying patch files between two states of a directory tree.
 */
public final class DirectoryPatcher {
    private DirectoryPatcher() {
    }

    /**
     * Writes a patch file at {@code patchLocation} describing the changes from {@code beforeDir} to {@code afterDir}.
     * The file is only written once the whole package has been built.
     */
    public static void createPatch(Path patchLocation, Path beforeDir, Path afterDir) throws IOException {
        createPatch(patchLocation, beforeDir, afterDir, new DiffOptions());
    }

    public static void createPatch(Path patchLocation, Path beforeDir, Path afterDir, DiffOptions options) throws IOException {
        PatchPackage patchPackage = new PatchBuilder(options).build(beforeDir, afterDir);
        byte[] encoded = PackageCodec.encode(patchPackage);

        try {
            Path parent = patchLocation.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(patchLocation, encoded);
        } catch (IOException e) {
            throw new PatchException(PatchException.Reason.IO, "Failed to write patch file: " + patchLocation, e);
        }
        ConsoleTool.debug("Wrote " + encoded.length + " bytes to " + patchLocation);
    }

    /**
     * Applies the patch file at {@code patchLocation} to {@code targetDir}, which is expected to be in the state the
     * patch was built from.
     * <p>
     * The format version is checked before the package body is decoded or the target is touched.
     */
    public static void applyPatch(Path patchLocation, Path targetDir) throws IOException {
        applyPatch(patchLocation, targetDir, new ApplyOptions());
    }

    public static void applyPatch(Path patchLocation, Path targetDir, ApplyOptions options) throws IOException {
        byte[] data;
        try {
            data = Files.readAllBytes(patchLocation);
        } catch (IOException e) {
            throw new PatchException(PatchException.Reason.IO, "Failed to read patch file: " + patchLocation, e);
        }

        int formatVersion = PackageCodec.peekFormatVersion(data);
        if (formatVersion != options.getFormatVersion()) {
            throw new PatchException(PatchException.Reason.UNSUPPORTED_VERSION, "Unsupported patch version: "
                    + Integer.toUnsignedString(formatVersion) + " (expected " + Integer.toUnsignedString(options.getFormatVersion()) + ")");
        }

        PatchPackage patchPackage = PackageCodec.decode(data);
        new PatchApplier(options).apply(patchPackage, targetDir);
    }
}
