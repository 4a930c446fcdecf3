/*
 * Copyright (c) Forge Development LLC
 * SPDX-License-Identifier: LGPL-2.1-only
 */
package net.polylauncher.dirpatcher;

import net.polylauncher.cliutils.progress.ProgressManager;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Replays a {@link PatchPackage} against a target directory, one entry at a time in package order.
 * <p>
 * Every entry path must stay inside the target directory and must not pass through a symbolic link. Modified
 * files are checked against the fingerprints recorded in the package before and after reconstruction, and are
 * only written once both checks pass.
 * <p>
 * Application is not transactional: when entry <i>k</i> fails, the entries before it remain applied and entry
 * <i>k</i> is left untouched.
 */
public class PatchApplier {
    private final ApplyOptions options;
    private final ContentDiffer differ;

    public PatchApplier(ApplyOptions options) {
        this(options, new GDiffContentDiffer());
    }

    public PatchApplier(ApplyOptions options, ContentDiffer differ) {
        this.options = options;
        this.differ = differ;
    }

    public void apply(PatchPackage patchPackage, Path targetRoot) throws IOException {
        if (!Files.exists(targetRoot, LinkOption.NOFOLLOW_LINKS)) {
            throw new PatchException(PatchException.Reason.IO, "Target directory does not exist: " + targetRoot);
        }
        if (Files.isSymbolicLink(targetRoot)) {
            throw new PatchException(PatchException.Reason.SYMLINK_REFUSED, "Target path must not be a symlink: " + targetRoot);
        }
        if (!Files.isDirectory(targetRoot, LinkOption.NOFOLLOW_LINKS)) {
            throw new PatchException(PatchException.Reason.IO, "Target path is not a directory: " + targetRoot);
        }
        if (patchPackage.getFormatVersion() != options.getFormatVersion()) {
            throw new PatchException(PatchException.Reason.UNSUPPORTED_VERSION, "Unsupported patch version: "
                    + Integer.toUnsignedString(patchPackage.getFormatVersion())
                    + " (expected " + Integer.toUnsignedString(options.getFormatVersion()) + ")");
        }

        Path root = targetRoot.toAbsolutePath().normalize();

        ProgressManager progress = options.getProgress();
        progress.setStep("Applying patch");
        progress.setMaxProgress(patchPackage.getEntries().size());

        log("Applying " + patchPackage.getEntries().size() + " patch entries to " + root);

        int done = 0;
        for (PatchEntry entry : patchPackage.getEntries()) {
            Path file = resolveEntry(root, entry.getRelativePath());
            debug("  " + entry);

            switch (entry.getOperation()) {
                case ADD:
                    applyAdd(entry, file);
                    break;
                case MODIFY:
                    applyModify(entry, file);
                    break;
                case REMOVE:
                    applyRemove(entry, file, root);
                    break;
                default:
                    throw new IllegalStateException("Unknown patch operation: " + entry.getOperation());
            }
            progress.setProgress(++done);
        }
    }

    /**
     * Resolves an entry path below the root, rejecting paths that leave the root or pass through a symbolic link.
     */
    static Path resolveEntry(Path root, RelativePath relativePath) throws PatchException {
        // Normalize lexically, without touching the filesystem
        Path file = relativePath.resolveAgainst(root).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw PatchException.forEntry(PatchException.Reason.PATH_ESCAPE, relativePath,
                    "Patch entry path " + relativePath + " escapes target directory " + root);
        }

        // No existing component below the root may be a link
        Path current = root;
        for (Path name : root.relativize(file)) {
            current = current.resolve(name);
            if (Files.isSymbolicLink(current)) {
                throw PatchException.forEntry(PatchException.Reason.SYMLINK_REFUSED, relativePath,
                        "Refusing to traverse symlink component: " + current);
            }
        }
        return file;
    }

    private void applyAdd(PatchEntry entry, Path file) throws IOException {
        RelativePath path = entry.getRelativePath();
        Path parent = file.getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw PatchException.forEntry(PatchException.Reason.IO, path, "Failed to create parent directories for file: " + file, e);
        }

        if (Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            refuseSymlink(path, file, "overwrite");
        }

        write(path, file, entry.getContent(), "Failed to write added file: ");
    }

    private void applyModify(PatchEntry entry, Path file) throws IOException {
        RelativePath path = entry.getRelativePath();
        FileDelta delta = entry.getDelta();

        refuseSymlink(path, file, "modify");
        byte[] current;
        try {
            current = Files.readAllBytes(file);
        } catch (IOException e) {
            throw PatchException.forEntry(PatchException.Reason.IO, path, "Failed to read file for modification: " + file, e);
        }

        Fingerprint currentFingerprint = differ.fingerprint(current);
        if (currentFingerprint.equals(delta.getAfterFingerprint())) {
            debug("    already up to date");
            return;
        }
        if (!currentFingerprint.equals(delta.getBeforeFingerprint())) {
            throw PatchException.forEntry(PatchException.Reason.INTEGRITY_MISMATCH, path,
                    "Hash mismatch before applying patch to file: " + path + ", the file changed since the patch was built."
                            + " Expected " + delta.getBeforeFingerprint() + " but was " + currentFingerprint);
        }

        byte[] patched;
        try {
            patched = differ.applyDelta(current, delta);
        } catch (IOException | RuntimeException e) {
            throw PatchException.forEntry(PatchException.Reason.DIFF, path, "Failed to apply patch to file: " + path, e);
        }

        Fingerprint patchedFingerprint = differ.fingerprint(patched);
        if (!patchedFingerprint.equals(delta.getAfterFingerprint())) {
            throw PatchException.forEntry(PatchException.Reason.INTEGRITY_MISMATCH, path,
                    "Hash mismatch after applying patch to file: " + path + ", the reconstruction is corrupted."
                            + " Expected " + delta.getAfterFingerprint() + " but was " + patchedFingerprint);
        }

        write(path, file, patched, "Failed to write modified file: ");
    }

    private void applyRemove(PatchEntry entry, Path file, Path root) throws IOException {
        RelativePath path = entry.getRelativePath();
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            debug("    already removed");
            return;
        }
        refuseSymlink(path, file, "remove");

        try {
            Files.delete(file);
        } catch (IOException e) {
            throw PatchException.forEntry(PatchException.Reason.IO, path, "Failed to remove file: " + file, e);
        }
        removeEmptyParents(file, root);
    }

    /**
     * Removes the now empty parent directories of a deleted file, stopping at the first non-empty directory and
     * never removing the root. This is best-effort: failures end the cleanup but do not fail the entry.
     */
    static void removeEmptyParents(Path file, Path root) {
        Path dir = file.getParent();
        while (dir != null && dir.startsWith(root) && !dir.equals(root)) {
            try {
                if (!isEmptyDirectory(dir)) {
                    break;
                }
                Files.delete(dir);
            } catch (IOException e) {
                debug("    could not remove directory " + dir + ": " + e);
                break;
            }
            dir = dir.getParent();
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
            return !children.iterator().hasNext();
        }
    }

    private static void refuseSymlink(RelativePath path, Path file, String action) throws PatchException {
        if (Files.isSymbolicLink(file)) {
            throw PatchException.forEntry(PatchException.Reason.SYMLINK_REFUSED, path, "Refusing to " + action + " symlink: " + file);
        }
    }

    private static void write(RelativePath path, Path file, byte[] content, String failure) throws PatchException {
        try {
            Files.write(file, content,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE,
                    LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            throw PatchException.forEntry(PatchException.Reason.IO, path, failure + file, e);
        }
    }

    private static void log(String message) {
        ConsoleTool.log(message);
    }

    private static void debug(String message) {
        ConsoleTool.debug(message);
    }
}
