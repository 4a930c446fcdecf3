package net.polylauncher.dirpatcher;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lists the regular files below a directory as {@link RelativePath relative paths}.
 * <p>
 * Symbolic links below the root are never followed. Depending on the configured {@link SymlinkHandling} they
 * are skipped or fail the scan. A root that is itself a link is resolved once before walking.
 */
public class TreeScanner {
    private final SymlinkHandling symlinkHandling;

    public TreeScanner(SymlinkHandling symlinkHandling) {
        this.symlinkHandling = symlinkHandling;
    }

    public SortedSet<RelativePath> scan(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new PatchException(PatchException.Reason.IO, "Not a directory: " + root, null);
        }

        final Path start = resolveRoot(root);
        SortedSet<RelativePath> paths = new TreeSet<>();
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (attrs.isSymbolicLink()) {
                        RelativePath link = RelativePath.of(start, file);
                        if (symlinkHandling == SymlinkHandling.REJECT) {
                            throw PatchException.forEntry(PatchException.Reason.SYMLINK_REFUSED, link,
                                    "Refusing to scan symbolic link: " + file);
                        }
                        ConsoleTool.debug("Skipping symbolic link " + link);
                    } else if (attrs.isRegularFile()) {
                        paths.add(RelativePath.of(start, file));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (PatchException e) {
            throw e;
        } catch (IOException e) {
            throw new PatchException(PatchException.Reason.IO, "Failed to read directory entry in: " + root, e);
        }
        return paths;
    }

    private static Path resolveRoot(Path root) throws PatchException {
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new PatchException(PatchException.Reason.IO, "Failed to resolve directory: " + root, e);
        }
    }
}
