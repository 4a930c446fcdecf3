package net.polylauncher.dirpatcher;

import org.jspecify.annotations.Nullable;
import org.tukaani.xz.LZMAInputStream;
import org.tukaani.xz.XZIOException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static net.polylauncher.dirpatcher.PatchPackageConstants.*;

/**
 * Reader for patch package files.
 * Usage:
 * 1. Create reader with input stream, which only parses the header
 * 2. Inspect getFormatVersion() and getEntryCount()
 * 3. Iterate through entries using the iterator, or read them all with readPackage()
 * <p>
 * The compressed body is not touched until the first entry is read. Packages in an unsupported format version are
 * rejected while parsing the header.
 */
public class PatchPackageReader implements Iterable<PatchEntry>, AutoCloseable {
    private final InputStream input;
    private final int formatVersion;
    private final int entryCount;
    private final long bodyLength;
    @Nullable
    private DataInputStream body;
    private long bodyRemaining;
    private int entriesRead;
    private boolean closed;

    public PatchPackageReader(Path file) throws IOException {
        this(new BufferedInputStream(Files.newInputStream(file)));
    }

    public PatchPackageReader(InputStream input) throws IOException {
        this.input = input;
        try {
            DataInputStream header = new DataInputStream(input);
            this.formatVersion = readFormatVersion(header);
            if (!isSupportedVersion(formatVersion)) {
                throw unsupportedVersion(formatVersion);
            }

            this.entryCount = header.readInt();
            if (entryCount < 0) {
                throw corrupt("Invalid entry count: " + entryCount);
            }
            this.bodyLength = header.readLong();
            if (bodyLength < 0 || bodyLength > MAX_BODY_LENGTH) {
                throw corrupt("Invalid body length: " + bodyLength);
            }
            if ((long) entryCount * MIN_ENTRY_LENGTH > bodyLength) {
                throw corrupt("Body of " + bodyLength + " bytes cannot hold " + entryCount + " entries");
            }
        } catch (EOFException e) {
            closeQuietly(e);
            throw corrupt("Truncated package header", e);
        } catch (IOException | RuntimeException e) {
            closeQuietly(e);
            throw e;
        }
        this.bodyRemaining = bodyLength;
    }

    /**
     * Reads the signature and the format version from the start of a package without checking whether the
     * version is supported.
     */
    static int readFormatVersion(DataInputStream header) throws IOException {
        byte[] signature = new byte[PACKAGE_SIGNATURE.length];
        try {
            header.readFully(signature);
            if (!Arrays.equals(signature, PACKAGE_SIGNATURE)) {
                throw corrupt("Invalid package signature");
            }
            return header.readInt();
        } catch (EOFException e) {
            throw corrupt("Truncated package header", e);
        }
    }

    static PatchException unsupportedVersion(int formatVersion) {
        return new PatchException(PatchException.Reason.UNSUPPORTED_VERSION,
                "Unsupported patch package version: " + Integer.toUnsignedString(formatVersion)
                        + " (expected " + CURRENT_FORMAT_VERSION + ")");
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    /**
     * Returns the total number of entries in the package.
     */
    public int getEntryCount() {
        return entryCount;
    }

    /**
     * Returns the number of entries that have been read so far.
     */
    public int getEntriesRead() {
        return entriesRead;
    }

    /**
     * Returns true if not all entries have been read yet.
     */
    public boolean hasMoreEntries() {
        return entriesRead < entryCount;
    }

    @Override
    public Iterator<PatchEntry> iterator() {
        if (entriesRead > 0) {
            throw new IllegalStateException("Cannot create multiple iterators or iterate after manual read");
        }
        return new EntryIterator();
    }

    /**
     * Reads all remaining entries and verifies that the package holds no data beyond them.
     */
    public PatchPackage readPackage() throws IOException {
        List<PatchEntry> entries = new ArrayList<>(Math.min(entryCount, 4096));
        PatchEntry entry;
        while ((entry = readEntry()) != null) {
            entries.add(entry);
        }
        if (entryCount == 0) {
            verifyEndOfBody(openBody());
        }
        return new PatchPackage(formatVersion, entries);
    }

    /**
     * Read the next entry from the package.
     *
     * @return the next entry, or null if all entries have been read
     */
    @Nullable
    public PatchEntry readEntry() throws IOException {
        if (closed) {
            throw new IllegalStateException("Reader is closed");
        }
        if (!hasMoreEntries()) {
            return null;
        }

        DataInputStream in = openBody();
        try {
            PatchEntry entry = decodeEntry(in);
            entriesRead++;
            if (!hasMoreEntries()) {
                verifyEndOfBody(in);
            }
            return entry;
        } catch (EOFException e) {
            throw corrupt("Package body ends before entry " + (entriesRead + 1) + " of " + entryCount, e);
        } catch (XZIOException e) {
            throw corrupt("Package body cannot be decompressed", e);
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            input.close();
            closed = true;
        }
    }

    private PatchEntry decodeEntry(DataInputStream in) throws IOException {
        require(1, "entry type");
        int type = in.readUnsignedByte();
        RelativePath path = readPath(in);

        switch (type) {
            case ENTRY_TYPE_ADD:
                return PatchEntry.createAdd(path, readPayload(in, path));
            case ENTRY_TYPE_MODIFY:
                Fingerprint before = readFingerprint(in, path);
                Fingerprint after = readFingerprint(in, path);
                return PatchEntry.createModify(path, new FileDelta(readPayload(in, path), before, after));
            case ENTRY_TYPE_REMOVE:
                return PatchEntry.createRemove(path);
            default:
                throw corrupt("Unknown entry type " + type + " for " + path);
        }
    }

    private RelativePath readPath(DataInputStream in) throws IOException {
        require(2, "path length");
        int length = in.readUnsignedShort();
        if (length == 0) {
            throw corrupt("Entry " + (entriesRead + 1) + " has an empty path");
        }
        require(length, "path");
        byte[] bytes = new byte[length];
        in.readFully(bytes);

        String path;
        try {
            path = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw corrupt("Entry " + (entriesRead + 1) + " has a path that is not valid UTF-8", e);
        }

        for (int i = 0; i < path.length(); i++) {
            if (!isValidPathCharacter(path.charAt(i))) {
                throw corrupt("Path contains invalid character: 0x" + Integer.toHexString(path.charAt(i)));
            }
        }
        try {
            return RelativePath.ofStored(path);
        } catch (IllegalArgumentException e) {
            throw corrupt("Invalid entry path: " + path, e);
        }
    }

    private Fingerprint readFingerprint(DataInputStream in, RelativePath path) throws IOException {
        require(FINGERPRINT_LENGTH, "fingerprint of " + path);
        byte[] digest = new byte[FINGERPRINT_LENGTH];
        in.readFully(digest);
        return Fingerprint.of(digest);
    }

    private byte[] readPayload(DataInputStream in, RelativePath path) throws IOException {
        require(4, "payload length of " + path);
        int length = in.readInt();
        if (length < 0) {
            throw corrupt("Invalid payload length " + length + " for " + path);
        }
        require(length, "payload of " + path);
        return readBytes(in, length);
    }

    /**
     * Reads exactly {@code length} bytes, growing the buffer only as data actually arrives.
     */
    private static byte[] readBytes(DataInputStream in, int length) throws IOException {
        if (length <= READ_CHUNK_SIZE) {
            byte[] data = new byte[length];
            in.readFully(data);
            return data;
        }

        ByteArrayOutputStream data = new ByteArrayOutputStream(READ_CHUNK_SIZE);
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        int remaining = length;
        while (remaining > 0) {
            int read = in.read(chunk, 0, Math.min(chunk.length, remaining));
            if (read < 0) {
                throw new EOFException();
            }
            data.write(chunk, 0, read);
            remaining -= read;
        }
        return data.toByteArray();
    }

    private void require(long length, String what) throws PatchException {
        if (length > bodyRemaining) {
            throw corrupt("Package declares " + length + " bytes of " + what + " but only " + bodyRemaining + " remain");
        }
        bodyRemaining -= length;
    }

    private DataInputStream openBody() throws IOException {
        if (body == null) {
            try {
                body = new DataInputStream(new LZMAInputStream(input, LZMA_MEMORY_LIMIT));
            } catch (EOFException | XZIOException e) {
                throw corrupt("Package body cannot be decompressed", e);
            }
        }
        return body;
    }

    private void verifyEndOfBody(DataInputStream in) throws IOException {
        if (bodyRemaining != 0) {
            throw corrupt(bodyRemaining + " bytes remain after the last entry");
        }
        try {
            if (in.read() != -1) {
                throw corrupt("Package body is longer than declared");
            }
        } catch (EOFException | XZIOException e) {
            throw corrupt("Package body cannot be decompressed", e);
        }
    }

    private void closeQuietly(Exception failure) {
        try {
            input.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static PatchException corrupt(String message) {
        return new PatchException(PatchException.Reason.CORRUPT_PACKAGE, message);
    }

    private static PatchException corrupt(String message, Throwable cause) {
        return new PatchException(PatchException.Reason.CORRUPT_PACKAGE, message, cause);
    }

    private class EntryIterator implements Iterator<PatchEntry> {
        @Override
        public boolean hasNext() {
            return hasMoreEntries();
        }

        @Override
        public PatchEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more entries");
            }
            try {
                return readEntry();
            } catch (IOException e) {
                throw new UncheckedIOException("Error reading entry", e);
            }
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException("Remove not supported");
        }
    }
}
