package net.polylauncher.dirpatcher;

import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.LZMAOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static net.polylauncher.dirpatcher.PatchPackageConstants.*;

/**
 * Writer for patch package files.
 * Usage:
 * 1. Create writer with output stream and format version
 * 2. Write entries using writeAddEntry, writeModifyEntry, or writeRemoveEntry
 * 3. Call close() to write the header followed by the compressed entries
 * <p>
 * Closing the writer does not close the underlying stream.
 */
public class PatchPackageWriter implements AutoCloseable {
    private final OutputStream output;
    private final int formatVersion;
    private final ByteArrayOutputStream entryBuffer;
    private final DataOutputStream entryOutput;
    private int entryCount;
    private boolean closed;

    public PatchPackageWriter(OutputStream output, int formatVersion) {
        if (!isSupportedVersion(formatVersion)) {
            throw new IllegalArgumentException("Cannot write patch packages in format version " + Integer.toUnsignedString(formatVersion));
        }
        this.output = output;
        this.formatVersion = formatVersion;
        this.entryBuffer = new ByteArrayOutputStream();
        this.entryOutput = new DataOutputStream(entryBuffer);
    }

    /**
     * Write an entry that creates a file with the given content.
     */
    public void writeAddEntry(RelativePath path, byte[] content) throws IOException {
        writeEntryHeader(ENTRY_TYPE_ADD, path);
        writePayload(content);
        entryCount++;
    }

    /**
     * Write an entry that rewrites an existing file by replaying a delta.
     */
    public void writeModifyEntry(RelativePath path, FileDelta delta) throws IOException {
        validateFingerprint(path, delta.getBeforeFingerprint());
        validateFingerprint(path, delta.getAfterFingerprint());
        writeEntryHeader(ENTRY_TYPE_MODIFY, path);
        entryOutput.write(delta.getBeforeFingerprint().getBytes());
        entryOutput.write(delta.getAfterFingerprint().getBytes());
        writePayload(delta.getPayload());
        entryCount++;
    }

    /**
     * Write an entry that removes a file.
     */
    public void writeRemoveEntry(RelativePath path) throws IOException {
        writeEntryHeader(ENTRY_TYPE_REMOVE, path);
        entryCount++;
    }

    public void write(PatchEntry entry) throws IOException {
        switch (entry.getOperation()) {
            case ADD:
                writeAddEntry(entry.getRelativePath(), entry.getContent());
                break;
            case MODIFY:
                writeModifyEntry(entry.getRelativePath(), entry.getDelta());
                break;
            case REMOVE:
                writeRemoveEntry(entry.getRelativePath());
                break;
        }
    }

    public int getEntryCount() {
        return entryCount;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            entryOutput.flush();

            DataOutputStream header = new DataOutputStream(output);
            header.write(PACKAGE_SIGNATURE);
            header.writeInt(formatVersion);
            header.writeInt(entryCount);
            header.writeLong(entryBuffer.size());
            header.flush();

            LZMAOutputStream body = new LZMAOutputStream(output, new LZMA2Options(), -1);
            entryBuffer.writeTo(body);
            body.finish();
            output.flush();

            closed = true;
        }
    }

    private void writeEntryHeader(int type, RelativePath path) throws IOException {
        if (closed) {
            throw new IllegalStateException("Package already closed");
        }
        byte[] pathBytes = encodePath(path);
        entryOutput.writeByte(type);
        entryOutput.writeShort(pathBytes.length);
        entryOutput.write(pathBytes);
    }

    private void writePayload(byte[] data) throws IOException {
        entryOutput.writeInt(data.length);
        entryOutput.write(data);
    }

    private static byte[] encodePath(RelativePath path) {
        if (!isEncodable(path)) {
            throw new IllegalArgumentException("Path cannot be stored in a patch package: " + path);
        }
        return path.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns whether a path can be written: no NUL characters and at most 65535
     * bytes of UTF-8.
     */
    static boolean isEncodable(RelativePath path) {
        String str = path.toString();
        for (int i = 0; i < str.length(); i++) {
            if (!isValidPathCharacter(str.charAt(i))) {
                return false;
            }
        }
        return str.getBytes(StandardCharsets.UTF_8).length <= MAX_PATH_LENGTH;
    }

    private static void validateFingerprint(RelativePath path, Fingerprint fingerprint) {
        if (fingerprint.length() != FINGERPRINT_LENGTH) {
            throw new IllegalArgumentException(String.format("Entry '%s' has a %d byte fingerprint, expected %d",
                    path, fingerprint.length(), FINGERPRINT_LENGTH));
        }
    }
}
