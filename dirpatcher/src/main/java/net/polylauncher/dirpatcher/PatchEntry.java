package net.polylauncher.dirpatcher;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Represents a single file operation in a patch package.
 */
public final class PatchEntry {
    private final PatchOperation operation;
    private final RelativePath relativePath;
    private final byte @Nullable [] content;
    @Nullable
    private final FileDelta delta;

    private PatchEntry(PatchOperation operation, RelativePath relativePath, byte @Nullable [] content, @Nullable FileDelta delta) {
        this.operation = operation;
        this.relativePath = relativePath;
        this.content = content;
        this.delta = delta;
    }

    public static PatchEntry createAdd(RelativePath relativePath, byte[] content) {
        return new PatchEntry(PatchOperation.ADD, relativePath, Objects.requireNonNull(content, "content"), null);
    }

    public static PatchEntry createModify(RelativePath relativePath, FileDelta delta) {
        return new PatchEntry(PatchOperation.MODIFY, relativePath, null, Objects.requireNonNull(delta, "delta"));
    }

    public static PatchEntry createRemove(RelativePath relativePath) {
        return new PatchEntry(PatchOperation.REMOVE, relativePath, null, null);
    }

    public PatchOperation getOperation() {
        return operation;
    }

    public RelativePath getRelativePath() {
        return relativePath;
    }

    /**
     * The full content of the added file. Only available for {@link PatchOperation#ADD} entries.
     */
    public byte[] getContent() {
        if (content == null) {
            throw new IllegalStateException("Content not available for " + operation + " entries");
        }
        return content;
    }

    /**
     * The delta to replay against the current file. Only available for {@link PatchOperation#MODIFY} entries.
     */
    public FileDelta getDelta() {
        if (delta == null) {
            throw new IllegalStateException("Delta not available for " + operation + " entries");
        }
        return delta;
    }

    /**
     * Size of the payload this entry carries in bytes, 0 for removals.
     */
    public int getPayloadSize() {
        switch (operation) {
            case ADD:
                return getContent().length;
            case MODIFY:
                return getDelta().getPayload().length;
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        return relativePath + " " + operation;
    }
}
