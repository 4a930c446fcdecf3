package net.polylauncher.dirpatcher;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static net.polylauncher.dirpatcher.PatchPackageReaderTest.assertCorrupt;
import static net.polylauncher.dirpatcher.PatchPackageReaderTest.craft;
import static org.assertj.core.api.Assertions.assertThat;

class PackageCodecTest {
    private static final GDiffContentDiffer DIFFER = new GDiffContentDiffer();

    @Test
    void shouldEncodeDeterministically() throws IOException {
        assertThat(PackageCodec.encode(samplePackage())).isEqualTo(PackageCodec.encode(samplePackage()));
    }

    @Test
    void shouldDecodeEncodedPackage() throws IOException {
        PatchPackage original = samplePackage();

        PatchPackage decoded = PackageCodec.decode(PackageCodec.encode(original));

        assertThat(decoded.getFormatVersion()).isEqualTo(original.getFormatVersion());
        assertThat(decoded.getEntries()).hasSameSizeAs(original.getEntries());
        for (int i = 0; i < original.getEntries().size(); i++) {
            PatchEntry expected = original.getEntries().get(i);
            PatchEntry actual = decoded.getEntries().get(i);
            assertThat(actual.getOperation()).isEqualTo(expected.getOperation());
            assertThat(actual.getRelativePath()).isEqualTo(expected.getRelativePath());
            assertThat(actual.getPayloadSize()).isEqualTo(expected.getPayloadSize());
        }
        assertThat(decoded.getEntries().get(0).getContent()).isEqualTo(original.getEntries().get(0).getContent());
        assertThat(decoded.getEntries().get(1).getDelta().getAfterFingerprint())
                .isEqualTo(original.getEntries().get(1).getDelta().getAfterFingerprint());
    }

    @Test
    void shouldKeepNonAsciiPaths() throws IOException {
        RelativePath path = RelativePath.of("música/тема/主题.ogg");
        PatchPackage original = new PatchPackage(PackageCodec.CURRENT_FORMAT_VERSION,
                Collections.singletonList(PatchEntry.createRemove(path)));

        assertThat(PackageCodec.decode(PackageCodec.encode(original)).getEntries().get(0).getRelativePath()).isEqualTo(path);
    }

    @Test
    void shouldDecodeEmptyPackage() throws IOException {
        PatchPackage empty = new PatchPackage(PackageCodec.CURRENT_FORMAT_VERSION, Collections.<PatchEntry>emptyList());

        PatchPackage decoded = PackageCodec.decode(PackageCodec.encode(empty));

        assertThat(decoded.isEmpty()).isTrue();
        assertThat(decoded.getFormatVersion()).isEqualTo(1);
    }

    @Test
    void shouldPeekVersionWithoutValidatingIt() throws IOException {
        assertThat(PackageCodec.peekFormatVersion(PackageCodec.encode(samplePackage()))).isEqualTo(1);
        assertThat(PackageCodec.peekFormatVersion(craft(42, 0, 0, null))).isEqualTo(42);
        assertThat(PackageCodec.isSupportedVersion(42)).isFalse();
    }

    @Test
    void shouldRejectGarbageWhenPeeking() {
        assertCorrupt(() -> PackageCodec.peekFormatVersion("not a patch".getBytes(StandardCharsets.US_ASCII)), "Invalid package signature");
        assertCorrupt(() -> PackageCodec.peekFormatVersion(new byte[3]), "Truncated package header");
    }

    @Test
    void shouldRejectEmptyPackageWithBody() {
        byte[] data = craft(1, 0, 1, new byte[]{0});

        assertCorrupt(() -> PackageCodec.decode(data), "1 bytes remain after the last entry");
    }

    private static PatchPackage samplePackage() throws IOException {
        byte[] before = "version=1\nname=game\n".getBytes(StandardCharsets.UTF_8);
        byte[] after = "version=2\nname=game\n".getBytes(StandardCharsets.UTF_8);
        return new PatchPackage(PackageCodec.CURRENT_FORMAT_VERSION, Arrays.asList(
                PatchEntry.createAdd(RelativePath.of("bin/new.dll"), new byte[]{0, 1, 2, 3}),
                PatchEntry.createModify(RelativePath.of("config/game.ini"), DIFFER.diff(before, after)),
                PatchEntry.createRemove(RelativePath.of("data/old.pak"))
        ));
    }
}
