package net.polylauncher.dirpatcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RelativePathTest {
    @Test
    void shouldNormalizeSeparators() {
        assertThat(RelativePath.of("data\\maps\\level1.pak").toString()).isEqualTo("data/maps/level1.pak");
        assertThat(RelativePath.of("/data/a.txt").toString()).isEqualTo("data/a.txt");
        assertThat(RelativePath.of("\\\\data\\a.txt").toString()).isEqualTo("data/a.txt");
    }

    @Test
    void shouldKeepDotSegments() {
        assertThat(RelativePath.of("a/../b.txt").toString()).isEqualTo("a/../b.txt");
        assertThat(RelativePath.of("./b.txt").toString()).isEqualTo("./b.txt");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "/", "//", "\\"})
    void shouldRejectEmptyPaths(String path) {
        assertThatThrownBy(() -> RelativePath.of(path)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareNormalizedForms() {
        assertThat(RelativePath.of("a\\b.txt")).isEqualTo(RelativePath.of("/a/b.txt"));
        assertThat(RelativePath.of("a\\b.txt").hashCode()).isEqualTo(RelativePath.of("a/b.txt").hashCode());
        assertThat(RelativePath.of("a/b.txt")).isNotEqualTo(RelativePath.of("a/B.txt"));
    }

    @Test
    void shouldOrderByString() {
        List<RelativePath> paths = Arrays.asList(
                RelativePath.of("b.txt"),
                RelativePath.of("a/z.txt"),
                RelativePath.of("a.txt"),
                RelativePath.of("B.txt")
        );

        assertThat(new TreeSet<>(paths)).extracting(RelativePath::toString)
                .containsExactly("B.txt", "a.txt", "a/z.txt", "b.txt");
    }

    @Test
    void shouldRelativizeAgainstRoot(@TempDir Path root) {
        Path file = root.resolve("data").resolve("maps").resolve("level1.pak");

        assertThat(RelativePath.of(root, file).toString()).isEqualTo("data/maps/level1.pak");
    }

    @Test
    void shouldKeepBackslashesFromFileNames(@TempDir Path root) {
        Path file = root.resolve("saves").resolve("slot\\1.dat");
        assumeTrue(file.getFileName().toString().equals("slot\\1.dat"), "Backslash is a separator on this platform");

        assertThat(RelativePath.of(root, file).toString()).isEqualTo("saves/slot\\1.dat");
    }

    @Test
    void shouldKeepBackslashesInStoredForm() {
        assertThat(RelativePath.ofStored("saves/slot\\1.dat").toString()).isEqualTo("saves/slot\\1.dat");
        assertThat(RelativePath.ofStored("//a.txt").toString()).isEqualTo("a.txt");
        assertThatThrownBy(() -> RelativePath.ofStored("/")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveAgainstDirectory(@TempDir Path root) {
        assertThat(RelativePath.of("data/maps/level1.pak").resolveAgainst(root))
                .isEqualTo(root.resolve("data").resolve("maps").resolve("level1.pak"));
    }
}
