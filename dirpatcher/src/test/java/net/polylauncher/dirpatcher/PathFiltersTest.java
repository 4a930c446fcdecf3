package net.polylauncher.dirpatcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PathFiltersTest {

    @ParameterizedTest(name = "pattern=''{0}'', path=''{1}'', expected={2}")
    @CsvSource({
            // Literal paths, regex characters are not special
            "config.ini, config.ini, true",
            "config.ini, configXini, false",
            "a+b.txt, a+b.txt, true",
            "a+b.txt, aab.txt, false",
            "(x)[y]{z}.txt, (x)[y]{z}.txt, true",
            "$HOME/^notes|, $HOME/^notes|, true",

            // Single character wildcard (?)
            "save?.dat, save1.dat, true",
            "save?.dat, save10.dat, false",
            "save?.dat, save.dat, false",
            "save?.dat, save/.dat, false",

            // Single segment wildcard (*)
            "*.log, latest.log, true",
            "*.log, logs/latest.log, false",
            "logs/*.log, logs/latest.log, true",
            "logs/*.log, logs/old/latest.log, false",
            "shader*, shader, true",

            // Multi-segment wildcard (**)
            "**/*.pak, level1.pak, true",
            "**/*.pak, data/maps/level1.pak, true",
            "**/*.pak, level1.pak.bak, false",
            "cache/**, cache/shaders/a.bin, true",
            "cache/**, cache, false",
            "cache/**, mycache/a.bin, false",
            "**/screenshots/**, screenshots/a.png, true",
            "**/screenshots/**, user/1/screenshots/a.png, true",
            "mods/**/*.jar, mods/a.jar, true",
            "mods/**/*.jar, mods/x/y/a.jar, true",
            "mods/**/*.jar, mods/a.zip, false",
            "**, any/depth/at/all, true",
            "*, a/b, false"
    })
    void testSinglePattern(String pattern, String path, boolean expected) {
        assertEquals(expected, PathFilters.compile(Collections.singleton(pattern)).test(path),
                String.format("Pattern '%s' should %smatch path '%s'",
                        pattern, expected ? "" : "not ", path));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("provideIncludeExclude")
    void testIncludeExclude(String description, String[] includes, String[] excludes, String path, boolean expected) {
        Predicate<String> filter = PathFilters.create(Arrays.asList(includes), Arrays.asList(excludes));
        assertEquals(expected, filter.test(path),
                String.format("Includes %s and excludes %s should %saccept path '%s'",
                        Arrays.toString(includes), Arrays.toString(excludes), expected ? "" : "not ", path));
    }

    static Stream<Arguments> provideIncludeExclude() {
        String[] none = new String[0];
        return Stream.of(
                Arguments.of("No patterns accept everything", none, none, "bin/game.exe", true),
                Arguments.of("Include matches", new String[]{"data/**"}, none, "data/a.pak", true),
                Arguments.of("Include misses", new String[]{"data/**"}, none, "bin/game.exe", false),
                Arguments.of("Exclude matches", none, new String[]{"**/*.log"}, "logs/latest.log", false),
                Arguments.of("Exclude misses", none, new String[]{"**/*.log"}, "data/a.pak", true),
                Arguments.of("Exclude wins over include",
                        new String[]{"data/**"}, new String[]{"data/cache/**"}, "data/cache/x.bin", false),
                Arguments.of("Include outside exclude",
                        new String[]{"data/**"}, new String[]{"data/cache/**"}, "data/maps/x.pak", true),
                Arguments.of("Any include is enough",
                        new String[]{"bin/*", "data/**"}, none, "bin/game.exe", true)
        );
    }

    @Test
    void testEmptyPatternListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PathFilters.toRegex(Collections.<String>emptyList()));
    }

    @Test
    void testPatternsAreCombined() {
        String regex = PathFilters.toRegex(Arrays.asList("*.txt", "**/*.dat"));
        assertEquals("^(?:[^/]*\\.txt|(?:.*/)?[^/]*\\.dat)$", regex);

        Predicate<String> filter = PathFilters.compile(Arrays.asList("*.txt", "**/*.dat"));
        assertTrue(filter.test("readme.txt"));
        assertTrue(filter.test("saves/slot1.dat"));
        assertFalse(filter.test("saves/readme.txt"));
    }
}
