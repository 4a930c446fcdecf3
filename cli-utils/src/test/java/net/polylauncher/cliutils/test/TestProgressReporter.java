package net.polylauncher.cliutils.test;

import net.polylauncher.cliutils.progress.ProgressActionType;
import net.polylauncher.cliutils.progress.ProgressReporter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TestProgressReporter {

    @Test
    void testStepLine() {
        Capture capture = new Capture(true);
        capture.reporter.setStep("Applying patch");
        assertThat(capture.lines()).containsExactly(ProgressReporter.PREFIX + "s Applying patch");
    }

    @Test
    void testProgressLines() {
        Capture capture = new Capture(true);
        capture.reporter.setMaxProgress(12);
        capture.reporter.setProgress(3);
        capture.reporter.setPercentageProgress(42.5);
        capture.reporter.setIndeterminate(false);
        assertThat(capture.lines()).containsExactly(
                ProgressReporter.PREFIX + "m 12",
                ProgressReporter.PREFIX + "p 3",
                ProgressReporter.PREFIX + "p 42.50%",
                ProgressReporter.PREFIX + "i false"
        );
    }

    @Test
    void testDisabledReporterWritesNothing() {
        Capture capture = new Capture(false);
        capture.reporter.setStep("Diffing");
        capture.reporter.setProgress(1);
        assertThat(capture.lines()).isEmpty();
    }

    @Test
    void testEveryActionHasItsOwnIdentifier() {
        assertThat(ProgressActionType.values())
                .extracting(type -> type.identifier)
                .containsExactly('s', 'p', 'm', 'i');
    }

    private static class Capture {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final ProgressReporter reporter;

        Capture(boolean enabled) {
            reporter = new ProgressReporter(enabled, new PrintStream(bytes, true));
        }

        List<String> lines() {
            String text = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
            if (text.isEmpty()) {
                return new ArrayList<>();
            }
            return Arrays.asList(text.split("\\R"));
        }
    }
}
