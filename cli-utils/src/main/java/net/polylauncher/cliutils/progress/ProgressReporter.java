package net.polylauncher.cliutils.progress;

import java.io.PrintStream;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * A {@link ProgressManager} that writes every update to a print stream, prefixed with the ANSI modifier
 * {@value #MODIFIER_KEY}, so that a launcher wrapping the tool can render a progress bar.
 * <p>
 * Lines take the form {@code \033[progressmanager;<action> <value>}, see {@link ProgressActionType}.
 * The {@link #getDefault() default reporter} writes to {@link System#err} and is only enabled when the
 * {@value #ENABLED_PROPERTY} system property is {@code true}.
 */
public class ProgressReporter implements ProgressManager {
    public static final String MODIFIER_KEY = "progressmanager";
    public static final String ENABLED_PROPERTY = "net.polylauncher.progressmanager.enabled";
    public static final String PREFIX = "\033[" + MODIFIER_KEY + ";";

    private final DecimalFormat twoDecimals = new DecimalFormat("0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));

    protected final boolean enabled;
    protected final PrintStream output;

    public ProgressReporter(boolean enabled, PrintStream output) {
        this.enabled = enabled;
        this.output = output;
    }

    public static ProgressReporter getDefault() {
        return new ProgressReporter(Boolean.getBoolean(ENABLED_PROPERTY), System.err);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setMaxProgress(int maxProgress) {
        write(ProgressActionType.MAX_PROGRESS, String.valueOf(maxProgress));
    }

    @Override
    public void setProgress(int progress) {
        write(ProgressActionType.PROGRESS, String.valueOf(progress));
    }

    @Override
    public void setPercentageProgress(double progress) {
        write(ProgressActionType.PROGRESS, twoDecimals.format(progress) + "%");
    }

    @Override
    public void setStep(String name) {
        write(ProgressActionType.STEP, name);
    }

    @Override
    public void setIndeterminate(boolean indeterminate) {
        write(ProgressActionType.INDETERMINATE, String.valueOf(indeterminate));
    }

    protected void write(ProgressActionType type, String value) {
        if (!enabled) return;

        output.println(PREFIX + type.identifier + " " + value);
        if (output.checkError()) {
            System.err.println("Failed to write progress update " + type + " " + value);
        }
    }
}
