package net.polylauncher.cliutils.progress;

/**
 * Receives progress updates of a long-running tool operation, such as building or applying a patch.
 */
public interface ProgressManager {
    /**
     * A manager that discards every update.
     */
    ProgressManager NONE = new ProgressManager() {
        @Override
        public void setMaxProgress(int maxProgress) {
        }

        @Override
        public void setProgress(int progress) {
        }

        @Override
        public void setPercentageProgress(double progress) {
        }

        @Override
        public void setStep(String name) {
        }

        @Override
        public void setIndeterminate(boolean indeterminate) {
        }
    };

    /**
     * Sets the number of units of work the current step consists of.
     */
    void setMaxProgress(int maxProgress);

    /**
     * Sets the number of units of work completed in the current step.
     */
    void setProgress(int progress);

    /**
     * Sets progress as a percentage. Implies a max progress of {@literal 100}.
     */
    void setPercentageProgress(double progress);

    /**
     * Names the step currently being worked on.
     */
    void setStep(String name);

    /**
     * Marks whether the amount of work in the current step is unknown.
     */
    void setIndeterminate(boolean indeterminate);
}
