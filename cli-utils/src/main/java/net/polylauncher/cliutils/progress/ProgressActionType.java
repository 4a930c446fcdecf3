package net.polylauncher.cliutils.progress;

/**
 * The actions of the progress protocol, each written as a single character before its value.
 */
public enum ProgressActionType {
    STEP('s'),
    PROGRESS('p'),
    MAX_PROGRESS('m'),
    INDETERMINATE('i');

    public final char identifier;

    ProgressActionType(char identifier) {
        this.identifier = identifier;
    }
}
