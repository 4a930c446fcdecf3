package net.polylauncher.dirpatcher;

/**
 * How the {@link TreeScanner} treats symbolic links found below the scanned root.
 */
public enum SymlinkHandling {
    /**
     * Links are neither followed nor reported.
     */
    SKIP,
    /**
     * The scan fails as soon as a link is found.
     */
    REJECT
}
