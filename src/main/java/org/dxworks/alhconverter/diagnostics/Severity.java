package org.dxworks.alhconverter.diagnostics;

public enum Severity {
    DEBUG,
    INFO,
    WARNING,
    ERROR;

    /** Threshold for the number of {@code -v} flags given on the command line. */
    public static Severity forVerbosity(int verbosity) {
        return switch (verbosity) {
            case 0 -> ERROR;
            case 1 -> WARNING;
            case 2 -> INFO;
            default -> DEBUG;
        };
    }
}
