package org.dxworks.alhconverter.diagnostics;

public enum DiagnosticKind {
    /** Informational remarks about how a construct was mapped. */
    NOTE,
    /** A construct without Phoebus or alarm handler equivalent; it is dropped. */
    UNSUPPORTED,
    /** A line that can't be understood; it is skipped. */
    MALFORMED,
    /** A tree operation that failed, e.g. duplicate identifiers. */
    STRUCTURAL,
    /** Mapped, but a human should check the result. */
    REVIEW
}
