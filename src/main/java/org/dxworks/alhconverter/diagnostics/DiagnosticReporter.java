package org.dxworks.alhconverter.diagnostics;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one conversion run and prints those at or above the threshold.
 *
 * <p>Parsers set the current position with {@link #at(Path, int, String)} so that every report
 * names the file, line and offending content.
 */
public class DiagnosticReporter {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Severity threshold;
    private final PrintStream out;

    private Path file;
    private int line;
    private String content;

    public DiagnosticReporter(Severity threshold, PrintStream out) {
        this.threshold = threshold;
        this.out = out;
    }

    /** Records everything but debug entries and prints nothing. */
    public static DiagnosticReporter silent() {
        return new DiagnosticReporter(Severity.ERROR, null);
    }

    public void at(Path file, int line, String content) {
        this.file = file;
        this.line = line;
        this.content = content;
    }

    public void clearPosition() {
        at(null, 0, null);
    }

    public void debug(String message) {
        report(Severity.DEBUG, DiagnosticKind.NOTE, message);
    }

    public void note(String message) {
        report(Severity.INFO, DiagnosticKind.NOTE, message);
    }

    public void review(String message) {
        report(Severity.WARNING, DiagnosticKind.REVIEW, message);
    }

    public void unsupported(String message) {
        report(Severity.WARNING, DiagnosticKind.UNSUPPORTED, message);
    }

    public void malformed(String message) {
        report(Severity.ERROR, DiagnosticKind.MALFORMED, message);
    }

    public void structural(String message) {
        report(Severity.ERROR, DiagnosticKind.STRUCTURAL, message);
    }

    /**
     * Debug entries are only kept when they are printed, everything else is always recorded.
     */
    public void report(Severity severity, DiagnosticKind kind, String message) {
        boolean printed = out != null && severity.compareTo(threshold) >= 0;
        if (severity == Severity.DEBUG && !printed) {
            return;
        }
        Diagnostic diagnostic = new Diagnostic(severity, kind, file, line, content, message);
        diagnostics.add(diagnostic);
        if (printed) {
            synchronized (out) {
                out.println(diagnostic);
            }
        }
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind == kind).collect(Collectors.toList());
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity == severity).count();
    }
}
