package org.dxworks.alhconverter.diagnostics;

import java.nio.file.Path;

public final class Diagnostic {
    public final Severity severity;
    public final DiagnosticKind kind;
    public final Path file; // null when not tied to a source file
    public final int line;  // 1-based, 0 when unknown
    public final String content;
    public final String message;

    public Diagnostic(Severity severity, DiagnosticKind kind, Path file, int line, String content, String message) {
        this.severity = severity;
        this.kind = kind;
        this.file = file;
        this.line = line;
        this.content = content;
        this.message = message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(severity.name()).append(": ");
        if (file != null) {
            sb.append(file);
            if (line > 0) {
                sb.append(':').append(line);
            }
            sb.append(": ");
        }
        sb.append(message);
        if (content != null && !content.isEmpty()) {
            sb.append(" [").append(content).append(']');
        }
        return sb.toString();
    }
}
