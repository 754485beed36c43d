package org.dxworks.alhconverter.export;

import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.model.AutomatedAction;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Translates Phoebus display and action entries into alarm handler lines.
 */
public final class AlhExportFormat {

    public static final String DEFAULT_EDM_COMMAND = "run_edm.sh";
    private static final String DISPLAY_EXTENSION = ".bob";
    private static final String EDM_EXTENSION = ".edl";

    private AlhExportFormat() {
        // utility class
    }

    /**
     * A {@code .bob} display becomes an EDM command opening the matching {@code .edl} file,
     * with the URL query passed as macros. Anything else is kept as a guidance link.
     */
    public static String formatDisplay(String display, String edmCommand) {
        if (!display.contains(DISPLAY_EXTENSION)) {
            return "$GUIDANCE " + display;
        }

        int queryStart = display.indexOf('?');
        String path = queryStart < 0 ? display : display.substring(0, queryStart);
        String query = queryStart < 0 ? "" : display.substring(queryStart + 1);

        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String edlName = fileName.replace(DISPLAY_EXTENSION, EDM_EXTENSION);

        List<String> parts = new ArrayList<>();
        parts.add(edmCommand);
        Map<String, String> macros = parseQuery(query);
        if (!macros.isEmpty()) {
            List<String> pairs = new ArrayList<>();
            macros.forEach((key, value) -> pairs.add(key + "=" + value));
            parts.add("-m \"" + String.join(",", pairs) + "\"");
        }
        parts.add(edlName);
        return "$COMMAND " + String.join(" ", parts);
    }

    /** Query parameters sorted by name; the first value wins for repeated names. */
    static Map<String, String> parseQuery(String query) {
        Map<String, String> macros = new TreeMap<>();
        if (query.isEmpty()) {
            return macros;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            macros.putIfAbsent(key, value);
        }
        return macros;
    }

    /**
     * The alarm handler line of an automated action, or empty when it has none. Dropped
     * actions are reported.
     */
    public static Optional<String> formatAction(AutomatedAction action, DiagnosticReporter reporter) {
        String line;
        switch (action.type()) {
            case AutomatedAction.SEVERITY_PV_PREFIX -> line = "$SEVRPV " + action.target();
            case AutomatedAction.COMMAND_PREFIX -> line = "$SEVRCOMMAND UP_ANY " + action.target();
            case AutomatedAction.MAIL_PREFIX -> {
                reporter.unsupported("mailto action not possible in alh: " + action.target());
                return Optional.empty();
            }
            default -> throw new IllegalArgumentException("unknown action type " + action.type() + " used");
        }

        if (action.delay > 0) {
            reporter.unsupported("delayed action not possible in alh: " + action.details);
            return Optional.empty();
        }
        return Optional.of(line);
    }
}
