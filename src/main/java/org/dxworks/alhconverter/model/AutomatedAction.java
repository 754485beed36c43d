package org.dxworks.alhconverter.model;

/**
 * An action Phoebus runs by itself once an alarm stays unacknowledged for {@code delay} seconds.
 * The details carry a type prefix: {@code cmd:}, {@code sevrpv:} or {@code mailto:}.
 */
public final class AutomatedAction {
    public static final String COMMAND_PREFIX = "cmd";
    public static final String SEVERITY_PV_PREFIX = "sevrpv";
    public static final String MAIL_PREFIX = "mailto";

    public final String title;
    public final String details;
    public final int delay;

    public AutomatedAction(String title, String details, int delay) {
        this.title = title;
        this.details = details;
        this.delay = delay;
    }

    public String type() {
        int colon = details.indexOf(':');
        return colon < 0 ? "" : details.substring(0, colon);
    }

    public String target() {
        int colon = details.indexOf(':');
        return colon < 0 ? details : details.substring(colon + 1);
    }
}
