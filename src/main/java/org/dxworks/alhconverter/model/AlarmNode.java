package org.dxworks.alhconverter.model;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Shared state of groups and channels: the name shown in Phoebus and the ordered
 * guidance, command, display and automated action entries.
 */
public abstract class AlarmNode extends TreeNode {

    private final String name;
    private List<Guidance> guidances = new ArrayList<>();
    private List<Command> commands = new ArrayList<>();
    private List<Display> displays = new ArrayList<>();
    private List<AutomatedAction> actions = new ArrayList<>();
    private FilterExpression filter;

    protected AlarmNode(String name, String identifier, String tag, SortKey sortKey) {
        super(identifier, tag, sortKey);
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Name of the node in Phoebus, the ALIAS of a group in alarm handler files. */
    public String getName() {
        return name;
    }

    public List<Guidance> getGuidances() {
        return Collections.unmodifiableList(guidances);
    }

    public List<Command> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    public List<Display> getDisplays() {
        return Collections.unmodifiableList(displays);
    }

    public List<AutomatedAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public FilterExpression getFilter() {
        return filter;
    }

    public void setFilter(FilterExpression filter) {
        this.filter = filter;
    }

    public void addGuidance(String title, String details) {
        guidances.add(new Guidance(title, details));
    }

    public void addCommand(String title, String details) {
        commands.add(new Command(title, details));
    }

    public void addDisplay(String title, String path) {
        displays.add(new Display(title, path));
    }

    /**
     * Adds a display and passes the given macros to it as URL query parameters.
     * Macros are sorted by name. A URL that already has a query is kept as it is.
     *
     * @throws IllegalArgumentException if macros are given and the path is not absolute
     */
    public void addDisplay(String title, String path, Map<String, ?> macros) {
        if (macros == null || macros.isEmpty()) {
            addDisplay(title, path);
            return;
        }

        URI uri = URI.create(path);
        String scheme = uri.getScheme() == null ? "file" : uri.getScheme();
        String rawPath = uri.getRawPath();
        if (rawPath == null || !rawPath.startsWith("/")) {
            throw new IllegalArgumentException("absolute path required to use macros " + rawPath);
        }

        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            StringJoiner joiner = new StringJoiner("&");
            for (Map.Entry<String, ?> macro : new TreeMap<>(macros).entrySet()) {
                joiner.add(URLEncoder.encode(macro.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(String.valueOf(macro.getValue()), StandardCharsets.UTF_8));
            }
            query = joiner.toString();
        }

        String authority = uri.getRawAuthority() == null ? "" : uri.getRawAuthority();
        addDisplay(title, scheme + "://" + authority + rawPath + "?" + query);
    }

    public void addAutoAction(String title, int delay, String command) {
        actions.add(new AutomatedAction(title, AutomatedAction.COMMAND_PREFIX + ":" + command, delay));
    }

    public void addMail(List<String> recipients, int delay, String title) {
        actions.add(new AutomatedAction(title, AutomatedAction.MAIL_PREFIX + ":" + String.join(",", recipients), delay));
    }

    public void addMail(String recipient, int delay) {
        addMail(List.of(recipient), delay, "mail");
    }

    /** Writes the alarm severity to another PV. */
    public void addSevrPv(String pv, String title) {
        actions.add(new AutomatedAction(title, AutomatedAction.SEVERITY_PV_PREFIX + ":" + pv, 0));
    }

    public void addSevrPv(String pv) {
        addSevrPv(pv, "Severity PV");
    }

    /**
     * Moves all entries and the filter of {@code previous} onto this node. The previous node
     * is left empty and must be discarded.
     */
    void takeOver(AlarmNode previous) {
        guidances.addAll(previous.guidances);
        commands.addAll(previous.commands);
        displays.addAll(previous.displays);
        actions.addAll(previous.actions);
        if (filter == null) {
            filter = previous.filter;
        }
        previous.guidances = new ArrayList<>();
        previous.commands = new ArrayList<>();
        previous.displays = new ArrayList<>();
        previous.actions = new ArrayList<>();
        previous.filter = null;
    }
}
