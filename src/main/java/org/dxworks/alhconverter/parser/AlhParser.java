package org.dxworks.alhconverter.parser;

import org.dxworks.alhconverter.diagnostics.DiagnosticKind;
import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.diagnostics.Severity;
import org.dxworks.alhconverter.model.AlarmChannel;
import org.dxworks.alhconverter.model.AlarmGroup;
import org.dxworks.alhconverter.model.AlarmNode;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.AlhMask;
import org.dxworks.alhconverter.model.DuplicateIdentifierException;
import org.dxworks.alhconverter.model.FilterExpression;
import org.dxworks.alhconverter.model.FilterValue;
import org.dxworks.alhconverter.model.StructuralException;
import org.dxworks.alhconverter.model.TreeNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an alarm handler configuration into an {@link AlarmTree}.
 *
 * <p>The file is processed line by line. Each keyword is applied to the current node, which is
 * the group or channel declared last. A bare {@code $GUIDANCE} collects the following lines up to
 * {@code $END}. Lines that can't be applied are reported and skipped; parsing never stops at a
 * single bad line.
 */
public class AlhParser {

    public static final String DEFAULT_CONFIG_NAME = "Accelerator";
    private static final String NULL_PARENT = "NULL";
    private static final String END_TOKEN = "$END";

    private final DiagnosticReporter reporter;

    public AlhParser(DiagnosticReporter reporter) {
        this.reporter = reporter;
    }

    public AlarmTree parse(Path file) throws IOException {
        return parse(file, DEFAULT_CONFIG_NAME);
    }

    public AlarmTree parse(Path file, String configName) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        reporter.at(file, 0, null);
        reporter.note("opened file: " + file);
        return parse(lines, file, configName);
    }

    /**
     * @param source file the lines come from, used in diagnostics only; may be null
     */
    public AlarmTree parse(List<String> lines, Path source, String configName) {
        ParseState state = new ParseState(new AlarmTree(configName));

        for (int i = 0; i < lines.size(); i++) {
            String raw = stripBom(lines.get(i), i);
            state.line = i + 1;
            reporter.at(source, state.line, raw.strip());

            if (state.guidance != null) {
                continueGuidance(raw, state);
                continue;
            }
            if (raw.isBlank() || raw.strip().startsWith("#")) {
                continue;
            }

            AlhLine line = AlhLine.split(raw);
            reporter.debug("Keyword: " + line.token + ", with args: " + line.args);
            try {
                dispatch(line, state);
            } catch (MalformedLineException e) {
                reporter.malformed(e.getMessage());
            } catch (DuplicateIdentifierException e) {
                reporter.structural("Alh contains duplicate groups, combining them for phoebus. " + e.getMessage());
                state.current = e.getIdentifier();
            } catch (IllegalArgumentException e) {
                reporter.malformed(line.token + ": " + e.getMessage());
            }
        }

        if (state.guidance != null) {
            reporter.at(source, lines.size(), null);
            reporter.malformed("$GUIDANCE not terminated by " + END_TOKEN + " before end of file");
            state.guidance.owner.addGuidance("help", state.guidance.text());
        }
        reporter.clearPosition();
        return state.tree;
    }

    private static String stripBom(String line, int index) {
        return index == 0 && line.startsWith("\uFEFF") ? line.substring(1) : line;
    }

    private void dispatch(AlhLine line, ParseState state) throws MalformedLineException {
        switch (line.keyword) {
            case GROUP -> processGroup(line.args, state);
            case INCLUDE -> processInclude(line.args, state);
            case CHANNEL -> processChannel(line.args, state);
            case ALIAS -> processAlias(line.args, state);
            case SEVRPV -> processSevrPv(line.args, state);
            case GUIDANCE -> processGuidance(line.args, state);
            case COMMAND -> processCommand(line.args, state);
            case SEVRCOMMAND -> processSevrCommand(line.args, state);
            case ALARMCOUNTFILTER -> processAlarmCount(line.args, state);
            case FORCEPV -> processForcePv(line.args, state);
            case FORCEPV_CALC -> processForcePvCalc(line.args, state);
            case STATCOMMAND -> processStatCommand(line.args, state);
            case HEARTBEATPV -> reporter.unsupported("Ignoring Heartbeat PV, must be added via settings.ini");
            case ACKPV -> reporter.unsupported("No equivalent for " + line.token + " in phoebus");
            case BEEPSEVERITY, BEEPSEVR -> reporter.unsupported("Ignoring " + line.token + " for " + state.current
                    + ", severity based annunciation filtering not possible in phoebus");
            case UNKNOWN -> throw new MalformedLineException("can't handle keyword " + line.token);
        }
    }

    // ---- tree structure ----

    private void processGroup(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "GROUP <parent> <name>");
        String parentId = findParent(state.tree, state.current, params[0]);
        AlarmGroup group = state.tree.createGroup(params[1], parentId);
        state.current = group.getIdentifier();
        propagateFilter(state.tree, parentId, group);
    }

    private void processInclude(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "INCLUDE <parent> <file>");
        String parentId = findParent(state.tree, state.current, params[0]);
        state.tree.createInclusion(params[1], parentId).setSourceLine(state.line);
    }

    private void processChannel(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "CHANNEL <parent> <pv> [mask]");
        String pvName = params[1];
        String parentId = findParent(state.tree, state.current, params[0]);

        AlarmChannel channel;
        try {
            channel = state.tree.createChannel(pvName, parentId);
        } catch (DuplicateIdentifierException e) {
            if (!(state.tree.getNode(pvName) instanceof AlarmChannel existing)) {
                throw new MalformedLineException("PV " + pvName + " clashes with a node of another type");
            }
            reporter.structural("PV " + pvName + " already exists, adding this channel's settings to the previous instance");
            channel = existing;
        }

        if (params.length > 2) {
            applyChannelMask(channel, params[2]);
        } else {
            reporter.debug("No mask for " + pvName);
        }

        state.current = channel.getIdentifier();
        state.maskEnabled = channel.isEnabled();
        propagateFilter(state.tree, parentId, channel);
    }

    private void applyChannelMask(AlarmChannel channel, String mask) {
        if (AlhMask.disables(mask)) {
            channel.setEnabled(false);
        }
        if (AlhMask.isTransient(mask)) {
            channel.setLatching(false);
        }
        if (mask.indexOf('A') >= 0) {
            reporter.note("Ignoring part of mask " + mask + " for pv " + channel.getPvName()
                    + ", because all phoebus alarms must be acknowledged");
        }
        if (mask.indexOf('L') >= 0) {
            reporter.note("Ignoring part of mask " + mask + " for pv " + channel.getPvName()
                    + ", because phoebus will log all alarms");
        }
    }

    /**
     * Walks up from {@code currentId} to the node whose alarm handler tag is {@code parentTag}.
     * {@code NULL} stands for the root.
     */
    String findParent(AlarmTree tree, String currentId, String parentTag) throws MalformedLineException {
        if (NULL_PARENT.equals(parentTag)) {
            return tree.getRootId();
        }
        String id = currentId;
        while (id != null && !id.equals(tree.getRootId())) {
            TreeNode node = tree.getNode(id);
            if (parentTag.equals(node.getTag())) {
                return id;
            }
            id = tree.parent(id).getIdentifier();
        }
        throw new MalformedLineException("parent group " + parentTag + " not found above " + currentId);
    }

    /**
     * Copies the filter of a group onto a node created below it. A channel the filter would
     * switch is enabled so that the filter decides its state.
     */
    void propagateFilter(AlarmTree tree, String parentId, AlarmNode child) {
        if (!(tree.getNode(parentId) instanceof AlarmNode parent) || parent.getFilter() == null) {
            return;
        }
        FilterExpression inherited = parent.getFilter().copy();
        reporter.note("Setting ForcePV for " + child.getIdentifier() + " to " + inherited
                + " from parent " + parentId);

        if (child instanceof AlarmChannel channel) {
            if (inherited.isEnabling() == channel.isEnabled()) {
                reporter.review("Manual check required: PV " + channel.getPvName() + " is "
                        + (channel.isEnabled() ? "enabled" : "disabled")
                        + " (channel mask) and the group forcePV would not change that. "
                        + "Keeping the group filter, check the state of this PV in Phoebus.");
            } else {
                channel.setEnabled(true);
            }
        }
        child.setFilter(inherited);
    }

    // ---- node properties ----

    private void processAlias(String args, ParseState state) throws MalformedLineException {
        String alias = args.strip();
        if (alias.isEmpty()) {
            throw new MalformedLineException("$ALIAS without text");
        }
        TreeNode node = state.tree.getNode(state.current);

        if (node instanceof AlarmChannel channel) {
            channel.setDescription(alias);
        } else if (node instanceof AlarmGroup group) {
            if (!group.getName().equals(alias)) {
                renameGroup(group, alias, state);
            }
        } else {
            throw new MalformedLineException("$ALIAS before any GROUP or CHANNEL");
        }
    }

    /**
     * The alias becomes the Phoebus name of the group; the alarm handler name stays as tag.
     */
    private void renameGroup(AlarmGroup group, String alias, ParseState state) {
        try {
            state.current = state.tree.renameGroup(group.getIdentifier(), alias).getIdentifier();
        } catch (DuplicateIdentifierException e) {
            reporter.structural("Alias " + alias + " of group " + group.getTag()
                    + " names an existing group, combining them for phoebus");
            state.current = state.tree.mergeGroup(group.getIdentifier(), e.getIdentifier()).getIdentifier();
        } catch (StructuralException e) {
            reporter.structural(e.getMessage());
        }
    }

    private void processSevrPv(String args, ParseState state) throws MalformedLineException {
        String pv = args.strip();
        if (pv.isEmpty()) {
            throw new MalformedLineException("$SEVRPV without PV");
        }
        alarmNode(state).addSevrPv(pv);
    }

    private void processGuidance(String args, ParseState state) throws MalformedLineException {
        AlarmNode node = alarmNode(state);
        String url = args.strip();
        // single line guidance is a link, best handled as a display
        if (!url.isEmpty()) {
            node.addDisplay("URL", url);
        } else {
            state.guidance = new PendingGuidance(node);
        }
    }

    private void continueGuidance(String raw, ParseState state) {
        if (raw.contains(END_TOKEN)) {
            state.guidance.owner.addGuidance("help", state.guidance.text());
            state.guidance = null;
        } else {
            state.guidance.lines.add(raw.stripTrailing());
        }
    }

    private void processCommand(String args, ParseState state) throws MalformedLineException {
        String command = args.strip();
        if (command.isEmpty()) {
            throw new MalformedLineException("$COMMAND without command");
        }
        alarmNode(state).addCommand(commandName(command), command);
    }

    private void processSevrCommand(String args, ParseState state) throws MalformedLineException {
        String[] params = args.split("\\s+", 2);
        if (params.length < 2 || params[1].isBlank()) {
            throw new MalformedLineException("expected $SEVRCOMMAND <severity> <command>");
        }
        String severity = params[0];
        String command = params[1].strip();
        AlarmNode node = alarmNode(state);

        if (!severity.contains("UP")) {
            reporter.unsupported("No phoebus equivalent for severity down commands, ignoring severity command "
                    + args + " for " + node.getIdentifier());
            return;
        }
        if (!"UP_ANY".equals(severity)) {
            reporter.note(node.getIdentifier() + ": phoebus automated action will be executed for "
                    + "any alarm increase instead of " + severity);
        }
        boolean duplicate = node.getActions().stream().anyMatch(action -> action.details.contains(command));
        if (duplicate) {
            reporter.note("ignoring duplicate action for " + node.getIdentifier() + " for severity " + severity);
        } else {
            node.addAutoAction(commandName(command), 0, command);
        }
    }

    private void processStatCommand(String args, ParseState state) throws MalformedLineException {
        String[] params = args.split("\\s+", 2);
        if (params.length < 2 || params[1].isBlank()) {
            throw new MalformedLineException("expected $STATCOMMAND <status> <command>");
        }
        AlarmNode node = alarmNode(state);
        String command = params[1].strip();
        reporter.review("Replacing STATCOMMAND with automated action for " + node.getIdentifier()
                + ", please review manually");
        node.addAutoAction(commandName(command), 0, command);
    }

    private void processAlarmCount(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "$ALARMCOUNTFILTER <count> <seconds>");
        if (!(state.tree.getNode(state.current) instanceof AlarmChannel channel)) {
            throw new MalformedLineException("$ALARMCOUNTFILTER only applies to channels");
        }
        int count = Integer.parseInt(params[0]);
        int delay = Integer.parseInt(params[1]);
        channel.setCount(count);
        channel.setDelay(delay);
    }

    // ---- force PVs ----

    private void processForcePv(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "$FORCEPV <pv|CALC> <mask> [value] [reset]");
        String forcePv = params[0];
        String forceMask = params[1];
        FilterValue value = params.length > 2 ? FilterValue.parse(params[2]) : FilterValue.of(1);
        boolean forceEnables = !AlhMask.disables(forceMask);
        AlarmNode node = alarmNode(state);

        if (params.length > 3 && !"NE".equals(params[3])) {
            reporter.report(Severity.WARNING, DiagnosticKind.NOTE, "PV " + node.getIdentifier()
                    + " uses resetValue " + params[3] + " for force, phoebus filter will reset "
                    + "immediately once forcePV != forceValue");
        }

        FilterExpression filter = "CALC".equals(forcePv)
                ? FilterExpression.forCalc("", value, forceEnables)
                : FilterExpression.forPv(forcePv, value, forceEnables);

        // compared against the channel mask, an inherited filter may already have enabled the channel
        if (node instanceof AlarmChannel channel) {
            if (forceEnables == state.maskEnabled) {
                reporter.report(Severity.ERROR, DiagnosticKind.UNSUPPORTED, "force mask " + forceMask
                        + " does not change the state of PV " + channel.getPvName()
                        + ", can't map the forcePV to a phoebus filter");
                return;
            }
            channel.setEnabled(true);
        }
        node.setFilter(filter);
    }

    private void processForcePvCalc(String args, ParseState state) throws MalformedLineException {
        String[] params = fields(args, 2, "$FORCEPV_CALC[_X] <expression|pv>");
        String fragment = params[0];
        AlarmNode node = alarmNode(state);
        FilterExpression filter = node.getFilter();
        if (filter == null || !filter.isCalc()) {
            throw new MalformedLineException("missing $FORCEPV CALC before " + "$FORCEPV_" + fragment
                    + " for " + node.getIdentifier());
        }

        String value = args.substring(fragment.length()).strip();
        if ("CALC".equals(fragment)) {
            filter.setExpr(value);
        } else if (fragment.startsWith("CALC_") && fragment.length() == "CALC_".length() + 1) {
            filter.setSlot(fragment.charAt(fragment.length() - 1), value);
        } else {
            throw new MalformedLineException("unknown keyword $FORCEPV_" + fragment);
        }
    }

    // ---- helpers ----

    private AlarmNode alarmNode(ParseState state) throws MalformedLineException {
        if (state.tree.getNode(state.current) instanceof AlarmNode node) {
            return node;
        }
        throw new MalformedLineException("no GROUP or CHANNEL declared yet");
    }

    private static String[] fields(String args, int required, String usage) throws MalformedLineException {
        String[] params = args.isBlank() ? new String[0] : args.strip().split("\\s+");
        if (params.length < required) {
            throw new MalformedLineException("expected " + usage);
        }
        return params;
    }

    /**
     * The base name of the program a command line runs, without directory and extension.
     */
    static String commandName(String commandLine) {
        String program = commandLine.strip().split("\\s+", 2)[0];
        int slash = program.lastIndexOf('/');
        String file = slash >= 0 ? program.substring(slash + 1) : program;
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    private static final class ParseState {
        final AlarmTree tree;
        String current;
        int line;
        /** Enabled state of the current channel as its mask sets it, before any filter. */
        boolean maskEnabled = true;
        PendingGuidance guidance;

        ParseState(AlarmTree tree) {
            this.tree = tree;
            this.current = tree.getRootId();
        }
    }

    /** A multi-line guidance waiting for its {@code $END}. */
    private static final class PendingGuidance {
        final AlarmNode owner;
        final List<String> lines = new ArrayList<>();

        PendingGuidance(AlarmNode owner) {
            this.owner = owner;
        }

        String text() {
            return String.join("\n", lines);
        }
    }
}
