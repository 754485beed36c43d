package org.dxworks.alhconverter.export;

import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.model.AlarmChannel;
import org.dxworks.alhconverter.model.AlarmGroup;
import org.dxworks.alhconverter.model.AlarmNode;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.AlhMask;
import org.dxworks.alhconverter.model.AutomatedAction;
import org.dxworks.alhconverter.model.Command;
import org.dxworks.alhconverter.model.Display;
import org.dxworks.alhconverter.model.FilterExpression;
import org.dxworks.alhconverter.model.Guidance;
import org.dxworks.alhconverter.model.InclusionMarker;
import org.dxworks.alhconverter.model.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a tree back into the alarm handler format.
 *
 * <p>Nodes are written in pre-order, each followed by a blank line. The root itself is not
 * written; its children name {@code NULL} as parent. Phoebus features without an alarm handler
 * equivalent are reported and left out.
 */
public class AlhTreeWriter implements TreeWriter {

    public static final String EXTENSION = ".alh";
    private static final String ROOT_PARENT = "NULL";

    private final String edmCommand;
    private final DiagnosticReporter reporter;

    public AlhTreeWriter(DiagnosticReporter reporter) {
        this(AlhExportFormat.DEFAULT_EDM_COMMAND, reporter);
    }

    public AlhTreeWriter(String edmCommand, DiagnosticReporter reporter) {
        this.edmCommand = edmCommand;
        this.reporter = reporter;
    }

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public String render(AlarmTree tree) {
        if (tree.children(tree.getRootId()).size() > 1) {
            reporter.structural("creating invalid alh, alarm tree " + tree.getConfigName()
                    + " has more than one top group");
        }
        List<String> lines = new ArrayList<>();
        appendChildren(tree, tree.getRootId(), ROOT_PARENT, lines);
        return String.join("\n", lines);
    }

    private void appendChildren(AlarmTree tree, String id, String parentTag, List<String> lines) {
        for (TreeNode child : tree.children(id)) {
            FilterExpression inherited = tree.getNode(id) instanceof AlarmNode parent ? parent.getFilter() : null;
            lines.addAll(nodeLines(child, parentTag, inherited));
            lines.add("");
            appendChildren(tree, child.getIdentifier(), child.getTag(), lines);
        }
    }

    List<String> nodeLines(TreeNode node, String parentTag) {
        return nodeLines(node, parentTag, null);
    }

    /**
     * @param inherited filter of the parent group, not repeated on a channel that carries the same
     */
    List<String> nodeLines(TreeNode node, String parentTag, FilterExpression inherited) {
        List<String> lines = new ArrayList<>();
        if (node instanceof InclusionMarker marker) {
            lines.add("INCLUDE " + parentTag + " " + marker.linkTarget(EXTENSION));
        } else if (node instanceof AlarmChannel channel) {
            lines.add("CHANNEL " + parentTag + " " + channel.getPvName() + " " + channelMask(channel));
            if (!channel.getDescription().isEmpty()) {
                lines.add("$ALIAS " + channel.getDescription());
            }
            appendEntries(channel, lines);
            if (channel.getDelay() > 0) {
                lines.add("$ALARMCOUNTFILTER " + channel.getCount() + " " + channel.getDelay());
            }
            if (channel.getFilter() != null && !sameFilter(channel.getFilter(), inherited)) {
                lines.addAll(channel.getFilter().toLegacyLines(channel.isLatching()));
            } else if (channel.hasFilter()) {
                reporter.unsupported("can't create alh force PV from filter " + channel.getRawFilter()
                        + " of " + channel.getPvName());
            }
        } else if (node instanceof AlarmGroup group) {
            lines.add("GROUP " + parentTag + " " + group.getTag());
            if (!group.getName().equals(group.getTag())) {
                lines.add("$ALIAS " + group.getName());
            }
            appendEntries(group, lines);
            if (group.getFilter() != null) {
                lines.addAll(group.getFilter().toLegacyLines());
            }
        } else {
            throw new IllegalArgumentException("Can't export " + node + " below the root");
        }
        return lines;
    }

    private static boolean sameFilter(FilterExpression filter, FilterExpression inherited) {
        return inherited != null && filter.isEnabling() == inherited.isEnabling()
                && filter.toTargetString().equals(inherited.toTargetString());
    }

    /**
     * An enabling filter only has an effect on a channel that is disabled by default.
     */
    static String channelMask(AlarmChannel channel) {
        boolean filterEnables = channel.getFilter() != null && channel.getFilter().isEnabling();
        boolean enabledByDefault = channel.isEnabled() && !filterEnables;
        return AlhMask.of(enabledByDefault, channel.isLatching());
    }

    private void appendEntries(AlarmNode node, List<String> lines) {
        for (Guidance guidance : node.getGuidances()) {
            lines.add("$GUIDANCE");
            lines.add(guidance.details);
            lines.add("$END");
        }
        for (Command command : node.getCommands()) {
            lines.add("$COMMAND " + command.details);
        }
        for (Display display : node.getDisplays()) {
            lines.add(AlhExportFormat.formatDisplay(display.details, edmCommand));
        }
        for (AutomatedAction action : node.getActions()) {
            AlhExportFormat.formatAction(action, reporter).ifPresent(lines::add);
        }
    }
}
