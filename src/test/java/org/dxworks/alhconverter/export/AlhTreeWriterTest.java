package org.dxworks.alhconverter.export;

import org.approvaltests.Approvals;
import org.dxworks.alhconverter.diagnostics.DiagnosticKind;
import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.model.AlarmChannel;
import org.dxworks.alhconverter.model.AlarmGroup;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.FilterExpression;
import org.dxworks.alhconverter.model.FilterValue;
import org.dxworks.alhconverter.parser.AlhParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlhTreeWriterTest {

    private static final Path SAMPLE = Paths.get("src/test/resources/samples/alh/sample.alh");

    private final DiagnosticReporter reporter = DiagnosticReporter.silent();
    private final AlhTreeWriter writer = new AlhTreeWriter(reporter);

    @Test
    void exportSample() throws IOException {
        AlarmTree tree = new AlhParser(DiagnosticReporter.silent()).parse(SAMPLE, "sample");
        Approvals.verify(writer.render(tree));
    }

    @Test
    void reparsedExportIsStable() throws IOException {
        AlhParser parser = new AlhParser(DiagnosticReporter.silent());
        String first = writer.render(parser.parse(SAMPLE, "sample"));
        List<String> lines = Arrays.asList(first.split("\n", -1));
        String second = writer.render(parser.parse(lines, null, "sample"));

        assertEquals(first, second);
    }

    @Test
    void channelMaskReflectsEnabledFilterAndLatching() {
        AlarmTree tree = new AlarmTree("test");
        AlarmGroup top = tree.createGroup("Top");
        AlarmChannel plain = tree.createChannel("PV:plain", top.getIdentifier());
        AlarmChannel disabled = tree.createChannel("PV:disabled", top.getIdentifier());
        disabled.setEnabled(false);
        disabled.setLatching(false);
        AlarmChannel enabledByFilter = tree.createChannel("PV:filtered", top.getIdentifier());
        enabledByFilter.setFilter(FilterExpression.forPv("SYS:on", FilterValue.of(1), true));

        assertEquals("-----", AlhTreeWriter.channelMask(plain));
        assertEquals("CD-T-", AlhTreeWriter.channelMask(disabled));
        assertEquals("CD---", AlhTreeWriter.channelMask(enabledByFilter));
    }

    @Test
    void groupHeaderUsesTagAndAlias() {
        AlarmTree tree = new AlarmTree("test");
        AlarmGroup group = tree.createGroup("Vacuum System", null, "Vacuum", null);
        AlarmGroup inner = tree.createGroup("Pumps", group.getIdentifier());
        tree.createChannel("VAC:pump1", inner.getIdentifier());

        assertEquals("GROUP NULL Vacuum\n$ALIAS Vacuum System\n\n"
                + "GROUP Vacuum Pumps\n\n"
                + "CHANNEL Pumps VAC:pump1 -----\n", writer.render(tree));
    }

    @Test
    void displaysAndActionsAreTranslated() {
        AlarmTree tree = new AlarmTree("test");
        AlarmChannel channel = tree.createChannel("PV:1");
        channel.addDisplay("Panel", "/opt/displays/vacuum.bob", Map.of("P", "VAC:", "N", "1"));
        channel.addDisplay("Wiki", "https://wiki.example.org/pv1");
        channel.addAutoAction("notify", 0, "notify.sh PV:1");
        channel.addAutoAction("late", 30, "late.sh");
        channel.addMail("ops@example.org", 0);

        List<String> lines = writer.nodeLines(channel, "NULL");

        assertEquals(List.of(
                "CHANNEL NULL PV:1 -----",
                "$COMMAND run_edm.sh -m \"N=1,P=VAC:\" vacuum.edl",
                "$GUIDANCE https://wiki.example.org/pv1",
                "$SEVRCOMMAND UP_ANY notify.sh PV:1"), lines);
        assertEquals(2, reporter.ofKind(DiagnosticKind.UNSUPPORTED).size());
    }

    @Test
    void edmCommandIsConfigurable() {
        AlarmTree tree = new AlarmTree("test");
        AlarmChannel channel = tree.createChannel("PV:1");
        channel.addDisplay("Panel", "file:///opt/displays/vacuum.bob");

        List<String> lines = new AlhTreeWriter("/usr/bin/edm -x", reporter).nodeLines(channel, "NULL");
        assertEquals("$COMMAND /usr/bin/edm -x vacuum.edl", lines.get(1));
    }

    @Test
    void inclusionAndRawFilter() {
        AlarmTree tree = new AlarmTree("test");
        AlarmGroup top = tree.createGroup("Top");
        tree.createInclusion("sub.xml", top.getIdentifier());
        AlarmChannel channel = tree.createChannel("PV:1", top.getIdentifier());
        channel.setRawFilter("PV:2 > 5");

        String alh = writer.render(tree);

        assertTrue(alh.contains("INCLUDE Top sub.alh\n"));
        assertFalse(alh.contains("$FORCEPV"));
        assertEquals(1, reporter.ofKind(DiagnosticKind.UNSUPPORTED).size());
    }

    @Test
    void multipleTopLevelGroupsAreReported() {
        AlarmTree tree = new AlarmTree("test");
        tree.createGroup("First");
        tree.createGroup("Second");

        String alh = writer.render(tree);

        assertEquals(List.of("GROUP NULL First", "", "GROUP NULL Second", ""),
                Arrays.stream(alh.split("\n", -1)).collect(Collectors.toList()));
        assertEquals(1, reporter.ofKind(DiagnosticKind.STRUCTURAL).size());
    }
}
