package org.dxworks.alhconverter.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlarmNodeTest {

    private final AlarmTree tree = new AlarmTree("Accelerator");

    @Test
    void displayMacrosBecomeSortedQuery() {
        AlarmGroup group = tree.createGroup("Vacuum");
        Map<String, Object> macros = new LinkedHashMap<>();
        macros.put("P", "VAC:");
        macros.put("DEV", "gauge 1");

        group.addDisplay("Overview", "/opt/displays/vacuum.bob", macros);

        assertEquals("file:///opt/displays/vacuum.bob?DEV=gauge+1&P=VAC%3A", group.getDisplays().get(0).details);
    }

    @Test
    void displayUrlKeepsExistingQuery() {
        AlarmGroup group = tree.createGroup("Vacuum");
        group.addDisplay("Overview", "https://host/displays/vacuum.bob?P=X", Map.of("P", "Y"));

        assertEquals("https://host/displays/vacuum.bob?P=X", group.getDisplays().get(0).details);
    }

    @Test
    void displayMacrosNeedAbsolutePath() {
        AlarmGroup group = tree.createGroup("Vacuum");
        assertThrows(IllegalArgumentException.class,
                () -> group.addDisplay("Overview", "displays/vacuum.bob", Map.of("P", "Y")));
        assertTrue(group.getDisplays().isEmpty());
    }

    @Test
    void displayWithoutMacrosIsKeptVerbatim() {
        AlarmGroup group = tree.createGroup("Vacuum");
        group.addDisplay("Wiki", "https://wiki.example.org/vacuum", Map.of());
        assertEquals("https://wiki.example.org/vacuum", group.getDisplays().get(0).details);
    }

    @Test
    void actionsCarryTypePrefixes() {
        AlarmChannel channel = tree.createChannel("VAC:gauge1");
        channel.addSevrPv("VAC:gauge1:sevr");
        channel.addAutoAction("notify", 0, "notify.sh gauge1");
        channel.addMail(List.of("ops@example.org", "vac@example.org"), 30, "Mail experts");
        channel.addMail("oncall@example.org", 5);

        List<AutomatedAction> actions = channel.getActions();
        assertEquals("sevrpv:VAC:gauge1:sevr", actions.get(0).details);
        assertEquals("Severity PV", actions.get(0).title);
        assertEquals("cmd", actions.get(1).type());
        assertEquals("notify.sh gauge1", actions.get(1).target());
        assertEquals("mailto:ops@example.org,vac@example.org", actions.get(2).details);
        assertEquals(30, actions.get(2).delay);
        assertEquals("mail", actions.get(3).title);
    }

    @Test
    void rawFilterAndExpressionExcludeEachOther() {
        AlarmChannel channel = tree.createChannel("VAC:gauge1");
        assertFalse(channel.hasFilter());
        assertNull(channel.targetFilter());

        channel.setFilter(FilterExpression.forPv("VAC:on", FilterValue.of(1), true));
        channel.setRawFilter("VAC:on > 2");
        assertNull(channel.getFilter());
        assertEquals("VAC:on > 2", channel.targetFilter());

        channel.setFilter(FilterExpression.forPv("VAC:on", FilterValue.of(1), true));
        assertNull(channel.getRawFilter());
        assertEquals("(VAC:on) == 1", channel.targetFilter());
    }

    @Test
    void entryListsAreReadOnly() {
        AlarmGroup group = tree.createGroup("Vacuum");
        assertThrows(UnsupportedOperationException.class, () -> group.getGuidances().add(new Guidance("t", "d")));
    }
}
