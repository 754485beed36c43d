package org.dxworks.alhconverter.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlarmTreeTest {

    private static List<String> ids(List<TreeNode> nodes) {
        return nodes.stream().map(TreeNode::getIdentifier).collect(Collectors.toList());
    }

    @Test
    void groupsAreIdentifiedByPathAndChannelsByPv() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup vacuum = tree.createGroup("Vacuum");
        AlarmGroup pumps = tree.createGroup("Pumps", vacuum.getIdentifier());
        AlarmChannel pump = tree.createChannel("VAC:pump1", pumps.getIdentifier());

        assertEquals("Accelerator", tree.getRootId());
        assertEquals("Accelerator/Vacuum", vacuum.getIdentifier());
        assertEquals("Accelerator/Vacuum/Pumps", pumps.getIdentifier());
        assertEquals("VAC:pump1", pump.getIdentifier());
        assertEquals("Pumps", pumps.getTag());
        assertSame(pumps, tree.parent(pump.getIdentifier()));
        assertNull(tree.parent(tree.getRootId()));
        assertTrue(tree.isLeaf(pump.getIdentifier()));
        assertEquals(4, tree.size());
    }

    @Test
    void sameNameUnderDifferentParentsIsAllowed() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup a = tree.createGroup("A");
        AlarmGroup b = tree.createGroup("B");
        tree.createGroup("Pumps", a.getIdentifier());
        tree.createGroup("Pumps", b.getIdentifier());

        assertTrue(tree.contains("Accelerator/A/Pumps"));
        assertTrue(tree.contains("Accelerator/B/Pumps"));
    }

    @Test
    void duplicateIdentifierFailsWithoutChangingTheTree() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup a = tree.createGroup("A");
        AlarmGroup b = tree.createGroup("B");
        tree.createChannel("PV:1", a.getIdentifier());
        int size = tree.size();

        DuplicateIdentifierException group = assertThrows(DuplicateIdentifierException.class, () -> tree.createGroup("A"));
        assertEquals("Accelerator/A", group.getIdentifier());
        assertThrows(DuplicateIdentifierException.class, () -> tree.createChannel("PV:1", b.getIdentifier()));

        assertEquals(size, tree.size());
        assertTrue(tree.isLeaf(b.getIdentifier()));
        assertInstanceOf(StructuralException.class, group);
    }

    @Test
    void unknownParentIsRejected() {
        AlarmTree tree = new AlarmTree("Accelerator");
        assertThrows(IllegalArgumentException.class, () -> tree.createChannel("PV:1", "Accelerator/missing"));
    }

    @Test
    void removeNodeReturnsSubtreeSize() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup top = tree.createGroup("Top");
        AlarmGroup sub = tree.createGroup("Sub", top.getIdentifier());
        tree.createChannel("PV:1", sub.getIdentifier());
        tree.createChannel("PV:2", sub.getIdentifier());
        tree.createChannel("PV:3", top.getIdentifier());

        assertEquals(3, tree.removeNode(sub.getIdentifier()));
        assertFalse(tree.contains("PV:1"));
        assertEquals(List.of("PV:3"), ids(tree.children(top.getIdentifier())));
        assertEquals(1, tree.removeNode("PV:3"));
        assertEquals(2, tree.size());
    }

    @Test
    void rootCanNotBeRemoved() {
        AlarmTree tree = new AlarmTree("Accelerator");
        assertThrows(RootRemovalException.class, () -> tree.removeNode("Accelerator"));
        assertThrows(RootRemovalException.class, () -> tree.linkPast("Accelerator"));
        assertThrows(RootRemovalException.class, () -> tree.removeSubtree("Accelerator"));
    }

    @Test
    void linkPastMovesChildrenToTheFormerPosition() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup top = tree.createGroup("Top");
        tree.createChannel("PV:before", top.getIdentifier(), SortKey.of(1));
        AlarmGroup middle = tree.createGroup("Middle", top.getIdentifier(), null, SortKey.of(2));
        tree.createChannel("PV:after", top.getIdentifier(), SortKey.of(3));
        AlarmChannel first = tree.createChannel("PV:1", middle.getIdentifier(), SortKey.of(2));
        first.setDescription("first");
        tree.createChannel("PV:2", middle.getIdentifier(), SortKey.of(2));
        int size = tree.size();

        tree.linkPast(middle.getIdentifier());

        assertEquals(size - 1, tree.size());
        assertFalse(tree.contains(middle.getIdentifier()));
        assertSame(top, tree.parent("PV:1"));
        assertSame(top, tree.parent("PV:2"));
        assertEquals("first", ((AlarmChannel) tree.getNode("PV:1")).getDescription());
        assertEquals(List.of("PV:before", "PV:1", "PV:2", "PV:after"),
                ids(tree.allNodes().subList(2, 6)));
    }

    @Test
    void childrenFollowSortKeysThenInsertionOrder() {
        AlarmTree tree = new AlarmTree("Accelerator");
        tree.createChannel("PV:text", null, SortKey.of("b"));
        tree.createChannel("PV:five", null, SortKey.of(5));
        tree.createChannel("PV:one", null, SortKey.of(1));
        tree.createChannel("PV:five-again", null, SortKey.of(5));

        assertEquals(List.of("PV:one", "PV:five", "PV:five-again", "PV:text"),
                ids(tree.children(tree.getRootId())));
    }

    @Test
    void renameKeepsPositionTagAndEntries() {
        AlarmTree tree = new AlarmTree("Accelerator");
        tree.createGroup("First");
        AlarmGroup old = tree.createGroup("Vac");
        tree.createGroup("Last");
        old.addGuidance("help", "text");
        old.setFilter(FilterExpression.forPv("PV:on", FilterValue.of(1), true));

        AlarmGroup renamed = tree.renameGroup(old.getIdentifier(), "Vacuum");

        assertEquals("Accelerator/Vacuum", renamed.getIdentifier());
        assertEquals("Vacuum", renamed.getName());
        assertEquals("Vac", renamed.getTag());
        assertEquals(old.getSortKey(), renamed.getSortKey());
        assertEquals(1, renamed.getGuidances().size());
        assertNotNull(renamed.getFilter());
        assertTrue(old.getGuidances().isEmpty());
        assertNull(old.getFilter());
        assertFalse(tree.contains("Accelerator/Vac"));
        assertEquals(List.of("Accelerator/First", "Accelerator/Vacuum", "Accelerator/Last"),
                ids(tree.children(tree.getRootId())));
    }

    @Test
    void renameOfGroupWithChildrenFails() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup group = tree.createGroup("Vac");
        tree.createChannel("PV:1", group.getIdentifier());

        assertThrows(StructuralException.class, () -> tree.renameGroup(group.getIdentifier(), "Vacuum"));
        assertTrue(tree.contains("Accelerator/Vac"));
        assertSame(group, tree.parent("PV:1"));
    }

    @Test
    void renameOntoExistingGroupFailsAndMergeCombinesEntries() {
        AlarmTree tree = new AlarmTree("Accelerator");
        AlarmGroup existing = tree.createGroup("Vacuum");
        AlarmGroup other = tree.createGroup("Vac");
        other.addCommand("ls", "ls -l");

        DuplicateIdentifierException e = assertThrows(DuplicateIdentifierException.class,
                () -> tree.renameGroup(other.getIdentifier(), "Vacuum"));
        assertTrue(tree.contains("Accelerator/Vac"));

        AlarmGroup merged = tree.mergeGroup(other.getIdentifier(), e.getIdentifier());
        assertSame(existing, merged);
        assertEquals("ls -l", merged.getCommands().get(0).details);
        assertFalse(tree.contains("Accelerator/Vac"));
    }

    @Test
    void removeSubtreeAndGraftMoveWholeBranches() {
        AlarmTree source = new AlarmTree("Accelerator/Target");
        AlarmGroup top = source.createGroup("Included");
        AlarmGroup inner = source.createGroup("Inner", top.getIdentifier());
        source.createChannel("PV:1", inner.getIdentifier());

        AlarmTree branch = source.removeSubtree(top.getIdentifier());
        assertEquals(1, source.size());
        assertSame(top, branch.getRoot());
        assertEquals(3, branch.size());

        AlarmTree target = new AlarmTree("Accelerator");
        AlarmGroup parent = target.createGroup("Target");
        target.createChannel("PV:0", parent.getIdentifier());
        target.graft(parent.getIdentifier(), branch, SortKey.of(-1));

        assertEquals(List.of("Accelerator/Target/Included", "PV:0"), ids(target.children(parent.getIdentifier())));
        assertSame(inner, target.parent("PV:1"));
        assertEquals(6, target.size());
    }

    @Test
    void graftCollisionLeavesTreeIntact() {
        AlarmTree branchSource = new AlarmTree("Other");
        AlarmGroup top = branchSource.createGroup("Group");
        branchSource.createChannel("PV:shared", top.getIdentifier());
        AlarmTree branch = branchSource.removeSubtree(top.getIdentifier());

        AlarmTree target = new AlarmTree("Accelerator");
        target.createChannel("PV:shared");
        int size = target.size();

        assertThrows(DuplicateIdentifierException.class, () -> target.graft(null, branch, null));
        assertEquals(size, target.size());
        assertFalse(target.contains("Other/Group"));
    }

    @Test
    void inclusionMarkersGetUniqueIdentifiers() {
        AlarmTree tree = new AlarmTree("Accelerator");
        InclusionMarker first = tree.createInclusion("sub.alh", null);
        InclusionMarker second = tree.createInclusion("sub.alh", null);

        assertNotEquals(first.getIdentifier(), second.getIdentifier());
        assertEquals("sub.xml", first.linkTarget(".xml"));
        assertEquals("sub.alh", first.linkTarget(null));
    }
}
