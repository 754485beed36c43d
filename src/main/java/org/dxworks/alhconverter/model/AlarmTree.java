package org.dxworks.alhconverter.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rooted tree holding an alarm configuration.
 *
 * <p>The tree owns all nodes. Nodes are created through the {@code create*} methods only and
 * are referenced by their identifier. Groups are identified by their path
 * ({@code parentId/name}), channels by their PV name.
 *
 * <pre>
 * AlarmTree tree = new AlarmTree("Accelerator");
 * AlarmGroup vacuum = tree.createGroup("Vacuum");
 * AlarmChannel gauge = tree.createChannel("VAC:gauge1", vacuum.getIdentifier());
 * gauge.setDescription("Gauge pressure");
 * </pre>
 */
public class AlarmTree {

    private static final String PATH_SEPARATOR = "/";
    private static final Comparator<TreeNode> BY_SORT_KEY = Comparator.comparing(TreeNode::getSortKey);

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final String rootId;
    private String configName;
    private long insertionCounter;

    public AlarmTree(String configName) {
        Objects.requireNonNull(configName, "configName");
        ConfigRoot root = new ConfigRoot(configName);
        this.rootId = root.getIdentifier();
        this.configName = configName;
        entries.put(rootId, new Entry(root, null));
    }

    private AlarmTree(TreeNode root) {
        this.rootId = root.getIdentifier();
        this.configName = root.getTag();
        entries.put(rootId, new Entry(root, null));
    }

    public String getRootId() {
        return rootId;
    }

    public TreeNode getRoot() {
        return entries.get(rootId).node;
    }

    /** Name of the configuration, exported on the {@code config} element. */
    public String getConfigName() {
        return configName;
    }

    public void setConfigName(String configName) {
        this.configName = Objects.requireNonNull(configName, "configName");
    }

    public AlarmGroup createGroup(String name) {
        return createGroup(name, null, null, null);
    }

    public AlarmGroup createGroup(String name, String parentId) {
        return createGroup(name, parentId, null, null);
    }

    /**
     * @param parentId parent identifier, the root when null
     * @param tag      alarm handler name of the group, the name when null
     * @param sortKey  export order among siblings, insertion order when null
     * @throws DuplicateIdentifierException if {@code parentId/name} already exists
     */
    public AlarmGroup createGroup(String name, String parentId, String tag, SortKey sortKey) {
        String pid = parentOrRoot(parentId);
        AlarmGroup group = new AlarmGroup(name, pid + PATH_SEPARATOR + name, tag, keyOrNext(sortKey));
        addNode(group, pid);
        return group;
    }

    public AlarmChannel createChannel(String pvName) {
        return createChannel(pvName, null, null);
    }

    public AlarmChannel createChannel(String pvName, String parentId) {
        return createChannel(pvName, parentId, null);
    }

    /**
     * @throws DuplicateIdentifierException if a channel for the PV already exists anywhere in the tree
     */
    public AlarmChannel createChannel(String pvName, String parentId, SortKey sortKey) {
        String pid = parentOrRoot(parentId);
        AlarmChannel channel = new AlarmChannel(pvName, keyOrNext(sortKey));
        addNode(channel, pid);
        return channel;
    }

    public InclusionMarker createInclusion(String filename, String parentId) {
        return createInclusion(filename, parentId, null);
    }

    public InclusionMarker createInclusion(String filename, String parentId, SortKey sortKey) {
        String pid = parentOrRoot(parentId);
        SortKey key = keyOrNext(sortKey);
        String identifier = pid + PATH_SEPARATOR + filename + "#" + insertionCounter;
        InclusionMarker marker = new InclusionMarker(identifier, filename, key);
        addNode(marker, pid);
        return marker;
    }

    private void addNode(TreeNode node, String parentId) {
        if (entries.containsKey(node.getIdentifier())) {
            throw new DuplicateIdentifierException(node.getIdentifier(), "can't create node");
        }
        entries.put(node.getIdentifier(), new Entry(node, parentId));
        entries.get(parentId).children.add(node.getIdentifier());
    }

    private String parentOrRoot(String parentId) {
        if (parentId == null) {
            return rootId;
        }
        if (!entries.containsKey(parentId)) {
            throw new IllegalArgumentException("Parent node '" + parentId + "' is not in the tree");
        }
        return parentId;
    }

    private SortKey keyOrNext(SortKey sortKey) {
        long next = insertionCounter++;
        return sortKey != null ? sortKey : SortKey.of(next);
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public TreeNode getNode(String id) {
        return entry(id).node;
    }

    public int size() {
        return entries.size();
    }

    /** Direct children ordered by sort key; equal keys keep insertion order. */
    public List<TreeNode> children(String id) {
        List<TreeNode> children = new ArrayList<>();
        for (String childId : entry(id).children) {
            children.add(entries.get(childId).node);
        }
        children.sort(BY_SORT_KEY);
        return children;
    }

    /** The parent node, {@code null} for the root. */
    public TreeNode parent(String id) {
        String pid = entry(id).parentId;
        return pid == null ? null : entries.get(pid).node;
    }

    public boolean isLeaf(String id) {
        return entry(id).children.isEmpty();
    }

    /** All nodes in pre-order, children by sort key. */
    public List<TreeNode> allNodes() {
        List<TreeNode> nodes = new ArrayList<>();
        collect(rootId, nodes);
        return nodes;
    }

    private void collect(String id, List<TreeNode> nodes) {
        nodes.add(entries.get(id).node);
        for (TreeNode child : children(id)) {
            collect(child.getIdentifier(), nodes);
        }
    }

    /**
     * Removes the node and its whole subtree.
     *
     * @return number of removed nodes
     * @throws RootRemovalException for the root
     */
    public int removeNode(String id) {
        if (rootId.equals(id)) {
            throw new RootRemovalException("You can't remove the root node");
        }
        Entry entry = entry(id);
        entries.get(entry.parentId).children.remove(id);
        return removeRecursively(id);
    }

    private int removeRecursively(String id) {
        Entry removed = entries.remove(id);
        int count = 1;
        for (String childId : removed.children) {
            count += removeRecursively(childId);
        }
        return count;
    }

    /**
     * Removes the node and hands its children to its parent, at the position the node had.
     * The children keep their sort keys and data.
     *
     * @throws RootRemovalException for the root
     */
    public void linkPast(String id) {
        Entry entry = entry(id);
        if (entry.parentId == null) {
            throw new RootRemovalException("Can't link past the root node");
        }
        List<String> siblings = entries.get(entry.parentId).children;
        int position = siblings.indexOf(id);
        siblings.remove(position);
        siblings.addAll(position, entry.children);
        for (String childId : entry.children) {
            entries.get(childId).parentId = entry.parentId;
        }
        entries.remove(id);
    }

    /**
     * Detaches the subtree starting at {@code id} and returns it as a tree of its own, with that
     * node as root. The configuration name of the new tree is the tag of the node.
     *
     * @throws RootRemovalException for the root
     */
    public AlarmTree removeSubtree(String id) {
        if (rootId.equals(id)) {
            throw new RootRemovalException("You can't detach the root node");
        }
        Entry top = entry(id);
        AlarmTree subtree = new AlarmTree(top.node);
        subtree.insertionCounter = insertionCounter;
        copyChildren(id, subtree);
        removeNode(id);
        return subtree;
    }

    private void copyChildren(String id, AlarmTree target) {
        for (String childId : entries.get(id).children) {
            Entry child = entries.get(childId);
            target.entries.put(childId, new Entry(child.node, id));
            target.entries.get(id).children.add(childId);
            copyChildren(childId, target);
        }
    }

    /**
     * Attaches the root of {@code subtree} and everything below it under {@code parentId}.
     * The subtree must not be used afterwards.
     *
     * @param sortKey new sort key of the attached root, kept when null
     * @throws DuplicateIdentifierException if any identifier of the subtree exists in this tree;
     *                                      nothing is attached in that case
     */
    public void graft(String parentId, AlarmTree subtree, SortKey sortKey) {
        String pid = parentOrRoot(parentId);
        for (String id : subtree.entries.keySet()) {
            if (entries.containsKey(id)) {
                throw new DuplicateIdentifierException(id, "can't graft subtree " + subtree.rootId);
            }
        }

        TreeNode top = subtree.getRoot();
        if (sortKey != null) {
            top.setSortKey(sortKey);
        }
        entries.put(top.getIdentifier(), new Entry(top, pid));
        entries.get(pid).children.add(top.getIdentifier());
        subtree.copyChildren(top.getIdentifier(), this);
        insertionCounter = Math.max(insertionCounter, subtree.insertionCounter);
    }

    /**
     * Renames a group by recreating it under its parent: the new name becomes the Phoebus name,
     * the old name is kept as tag. Entries, filter and sort key move to the new group.
     *
     * @throws StructuralException          if the group has children
     * @throws DuplicateIdentifierException if the new identifier is taken; nothing changes
     */
    public AlarmGroup renameGroup(String id, String newName) {
        AlarmGroup old = group(id);
        if (!isLeaf(id)) {
            throw new StructuralException("Can't rename node " + id + " to " + newName + ", because it has children");
        }
        String pid = entry(id).parentId;
        String newId = pid + PATH_SEPARATOR + newName;
        if (entries.containsKey(newId)) {
            throw new DuplicateIdentifierException(newId, "can't rename " + id);
        }

        List<String> siblings = entries.get(pid).children;
        int position = siblings.indexOf(id);
        removeNode(id);

        AlarmGroup renamed = new AlarmGroup(newName, newId, old.getTag(), old.getSortKey());
        renamed.takeOver(old);
        entries.put(newId, new Entry(renamed, pid));
        siblings.add(position, newId);
        return renamed;
    }

    /**
     * Moves the entries of the childless group {@code sourceId} onto group {@code targetId}
     * and removes the source.
     */
    public AlarmGroup mergeGroup(String sourceId, String targetId) {
        AlarmGroup source = group(sourceId);
        AlarmGroup target = group(targetId);
        if (!isLeaf(sourceId)) {
            throw new StructuralException("Can't merge node " + sourceId + ", because it has children");
        }
        target.takeOver(source);
        removeNode(sourceId);
        return target;
    }

    private AlarmGroup group(String id) {
        if (!(getNode(id) instanceof AlarmGroup group)) {
            throw new IllegalArgumentException("Node '" + id + "' is not a group");
        }
        return group;
    }

    private Entry entry(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("Node '" + id + "' is not in the tree");
        }
        return entry;
    }

    private static final class Entry {
        final TreeNode node;
        String parentId;
        final List<String> children = new ArrayList<>();

        Entry(TreeNode node, String parentId) {
            this.node = node;
            this.parentId = parentId;
        }
    }
}
