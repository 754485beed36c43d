package org.dxworks.alhconverter.model;

import java.util.Objects;

/**
 * Common part of every node held by an {@link AlarmTree}.
 */
public abstract class TreeNode {

    private final String identifier;
    private final String tag;
    private SortKey sortKey;

    protected TreeNode(String identifier, String tag, SortKey sortKey) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.tag = tag == null ? identifier : tag;
        this.sortKey = Objects.requireNonNull(sortKey, "sortKey");
    }

    public String getIdentifier() {
        return identifier;
    }

    /** The name used for this node in alarm handler files. */
    public String getTag() {
        return tag;
    }

    public SortKey getSortKey() {
        return sortKey;
    }

    public void setSortKey(SortKey sortKey) {
        this.sortKey = Objects.requireNonNull(sortKey, "sortKey");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + identifier + "]";
    }
}
