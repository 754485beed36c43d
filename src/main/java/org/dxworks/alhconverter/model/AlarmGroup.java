package org.dxworks.alhconverter.model;

/**
 * An inner node of the alarm hierarchy, a {@code component} in Phoebus.
 */
public final class AlarmGroup extends AlarmNode {

    AlarmGroup(String name, String identifier, String tag, SortKey sortKey) {
        super(name, identifier, tag == null ? name : tag, sortKey);
    }
}
