package org.dxworks.alhconverter.model;

/**
 * A monitored process variable, a {@code pv} in Phoebus and a CHANNEL in alarm handler files.
 * The identifier of a channel is its PV name.
 */
public final class AlarmChannel extends AlarmNode {

    private String description = "";
    private boolean enabled = true;
    private boolean latching = true;
    private boolean annunciating = true;
    private int delay;
    private int count;
    private String rawFilter;

    AlarmChannel(String pvName, SortKey sortKey) {
        super(pvName, pvName, pvName, sortKey);
    }

    public String getPvName() {
        return getName();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isLatching() {
        return latching;
    }

    public void setLatching(boolean latching) {
        this.latching = latching;
    }

    public boolean isAnnunciating() {
        return annunciating;
    }

    public void setAnnunciating(boolean annunciating) {
        this.annunciating = annunciating;
    }

    /** Seconds the alarm condition must persist before it is raised. */
    public int getDelay() {
        return delay;
    }

    public void setDelay(int delay) {
        this.delay = delay;
    }

    /** Number of occurrences within the delay that also raise the alarm. */
    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    /**
     * A Phoebus filter given verbatim instead of as a {@link FilterExpression}.
     * Has no alarm handler representation.
     */
    public String getRawFilter() {
        return rawFilter;
    }

    public void setRawFilter(String rawFilter) {
        this.rawFilter = rawFilter;
        if (rawFilter != null) {
            setFilter(null);
        }
    }

    @Override
    public void setFilter(FilterExpression filter) {
        super.setFilter(filter);
        if (filter != null) {
            rawFilter = null;
        }
    }

    public boolean hasFilter() {
        return getFilter() != null || (rawFilter != null && !rawFilter.isEmpty());
    }

    /** The filter as Phoebus expects it, or {@code null} without a filter. */
    public String targetFilter() {
        if (getFilter() != null) {
            return getFilter().toTargetString();
        }
        return rawFilter == null || rawFilter.isEmpty() ? null : rawFilter;
    }
}
