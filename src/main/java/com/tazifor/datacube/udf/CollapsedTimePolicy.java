package com.tazifor.datacube.udf;

import java.time.Instant;
import java.util.List;

/**
 * Picks the instant for the tile produced when a grouped udf drops the time
 * axis.
 */
public enum CollapsedTimePolicy {
    FIRST_INSTANT,
    LAST_INSTANT,
    FIXED;

    /**
     * @param groupInstants instants of the input group, ascending
     * @param fixedLabel    label used by {@link #FIXED}, and when the group has no instants
     */
    public Instant resolve(List<Instant> groupInstants, Instant fixedLabel) {
        if (this == FIXED || groupInstants.isEmpty()) return fixedLabel;
        return this == FIRST_INSTANT ? groupInstants.get(0) : groupInstants.get(groupInstants.size() - 1);
    }
}
