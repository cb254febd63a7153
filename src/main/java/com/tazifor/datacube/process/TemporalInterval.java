package com.tazifor.datacube.process;

import java.time.Instant;

/**
 * Left-closed interval {@code [start, end)}.
 */
public record TemporalInterval(Instant start, Instant end) {

    public TemporalInterval {
        if (start == null || end == null)
            throw new IllegalArgumentException("interval bounds must not be null");
        if (end.isBefore(start))
            throw new IllegalArgumentException("interval end " + end + " before start " + start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
