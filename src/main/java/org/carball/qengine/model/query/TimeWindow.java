package org.carball.qengine.model.query;

import java.time.Instant;

/**
 * Inclusive window used to filter recorded executions.
 */
public record TimeWindow(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
