package org.carball.qengine.model.history;

import java.time.Instant;

/**
 * Inclusive instant range.
 */
public record DateRange(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
