package org.carball.qengine.model.routing;

import java.time.Instant;

/**
 * One entry of the router's decision log, used to attribute execution feedback.
 */
public record RoutingDecision(String query, RoutingStrategy strategy, String connectionId,
                              double score, long routingTimeNanos, Instant timestamp) {
}
