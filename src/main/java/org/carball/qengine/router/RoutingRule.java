package org.carball.qengine.router;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.routing.RouteCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Rule evaluated before load balancing. Rules run in descending priority; the first one that
 * matches and finds a candidate decides the route.
 */
public interface RoutingRule {

    String name();

    int priority();

    String description();

    boolean matches(String query, QueryContext context);

    /**
     * Picks a candidate from the healthy pool, which is sorted by score, best first.
     */
    Optional<RouteCandidate> route(String query, List<RouteCandidate> candidates, QueryContext context);
}
