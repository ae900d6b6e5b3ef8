package org.carball.qengine.router;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.routing.RouteCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class GeographicRoutingRule implements RoutingRule {

    private static final double HIGH_LATENCY_MS = 100;

    @Override
    public String name() {
        return "geographic_routing";
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public String description() {
        return "Route queries to the lowest latency node when the client link is slow";
    }

    @Override
    public boolean matches(String query, QueryContext context) {
        return context != null && context.networkLatency(0) > HIGH_LATENCY_MS;
    }

    @Override
    public Optional<RouteCandidate> route(String query, List<RouteCandidate> candidates, QueryContext context) {
        return candidates.stream().min(Comparator.comparingDouble(RouteCandidate::getLatency));
    }
}
