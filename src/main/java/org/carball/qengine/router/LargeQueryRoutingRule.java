package org.carball.qengine.router;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.routing.NodeRole;
import org.carball.qengine.model.routing.RouteCandidate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public class LargeQueryRoutingRule implements RoutingRule {

    private static final long LARGE_ROW_COUNT = 1_000_000;
    private static final Pattern HEAVY_CLAUSE = Pattern.compile("\\b(?:GROUP|ORDER)\\s+BY\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "large_query_routing";
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public String description() {
        return "Route large or complex queries to analytics nodes";
    }

    @Override
    public boolean matches(String query, QueryContext context) {
        return (context != null && context.totalRows() > LARGE_ROW_COUNT) || HEAVY_CLAUSE.matcher(query).find();
    }

    @Override
    public Optional<RouteCandidate> route(String query, List<RouteCandidate> candidates, QueryContext context) {
        return candidates.stream().filter(c -> c.role() == NodeRole.ANALYTICS).findFirst();
    }
}
