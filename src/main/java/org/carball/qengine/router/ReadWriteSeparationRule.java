package org.carball.qengine.router;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.routing.NodeRole;
import org.carball.qengine.model.routing.RouteCandidate;

import java.util.List;
import java.util.Optional;

public class ReadWriteSeparationRule implements RoutingRule {

    @Override
    public String name() {
        return "read_write_separation";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String description() {
        return "Route read queries to secondary or analytics nodes and writes to the primary";
    }

    @Override
    public boolean matches(String query, QueryContext context) {
        QueryKind kind = QueryKind.fromLeadingVerb(query);
        return kind.isRead() || kind.isWrite();
    }

    @Override
    public Optional<RouteCandidate> route(String query, List<RouteCandidate> candidates, QueryContext context) {
        if (QueryKind.fromLeadingVerb(query).isWrite()) {
            return candidates.stream().filter(c -> c.role() == NodeRole.PRIMARY).findFirst();
        }
        return candidates.stream()
                .filter(c -> c.role() == NodeRole.SECONDARY || c.role() == NodeRole.ANALYTICS)
                .findFirst();
    }
}
