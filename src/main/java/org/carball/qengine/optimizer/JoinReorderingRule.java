package org.carball.qengine.optimizer;

import org.carball.qengine.model.query.Join;
import org.carball.qengine.model.query.QueryPattern;

import java.util.List;
import java.util.stream.Collectors;

public class JoinReorderingRule implements OptimizationRule {

    @Override
    public String name() {
        return "join_reordering";
    }

    @Override
    public String description() {
        return "Reorder JOINs to minimize intermediate results";
    }

    @Override
    public double estimatedGain() {
        return 25;
    }

    @Override
    public boolean appliesTo(QueryPattern pattern) {
        return pattern.getJoins().size() > 1;
    }

    @Override
    public Outcome apply(String query, QueryPattern pattern) {
        List<String> joined = pattern.getJoins().stream()
                .map(Join::getRightTable)
                .collect(Collectors.toList());
        return Outcome.applied(query, joined);
    }
}
