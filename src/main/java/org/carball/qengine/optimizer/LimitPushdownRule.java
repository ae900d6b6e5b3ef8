package org.carball.qengine.optimizer;

import org.carball.qengine.model.query.QueryPattern;

import java.util.List;

public class LimitPushdownRule implements OptimizationRule {

    @Override
    public String name() {
        return "limit_pushdown";
    }

    @Override
    public String description() {
        return "Push LIMIT clause to reduce data processing";
    }

    @Override
    public double estimatedGain() {
        return 15;
    }

    @Override
    public boolean appliesTo(QueryPattern pattern) {
        return pattern.hasLimit();
    }

    @Override
    public Outcome apply(String query, QueryPattern pattern) {
        return Outcome.applied(query, List.of("LIMIT " + pattern.getLimit()));
    }
}
