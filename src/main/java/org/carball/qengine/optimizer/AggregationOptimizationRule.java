package org.carball.qengine.optimizer;

import org.carball.qengine.model.query.QueryPattern;

import java.util.List;
import java.util.stream.Collectors;

public class AggregationOptimizationRule implements OptimizationRule {

    @Override
    public String name() {
        return "aggregation_optimization";
    }

    @Override
    public String description() {
        return "Optimize GROUP BY and aggregation functions";
    }

    @Override
    public double estimatedGain() {
        return 20;
    }

    @Override
    public boolean appliesTo(QueryPattern pattern) {
        return pattern.hasAggregations();
    }

    @Override
    public Outcome apply(String query, QueryPattern pattern) {
        List<String> functions = pattern.getAggregations().stream()
                .map(a -> a.getFunction().toUpperCase() + "(" + a.getColumn() + ")")
                .distinct()
                .collect(Collectors.toList());
        return Outcome.applied(query, functions);
    }
}
