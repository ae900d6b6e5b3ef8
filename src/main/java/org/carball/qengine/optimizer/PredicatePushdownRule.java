package org.carball.qengine.optimizer;

import org.carball.qengine.model.query.Condition;
import org.carball.qengine.model.query.QueryPattern;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class PredicatePushdownRule implements OptimizationRule {

    @Override
    public String name() {
        return "predicate_pushdown";
    }

    @Override
    public String description() {
        return "Push WHERE conditions down to reduce data scanning";
    }

    @Override
    public double estimatedGain() {
        return 30;
    }

    @Override
    public boolean appliesTo(QueryPattern pattern) {
        return !pattern.getConditions().isEmpty();
    }

    @Override
    public Outcome apply(String query, QueryPattern pattern) {
        List<String> columns = pattern.getConditions().stream()
                .map(Condition::getColumn)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        return Outcome.applied(query, columns.isEmpty() ? List.of("WHERE clause") : columns);
    }
}
