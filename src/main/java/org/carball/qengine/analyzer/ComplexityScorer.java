package org.carball.qengine.analyzer;

import org.carball.qengine.model.query.ComplexityFactor;
import org.carball.qengine.model.query.QueryComplexity;
import org.carball.qengine.model.query.QueryPattern;

import java.util.ArrayList;
import java.util.List;

public class ComplexityScorer {

    private static final int TABLE_WEIGHT = 10;
    private static final int JOIN_WEIGHT = 20;
    private static final int CONDITION_WEIGHT = 5;
    private static final int AGGREGATION_WEIGHT = 15;
    private static final int SORT_WEIGHT = 10;
    private static final int TIME_RANGE_WEIGHT = 5;

    public QueryComplexity score(QueryPattern pattern) {
        List<ComplexityFactor> factors = new ArrayList<>();

        // Factor 1: Tables touched
        addFactor(factors, "table_count", pattern.getTables().size() * TABLE_WEIGHT,
                pattern.getTables().size() + " table(s) accessed");

        // Factor 2: Joins
        addFactor(factors, "join_complexity", pattern.getJoins().size() * JOIN_WEIGHT,
                pattern.getJoins().size() + " join operation(s)");

        // Factor 3: Filter predicates
        addFactor(factors, "condition_complexity", pattern.getConditions().size() * CONDITION_WEIGHT,
                pattern.getConditions().size() + " filter condition(s)");

        // Factor 4: Aggregate functions
        addFactor(factors, "aggregation_complexity", pattern.getAggregations().size() * AGGREGATION_WEIGHT,
                pattern.getAggregations().size() + " aggregation function(s)");

        // Factor 5: Sort columns
        addFactor(factors, "sort_complexity", pattern.getOrderBy().size() * SORT_WEIGHT,
                pattern.getOrderBy().size() + " sort column(s)");

        // Factor 6: Time range restriction
        if (pattern.hasTimeRange()) {
            addFactor(factors, "time_range", TIME_RANGE_WEIGHT, "Time range filter");
        }

        int score = factors.stream().mapToInt(ComplexityFactor::weight).sum();
        return QueryComplexity.of(score, factors);
    }

    private void addFactor(List<ComplexityFactor> factors, String name, int weight, String description) {
        if (weight > 0) {
            factors.add(new ComplexityFactor(name, weight, description));
        }
    }

    public String generateComplexityReport(QueryPattern pattern, QueryComplexity complexity) {
        StringBuilder report = new StringBuilder();

        report.append("Statement: ").append(pattern.getKind()).append("\n");
        report.append("Complexity: ").append(complexity.getLevel().getLabel())
                .append(" (").append(complexity.getScore()).append(")\n");
        report.append("Factors:\n");

        for (ComplexityFactor factor : complexity.getFactors()) {
            report.append("  - ").append(factor.description())
                    .append(": +").append(factor.weight()).append("\n");
        }

        if (complexity.getFactors().isEmpty()) {
            report.append("  - none\n");
        }

        return report.toString();
    }
}
