package org.carball.qengine.optimizer;

import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.query.QueryPattern;

import java.util.List;

/**
 * A rewrite applied by the rule-based stage of {@link QueryOptimizer}.
 */
public interface OptimizationRule {

    String name();

    String description();

    double estimatedGain();

    boolean appliesTo(QueryPattern pattern);

    Outcome apply(String query, QueryPattern pattern);

    default Impact impact() {
        return Impact.fromGain(estimatedGain());
    }

    /**
     * Rewritten query and the parts of it the rule touched. A rule that cannot act returns
     * {@code applied = false}; its gain is not counted.
     */
    record Outcome(boolean applied, String query, List<String> appliedTo) {

        public static Outcome applied(String query, List<String> appliedTo) {
            return new Outcome(true, query, appliedTo);
        }

        public static Outcome skipped(String query) {
            return new Outcome(false, query, List.of());
        }
    }
}
