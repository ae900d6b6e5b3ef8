package org.carball.qengine.ml;

import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.util.ArrayList;
import java.util.List;

/**
 * Techniques the optimization models can suggest.
 */
public class MLTechniques {

    public static final String INDEX_RECOMMENDATION = "ML_index_recommendation";
    public static final String JOIN_OPTIMIZATION = "ML_join_optimization";
    public static final String SMART_INDEXING = "ML_smart_indexing";
    public static final String JOIN_REORDERING = "ML_join_reordering";
    public static final String AGGREGATION_OPTIMIZATION = "ML_aggregation_optimization";
    public static final String DYNAMIC_OPTIMIZATION = "RL_dynamic_optimization";

    private MLTechniques() {
        // Utility class - prevent instantiation
    }

    static OptimizationTechnique indexRecommendation() {
        return technique(INDEX_RECOMMENDATION, "Machine learning recommended optimal indexes",
                Impact.HIGH, "WHERE clauses", 45);
    }

    static OptimizationTechnique joinOptimization() {
        return technique(JOIN_OPTIMIZATION, "ML-optimized join order and strategy",
                Impact.HIGH, "JOIN clauses", 35);
    }

    static OptimizationTechnique smartIndexing() {
        return technique(SMART_INDEXING, "ML-driven intelligent indexing strategy",
                Impact.HIGH, "Index selection", 50);
    }

    static OptimizationTechnique joinReordering() {
        return technique(JOIN_REORDERING, "ML-optimized join execution order",
                Impact.MEDIUM, "JOIN execution", 30);
    }

    static OptimizationTechnique aggregationOptimization() {
        return technique(AGGREGATION_OPTIMIZATION, "ML-guided aggregation optimization",
                Impact.MEDIUM, "GROUP BY, HAVING", 25);
    }

    static OptimizationTechnique dynamicOptimization() {
        return technique(DYNAMIC_OPTIMIZATION, "Reinforcement learning adaptive optimization",
                Impact.HIGH, "Execution strategy", 40);
    }

    private static OptimizationTechnique technique(String name, String description, Impact impact,
                                                   String appliedTo, double gain) {
        List<String> targets = new ArrayList<>();
        targets.add(appliedTo);
        return OptimizationTechnique.builder()
                .name(name)
                .description(description)
                .impact(impact)
                .appliedTo(targets)
                .estimatedGain(gain)
                .build();
    }
}
