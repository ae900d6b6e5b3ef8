package org.carball.qengine.ml;

import org.carball.qengine.model.ml.FeatureVector;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification-style scorer: picks exactly one strategy from the query shape.
 */
public class ThresholdRuleModel implements ScoringModel {

    @Override
    public MLPrediction predict(MLModel descriptor, FeatureVector features, String query) {
        String strategy;
        OptimizationTechnique technique;
        if (features.getAggregationCount() > 0 && features.getGroupByCount() > 0) {
            strategy = "aggregation_optimization";
            technique = MLTechniques.aggregationOptimization();
        } else if (features.getJoinCount() > 1) {
            strategy = "join_reordering";
            technique = MLTechniques.joinReordering();
        } else {
            strategy = "smart_indexing";
            technique = MLTechniques.smartIndexing();
        }

        List<OptimizationTechnique> techniques = new ArrayList<>();
        techniques.add(technique);
        List<String> reasoning = new ArrayList<>();
        reasoning.add("Classification model selected " + strategy + " strategy");

        return MLPrediction.builder()
                .optimizedQuery(query)
                .confidence(descriptor.getAccuracy())
                .techniques(techniques)
                .reasoning(reasoning)
                .build();
    }
}
