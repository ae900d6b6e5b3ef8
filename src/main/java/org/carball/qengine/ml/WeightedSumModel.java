package org.carball.qengine.ml;

import org.carball.qengine.model.ml.FeatureVector;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.util.ArrayList;
import java.util.List;

/**
 * Regression-style scorer: a weighted sum of normalised complexity, table count, join count
 * and system load decides whether index and join techniques are worth suggesting.
 */
public class WeightedSumModel implements ScoringModel {

    private static final double COMPLEXITY_WEIGHT = 0.3;
    private static final double TABLE_WEIGHT = 0.2;
    private static final double JOIN_WEIGHT = 0.25;
    private static final double LOAD_WEIGHT = 0.25;
    private static final double INDEX_THRESHOLD = 0.7;

    @Override
    public MLPrediction predict(MLModel descriptor, FeatureVector features, String query) {
        double score = optimizationScore(features);

        List<OptimizationTechnique> techniques = new ArrayList<>();
        if (score > INDEX_THRESHOLD) {
            techniques.add(MLTechniques.indexRecommendation());
        }
        if (features.getJoinCount() > 2) {
            techniques.add(MLTechniques.joinOptimization());
        }

        List<String> reasoning = new ArrayList<>();
        reasoning.add("Regression model predicted optimal execution path");

        return MLPrediction.builder()
                .optimizedQuery(query)
                .confidence(descriptor.getAccuracy())
                .techniques(techniques)
                .reasoning(reasoning)
                .build();
    }

    static double optimizationScore(FeatureVector features) {
        return Math.min(features.getComplexityScore() / 100.0, 1.0) * COMPLEXITY_WEIGHT
                + Math.min(features.getTableCount() / 10.0, 1.0) * TABLE_WEIGHT
                + Math.min(features.getJoinCount() / 5.0, 1.0) * JOIN_WEIGHT
                + Math.min(features.getSystemLoad(), 1.0) * LOAD_WEIGHT;
    }
}
