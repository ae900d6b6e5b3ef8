package org.carball.qengine.predictor;

import org.carball.qengine.model.prediction.PerformanceFeatures;

import java.util.List;

public class DecisionTreeModel implements PredictionModel {

    public static final String ID = "decision_tree";

    private static final double BASE_DURATION = 100;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Decision Tree Model";
    }

    @Override
    public double initialAccuracy() {
        return 0.75;
    }

    @Override
    public List<String> featureNames() {
        return List.of("tableCount", "joinCount", "complexityScore", "systemLoad");
    }

    @Override
    public ModelEstimate predict(PerformanceFeatures features) {
        double duration = BASE_DURATION;

        if (features.getTableCount() > 3) {
            duration *= 2;
        }
        if (features.getJoinCount() > 2) {
            duration *= 3;
        }
        if (features.getComplexityScore() > 50) {
            duration *= 1.5;
        }
        if (features.getSystemLoad() > 0.8) {
            duration *= 1.3;
        }

        return new ModelEstimate(
                duration,
                duration * 0.5,
                features.getComplexityScore() * 0.2,
                features.getTableCount() * 150,
                features.getColumnCount() * 2048);
    }
}
