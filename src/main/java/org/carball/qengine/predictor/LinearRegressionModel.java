package org.carball.qengine.predictor;

import org.carball.qengine.model.prediction.PerformanceFeatures;

import java.util.List;

public class LinearRegressionModel implements PredictionModel {

    public static final String ID = "linear_regression";

    private static final double BIAS = 100;
    private static final double TABLE_WEIGHT = 0.2;
    private static final double JOIN_WEIGHT = 0.3;
    private static final double COMPLEXITY_WEIGHT = 0.4;
    private static final double DATA_SIZE_WEIGHT = 0.1;
    private static final double SYSTEM_LOAD_WEIGHT = 0.2;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Linear Regression Model";
    }

    @Override
    public double initialAccuracy() {
        return 0.7;
    }

    @Override
    public List<String> featureNames() {
        return List.of("tableCount", "joinCount", "complexityScore", "dataSize", "systemLoad");
    }

    @Override
    public ModelEstimate predict(PerformanceFeatures features) {
        double duration = BIAS
                + TABLE_WEIGHT * features.getTableCount()
                + JOIN_WEIGHT * features.getJoinCount()
                + COMPLEXITY_WEIGHT * features.getComplexityScore()
                + DATA_SIZE_WEIGHT * (features.getDataSize() * 0.001)
                + SYSTEM_LOAD_WEIGHT * (features.getSystemLoad() * 1000);

        return new ModelEstimate(
                Math.max(duration, 10),
                features.getTableCount() * 64 + features.getJoinCount() * 128,
                features.getComplexityScore() * 0.1,
                features.getTableCount() * 100,
                features.getColumnCount() * 1024);
    }
}
