package org.carball.qengine.predictor;

import org.carball.qengine.model.prediction.PerformanceFeatures;

import java.util.List;

/**
 * Single hidden layer with fixed weights: each input passes through ReLU(x * 0.5 + 0.1) and the
 * output sums the hidden units scaled by 0.3.
 */
public class NeuralNetworkModel implements PredictionModel {

    public static final String ID = "neural_network";

    private static final double HIDDEN_WEIGHT = 0.5;
    private static final double HIDDEN_BIAS = 0.1;
    private static final double OUTPUT_WEIGHT = 0.3;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Neural Network Model";
    }

    @Override
    public double initialAccuracy() {
        return 0.85;
    }

    @Override
    public List<String> featureNames() {
        return List.of("tableCount", "joinCount", "complexityScore", "systemLoad", "memoryAvailable");
    }

    @Override
    public ModelEstimate predict(PerformanceFeatures features) {
        double[] inputs = {
                features.getTableCount(),
                features.getJoinCount(),
                features.getComplexityScore(),
                features.getSystemLoad(),
                features.getMemoryAvailable()
        };

        double output = 0;
        for (double input : inputs) {
            output += Math.max(0, input * HIDDEN_WEIGHT + HIDDEN_BIAS) * OUTPUT_WEIGHT;
        }

        return new ModelEstimate(
                Math.max(output, 10),
                output * 0.3,
                features.getComplexityScore() * 0.15,
                features.getTableCount() * 120,
                features.getColumnCount() * 1536);
    }
}
