package org.carball.qengine.predictor;

import org.carball.qengine.model.prediction.PerformanceFeatures;

import java.util.List;

/**
 * A duration and resource model over {@link PerformanceFeatures}. Implementations are
 * stateless; accuracy and training state live in the {@link PredictionModelRegistry}.
 */
public interface PredictionModel {

    String id();

    String name();

    double initialAccuracy();

    List<String> featureNames();

    ModelEstimate predict(PerformanceFeatures features);
}
