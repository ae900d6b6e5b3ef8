package org.carball.qengine.ml;

import org.carball.qengine.model.ml.FeatureVector;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.ml.MLTrainingData;

import java.util.List;

/**
 * One optimization model variant. The descriptor carries the model's current accuracy and
 * name; the scorer turns features into suggested techniques.
 */
public interface ScoringModel {

    MLPrediction predict(MLModel descriptor, FeatureVector features, String query);

    /**
     * Adjusts internal state from a training split. Stateless scorers ignore it.
     */
    default void learn(List<MLTrainingData> trainSet) {
    }
}
