package org.carball.qengine.predictor;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.prediction.ModelDescriptor;
import org.carball.qengine.model.prediction.PerformanceFeatures;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of duration models with their training state. Models are chosen by how complex
 * the query looks: simple queries use the linear model only, medium ones add the decision
 * tree, complex ones use all three.
 */
@Slf4j
public class PredictionModelRegistry {

    private static final double MEDIUM_COMPLEXITY = 0.3;
    private static final double HIGH_COMPLEXITY = 0.7;
    private static final double ACCURACY_STEP = 0.01;
    private static final double ACCURACY_CEILING = 0.95;

    private final Map<String, PredictionModel> models = new LinkedHashMap<>();
    private final Map<String, ModelDescriptor> descriptors = new LinkedHashMap<>();

    public PredictionModelRegistry() {
        this(List.of(new LinearRegressionModel(), new DecisionTreeModel(), new NeuralNetworkModel()));
    }

    public PredictionModelRegistry(List<PredictionModel> models) {
        for (PredictionModel model : models) {
            this.models.put(model.id(), model);
            this.descriptors.put(model.id(), ModelDescriptor.builder()
                    .id(model.id())
                    .name(model.name())
                    .version("1.0.0")
                    .accuracy(model.initialAccuracy())
                    .trainingSamples(0)
                    .lastUpdated(Instant.now())
                    .features(new ArrayList<>(model.featureNames()))
                    .build());
        }
    }

    public synchronized List<PredictionModel> select(PerformanceFeatures features) {
        double complexity = Math.min(features.getComplexityScore() / 100.0, 1.0);
        List<PredictionModel> all = new ArrayList<>(models.values());
        int count;
        if (complexity < MEDIUM_COMPLEXITY) {
            count = 1;
        } else if (complexity < HIGH_COMPLEXITY) {
            count = 2;
        } else {
            count = all.size();
        }
        return all.subList(0, Math.min(count, all.size()));
    }

    public synchronized double accuracyOf(String modelId) {
        ModelDescriptor descriptor = descriptors.get(modelId);
        return descriptor == null ? 0 : descriptor.getAccuracy();
    }

    /**
     * Records a retraining pass over {@code sampleCount} samples.
     */
    public synchronized void retrain(int sampleCount, Instant when) {
        for (ModelDescriptor descriptor : descriptors.values()) {
            descriptor.setAccuracy(Math.min(descriptor.getAccuracy() + ACCURACY_STEP, ACCURACY_CEILING));
            descriptor.setTrainingSamples(sampleCount);
            descriptor.setLastUpdated(when);
        }
        log.info("Retrained {} duration models on {} samples", descriptors.size(), sampleCount);
    }

    public synchronized List<ModelDescriptor> describe() {
        List<ModelDescriptor> copies = new ArrayList<>();
        descriptors.values().forEach(d -> copies.add(d.toBuilder().features(new ArrayList<>(d.getFeatures())).build()));
        return copies;
    }
}
