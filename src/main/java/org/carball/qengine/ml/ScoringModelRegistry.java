package org.carball.qengine.ml;

import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.ModelType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Registered optimization models, each a descriptor bound to its {@link ScoringModel}.
 */
public class ScoringModelRegistry {

    private static final double MEDIUM_COMPLEXITY = 0.3;
    private static final double HIGH_COMPLEXITY = 0.7;

    private final Map<String, MLModel> descriptors = new LinkedHashMap<>();
    private final Map<String, ScoringModel> scorers = new LinkedHashMap<>();

    public static ScoringModelRegistry withDefaultModels() {
        ScoringModelRegistry registry = new ScoringModelRegistry();
        Instant now = Instant.now();

        Map<String, Object> linear = new LinkedHashMap<>();
        linear.put("learningRate", 0.01);
        linear.put("regularization", 0.1);
        registry.register(model("linear_regression", "Linear Regression Optimizer", ModelType.REGRESSION,
                0.70, true, linear, now), new WeightedSumModel());

        Map<String, Object> forest = new LinkedHashMap<>();
        forest.put("nEstimators", 100);
        forest.put("maxDepth", 10);
        forest.put("minSamplesSplit", 2);
        registry.register(model("random_forest", "Random Forest Optimizer", ModelType.CLASSIFICATION,
                0.82, true, forest, now), new ThresholdRuleModel());

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("hiddenLayers", List.of(64, 32, 16));
        network.put("activation", "relu");
        network.put("optimizer", "adam");
        network.put("learningRate", 0.001);
        registry.register(model("neural_network", "Neural Network Optimizer", ModelType.REGRESSION,
                0.85, true, network, now), new WeightedSumModel());

        Map<String, Object> reinforcement = new LinkedHashMap<>();
        reinforcement.put("algorithm", "PPO");
        reinforcement.put("gamma", 0.99);
        reinforcement.put("epsilon", 0.2);
        registry.register(model("reinforcement_learning", "RL Query Optimizer", ModelType.REINFORCEMENT,
                0.78, false, reinforcement, now), new SimulatedReinforcementModel());

        return registry;
    }

    private static MLModel model(String id, String name, ModelType type, double accuracy, boolean active,
                                 Map<String, Object> hyperparameters, Instant now) {
        return MLModel.builder()
                .id(id)
                .name(name)
                .type(type)
                .version("1.0.0")
                .accuracy(accuracy)
                .features(new ArrayList<>(List.of("structural", "semantic", "context", "historical")))
                .hyperparameters(hyperparameters)
                .lastTrained(now)
                .active(active)
                .build();
    }

    public synchronized void register(MLModel descriptor, ScoringModel scorer) {
        descriptors.put(descriptor.getId(), descriptor);
        scorers.put(descriptor.getId(), scorer);
    }

    /**
     * Active models for a feature complexity in [0, 1]: the first regression model for simple
     * queries, regression and classification models for medium ones, everything active
     * otherwise.
     */
    public synchronized List<MLModel> select(double featureComplexity) {
        List<MLModel> active = descriptors.values().stream()
                .filter(MLModel::isActive)
                .map(this::copy)
                .collect(Collectors.toList());

        if (featureComplexity < MEDIUM_COMPLEXITY) {
            return active.stream()
                    .filter(m -> m.getType() == ModelType.REGRESSION)
                    .limit(1)
                    .collect(Collectors.toList());
        } else if (featureComplexity < HIGH_COMPLEXITY) {
            return active.stream()
                    .filter(m -> m.getType() == ModelType.REGRESSION || m.getType() == ModelType.CLASSIFICATION)
                    .collect(Collectors.toList());
        }
        return active;
    }

    public synchronized ScoringModel scorerFor(String modelId) {
        ScoringModel scorer = scorers.get(modelId);
        if (scorer == null) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        return scorer;
    }

    public synchronized Optional<MLModel> find(String modelId) {
        return Optional.ofNullable(descriptors.get(modelId)).map(this::copy);
    }

    public synchronized boolean update(String modelId, UnaryOperator<MLModel> change) {
        MLModel current = descriptors.get(modelId);
        if (current == null) {
            return false;
        }
        descriptors.put(modelId, change.apply(copy(current)));
        return true;
    }

    public synchronized List<MLModel> all() {
        List<MLModel> copies = new ArrayList<>();
        descriptors.values().forEach(m -> copies.add(copy(m)));
        return copies;
    }

    private MLModel copy(MLModel model) {
        return model.toBuilder()
                .features(new ArrayList<>(model.getFeatures()))
                .hyperparameters(new LinkedHashMap<>(model.getHyperparameters()))
                .build();
    }
}
