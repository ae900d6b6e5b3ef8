package org.carball.qengine.ml;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.analyzer.QueryPatternParser;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.ml.FeatureVector;
import org.carball.qengine.model.ml.MLAlternative;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.ml.MLTrainingData;
import org.carball.qengine.model.ml.ModelMetrics;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.persistence.PersistenceStore;
import org.carball.qengine.util.BoundedBuffer;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Suggests optimization techniques with an ensemble of scoring models and learns from
 * recorded executions.
 */
@Slf4j
public class MLOptimizer {

    public static final int DEFAULT_TRAINING_BUFFER_SIZE = 50_000;
    public static final int DEFAULT_TRAINING_INTERVAL = 1_000;
    public static final int DEFAULT_MIN_TRAINING_SAMPLES = 100;

    static final double FALLBACK_CONFIDENCE = 0.3;
    static final String FALLBACK_REASONING = "ML optimization failed, using fallback";

    private static final long MAX_EXECUTION_TIME = 300_000;
    private static final double MAX_ACCURACY = 0.95;
    private static final double ACCURACY_STEP = 0.01;
    private static final long GOOD_EXECUTION_TIME = 1_000;

    private final ScoringModelRegistry registry;
    private final BoundedBuffer<MLTrainingData> trainingData;
    private final int trainingInterval;
    private final int minTrainingSamples;
    private final PersistenceStore store;
    private final Clock clock;
    private final AtomicLong accepted = new AtomicLong();
    private final Map<String, ModelMetrics> metrics = new ConcurrentHashMap<>();

    public MLOptimizer() {
        this(ScoringModelRegistry.withDefaultModels(), DEFAULT_TRAINING_BUFFER_SIZE, DEFAULT_TRAINING_INTERVAL,
                DEFAULT_MIN_TRAINING_SAMPLES, null, Clock.systemUTC());
    }

    public MLOptimizer(ScoringModelRegistry registry, int trainingBufferSize, int trainingInterval,
                       int minTrainingSamples, PersistenceStore store, Clock clock) {
        this.registry = registry;
        this.trainingData = new BoundedBuffer<>(trainingBufferSize);
        this.trainingInterval = trainingInterval;
        this.minTrainingSamples = minTrainingSamples;
        this.store = store;
        this.clock = clock;
        restoreTrainingData();
    }

    public MLPrediction optimizeQuery(String query, QueryAnalysis analysis) {
        return optimizeQuery(query, analysis, null);
    }

    public MLPrediction optimizeQuery(String query, QueryAnalysis analysis, QueryContext context) {
        try {
            FeatureVector features = MLFeatureExtractor.extract(query, analysis, context,
                    ZonedDateTime.now(clock), averagePerformance());
            double complexity = MLFeatureExtractor.featureComplexity(features);
            List<MLModel> models = registry.select(complexity);
            log.debug("ML feature complexity {} selected models {}", String.format("%.2f", complexity),
                    models.stream().map(MLModel::getId).collect(Collectors.toList()));

            List<MLPrediction> predictions = new ArrayList<>();
            for (MLModel model : models) {
                predictions.add(predictWith(model, features, query));
            }

            MLPrediction combined = EnsembleCombiner.combine(predictions, query);
            combined.setAlternatives(alternatives(query, features, complexity));
            return combined;
        } catch (RuntimeException e) {
            log.warn("ML optimization failed for query: {}", e.getMessage());
            List<String> reasoning = new ArrayList<>();
            reasoning.add(FALLBACK_REASONING);
            return MLPrediction.builder()
                    .optimizedQuery(query)
                    .confidence(FALLBACK_CONFIDENCE)
                    .reasoning(reasoning)
                    .build();
        }
    }

    /**
     * Buffers one observed execution. Invalid samples are dropped with a debug message; every
     * {@code trainingInterval}-th accepted sample triggers a training pass.
     *
     * @return whether the sample was accepted
     */
    public boolean addTrainingData(MLTrainingData data) {
        if (!isValid(data)) {
            log.debug("Rejected ML training sample");
            return false;
        }
        trainingData.add(data);
        if (accepted.incrementAndGet() % trainingInterval == 0) {
            trainModels();
        }
        return true;
    }

    public void trainModels() {
        trainModels(trainingData.snapshot());
    }

    /**
     * Runs a training pass over the given samples: 70% train, 20% validation, 10% test. Does
     * nothing when fewer than the minimum number of valid samples are available.
     */
    public void trainModels(List<MLTrainingData> data) {
        List<MLTrainingData> valid = data.stream().filter(this::isValid).collect(Collectors.toList());
        if (valid.size() < minTrainingSamples) {
            log.debug("Skipping ML training: {} samples, {} required", valid.size(), minTrainingSamples);
            return;
        }

        int trainEnd = (int) (valid.size() * 0.7);
        int validationEnd = (int) (valid.size() * 0.9);
        List<MLTrainingData> trainSet = valid.subList(0, trainEnd);
        List<MLTrainingData> testSet = valid.subList(validationEnd, valid.size());

        for (MLModel model : registry.all()) {
            if (!model.isActive()) {
                continue;
            }
            trainModel(model, trainSet, testSet);
        }

        log.info("Trained ML models on {} samples ({} train, {} validation, {} test)", valid.size(),
                trainSet.size(), validationEnd - trainEnd, testSet.size());
        persistTrainingData();
    }

    public List<MLModel> getModelInfo() {
        return registry.all();
    }

    public Optional<ModelMetrics> getModelMetrics(String modelId) {
        Optional<MLModel> model = registry.find(modelId);
        if (model.isEmpty()) {
            return Optional.empty();
        }
        ModelMetrics evaluated = metrics.get(modelId);
        if (evaluated != null) {
            return Optional.of(evaluated);
        }
        return Optional.of(ModelMetrics.builder()
                .modelId(modelId)
                .accuracy(model.get().getAccuracy())
                .trainingSamples(model.get().getTrainingSamples())
                .lastTrained(model.get().getLastTrained())
                .build());
    }

    public boolean setModelActive(String modelId, boolean active) {
        boolean updated = registry.update(modelId, m -> m.toBuilder().active(active).build());
        if (updated) {
            log.info("Model {} {}", modelId, active ? "activated" : "deactivated");
        } else {
            log.warn("Cannot change state of unknown model {}", modelId);
        }
        return updated;
    }

    public List<MLTrainingData> exportTrainingData() {
        return trainingData.snapshot();
    }

    /**
     * Appends valid samples to the training buffer without triggering training.
     *
     * @return number of accepted samples
     */
    public int importTrainingData(List<MLTrainingData> data) {
        List<MLTrainingData> valid = data.stream().filter(this::isValid).collect(Collectors.toList());
        trainingData.addAll(valid);
        log.info("Imported {} of {} ML training samples", valid.size(), data.size());
        return valid.size();
    }

    public int trainingDataSize() {
        return trainingData.size();
    }

    private MLPrediction predictWith(MLModel model, FeatureVector features, String query) {
        try {
            MLPrediction prediction = registry.scorerFor(model.getId()).predict(model, features, query);
            List<String> reasoning = new ArrayList<>();
            reasoning.add("Optimized using " + model.getName());
            reasoning.addAll(prediction.getReasoning());
            prediction.setReasoning(reasoning);
            return prediction;
        } catch (RuntimeException e) {
            log.warn("Model {} failed: {}", model.getId(), e.getMessage());
            List<String> reasoning = new ArrayList<>();
            reasoning.add("Model " + model.getName() + " failed");
            return MLPrediction.builder()
                    .optimizedQuery(query)
                    .confidence(0.1)
                    .reasoning(reasoning)
                    .build();
        }
    }

    private List<MLAlternative> alternatives(String query, FeatureVector features, double complexity) {
        List<MLAlternative> alternatives = new ArrayList<>();
        if (complexity > 0.5) {
            alternatives.add(MLAlternative.builder()
                    .query(query)
                    .score(0.8)
                    .tradeoffs(new ArrayList<>(List.of("Higher accuracy", "Slightly slower execution")))
                    .build());
        }
        if (features.getJoinCount() > 1) {
            alternatives.add(MLAlternative.builder()
                    .query(query)
                    .score(0.7)
                    .tradeoffs(new ArrayList<>(List.of("Better memory usage", "May require more CPU")))
                    .build());
        }
        return alternatives;
    }

    private void trainModel(MLModel model, List<MLTrainingData> trainSet, List<MLTrainingData> testSet) {
        ScoringModel scorer = registry.scorerFor(model.getId());
        scorer.learn(trainSet);

        double accuracy = Math.min(model.getAccuracy() + ACCURACY_STEP, MAX_ACCURACY);
        registry.update(model.getId(), m -> m.toBuilder()
                .accuracy(accuracy)
                .version(nextVersion(m.getVersion()))
                .trainingSamples(trainSet.size())
                .lastTrained(clock.instant())
                .build());

        metrics.put(model.getId(), evaluate(model.toBuilder().accuracy(accuracy).build(), scorer, testSet,
                trainSet.size()));
        log.debug("Model {} retrained, accuracy {}", model.getId(), String.format("%.2f", accuracy));
    }

    /**
     * Scores the model on the test split. A sample counts as a real improvement when the
     * optimization was accepted or rated 4 or better, or, without feedback, when it ran under
     * a second. The model predicts an improvement when it suggests any technique.
     */
    private ModelMetrics evaluate(MLModel model, ScoringModel scorer, List<MLTrainingData> testSet, int trainingSamples) {
        int truePositives = 0;
        int falsePositives = 0;
        int falseNegatives = 0;
        int correct = 0;
        double squaredError = 0;
        double absoluteError = 0;

        for (MLTrainingData sample : testSet) {
            boolean actual = improved(sample);
            MLPrediction prediction = scorer.predict(model, sampleFeatures(sample), sample.getOriginalQuery());
            boolean predicted = !prediction.getTechniques().isEmpty();

            if (predicted && actual) {
                truePositives++;
            } else if (predicted) {
                falsePositives++;
            } else if (actual) {
                falseNegatives++;
            }
            if (predicted == actual) {
                correct++;
            }
            double error = prediction.getConfidence() - (actual ? 1 : 0);
            squaredError += error * error;
            absoluteError += Math.abs(error);
        }

        int n = testSet.size();
        double precision = truePositives + falsePositives > 0
                ? (double) truePositives / (truePositives + falsePositives) : 0;
        double recall = truePositives + falseNegatives > 0
                ? (double) truePositives / (truePositives + falseNegatives) : 0;
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0;

        return ModelMetrics.builder()
                .modelId(model.getId())
                .accuracy(n > 0 ? (double) correct / n : model.getAccuracy())
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .mse(n > 0 ? squaredError / n : 0)
                .mae(n > 0 ? absoluteError / n : 0)
                .trainingSamples(trainingSamples)
                .lastTrained(clock.instant())
                .build();
    }

    private FeatureVector sampleFeatures(MLTrainingData sample) {
        QueryContext context = sample.getContext();
        QueryPattern pattern = QueryPatternParser.parse(sample.getOriginalQuery());
        return FeatureVector.builder()
                .queryLength(sample.getOriginalQuery().length())
                .tableCount(pattern.getTables().size())
                .joinCount(pattern.getJoins().size())
                .aggregationCount(pattern.getAggregations().size())
                .groupByCount(pattern.getGroupBy().size())
                .conditionCount(pattern.getConditions().size())
                .limited(pattern.hasLimit())
                .systemLoad(context != null ? context.cpuUsage(0) / 100 : 0)
                .averagePerformance(sample.getPerformance().getExecutionTime())
                .build();
    }

    private boolean improved(MLTrainingData sample) {
        if (sample.getFeedback() != null) {
            return sample.getFeedback().isAccepted() || sample.getFeedback().getRating() >= 4;
        }
        return sample.getPerformance().getExecutionTime() < GOOD_EXECUTION_TIME;
    }

    private boolean isValid(MLTrainingData data) {
        if (data == null || data.getOriginalQuery() == null || data.getOriginalQuery().isBlank()
                || data.getPerformance() == null) {
            return false;
        }
        long executionTime = data.getPerformance().getExecutionTime();
        if (executionTime <= 0 || executionTime >= MAX_EXECUTION_TIME) {
            return false;
        }
        return data.getFeedback() == null || data.getFeedback().getRating() > 0;
    }

    private double averagePerformance() {
        return trainingData.snapshot().stream()
                .mapToLong(sample -> sample.getPerformance().getExecutionTime())
                .average()
                .orElse(0);
    }

    static String nextVersion(String version) {
        if (version == null) {
            return "1.0.1";
        }
        int lastDot = version.lastIndexOf('.');
        try {
            int patch = Integer.parseInt(version.substring(lastDot + 1));
            return version.substring(0, lastDot + 1) + (patch + 1);
        } catch (NumberFormatException e) {
            return version + ".1";
        }
    }

    private void restoreTrainingData() {
        if (store == null) {
            return;
        }
        try {
            store.load(PersistenceStore.ML_TRAINING_DATA, new TypeReference<List<MLTrainingData>>() { })
                    .ifPresent(this::importTrainingData);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not restore ML training data, starting empty: {}", e.getMessage());
        }
    }

    private void persistTrainingData() {
        if (store == null) {
            return;
        }
        try {
            store.save(PersistenceStore.ML_TRAINING_DATA, trainingData.snapshot());
        } catch (IOException | RuntimeException e) {
            log.warn("Could not save ML training data: {}", e.getMessage());
        }
    }
}
