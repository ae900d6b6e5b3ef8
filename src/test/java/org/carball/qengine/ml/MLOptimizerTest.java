package org.carball.qengine.ml;

import org.carball.qengine.analyzer.QueryAnalyzer;
import org.carball.qengine.model.ml.MLAlternative;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.ml.MLTrainingData;
import org.carball.qengine.model.ml.ModelMetrics;
import org.carball.qengine.model.ml.ModelType;
import org.carball.qengine.model.ml.ObservedPerformance;
import org.carball.qengine.model.ml.TrainingFeedback;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.persistence.InMemoryPersistenceStore;
import org.carball.qengine.persistence.PersistenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class MLOptimizerTest {

    private static final String SIMPLE_QUERY = "SELECT * FROM t";
    private static final String FIVE_TABLE_QUERY = "SELECT * FROM a JOIN b ON a.id = b.a_id JOIN c ON b.id = c.b_id " +
            "JOIN d ON c.id = d.c_id JOIN e ON d.id = e.d_id";
    private static final String AGGREGATE_QUERY = FIVE_TABLE_QUERY.replace("SELECT *", "SELECT a.region, COUNT(*)")
            + " GROUP BY a.region";

    private final QueryAnalyzer analyzer = new QueryAnalyzer();
    private Clock clock;
    private MLOptimizer optimizer;

    @BeforeEach
    public void setUp() {
        clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        optimizer = new MLOptimizer(ScoringModelRegistry.withDefaultModels(), 50_000, 1_000, 100, null, clock);
    }

    @Test
    public void shouldUseSingleRegressionModelForSimpleQuery() {
        // When
        MLPrediction prediction = optimizer.optimizeQuery(SIMPLE_QUERY, analyzer.analyze(SIMPLE_QUERY));

        // Then
        assertThat(prediction.getOptimizedQuery()).isEqualTo(SIMPLE_QUERY);
        assertThat(prediction.getConfidence()).isCloseTo(0.70, within(1e-9));
        assertThat(prediction.getTechniques()).isEmpty();
        assertThat(prediction.getReasoning()).containsExactly(
                "Optimized using Linear Regression Optimizer",
                "Regression model predicted optimal execution path");
        assertThat(prediction.getAlternatives()).isEmpty();
    }

    @Test
    public void shouldCombineRegressionAndClassificationModelsForJoinHeavyQuery() {
        // When
        MLPrediction prediction = optimizer.optimizeQuery(FIVE_TABLE_QUERY, analyzer.analyze(FIVE_TABLE_QUERY));

        // Then
        double expected = (0.70 * 0.70 + 0.82 * 0.82 + 0.85 * 0.85) / (0.70 + 0.82 + 0.85);
        assertThat(prediction.getConfidence()).isCloseTo(expected, within(1e-9));
        assertThat(prediction.getTechniques()).extracting(OptimizationTechnique::getName)
                .containsExactly(MLTechniques.JOIN_OPTIMIZATION, MLTechniques.JOIN_REORDERING);
        assertThat(prediction.getReasoning()).contains(
                "Optimized using Linear Regression Optimizer",
                "Optimized using Random Forest Optimizer",
                "Optimized using Neural Network Optimizer",
                "Classification model selected join_reordering strategy");
        assertThat(prediction.getAlternatives()).extracting(MLAlternative::getScore).containsExactly(0.8, 0.7);
    }

    @Test
    public void shouldIncludeReinforcementModelOnceActivated() {
        // Given
        boolean changed = optimizer.setModelActive("reinforcement_learning", true);

        // When
        MLPrediction prediction = optimizer.optimizeQuery(AGGREGATE_QUERY, analyzer.analyze(AGGREGATE_QUERY));

        // Then
        assertThat(changed).isTrue();
        assertThat(prediction.getTechniques()).extracting(OptimizationTechnique::getName)
                .contains(MLTechniques.AGGREGATION_OPTIMIZATION, MLTechniques.DYNAMIC_OPTIMIZATION);
        assertThat(prediction.getReasoning()).contains("Optimized using RL Query Optimizer");
    }

    @Test
    public void shouldIgnoreUnknownModelWhenChangingState() {
        // When
        boolean changed = optimizer.setModelActive("missing", false);

        // Then
        assertThat(changed).isFalse();
        assertThat(optimizer.getModelMetrics("missing")).isEmpty();
    }

    @Test
    public void shouldReportFailingModelWithLowConfidence() {
        // Given
        ScoringModelRegistry registry = new ScoringModelRegistry();
        registry.register(MLModel.builder()
                .id("broken")
                .name("Broken Model")
                .type(ModelType.REGRESSION)
                .accuracy(0.9)
                .active(true)
                .build(), (descriptor, features, query) -> {
                    throw new IllegalStateException("boom");
                });
        MLOptimizer broken = new MLOptimizer(registry, 100, 10, 10, null, clock);

        // When
        MLPrediction prediction = broken.optimizeQuery(SIMPLE_QUERY, analyzer.analyze(SIMPLE_QUERY));

        // Then
        assertThat(prediction.getConfidence()).isCloseTo(0.1, within(1e-9));
        assertThat(prediction.getReasoning()).containsExactly("Model Broken Model failed");
    }

    @Test
    public void shouldFallBackWhenFeaturesCannotBeExtracted() {
        // When
        MLPrediction prediction = optimizer.optimizeQuery(SIMPLE_QUERY, null);

        // Then
        assertThat(prediction.getOptimizedQuery()).isEqualTo(SIMPLE_QUERY);
        assertThat(prediction.getConfidence()).isEqualTo(MLOptimizer.FALLBACK_CONFIDENCE);
        assertThat(prediction.getReasoning()).containsExactly(MLOptimizer.FALLBACK_REASONING);
    }

    @Test
    public void shouldRejectInvalidTrainingSamples() {
        // When
        boolean zeroTime = optimizer.addTrainingData(sample(0, null));
        boolean tooSlow = optimizer.addTrainingData(sample(300_000, null));
        boolean unrated = optimizer.addTrainingData(sample(500, new TrainingFeedback(0, true, null)));
        boolean valid = optimizer.addTrainingData(sample(500, new TrainingFeedback(5, true, "fast")));

        // Then
        assertThat(zeroTime).isFalse();
        assertThat(tooSlow).isFalse();
        assertThat(unrated).isFalse();
        assertThat(valid).isTrue();
        assertThat(optimizer.trainingDataSize()).isEqualTo(1);
    }

    @Test
    public void shouldSkipTrainingBelowMinimumSamples() {
        // Given
        List<MLTrainingData> data = samples(99);

        // When
        optimizer.trainModels(data);

        // Then
        MLModel linear = modelById("linear_regression");
        assertThat(linear.getAccuracy()).isEqualTo(0.70);
        assertThat(linear.getVersion()).isEqualTo("1.0.0");
    }

    @Test
    public void shouldTrainActiveModelsOnSplit() {
        // When
        optimizer.trainModels(samples(100));

        // Then
        MLModel linear = modelById("linear_regression");
        assertThat(linear.getAccuracy()).isCloseTo(0.71, within(1e-9));
        assertThat(linear.getVersion()).isEqualTo("1.0.1");
        assertThat(linear.getTrainingSamples()).isEqualTo(70);
        assertThat(linear.getLastTrained()).isEqualTo(clock.instant());
        assertThat(modelById("reinforcement_learning").getVersion()).isEqualTo("1.0.0");

        Optional<ModelMetrics> metrics = optimizer.getModelMetrics("random_forest");
        assertThat(metrics).isPresent();
        assertThat(metrics.get().getTrainingSamples()).isEqualTo(70);
        assertThat(metrics.get().getPrecision()).isBetween(0.0, 1.0);
        assertThat(metrics.get().getRecall()).isBetween(0.0, 1.0);
    }

    @Test
    public void shouldCapAccuracyWhenTrainingRepeatedly() {
        // When
        for (int i = 0; i < 30; i++) {
            optimizer.trainModels(samples(100));
        }

        // Then
        assertThat(modelById("neural_network").getAccuracy()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    public void shouldTrainEveryIntervalOfAcceptedSamples() {
        // Given
        MLOptimizer small = new MLOptimizer(ScoringModelRegistry.withDefaultModels(), 100, 10, 10, null, clock);

        // When
        samples(10).forEach(small::addTrainingData);

        // Then
        MLModel linear = small.getModelInfo().stream()
                .filter(m -> m.getId().equals("linear_regression"))
                .findFirst()
                .orElseThrow();
        assertThat(linear.getVersion()).isEqualTo("1.0.1");
        assertThat(linear.getTrainingSamples()).isEqualTo(7);
    }

    @Test
    public void shouldImportOnlyValidSamples() {
        // Given
        List<MLTrainingData> data = new ArrayList<>(samples(3));
        data.add(sample(-5, null));

        // When
        int accepted = optimizer.importTrainingData(data);

        // Then
        assertThat(accepted).isEqualTo(3);
        assertThat(optimizer.exportTrainingData()).hasSize(3);
    }

    @Test
    public void shouldRestoreTrainingDataFromStore() {
        // Given
        PersistenceStore store = new InMemoryPersistenceStore();
        MLOptimizer first = new MLOptimizer(ScoringModelRegistry.withDefaultModels(), 1_000, 1_000, 100, store, clock);
        first.importTrainingData(samples(100));
        first.trainModels();

        // When
        MLOptimizer second = new MLOptimizer(ScoringModelRegistry.withDefaultModels(), 1_000, 1_000, 100, store, clock);

        // Then
        assertThat(second.trainingDataSize()).isEqualTo(100);
    }

    @Test
    public void shouldBumpPatchVersion() {
        assertThat(MLOptimizer.nextVersion("1.0.9")).isEqualTo("1.0.10");
        assertThat(MLOptimizer.nextVersion("beta")).isEqualTo("beta.1");
    }

    private MLModel modelById(String id) {
        return optimizer.getModelInfo().stream()
                .filter(m -> m.getId().equals(id))
                .findFirst()
                .orElseThrow();
    }

    @Test
    public void shouldEvictOldestSampleWhenTrainingBufferIsFull() {
        // Given
        MLOptimizer small = new MLOptimizer(ScoringModelRegistry.withDefaultModels(), 5, 1_000, 100, null, clock);
        List<MLTrainingData> data = samples(6);
        data.subList(0, 5).forEach(small::addTrainingData);

        // When
        boolean accepted = small.addTrainingData(data.get(5));
        List<MLTrainingData> afterOverflow = small.exportTrainingData();
        small.addTrainingData(sample(900, null));

        // Then
        assertThat(accepted).isTrue();
        assertThat(afterOverflow)
                .extracting(d -> d.getPerformance().getExecutionTime())
                .containsExactly(210L, 220L, 230L, 240L, 250L);
        assertThat(small.trainingDataSize()).isEqualTo(5);
        assertThat(small.exportTrainingData())
                .extracting(d -> d.getPerformance().getExecutionTime())
                .containsExactly(220L, 230L, 240L, 250L, 900L);
    }

    private static List<MLTrainingData> samples(int count) {
        List<MLTrainingData> data = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            TrainingFeedback feedback = i % 2 == 0 ? new TrainingFeedback(4, true, null) : null;
            data.add(sample(200 + i * 10L, feedback));
        }
        return data;
    }

    private static MLTrainingData sample(long executionTime, TrainingFeedback feedback) {
        return MLTrainingData.builder()
                .originalQuery(SIMPLE_QUERY)
                .optimizedQuery(SIMPLE_QUERY + " LIMIT 1000")
                .performance(ObservedPerformance.builder().executionTime(executionTime).rowsProcessed(10).build())
                .feedback(feedback)
                .timestamp(Instant.parse("2024-03-01T11:00:00Z"))
                .build();
    }
}
