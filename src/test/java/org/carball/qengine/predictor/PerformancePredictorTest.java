package org.carball.qengine.predictor;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.context.SystemLoad;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.plan.StepOperation;
import org.carball.qengine.model.prediction.BottleneckType;
import org.carball.qengine.model.prediction.ModelDescriptor;
import org.carball.qengine.model.prediction.PerformanceFeatures;
import org.carball.qengine.model.prediction.PerformancePrediction;
import org.carball.qengine.model.prediction.PredictedBottleneck;
import org.carball.qengine.model.prediction.RiskFactor;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PerformancePredictorTest {

    private static final String SIMPLE_QUERY = "SELECT * FROM t";
    private static final String FIVE_TABLE_QUERY = "SELECT * FROM a JOIN b ON a.id = b.a_id JOIN c ON b.id = c.b_id " +
            "JOIN d ON c.id = d.c_id JOIN e ON d.id = e.d_id";

    private PerformancePredictor predictor;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        predictor = new PerformancePredictor(new PredictionModelRegistry(), 1_000, 100, clock);
    }

    @Test
    public void shouldUseLinearModelOnlyForSimpleQueries() {
        // When
        PerformancePrediction prediction = predictor.predict(SIMPLE_QUERY);

        // Then
        assertThat(prediction.getEstimatedDuration()).isCloseTo(300.2, within(1e-6));
        assertThat(prediction.getEstimatedMemoryUsage()).isCloseTo(64.0, within(1e-6));
        assertThat(prediction.getEstimatedIoOperations()).isCloseTo(100.0, within(1e-6));
        assertThat(prediction.getEstimatedNetworkTraffic()).isCloseTo(10240.0, within(1e-6));
        assertThat(prediction.getConfidence()).isCloseTo(0.63, within(1e-9));
        assertThat(prediction.getBottlenecks()).isEmpty();
        assertThat(prediction.isFallback()).isFalse();
    }

    @Test
    public void shouldUseAllModelsForComplexQueries() {
        // When
        PerformancePrediction prediction = predictor.predict(FIVE_TABLE_QUERY);

        // Then
        assertThat(prediction.getConfidence()).isCloseTo((0.7 + 0.75 + 0.85) / 3, within(1e-9));
        assertThat(prediction.getRiskFactors()).extracting(RiskFactor::getFactor).containsExactly("Query Complexity");
    }

    @Test
    public void shouldFlagBottlenecksAndRisksUnderLoad() {
        // Given
        QueryContext context = QueryContext.builder()
                .systemLoad(new SystemLoad(90, 85, 20, 150))
                .build();

        // When
        PerformancePrediction prediction = predictor.predict(SIMPLE_QUERY, context);

        // Then
        assertThat(prediction.getBottlenecks()).extracting(PredictedBottleneck::getType)
                .containsExactly(BottleneckType.CPU, BottleneckType.MEMORY, BottleneckType.NETWORK);
        assertThat(prediction.getRecommendations()).extracting(r -> r.getTitle())
                .contains("Optimize CPU-intensive operations", "Increase memory allocation", "Optimize network usage");
        assertThat(prediction.getRiskFactors()).extracting(RiskFactor::getFactor)
                .containsExactly("System Load", "Memory Availability");
    }

    @Test
    public void shouldFallBackToConservativeEstimateWhenModelsFail() {
        // Given
        PerformancePredictor failing = new PerformancePredictor(
                new PredictionModelRegistry(List.of(new FailingModel())), 100, 100, Clock.systemUTC());

        // When
        PerformancePrediction prediction = failing.predict(SIMPLE_QUERY);

        // Then
        assertThat(prediction.isFallback()).isTrue();
        assertThat(prediction.getEstimatedDuration()).isEqualTo(1000);
        assertThat(prediction.getConfidence()).isEqualTo(0.5);
        assertThat(prediction.getRecommendations().get(0).getTitle()).isEqualTo("Performance analysis unavailable");
        assertThat(prediction.getRiskFactors().get(0).getFactor()).isEqualTo("Unknown Performance");
    }

    @Test
    public void shouldIncreaseDurationWithLoadAndDecreaseWithParallelism() {
        // Given
        List<ExecutionStep> sequential = List.of(step("a", 1000, false), step("b", 1000, false));
        List<ExecutionStep> parallel = List.of(step("a", 1000, true), step("b", 1000, true));
        ResourceRequirements requirements = ResourceRequirements.builder()
                .minMemory(64).maxMemory(2048).cpuIntensive(true).ioIntensive(true).build();
        QueryContext idle = QueryContext.builder().systemLoad(new SystemLoad(10, 10, 10, 10)).build();
        QueryContext busy = QueryContext.builder().systemLoad(new SystemLoad(95, 95, 95, 10)).build();

        // When
        double idleDuration = predictor.estimateDuration(sequential, requirements, idle);
        double busyDuration = predictor.estimateDuration(sequential, requirements, busy);
        double parallelDuration = predictor.estimateDuration(parallel, requirements, idle);

        // Then
        assertThat(idleDuration).isEqualTo(2000);
        assertThat(busyDuration).isCloseTo(2000 * 1.5 * 1.3 * 1.4, within(1e-6));
        assertThat(parallelDuration).isCloseTo(2000 * 0.7, within(1e-6));
        assertThat(predictor.estimateDuration(List.of(), requirements, null)).isEqualTo(10);
    }

    @Test
    public void shouldRetrainAfterEnoughSamples() {
        // Given
        QueryExecutionResult result = QueryExecutionResult.builder().executionTime(300).success(true).build();

        // When
        for (int i = 0; i < 100; i++) {
            predictor.updateModel(SIMPLE_QUERY, result, null);
        }

        // Then
        ModelDescriptor linear = predictor.getModelInfo().get(0);
        assertThat(linear.getId()).isEqualTo(LinearRegressionModel.ID);
        assertThat(linear.getAccuracy()).isCloseTo(0.71, within(1e-9));
        assertThat(linear.getTrainingSamples()).isEqualTo(100);
        assertThat(predictor.getModelMetrics().getEvaluatedCount()).isEqualTo(100);
    }

    @Test
    public void shouldFoldPredictionErrorIntoMetrics() {
        // Given
        predictor.predict(SIMPLE_QUERY);

        // When
        predictor.updateModel(SIMPLE_QUERY, QueryExecutionResult.builder().executionTime(300).success(true).build(), null);

        // Then
        assertThat(predictor.getModelMetrics().getAccuracy()).isBetween(0.09, 0.1);
        assertThat(predictor.getModelMetrics().getMeanAbsoluteError()).isCloseTo(0.02, within(1e-6));
        assertThat(predictor.trainingDataSize()).isEqualTo(1);
    }

    @Test
    public void shouldKeepOnlyNewestSamplesOnImport() {
        // Given
        PerformancePredictor small = new PerformancePredictor(new PredictionModelRegistry(), 2, 100, Clock.systemUTC());
        QueryExecutionResult result = QueryExecutionResult.builder().executionTime(10).success(true).build();
        for (int i = 0; i < 3; i++) {
            small.updateModel("SELECT " + i, result, null);
        }

        // When
        predictor.importTrainingData(small.exportTrainingData());

        // Then
        assertThat(small.exportTrainingData()).hasSize(2);
        assertThat(predictor.trainingDataSize()).isEqualTo(2);
    }

    private ExecutionStep step(String id, double cost, boolean parallel) {
        return ExecutionStep.builder()
                .id(id)
                .operation(StepOperation.TABLE_SCAN)
                .estimatedCost(cost)
                .canParallelize(parallel)
                .build();
    }

    private static class FailingModel implements PredictionModel {
        @Override
        public String id() {
            return "failing";
        }

        @Override
        public String name() {
            return "Failing";
        }

        @Override
        public double initialAccuracy() {
            return 0.5;
        }

        @Override
        public List<String> featureNames() {
            return List.of();
        }

        @Override
        public ModelEstimate predict(PerformanceFeatures features) {
            throw new IllegalStateException("model unavailable");
        }
    }
}
