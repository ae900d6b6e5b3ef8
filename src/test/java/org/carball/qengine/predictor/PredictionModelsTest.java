package org.carball.qengine.predictor;

import org.carball.qengine.model.prediction.PerformanceFeatures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PredictionModelsTest {

    @Test
    public void shouldMultiplyDecisionTreeBranches() {
        // Given
        PerformanceFeatures features = PerformanceFeatures.builder()
                .tableCount(5).joinCount(4).complexityScore(130).systemLoad(0.9).columnCount(2)
                .build();

        // When
        ModelEstimate estimate = new DecisionTreeModel().predict(features);

        // Then
        assertThat(estimate.duration()).isCloseTo(100 * 2 * 3 * 1.5 * 1.3, within(1e-6));
        assertThat(estimate.memoryUsage()).isCloseTo(estimate.duration() * 0.5, within(1e-6));
        assertThat(estimate.networkTraffic()).isEqualTo(4096);
    }

    @Test
    public void shouldFloorNeuralNetworkDuration() {
        // Given
        PerformanceFeatures features = PerformanceFeatures.builder()
                .tableCount(1).complexityScore(10).systemLoad(0.5).memoryAvailable(0.7).columnCount(1)
                .build();

        // When
        ModelEstimate estimate = new NeuralNetworkModel().predict(features);

        // Then
        assertThat(estimate.duration()).isEqualTo(10);
        assertThat(estimate.ioOperations()).isEqualTo(120);
    }

    @Test
    public void shouldSelectModelsByComplexity() {
        // Given
        PredictionModelRegistry registry = new PredictionModelRegistry();

        // When / Then
        assertThat(registry.select(PerformanceFeatures.builder().complexityScore(10).build())).hasSize(1);
        assertThat(registry.select(PerformanceFeatures.builder().complexityScore(45).build())).hasSize(2);
        assertThat(registry.select(PerformanceFeatures.builder().complexityScore(70).build())).hasSize(3);
    }
}
