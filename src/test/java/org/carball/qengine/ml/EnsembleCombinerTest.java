package org.carball.qengine.ml;

import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class EnsembleCombinerTest {

    @Test
    public void shouldTakeQueryFromMostConfidentPrediction() {
        // Given
        MLPrediction weak = prediction("SELECT a", 0.5, List.of(technique("x", 10, "t1")), List.of("first"));
        MLPrediction strong = prediction("SELECT b", 1.0, List.of(technique("x", 30, "t2")), List.of("second", "first"));

        // When
        MLPrediction combined = EnsembleCombiner.combine(List.of(weak, strong), "SELECT original");

        // Then
        assertThat(combined.getOptimizedQuery()).isEqualTo("SELECT b");
        assertThat(combined.getConfidence()).isCloseTo(1.25 / 1.5, within(1e-9));
        assertThat(combined.getReasoning()).containsExactly("first", "second");
        assertThat(combined.getTechniques()).hasSize(1);
        assertThat(combined.getTechniques().get(0).getEstimatedGain()).isEqualTo(30);
        assertThat(combined.getTechniques().get(0).getAppliedTo()).containsExactly("t1", "t2");
    }

    @Test
    public void shouldReturnOriginalQueryWhenNothingPredicted() {
        // When
        MLPrediction combined = EnsembleCombiner.combine(List.of(), "SELECT original");

        // Then
        assertThat(combined.getOptimizedQuery()).isEqualTo("SELECT original");
        assertThat(combined.getConfidence()).isZero();
    }

    private static MLPrediction prediction(String query, double confidence, List<OptimizationTechnique> techniques,
                                           List<String> reasoning) {
        return MLPrediction.builder()
                .optimizedQuery(query)
                .confidence(confidence)
                .techniques(new ArrayList<>(techniques))
                .reasoning(new ArrayList<>(reasoning))
                .build();
    }

    private static OptimizationTechnique technique(String name, double gain, String target) {
        return OptimizationTechnique.builder()
                .name(name)
                .impact(Impact.fromGain(gain))
                .appliedTo(new ArrayList<>(List.of(target)))
                .estimatedGain(gain)
                .build();
    }
}
