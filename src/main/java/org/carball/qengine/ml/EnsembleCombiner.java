package org.carball.qengine.ml;

import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-model predictions. The most confident model supplies the query; confidence is
 * weighted towards the confident models (sum of c squared over sum of c).
 */
public class EnsembleCombiner {

    private EnsembleCombiner() {
        // Utility class - prevent instantiation
    }

    public static MLPrediction combine(List<MLPrediction> predictions, String originalQuery) {
        if (predictions.isEmpty()) {
            return MLPrediction.builder()
                    .optimizedQuery(originalQuery)
                    .confidence(0)
                    .build();
        }

        MLPrediction best = predictions.stream()
                .max(Comparator.comparingDouble(MLPrediction::getConfidence))
                .orElseThrow();

        double sum = predictions.stream().mapToDouble(MLPrediction::getConfidence).sum();
        double sumOfSquares = predictions.stream().mapToDouble(p -> p.getConfidence() * p.getConfidence()).sum();

        Set<String> reasoning = new LinkedHashSet<>();
        List<OptimizationTechnique> techniques = new ArrayList<>();
        for (MLPrediction prediction : predictions) {
            reasoning.addAll(prediction.getReasoning());
            techniques.addAll(prediction.getTechniques());
        }

        return MLPrediction.builder()
                .optimizedQuery(best.getOptimizedQuery())
                .confidence(sum > 0 ? sumOfSquares / sum : 0)
                .techniques(mergeTechniques(techniques))
                .reasoning(new ArrayList<>(reasoning))
                .build();
    }

    /**
     * De-duplicates by name, keeping the highest estimated gain and the union of targets.
     */
    static List<OptimizationTechnique> mergeTechniques(List<OptimizationTechnique> techniques) {
        Map<String, OptimizationTechnique> merged = new LinkedHashMap<>();
        for (OptimizationTechnique technique : techniques) {
            OptimizationTechnique existing = merged.get(technique.getName());
            if (existing == null) {
                merged.put(technique.getName(), technique.toBuilder()
                        .appliedTo(new ArrayList<>(technique.getAppliedTo()))
                        .build());
                continue;
            }
            Set<String> targets = new LinkedHashSet<>(existing.getAppliedTo());
            targets.addAll(technique.getAppliedTo());
            existing.setAppliedTo(new ArrayList<>(targets));
            existing.setEstimatedGain(Math.max(existing.getEstimatedGain(), technique.getEstimatedGain()));
        }
        return new ArrayList<>(merged.values());
    }
}
