package org.carball.qengine.model.optimization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.plan.ExecutionPlan;
import org.carball.qengine.model.prediction.PerformancePrediction;
import org.carball.qengine.model.routing.RoutingStrategy;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryOptimizationResult {
    private String originalQuery;
    private String optimizedQuery;
    @Builder.Default
    private List<OptimizationTechnique> optimizationTechniques = new ArrayList<>();
    private double estimatedPerformanceGain;
    private String cacheKey;
    private RoutingStrategy routingStrategy;
    private ExecutionPlan executionPlan;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();
    private PerformancePrediction prediction;
    // set on fresh results only; cached copies carry no ledger entry
    private String historyEntryId;

    public boolean hasTechnique(String name) {
        return optimizationTechniques.stream().anyMatch(t -> t.getName().equals(name));
    }
}
