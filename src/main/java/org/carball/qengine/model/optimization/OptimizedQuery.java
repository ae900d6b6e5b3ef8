package org.carball.qengine.model.optimization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizedQuery {
    private String query;
    @Builder.Default
    private List<OptimizationTechnique> techniques = new ArrayList<>();
    private double confidence;
    private double estimatedImprovement;
}
