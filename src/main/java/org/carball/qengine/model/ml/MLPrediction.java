package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MLPrediction {
    private String optimizedQuery;
    private double confidence;
    @Builder.Default
    private List<OptimizationTechnique> techniques = new ArrayList<>();
    @Builder.Default
    private List<String> reasoning = new ArrayList<>();
    @Builder.Default
    private List<MLAlternative> alternatives = new ArrayList<>();
}
