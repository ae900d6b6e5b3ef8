package org.carball.qengine.model.optimization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationTechnique {
    private String name;
    private String description;
    private Impact impact;
    @Builder.Default
    private List<String> appliedTo = new ArrayList<>();
    private double estimatedGain;
}
