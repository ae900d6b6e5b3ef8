package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictedBottleneck {
    private BottleneckType type;
    private Severity severity;
    private String description;
    private double probability;
    private double impact;
    private String mitigation;
}
