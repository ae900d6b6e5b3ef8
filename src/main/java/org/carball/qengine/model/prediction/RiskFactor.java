package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.optimization.Priority;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactor {
    private String factor;
    private Priority riskLevel;
    private String description;
    private double probability;
    private String impact;
}
