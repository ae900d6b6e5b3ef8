package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PredictionMetrics {
    private double accuracy;
    private double meanAbsoluteError;
    private double meanSquaredError;
    private long predictionCount;
    private long evaluatedCount;
    private Instant lastEvaluated;
}
