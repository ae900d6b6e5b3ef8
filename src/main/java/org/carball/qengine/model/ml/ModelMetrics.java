package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetrics {
    private String modelId;
    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;
    private double mse;
    private double mae;
    private int trainingSamples;
    private Instant lastTrained;
}
