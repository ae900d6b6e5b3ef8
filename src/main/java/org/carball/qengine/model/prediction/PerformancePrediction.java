package org.carball.qengine.model.prediction;

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
public class PerformancePrediction {
    private double estimatedDuration;
    private double estimatedMemoryUsage;
    private double estimatedCpuUsage;
    private double estimatedIoOperations;
    private double estimatedNetworkTraffic;
    private double confidence;
    @Builder.Default
    private List<PredictedBottleneck> bottlenecks = new ArrayList<>();
    @Builder.Default
    private List<PerformanceRecommendation> recommendations = new ArrayList<>();
    @Builder.Default
    private List<RiskFactor> riskFactors = new ArrayList<>();
    // true when the conservative estimate was returned instead of a model prediction
    private boolean fallback;
}
