package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryStatistics {
    private int totalOptimizations;
    private int successfulOptimizations;
    private double averagePerformanceGain;
    @Builder.Default
    private List<TechniqueStats> mostUsedTechniques = new ArrayList<>();
    @Builder.Default
    private Map<String, Integer> queryTypeDistribution = new LinkedHashMap<>();
    @Builder.Default
    private PerformanceDistribution performanceDistribution = new PerformanceDistribution();
    @Builder.Default
    private SatisfactionStats userSatisfaction = SatisfactionStats.empty();
    @Builder.Default
    private List<HistoryTrend> trends = new ArrayList<>();
}
