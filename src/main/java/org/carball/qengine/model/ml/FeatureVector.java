package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureVector {
    // structural
    private int queryLength;
    private int tableCount;
    private int columnCount;
    private int joinCount;
    private int aggregationCount;
    private int conditionCount;
    private int subqueryCount;
    private int orderByCount;
    private int groupByCount;
    private boolean limited;

    // semantic
    private double selectivity;
    private double complexityScore;
    private double dataVolumeScore;
    private double computationalComplexity;

    // context
    private double systemLoad;
    private double memoryAvailable;
    private double diskUtilization;
    private double networkLatency;
    private int timeOfDay;
    private int dayOfWeek;

    // history
    private int queryFrequency;
    private double averagePerformance;
}
