package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.query.QueryKind;

/**
 * Numeric encoding of a query and its runtime context used by the duration models.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceFeatures {
    // query
    private QueryKind queryKind;
    private int tableCount;
    private int columnCount;
    private int joinCount;
    private int aggregationCount;
    private int conditionCount;
    private double complexityScore;
    private double selectivity;
    private double dataSize;
    private double indexUsage;

    // context
    private double systemLoad;
    private double memoryAvailable;
    private double diskUtilization;
    private double networkLatency;
    private int timeOfDay;
    private int dayOfWeek;

    // history
    private int queryFrequency;
    private double averagePastDuration;
}
