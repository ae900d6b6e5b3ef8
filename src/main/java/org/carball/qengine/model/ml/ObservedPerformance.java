package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedPerformance {
    private long executionTime;
    private double memoryUsage;
    private double cpuUsage;
    private double ioOperations;
    private double networkTraffic;
    private long rowsProcessed;
}
