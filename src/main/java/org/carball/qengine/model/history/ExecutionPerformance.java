package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Measured outcome of running an optimized query next to its original form.
 * {@code performanceGain} is a percentage; negative values mean the rewrite was slower.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPerformance {
    private double originalExecutionTime;
    private double optimizedExecutionTime;
    private double performanceGain;
    private double memoryUsage;
    private double cpuUsage;
    private long ioOperations;
    private long networkTraffic;
    private long rowsAffected;
    private boolean success;
    private String error;

    public static ExecutionPerformance pending() {
        return new ExecutionPerformance();
    }
}
