package org.carball.qengine.model.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot returned by a health probe. Usage figures are percentages, latency milliseconds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HealthDetails {
    private double cpuUsage;
    private double memoryUsage;
    private double diskUsage;
    private double networkLatency;
    private int activeConnections;
    private int queueLength;
    private String lastError;

    /**
     * Healthy iff CPU and memory are below 90%, disk below 95%, latency below one second and
     * active connections below 80% of the queue length.
     */
    @JsonIgnore
    public boolean isHealthy() {
        return cpuUsage < 90
                && memoryUsage < 90
                && diskUsage < 95
                && networkLatency < 1000
                && activeConnections < queueLength * 0.8;
    }
}
