package org.carball.qengine.router;

import org.carball.qengine.model.routing.HealthDetails;

/**
 * Reports the live state of an execution endpoint. Implementations may block; the router
 * bounds every call with its probe timeout and treats exceptions as failed checks.
 */
@FunctionalInterface
public interface HealthProbe {

    HealthDetails checkHealth(String endpointId);

    /**
     * Probe that reports every endpoint as idle and healthy.
     */
    static HealthProbe idle() {
        return endpointId -> HealthDetails.builder()
                .cpuUsage(0)
                .memoryUsage(0)
                .diskUsage(0)
                .networkLatency(0)
                .activeConnections(0)
                .queueLength(100)
                .build();
    }
}
