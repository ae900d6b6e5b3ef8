package org.carball.qengine.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionHealth {
    private String connectionId;
    private boolean healthy;
    private double latency;
    private double load;
    private double errorRate;
    private Instant lastCheck;
    private int consecutiveFailures;
    private HealthDetails details;
}
