package org.carball.qengine.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteMetadata {
    @Builder.Default
    private NodeRole nodeRole = NodeRole.PRIMARY;
    private String region;
    private String version;
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();
    private Instant lastHealthCheck;
    private double avgResponseTime;
    private double errorRate;
    private int connectionCount;
    @Builder.Default
    private int maxConnections = 100;
}
