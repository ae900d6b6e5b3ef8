package org.carball.qengine.model.routing;

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
public class RoutingStatistics {
    private long totalRequests;
    private long successfulRoutes;
    private long failedRoutes;
    private double avgRoutingTime;
    @Builder.Default
    private Map<String, Long> routeDistribution = new LinkedHashMap<>();
    private int healthyNodes;
    private int unhealthyNodes;
    // routes that fell back to the caller's default endpoint
    private long failoverCount;
    @Builder.Default
    private List<RoutingRuleStats> routingRules = new ArrayList<>();
}
