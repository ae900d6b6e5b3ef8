package org.carball.qengine.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingStrategy {
    private String targetConnection;
    private LoadBalancingStrategy loadBalancing;
    private int priority;
    private String reason;
}
