package org.carball.qengine.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRuleStats {
    private String name;
    private long hitCount;
    private Instant lastUsed;
}
