package org.carball.qengine.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.optimization.QueryOptimizationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A cached optimization result with its expiry information.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CachedResult {
    private String key;
    private QueryOptimizationResult value;
    private Instant storedAt;
    private long ttl;
    private long hitCount;
    private Instant lastHit;
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    public Instant expiresAt() {
        return storedAt.plusMillis(ttl);
    }
}
