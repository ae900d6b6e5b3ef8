package org.carball.qengine.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    double hitRate;
    int size;
    long evictions;
}
