package org.carball.qengine.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheOptions {
    // milliseconds; null uses the cache default
    private Long ttl;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
