package org.carball.qengine.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {
    @Builder.Default
    private PreferredPerformance preferredPerformance = PreferredPerformance.BALANCED;
    @Builder.Default
    private long maxQueryTime = 30_000;
    @Builder.Default
    private CachePreference cachePreference = CachePreference.CONSERVATIVE;
}
