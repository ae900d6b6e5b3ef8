package org.carball.qengine.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.optimization.Priority;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.optimization.RecommendationType;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.util.QueryText;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * In-process LRU cache with per-entry expiry. Lookups refresh recency; inserting into a full
 * cache evicts the least recently used entry.
 */
@Slf4j
public class InMemoryResultCache implements ResultCache {

    public static final int DEFAULT_MAX_SIZE = 1_000;
    public static final long DEFAULT_TTL_MS = 3_600_000;

    static final String REAL_TIME_TAG = "real_time";
    static final String HISTORICAL_TAG = "historical";

    private static final long REAL_TIME_MAX_TTL_MS = 300_000;
    private static final long SLOW_QUERY_MS = 1_000;
    private static final int MIN_LOOKUPS_FOR_HIT_RATE = 10;
    private static final double LOW_HIT_RATE = 0.3;

    // access-ordered; guarded by this
    private final LinkedHashMap<String, CachedResult> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Set<String> slowQueries = ConcurrentHashMap.newKeySet();
    private final int maxSize;
    private final long defaultTtl;
    private final Clock clock;

    private long hits;
    private long misses;
    private long evictions;

    public InMemoryResultCache() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL_MS, Clock.systemUTC());
    }

    public InMemoryResultCache(int maxSize, long defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<CachedResult> get(String key) {
        CachedResult entry = entries.get(key);
        if (entry == null) {
            misses++;
            log.debug("Cache miss for {}", key);
            return Optional.empty();
        }
        if (!isValid(entry)) {
            entries.remove(key);
            misses++;
            log.debug("Cache entry {} expired", key);
            return Optional.empty();
        }
        entry.setHitCount(entry.getHitCount() + 1);
        entry.setLastHit(clock.instant());
        hits++;
        log.debug("Cache hit for {}", key);
        return Optional.of(entry.toBuilder().tags(new ArrayList<>(entry.getTags())).build());
    }

    @Override
    public synchronized void set(String key, QueryOptimizationResult result, CacheOptions options) {
        CacheOptions effective = options != null ? options : new CacheOptions();
        long ttl = effective.getTtl() != null && effective.getTtl() > 0 ? effective.getTtl() : defaultTtl;

        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            evictOne();
        }
        entries.put(key, CachedResult.builder()
                .key(key)
                .value(result)
                .storedAt(clock.instant())
                .ttl(ttl)
                .tags(effective.getTags() != null ? new ArrayList<>(effective.getTags()) : new ArrayList<>())
                .build());
    }

    @Override
    public boolean isValid(CachedResult result) {
        return result != null && result.getStoredAt() != null && !clock.instant().isAfter(result.expiresAt());
    }

    /**
     * Starts from the default TTL. Doubled above complexity 80, halved below 20, capped at
     * five minutes for real-time queries, tripled for historical ones and raised by half when
     * the estimated memory exceeds 1 GiB.
     */
    @Override
    public long calculateTTL(QueryAnalysis analysis) {
        double ttl = defaultTtl;

        double complexity = analysis.getComplexity() != null ? analysis.getComplexity().getScore() : 0;
        if (complexity > 80) {
            ttl *= 2;
        } else if (complexity < 20) {
            ttl *= 0.5;
        }

        if (analysis.hasTag(REAL_TIME_TAG)) {
            ttl = Math.min(ttl, REAL_TIME_MAX_TTL_MS);
        }
        if (analysis.hasTag(HISTORICAL_TAG)) {
            ttl *= 3;
        }
        if (analysis.getResourceUsage() != null && analysis.getResourceUsage().getEstimatedMemory() > 1024) {
            ttl *= 1.5;
        }
        return (long) ttl;
    }

    @Override
    public long calculateTTL(String query, QueryAnalysis analysis) {
        long ttl = calculateTTL(analysis);
        return slowQueries.contains(QueryText.hash(query)) ? ttl * 2 : ttl;
    }

    @Override
    public List<Recommendation> recommendCaching(String query, QueryAnalysis analysis) {
        List<Recommendation> recommendations = new ArrayList<>();
        double score = cachingScore(analysis);
        long ttl = calculateTTL(query, analysis);

        if (score > 0.7) {
            recommendations.add(recommendation(Priority.HIGH, "Enable aggressive caching",
                    "This query is ideal for caching with high TTL",
                    "Set cache TTL to " + ttl + "ms", Math.floor(score * 100)));
        } else if (score > 0.4) {
            recommendations.add(recommendation(Priority.MEDIUM, "Enable conservative caching",
                    "This query could benefit from short-term caching",
                    "Set cache TTL to " + ttl / 2 + "ms", Math.floor(score * 60)));
        }

        CacheStats stats = getStats();
        if (stats.getHits() + stats.getMisses() >= MIN_LOOKUPS_FOR_HIT_RATE && stats.getHitRate() < LOW_HIT_RATE) {
            recommendations.add(recommendation(Priority.MEDIUM, "Optimize cache strategy",
                    "Current cache hit rate is low, consider adjusting strategy",
                    "Switch to adaptive caching strategy", 40));
        }
        return recommendations;
    }

    @Override
    public void updateStrategy(String query, QueryExecutionResult result) {
        if (result != null && result.getExecutionTime() > SLOW_QUERY_MS) {
            if (slowQueries.add(QueryText.hash(query))) {
                log.debug("Marked slow query for longer caching: {}", QueryText.truncate(query, 80));
            }
        }
    }

    @Override
    public synchronized void clear(String pattern) {
        if (pattern == null) {
            entries.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            log.info("Cleared result cache");
            return;
        }
        Pattern regex = Pattern.compile(pattern);
        int removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (regex.matcher(keys.next()).find()) {
                keys.remove();
                removed++;
            }
        }
        log.info("Removed {} cache entries matching {}", removed, pattern);
    }

    @Override
    public synchronized CacheStats getStats() {
        long lookups = hits + misses;
        return CacheStats.builder()
                .hits(hits)
                .misses(misses)
                .hitRate(lookups > 0 ? (double) hits / lookups : 0)
                .size(entries.size())
                .evictions(evictions)
                .build();
    }

    // Factor 1: complexity, Factor 2: memory, Factor 3: read-only, Factor 4: freshness
    static double cachingScore(QueryAnalysis analysis) {
        double score = 0;
        if (analysis.getComplexity() != null && analysis.getComplexity().getScore() > 50) {
            score += 0.3;
        }
        if (analysis.getResourceUsage() != null && analysis.getResourceUsage().getEstimatedMemory() > 512) {
            score += 0.2;
        }
        if (analysis.primaryPattern().getKind() == QueryKind.SELECT) {
            score += 0.3;
        }
        if (!analysis.hasTag(REAL_TIME_TAG)) {
            score += 0.2;
        }
        return Math.min(score, 1.0);
    }

    private void evictOne() {
        Instant now = clock.instant();
        // expired entries go first, then the least recently used one
        for (Iterator<Map.Entry<String, CachedResult>> it = entries.entrySet().iterator(); it.hasNext(); ) {
            if (now.isAfter(it.next().getValue().expiresAt())) {
                it.remove();
                evictions++;
                return;
            }
        }
        Iterator<String> eldest = entries.keySet().iterator();
        if (eldest.hasNext()) {
            eldest.next();
            eldest.remove();
            evictions++;
        }
    }

    private static Recommendation recommendation(Priority priority, String title, String description,
                                                 String implementation, double benefit) {
        return Recommendation.builder()
                .type(RecommendationType.CACHING)
                .priority(priority)
                .title(title)
                .description(description)
                .implementation(implementation)
                .estimatedBenefit(benefit)
                .build();
    }
}
