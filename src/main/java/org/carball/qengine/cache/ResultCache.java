package org.carball.qengine.cache;

import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.util.QueryText;

import java.util.List;
import java.util.Optional;

/**
 * Cache of optimization results keyed by connection, database and normalised query.
 * Implementations must be safe for concurrent use.
 */
public interface ResultCache {

    Optional<CachedResult> get(String key);

    void set(String key, QueryOptimizationResult result, CacheOptions options);

    boolean isValid(CachedResult result);

    /**
     * TTL in milliseconds for a result of the analysed query.
     */
    long calculateTTL(QueryAnalysis analysis);

    default long calculateTTL(String query, QueryAnalysis analysis) {
        return calculateTTL(analysis);
    }

    List<Recommendation> recommendCaching(String query, QueryAnalysis analysis);

    /**
     * Feeds an observed execution back so later TTLs can adapt.
     */
    void updateStrategy(String query, QueryExecutionResult result);

    /**
     * Removes entries whose key matches the regular expression, or everything when the
     * pattern is null.
     */
    void clear(String pattern);

    CacheStats getStats();

    default String generateCacheKey(String query, String connectionId, String database) {
        return connectionId + ":" + database + ":" + QueryText.hash(query);
    }
}
