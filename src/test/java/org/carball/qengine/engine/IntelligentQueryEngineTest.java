package org.carball.qengine.engine;

import org.carball.qengine.cache.CacheOptions;
import org.carball.qengine.cache.CacheStats;
import org.carball.qengine.cache.CachedResult;
import org.carball.qengine.cache.InMemoryResultCache;
import org.carball.qengine.cache.ResultCache;
import org.carball.qengine.config.EngineConfig;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.QueryOptimizationRequest;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.routing.NodeRole;
import org.carball.qengine.model.routing.RouteMetadata;
import org.carball.qengine.persistence.InMemoryPersistenceStore;
import org.carball.qengine.persistence.PersistenceStore;
import org.carball.qengine.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IntelligentQueryEngineTest {

    private static final String ORDERS_QUERY =
            "SELECT * FROM orders o JOIN customers c ON o.customer_id = c.id WHERE o.status = 'open' ORDER BY o.created_at";

    private MutableClock clock;
    private IntelligentQueryEngine engine;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        engine = IntelligentQueryEngine.builder()
                .config(EngineConfig.defaults())
                .clock(clock)
                .build();
    }

    @AfterEach
    public void tearDown() {
        engine.close();
    }

    @Test
    public void shouldProduceCompleteResultOnCacheMiss() {
        // When
        QueryOptimizationResult result = engine.optimizeQuery(request(ORDERS_QUERY));

        // Then
        assertThat(result.getOriginalQuery()).isEqualTo(ORDERS_QUERY);
        assertThat(result.getOptimizedQuery()).isNotBlank();
        assertThat(result.hasTechnique(IntelligentQueryEngine.CACHE_HIT_TECHNIQUE)).isFalse();
        assertThat(result.getCacheKey()).startsWith("primary:shop:");
        assertThat(result.getRoutingStrategy().getTargetConnection()).isEqualTo("primary");
        assertThat(result.getExecutionPlan().getSteps()).isNotEmpty();
        assertThat(result.getExecutionPlan().getEstimatedDuration()).isPositive();
        assertThat(result.getPrediction()).isNotNull();
        assertThat(result.getWarnings()).contains("Query without LIMIT may return large result sets");
        assertThat(result.getRecommendations())
                .isNotEmpty()
                .hasSizeLessThanOrEqualTo(IntelligentQueryEngine.MAX_RECOMMENDATIONS)
                .isSortedAccordingTo(Recommendation.BY_BENEFIT_DESC);
        assertThat(result.getHistoryEntryId()).isNotNull();
        assertThat(engine.getHistoryEntry(result.getHistoryEntryId()))
                .hasValueSatisfying(entry -> assertThat(entry.getOriginalQuery()).isEqualTo(ORDERS_QUERY));
    }

    @Test
    public void shouldServeRepeatedRequestFromCache() {
        // Given
        QueryOptimizationResult first = engine.optimizeQuery(request(ORDERS_QUERY));

        // When
        QueryOptimizationResult second = engine.optimizeQuery(request(ORDERS_QUERY));

        // Then
        assertThat(second.getOriginalQuery()).isEqualTo(first.getOriginalQuery());
        assertThat(second.getOptimizedQuery()).isEqualTo(first.getOptimizedQuery());
        assertThat(second.getHistoryEntryId()).isNull();
        assertThat(second.getOptimizationTechniques())
                .hasSize(first.getOptimizationTechniques().size() + 1);
        OptimizationTechnique cacheHit = second.getOptimizationTechniques()
                .get(second.getOptimizationTechniques().size() - 1);
        assertThat(cacheHit.getName()).isEqualTo("Cache Hit");
        assertThat(cacheHit.getEstimatedGain()).isEqualTo(95);
        assertThat(cacheHit.getAppliedTo()).containsExactly("query_result");
        assertThat(first.hasTechnique("Cache Hit")).isFalse();
        assertThat(engine.getOptimizationHistory()).hasSize(1);
    }

    @Test
    public void shouldReturnDegradedResultWhenPipelineFails() {
        // Given
        ResultCache broken = new RecordingCache(new InMemoryResultCache()) {
            @Override
            public String generateCacheKey(String query, String connectionId, String database) {
                throw new IllegalStateException("key generator unavailable");
            }
        };
        try (IntelligentQueryEngine degraded = IntelligentQueryEngine.builder().cache(broken).build()) {

            // When
            QueryOptimizationResult result = degraded.optimizeQuery(request(ORDERS_QUERY));

            // Then
            assertThat(result.getOptimizedQuery()).isEqualTo(ORDERS_QUERY);
            assertThat(result.getEstimatedPerformanceGain()).isZero();
            assertThat(result.getWarnings()).containsExactly("Optimization failed: key generator unavailable");
            assertThat(result.getRoutingStrategy().getTargetConnection()).isEqualTo("primary");
            assertThat(result.getRoutingStrategy().getReason()).isEqualTo(IntelligentQueryEngine.DEGRADED_REASON);
            assertThat(result.getExecutionPlan().getSteps()).isEmpty();
        }
    }

    @Test
    public void shouldTreatSlowCacheAsMiss() {
        // Given
        RecordingCache slow = new RecordingCache(new InMemoryResultCache()) {
            @Override
            public Optional<CachedResult> get(String key) {
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.get(key);
            }
        };
        EngineConfig config = EngineConfig.builder().collaboratorTimeout(50).build();
        try (IntelligentQueryEngine impatient = IntelligentQueryEngine.builder().config(config).cache(slow).build()) {
            impatient.optimizeQuery(request(ORDERS_QUERY));

            // When
            QueryOptimizationResult second = impatient.optimizeQuery(request(ORDERS_QUERY));

            // Then
            assertThat(second.hasTechnique("Cache Hit")).isFalse();
            assertThat(second.getHistoryEntryId()).isNotNull();
            assertThat(impatient.getOptimizationHistory()).hasSize(2);
        }
    }

    @Test
    public void shouldNotWaitForStalledPersistenceStore() {
        // Given
        PersistenceStore stalled = new InMemoryPersistenceStore() {
            @Override
            public void save(String key, Object value) throws IOException {
                try {
                    Thread.sleep(8_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("save interrupted");
                }
                super.save(key, value);
            }
        };
        EngineConfig config = EngineConfig.builder().collaboratorTimeout(200).build();
        try (IntelligentQueryEngine impatient = IntelligentQueryEngine.builder().config(config).store(stalled).build()) {

            // When
            long started = System.nanoTime();
            QueryOptimizationResult result = impatient.optimizeQuery(request("SELECT a FROM t WHERE a = 1"));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            // Then
            assertThat(elapsedMs).isLessThan(2_000);
            assertThat(result.getHistoryEntryId()).isNotNull();
            assertThat(impatient.getOptimizationHistory()).hasSize(1);
        }
    }

    @Test
    public void shouldKeepCachedResultIndependentOfCallerChanges() {
        // Given
        QueryOptimizationResult first = engine.optimizeQuery(request(ORDERS_QUERY));
        List<String> originalWarnings = new ArrayList<>(first.getWarnings());
        int originalRecommendations = first.getRecommendations().size();

        // When
        first.getWarnings().add("added by caller");
        first.getRecommendations().clear();
        QueryOptimizationResult second = engine.optimizeQuery(request(ORDERS_QUERY));

        // Then
        assertThat(second.hasTechnique("Cache Hit")).isTrue();
        assertThat(second.getWarnings()).containsExactlyElementsOf(originalWarnings);
        assertThat(second.getRecommendations()).hasSize(originalRecommendations);
    }

    @Test
    public void shouldOptimizeTableCreatorBeforeItsReader() {
        // Given
        RecordingCache recording = new RecordingCache(new InMemoryResultCache());
        String create = "CREATE TABLE staging_events (id INT, amount DOUBLE)";
        String read = "SELECT id, amount FROM staging_events WHERE amount > 10";
        try (IntelligentQueryEngine batchEngine = IntelligentQueryEngine.builder().cache(recording).build()) {

            // When
            List<QueryOptimizationResult> results = batchEngine.optimizeQueries(List.of(request(create), request(read)));

            // Then
            assertThat(results).extracting(QueryOptimizationResult::getOriginalQuery).containsExactly(create, read);
            String createKey = recording.generateCacheKey(create, "primary", "shop");
            String readKey = recording.generateCacheKey(read, "primary", "shop");
            assertThat(recording.events.indexOf("set:" + createKey))
                    .isNotNegative()
                    .isLessThan(recording.events.indexOf("get:" + readKey));
        }
    }

    @Test
    public void shouldOptimizeIndependentQueriesConcurrently() {
        // Given
        CountDownLatch bothStarted = new CountDownLatch(2);
        List<Boolean> overlapped = Collections.synchronizedList(new ArrayList<>());
        RecordingCache rendezvous = new RecordingCache(new InMemoryResultCache()) {
            @Override
            public Optional<CachedResult> get(String key) {
                bothStarted.countDown();
                try {
                    overlapped.add(bothStarted.await(1, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.get(key);
            }
        };
        String users = "SELECT id, name FROM users WHERE id = 7";
        String metrics = "SELECT host, cpu FROM metrics WHERE host = 'web-1' LIMIT 10";
        try (IntelligentQueryEngine batchEngine = IntelligentQueryEngine.builder().cache(rendezvous).build()) {

            // When
            List<QueryOptimizationResult> results = batchEngine.optimizeQueries(List.of(request(users), request(metrics)));

            // Then
            assertThat(results).extracting(QueryOptimizationResult::getOriginalQuery).containsExactly(users, metrics);
            assertThat(overlapped).containsExactly(true, true);
        }
    }

    @Test
    public void shouldKeepLearningWhenOneStepFails() {
        // Given
        ResultCache failingStrategy = new RecordingCache(new InMemoryResultCache()) {
            @Override
            public void updateStrategy(String query, QueryExecutionResult result) {
                throw new IllegalStateException("strategy store offline");
            }
        };
        try (IntelligentQueryEngine learning = IntelligentQueryEngine.builder().cache(failingStrategy).build()) {

            // When
            learning.learnFromQuery(ORDERS_QUERY, execution(2_500, true), null, "primary");

            // Then
            assertThat(learning.getQueryStats("primary").getTotalQueries()).isEqualTo(1);
            assertThat(learning.getQueryStats("primary").getSlowQueries()).hasSize(1);
        }
    }

    @Test
    public void shouldRecommendForSlowestRecordedQueries() {
        // Given
        engine.learnFromQuery(ORDERS_QUERY, execution(4_000, true), null, "primary");
        engine.learnFromQuery("SELECT id FROM users WHERE id = 1 LIMIT 1", execution(5, true), null, "primary");

        // When
        List<Recommendation> recommendations = engine.getOptimizationRecommendations("primary", 3);

        // Then
        assertThat(recommendations)
                .isNotEmpty()
                .hasSizeLessThanOrEqualTo(3)
                .isSortedAccordingTo(Recommendation.BY_BENEFIT_DESC);
    }

    @Test
    public void shouldRetryThenFallBackToRequestedConnection() {
        // Given
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        EngineConfig config = EngineConfig.builder().maxRetries(1).build();
        try (IntelligentQueryEngine executing = IntelligentQueryEngine.builder()
                .config(config)
                .backend((connectionId, query) -> {
                    calls.add(connectionId);
                    return "replica".equals(connectionId) ? failure("replica lagging") : execution(120, true);
                })
                .build()) {
            executing.registerEndpoint("replica", 100, RouteMetadata.builder().nodeRole(NodeRole.SECONDARY).build());

            // When
            ExecutionOutcome outcome = executing.executeAndLearn(request("SELECT id, total FROM orders WHERE id = 42"));

            // Then
            assertThat(calls).containsExactly("replica", "replica", "primary");
            assertThat(outcome.connectionId()).isEqualTo("primary");
            assertThat(outcome.attempts()).isEqualTo(3);
            assertThat(outcome.execution().isSuccess()).isTrue();
            OptimizationHistoryEntry entry = executing.getHistoryEntry(outcome.optimization().getHistoryEntryId())
                    .orElseThrow();
            assertThat(entry.isPerformanceRecorded()).isTrue();
            assertThat(entry.getPerformance().getOptimizedExecutionTime()).isEqualTo(120);
            assertThat(executing.getQueryStats("primary").getTotalQueries()).isEqualTo(1);
        }
    }

    @Test
    public void shouldRequireBackendForExecution() {
        // When/Then
        assertThatThrownBy(() -> engine.executeAndLearn(request(ORDERS_QUERY)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No execution backend configured");
    }

    private static QueryOptimizationRequest request(String query) {
        return QueryOptimizationRequest.builder()
                .query(query)
                .connectionId("primary")
                .database("shop")
                .build();
    }

    private static QueryExecutionResult execution(long time, boolean success) {
        return QueryExecutionResult.builder()
                .executionTime(time)
                .rowsAffected(10)
                .memoryUsed(1_024)
                .success(success)
                .build();
    }

    private static QueryExecutionResult failure(String error) {
        return QueryExecutionResult.builder()
                .executionTime(30)
                .success(false)
                .error(error)
                .build();
    }

    private static class RecordingCache implements ResultCache {

        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        private final ResultCache delegate;

        RecordingCache(ResultCache delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<CachedResult> get(String key) {
            events.add("get:" + key);
            return delegate.get(key);
        }

        @Override
        public void set(String key, QueryOptimizationResult result, CacheOptions options) {
            events.add("set:" + key);
            delegate.set(key, result, options);
        }

        @Override
        public boolean isValid(CachedResult result) {
            return delegate.isValid(result);
        }

        @Override
        public long calculateTTL(QueryAnalysis analysis) {
            return delegate.calculateTTL(analysis);
        }

        @Override
        public List<Recommendation> recommendCaching(String query, QueryAnalysis analysis) {
            return delegate.recommendCaching(query, analysis);
        }

        @Override
        public void updateStrategy(String query, QueryExecutionResult result) {
            delegate.updateStrategy(query, result);
        }

        @Override
        public void clear(String pattern) {
            delegate.clear(pattern);
        }

        @Override
        public CacheStats getStats() {
            return delegate.getStats();
        }
    }
}
