package org.carball.qengine.engine;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.analyzer.QueryAnalyzer;
import org.carball.qengine.backend.ExecutionBackend;
import org.carball.qengine.cache.CacheOptions;
import org.carball.qengine.cache.CachedResult;
import org.carball.qengine.cache.InMemoryResultCache;
import org.carball.qengine.cache.ResultCache;
import org.carball.qengine.config.EngineConfig;
import org.carball.qengine.history.OptimizationHistory;
import org.carball.qengine.ml.MLOptimizer;
import org.carball.qengine.ml.ScoringModelRegistry;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.history.ExecutionPerformance;
import org.carball.qengine.model.history.ExportFormat;
import org.carball.qengine.model.history.ExportOptions;
import org.carball.qengine.model.history.HistoryFilter;
import org.carball.qengine.model.history.HistoryStatistics;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.history.UserFeedback;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLTrainingData;
import org.carball.qengine.model.ml.ModelMetrics;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.OptimizedQuery;
import org.carball.qengine.model.optimization.QueryOptimizationRequest;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.plan.ExecutionPlan;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.prediction.PerformancePrediction;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryDependency;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.query.QueryStatistics;
import org.carball.qengine.model.query.QuerySummary;
import org.carball.qengine.model.query.TimeWindow;
import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.model.routing.RouteMetadata;
import org.carball.qengine.model.routing.RoutingStatistics;
import org.carball.qengine.model.routing.RoutingStrategy;
import org.carball.qengine.optimizer.QueryOptimizer;
import org.carball.qengine.persistence.FilePersistenceStore;
import org.carball.qengine.persistence.InMemoryPersistenceStore;
import org.carball.qengine.persistence.PersistenceStore;
import org.carball.qengine.persistence.TimeLimitedPersistenceStore;
import org.carball.qengine.predictor.PerformancePredictor;
import org.carball.qengine.predictor.PredictionModelRegistry;
import org.carball.qengine.router.HealthProbe;
import org.carball.qengine.router.QueryRouter;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Orchestrates analysis, caching, optimization, prediction, routing, planning and history
 * for each query. Create one instance per application with {@link #builder()} and close it on
 * shutdown.
 */
@Slf4j
public class IntelligentQueryEngine implements AutoCloseable {

    public static final String CACHE_HIT_TECHNIQUE = "Cache Hit";
    public static final int MAX_RECOMMENDATIONS = 10;

    static final String DEGRADED_REASON = "Optimization failed, using original query";

    private static final double CACHE_HIT_GAIN = 95;

    private final EngineConfig config;
    private final QueryAnalyzer analyzer;
    private final PerformancePredictor predictor;
    private final QueryOptimizer optimizer;
    private final QueryRouter router;
    private final OptimizationHistory history;
    private final ResultCache cache;
    private final ExecutionBackend backend;
    private final ExecutorService workers;
    private final ExecutorService collaborators;

    @Builder
    private IntelligentQueryEngine(EngineConfig config, ResultCache cache, HealthProbe healthProbe,
                                   PersistenceStore store, ExecutionBackend backend, Clock clock) {
        this.config = config != null ? config : EngineConfig.defaults();
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        this.workers = Executors.newFixedThreadPool(Math.max(1, this.config.getWorkerThreads()),
                daemonThreads("query-engine-worker"));
        this.collaborators = Executors.newCachedThreadPool(daemonThreads("query-engine-collaborator"));
        PersistenceStore effectiveStore = new TimeLimitedPersistenceStore(
                store != null ? store : defaultStore(this.config),
                this.config.getCollaboratorTimeout(), collaborators);

        this.analyzer = new QueryAnalyzer();
        this.predictor = new PerformancePredictor(new PredictionModelRegistry(),
                this.config.getPredictorTrainingBufferSize(), this.config.getPredictorRetrainThreshold(),
                effectiveClock);
        MLOptimizer mlOptimizer = new MLOptimizer(ScoringModelRegistry.withDefaultModels(),
                this.config.getMlTrainingBufferSize(), this.config.getMlTrainingInterval(),
                this.config.getMlMinTrainingSamples(), effectiveStore, effectiveClock);
        this.optimizer = new QueryOptimizer(mlOptimizer, this.config.isMlEnabled());
        this.router = new QueryRouter(healthProbe != null ? healthProbe : HealthProbe.idle(),
                this.config.getRoutingStrategy(), this.config.getHealthCheckInterval(),
                this.config.getProbeTimeout(), this.config.getRoutingHistorySize(), effectiveClock);
        this.history = new OptimizationHistory(this.config.getHistoryMaxSize(), effectiveStore, effectiveClock);
        this.cache = cache != null ? cache
                : new InMemoryResultCache(this.config.getCacheMaxSize(), this.config.getCacheDefaultTtl(),
                effectiveClock);
        this.backend = backend;

        router.start();
        log.info("Query engine started: {}", this.config.getConfigurationSummary());
    }

    private static PersistenceStore defaultStore(EngineConfig config) {
        if (config.isPersistenceEnabled()) {
            return new FilePersistenceStore(Path.of(config.getPersistenceDirectory()));
        }
        return new InMemoryPersistenceStore();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Runs the full pipeline for one request. Never throws for query content: an unexpected
     * failure yields a degraded result that keeps the original query.
     */
    public QueryOptimizationResult optimizeQuery(QueryOptimizationRequest request) {
        String query = request.getQuery();
        String connectionId = request.getConnectionId();
        QueryContext context = request.getContext();
        String cacheKey = null;

        try {
            // 1. Analyze
            QueryAnalysis analysis = analyzer.analyze(query, context);

            // 2. Cache check
            cacheKey = cache.generateCacheKey(query, connectionId, request.getDatabase());
            Optional<QueryOptimizationResult> cached = cachedResult(cacheKey);
            if (cached.isPresent()) {
                log.debug("Serving optimization of {} from cache", cacheKey);
                return cached.get();
            }

            // 3. Optimize
            OptimizedQuery optimized = optimizer.optimize(query, analysis, context);

            // 4. Predict
            PerformancePrediction prediction = predictor.predict(optimized.getQuery(), context);

            // 5. Route
            RoutingStrategy routing = router.determineRouting(optimized.getQuery(), connectionId, context);

            // 6. Plan
            ExecutionPlan plan = generateExecutionPlan(optimized.getQuery(), context);

            // 7. Recommend
            List<Recommendation> recommendations = generateRecommendations(query, analysis, context);

            QueryOptimizationResult result = QueryOptimizationResult.builder()
                    .originalQuery(query)
                    .optimizedQuery(optimized.getQuery())
                    .optimizationTechniques(new ArrayList<>(optimized.getTechniques()))
                    .estimatedPerformanceGain(optimized.getEstimatedImprovement())
                    .cacheKey(cacheKey)
                    .routingStrategy(routing)
                    .executionPlan(plan)
                    .warnings(new ArrayList<>(analysis.getWarnings()))
                    .recommendations(recommendations)
                    .prediction(prediction)
                    .build();

            // 8. Cache and record
            storeInCache(cacheKey, result, CacheOptions.builder()
                    .ttl(cache.calculateTTL(query, analysis))
                    .tags(new ArrayList<>(analysis.getTags()))
                    .build());
            String entryId = history.recordOptimization(connectionId, request.getDatabase(), query, result, context);

            return result.toBuilder().historyEntryId(entryId).build();
        } catch (RuntimeException e) {
            log.error("Optimization failed for query on {}: {}", connectionId, e.getMessage(), e);
            return degradedResult(request, cacheKey, e);
        }
    }

    /**
     * Optimizes a batch. Requests nothing else depends on run concurrently; the remaining ones
     * run afterwards one at a time in request order. Results come back in request order.
     */
    public List<QueryOptimizationResult> optimizeQueries(List<QueryOptimizationRequest> requests) {
        List<String> queries = requests.stream()
                .map(QueryOptimizationRequest::getQuery)
                .collect(Collectors.toList());
        List<QueryDependency> dependencies = analyzer.analyzeDependencies(queries);
        Set<Integer> dependent = new HashSet<>();
        for (QueryDependency dependency : dependencies) {
            dependent.add(dependency.dependentIndex());
        }
        log.debug("Batch of {} queries has {} dependent queries", requests.size(), dependent.size());

        QueryOptimizationResult[] results = new QueryOptimizationResult[requests.size()];

        Map<Integer, Future<QueryOptimizationResult>> independent = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            if (!dependent.contains(i)) {
                QueryOptimizationRequest request = requests.get(i);
                independent.put(i, workers.submit(() -> optimizeQuery(request)));
            }
        }
        for (Map.Entry<Integer, Future<QueryOptimizationResult>> entry : independent.entrySet()) {
            results[entry.getKey()] = await(entry.getValue(), requests.get(entry.getKey()));
        }

        for (int i = 0; i < requests.size(); i++) {
            if (dependent.contains(i)) {
                results[i] = optimizeQuery(requests.get(i));
            }
        }

        List<QueryOptimizationResult> ordered = new ArrayList<>(results.length);
        for (QueryOptimizationResult result : results) {
            ordered.add(result);
        }
        return ordered;
    }

    private QueryOptimizationResult await(Future<QueryOptimizationResult> future, QueryOptimizationRequest request) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return degradedResult(request, null, e);
        } catch (ExecutionException e) {
            log.error("Batch optimization task failed: {}", e.getCause().getMessage(), e.getCause());
            return degradedResult(request, null, e.getCause());
        }
    }

    public void learnFromQuery(String query, QueryExecutionResult result, QueryContext context) {
        learnFromQuery(query, result, context, null);
    }

    /**
     * Feeds one observed execution to the analyzer, predictor, cache and router. Each update
     * is independent; a failure in one is logged and the others still run.
     */
    public void learnFromQuery(String query, QueryExecutionResult result, QueryContext context,
                               String connectionId) {
        isolated("record performance", () -> analyzer.recordPerformance(query, connectionId, result));
        isolated("update prediction model", () -> predictor.updateModel(query, result, context));
        isolated("update cache strategy", () -> cache.updateStrategy(query, result));
        isolated("update routing weights", () -> router.updateWeights(query, result));
    }

    private void isolated(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Learning step '{}' failed: {}", step, e.getMessage());
        }
    }

    /**
     * Optimizes the request, runs the optimized query on the routed endpoint and learns from
     * the outcome. Each endpoint gets {@code maxRetries} retries within the failover timeout;
     * when the routed endpoint keeps failing the request's own connection is tried once.
     */
    public ExecutionOutcome executeAndLearn(QueryOptimizationRequest request) {
        if (backend == null) {
            throw new IllegalStateException("No execution backend configured");
        }

        QueryOptimizationResult optimization = optimizeQuery(request);
        String target = optimization.getRoutingStrategy() != null
                && optimization.getRoutingStrategy().getTargetConnection() != null
                ? optimization.getRoutingStrategy().getTargetConnection()
                : request.getConnectionId();

        int attempts = 0;
        String usedConnection = target;
        QueryExecutionResult execution = null;
        for (int retry = 0; retry <= Math.max(0, config.getMaxRetries()); retry++) {
            attempts++;
            execution = executeOnce(target, optimization.getOptimizedQuery());
            if (execution.isSuccess()) {
                break;
            }
            log.debug("Execution attempt {} on {} failed: {}", attempts, target, execution.getError());
        }

        if (!execution.isSuccess() && request.getConnectionId() != null
                && !request.getConnectionId().equals(target)) {
            log.warn("Endpoint {} failed {} times, falling back to {}", target, attempts, request.getConnectionId());
            attempts++;
            usedConnection = request.getConnectionId();
            execution = executeOnce(usedConnection, optimization.getOptimizedQuery());
        }

        learnFromQuery(optimization.getOptimizedQuery(), execution, request.getContext(), usedConnection);

        if (optimization.getHistoryEntryId() != null) {
            history.updatePerformance(optimization.getHistoryEntryId(),
                    measuredPerformance(request, execution));
        }
        return new ExecutionOutcome(optimization, execution, usedConnection, attempts);
    }

    private QueryExecutionResult executeOnce(String connectionId, String query) {
        try {
            return CompletableFuture.supplyAsync(() -> backend.execute(connectionId, query), collaborators)
                    .get(config.getFailoverTimeout(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return failedExecution("Execution timed out after " + config.getFailoverTimeout() + " ms");
        } catch (ExecutionException e) {
            return failedExecution(e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failedExecution("Execution interrupted");
        }
    }

    private static QueryExecutionResult failedExecution(String error) {
        return QueryExecutionResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * The original query is not executed, so its predicted duration stands in as the baseline.
     */
    private ExecutionPerformance measuredPerformance(QueryOptimizationRequest request, QueryExecutionResult execution) {
        double baseline = predictor.predict(request.getQuery(), request.getContext()).getEstimatedDuration();
        double actual = execution.getExecutionTime();
        double gain = baseline > 0 ? (baseline - actual) / baseline * 100 : 0;

        return ExecutionPerformance.builder()
                .originalExecutionTime(baseline)
                .optimizedExecutionTime(actual)
                .performanceGain(gain)
                .memoryUsage(execution.getMemoryUsed())
                .ioOperations(execution.getDiskReads() + execution.getDiskWrites())
                .networkTraffic(execution.getNetworkBytes())
                .rowsAffected(execution.getRowsAffected())
                .success(execution.isSuccess())
                .error(execution.getError())
                .build();
    }

    public QueryStatistics getQueryStats(String connectionId) {
        return analyzer.getStatistics(connectionId);
    }

    public QueryStatistics getQueryStats(String connectionId, TimeWindow window) {
        return analyzer.getStatistics(connectionId, window);
    }

    public void clearCache() {
        clearCache(null);
    }

    public void clearCache(String pattern) {
        cache.clear(pattern);
    }

    public List<Recommendation> getOptimizationRecommendations(String connectionId) {
        return getOptimizationRecommendations(connectionId, MAX_RECOMMENDATIONS);
    }

    /**
     * Recommendations for the slowest recorded queries of a connection, merged and ranked by
     * estimated benefit.
     */
    public List<Recommendation> getOptimizationRecommendations(String connectionId, int limit) {
        List<QuerySummary> slowQueries = getQueryStats(connectionId).getSlowQueries();

        List<Recommendation> recommendations = new ArrayList<>();
        for (QuerySummary slowQuery : slowQueries.stream().limit(limit).collect(Collectors.toList())) {
            QueryAnalysis analysis = analyzer.analyze(slowQuery.getQuery());
            recommendations.addAll(generateRecommendations(slowQuery.getQuery(), analysis, null));
        }

        return recommendations.stream()
                .sorted(Recommendation.BY_BENEFIT_DESC)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public void trainMLModels() {
        optimizer.trainMLModels();
    }

    public boolean addMLTrainingData(MLTrainingData data) {
        return optimizer.addMLTrainingData(data);
    }

    public List<MLModel> getMLModelInfo() {
        return optimizer.getMLModelInfo();
    }

    public Optional<ModelMetrics> getMLModelMetrics(String modelId) {
        return optimizer.getMLModelMetrics(modelId);
    }

    public List<OptimizationHistoryEntry> getOptimizationHistory() {
        return history.queryHistory();
    }

    public List<OptimizationHistoryEntry> getOptimizationHistory(HistoryFilter filter, int limit, int offset) {
        return history.queryHistory(filter, limit, offset);
    }

    public Optional<OptimizationHistoryEntry> getHistoryEntry(String entryId) {
        return history.getHistoryEntry(entryId);
    }

    public boolean updateExecutionPerformance(String entryId, ExecutionPerformance performance) {
        return history.updatePerformance(entryId, performance);
    }

    public boolean addUserFeedback(String entryId, UserFeedback feedback) {
        return history.addUserFeedback(entryId, feedback);
    }

    public HistoryStatistics getHistoryStatistics(HistoryFilter filter) {
        return history.generateStatistics(filter);
    }

    public List<OptimizationHistoryEntry> findSimilarQueries(String query) {
        return history.findSimilarQueries(query);
    }

    public List<OptimizationHistoryEntry> findSimilarQueries(String query, int limit, double threshold) {
        return history.findSimilarQueries(query, limit, threshold);
    }

    public List<OptimizationHistoryEntry> getBestOptimizations(int limit) {
        return history.getBestOptimizations(limit);
    }

    public List<OptimizationHistoryEntry> getWorstOptimizations(int limit) {
        return history.getWorstOptimizations(limit);
    }

    public String exportOptimizationHistory(ExportOptions options) {
        return history.exportHistory(options);
    }

    public int importOptimizationHistory(String data, ExportFormat format) {
        return history.importHistory(data, format);
    }

    public void clearOptimizationHistory() {
        history.clearHistory();
    }

    public void registerEndpoint(String connectionId, int capacity, RouteMetadata metadata) {
        router.registerEndpoint(connectionId, capacity, metadata);
    }

    public boolean unregisterEndpoint(String connectionId) {
        return router.unregisterEndpoint(connectionId);
    }

    public RoutingStatistics getRoutingStatistics() {
        return router.getRoutingStatistics();
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        router.close();
        shutdown(workers);
        collaborators.shutdownNow();
        log.info("Query engine stopped");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Optional<QueryOptimizationResult> cachedResult(String cacheKey) {
        Optional<CachedResult> cached = withCollaboratorTimeout("cache get", () -> cache.get(cacheKey))
                .flatMap(result -> result);
        if (cached.isEmpty() || cached.get().getValue() == null || !cache.isValid(cached.get())) {
            return Optional.empty();
        }

        QueryOptimizationResult value = cached.get().getValue();
        List<OptimizationTechnique> techniques = new ArrayList<>(value.getOptimizationTechniques());
        List<String> appliedTo = new ArrayList<>();
        appliedTo.add("query_result");
        techniques.add(OptimizationTechnique.builder()
                .name(CACHE_HIT_TECHNIQUE)
                .description("Result retrieved from intelligent cache")
                .impact(Impact.HIGH)
                .appliedTo(appliedTo)
                .estimatedGain(CACHE_HIT_GAIN)
                .build());

        return Optional.of(detachedCopy(value).toBuilder()
                .optimizationTechniques(techniques)
                .historyEntryId(null)
                .build());
    }

    // cached values must not share their lists with results handed to callers
    private static QueryOptimizationResult detachedCopy(QueryOptimizationResult result) {
        return result.toBuilder()
                .optimizationTechniques(new ArrayList<>(result.getOptimizationTechniques()))
                .warnings(new ArrayList<>(result.getWarnings()))
                .recommendations(new ArrayList<>(result.getRecommendations()))
                .build();
    }

    private void storeInCache(String cacheKey, QueryOptimizationResult result, CacheOptions options) {
        QueryOptimizationResult detached = detachedCopy(result);
        withCollaboratorTimeout("cache set", () -> {
            cache.set(cacheKey, detached, options);
            return Boolean.TRUE;
        });
    }

    /**
     * Runs a cache call under the collaborator timeout. Failures and timeouts are logged and
     * reported as an empty result.
     */
    private <T> Optional<T> withCollaboratorTimeout(String operation, Supplier<T> call) {
        try {
            return Optional.ofNullable(CompletableFuture.supplyAsync(call, collaborators)
                    .get(config.getCollaboratorTimeout(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("{} timed out after {} ms", operation, config.getCollaboratorTimeout());
        } catch (ExecutionException e) {
            log.warn("{} failed: {}", operation, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", operation);
        }
        return Optional.empty();
    }

    private ExecutionPlan generateExecutionPlan(String optimizedQuery, QueryContext context) {
        QueryAnalysis optimizedAnalysis = analyzer.analyze(optimizedQuery, context);
        List<ExecutionStep> steps = optimizer.generateSteps(optimizedAnalysis);
        ResourceRequirements requirements = optimizer.calculateResourceRequirements(steps, context);

        return ExecutionPlan.builder()
                .steps(steps)
                .parallelization(optimizer.analyzeParallelization(steps))
                .resourceRequirements(requirements)
                .estimatedDuration(predictor.estimateDuration(steps, requirements, context))
                .build();
    }

    private List<Recommendation> generateRecommendations(String query, QueryAnalysis analysis, QueryContext context) {
        List<Recommendation> recommendations = new ArrayList<>();
        recommendations.addAll(optimizer.recommendIndexes(analysis, context));
        recommendations.addAll(optimizer.recommendRewrites(query, analysis));
        recommendations.addAll(cache.recommendCaching(query, analysis));
        recommendations.addAll(optimizer.recommendConfiguration(analysis, context));

        return recommendations.stream()
                .sorted(Recommendation.BY_BENEFIT_DESC)
                .limit(MAX_RECOMMENDATIONS)
                .collect(Collectors.toList());
    }

    private QueryOptimizationResult degradedResult(QueryOptimizationRequest request, String cacheKey, Throwable cause) {
        List<String> warnings = new ArrayList<>();
        warnings.add("Optimization failed: " + cause.getMessage());

        return QueryOptimizationResult.builder()
                .originalQuery(request.getQuery())
                .optimizedQuery(request.getQuery())
                .estimatedPerformanceGain(0)
                .cacheKey(cacheKey)
                .routingStrategy(RoutingStrategy.builder()
                        .targetConnection(request.getConnectionId())
                        .loadBalancing(LoadBalancingStrategy.ROUND_ROBIN)
                        .priority(0)
                        .reason(DEGRADED_REASON)
                        .build())
                .executionPlan(ExecutionPlan.builder().build())
                .warnings(warnings)
                .build();
    }
}
