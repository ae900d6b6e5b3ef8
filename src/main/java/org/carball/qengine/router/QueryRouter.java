package org.carball.qengine.router;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.routing.ConnectionHealth;
import org.carball.qengine.model.routing.HealthDetails;
import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.model.routing.RouteCandidate;
import org.carball.qengine.model.routing.RouteMetadata;
import org.carball.qengine.model.routing.RoutingDecision;
import org.carball.qengine.model.routing.RoutingRuleStats;
import org.carball.qengine.model.routing.RoutingStatistics;
import org.carball.qengine.model.routing.RoutingStrategy;
import org.carball.qengine.util.BoundedBuffer;
import org.carball.qengine.util.QueryText;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Chooses an execution endpoint per query. Healthy candidates are scored, routing rules are
 * tried in priority order and the load-balancing strategy decides otherwise. Endpoint health
 * is refreshed by a periodic background check once {@link #start()} is called.
 */
@Slf4j
public class QueryRouter implements AutoCloseable {

    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 2_000;
    public static final int DEFAULT_ROUTING_HISTORY_SIZE = 1_000;

    static final String NO_CANDIDATE_REASON = "No suitable candidate found, using default connection";
    static final String ROUTING_ERROR_REASON = "Fallback to default connection due to routing error";

    private static final double INITIAL_SCORE = 50;
    private static final int LOAD_BALANCED_PRIORITY = 50;
    private static final double ERROR_RATE_KEEP = 0.9;
    private static final double LEARNED_SCORE_KEEP = 0.8;
    private static final Duration FEEDBACK_WINDOW = Duration.ofMinutes(5);
    private static final int MAX_RECORDED_QUERY_LENGTH = 200;
    private static final long ONE_GIB = 1024L * 1024 * 1024;

    private final Map<String, RouteCandidate> candidates = new ConcurrentHashMap<>();
    private final Map<String, ConnectionHealth> health = new ConcurrentHashMap<>();
    private final List<RoutingRule> rules = new CopyOnWriteArrayList<>();
    private final Map<String, RoutingRuleStats> ruleStats = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> routeDistribution = new ConcurrentHashMap<>();
    private final BoundedBuffer<RoutingDecision> routingHistory;

    private final HealthProbe probe;
    private final LoadBalancer loadBalancer;
    private final long healthCheckIntervalMs;
    private final long probeTimeoutMs;
    private final Clock clock;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRoutes = new AtomicLong();
    private final AtomicLong failedRoutes = new AtomicLong();
    private final AtomicLong failoverCount = new AtomicLong();
    private final AtomicLong totalRoutingNanos = new AtomicLong();

    private final ExecutorService probeExecutor;
    private ScheduledExecutorService scheduler;

    public QueryRouter(HealthProbe probe) {
        this(probe, LoadBalancingStrategy.ADAPTIVE, DEFAULT_HEALTH_CHECK_INTERVAL_MS, DEFAULT_PROBE_TIMEOUT_MS,
                DEFAULT_ROUTING_HISTORY_SIZE, Clock.systemUTC());
    }

    public QueryRouter(HealthProbe probe, LoadBalancingStrategy strategy, long healthCheckIntervalMs,
                       long probeTimeoutMs, int routingHistorySize, Clock clock) {
        this.probe = probe;
        this.loadBalancer = new LoadBalancer(strategy);
        this.healthCheckIntervalMs = healthCheckIntervalMs;
        this.probeTimeoutMs = probeTimeoutMs;
        this.routingHistory = new BoundedBuffer<>(routingHistorySize);
        this.clock = clock;

        AtomicInteger probeThreads = new AtomicInteger();
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "query-router-probe-" + probeThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        addRule(new ReadWriteSeparationRule());
        addRule(new LargeQueryRoutingRule());
        addRule(new GeographicRoutingRule());
    }

    /**
     * Starts the periodic health check. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "query-router-health");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::runScheduledHealthCheck,
                healthCheckIntervalMs, healthCheckIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Started endpoint health checks every {} ms", healthCheckIntervalMs);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        probeExecutor.shutdownNow();
    }

    public void registerEndpoint(String connectionId, int capacity, RouteMetadata metadata) {
        RouteCandidate candidate = RouteCandidate.builder()
                .connectionId(connectionId)
                .score(INITIAL_SCORE)
                .capacity(capacity)
                .health(1.0)
                .priority(1)
                .metadata(metadata != null ? metadata : RouteMetadata.builder().build())
                .build();
        candidates.put(connectionId, candidate);
        log.info("Registered endpoint {} ({}, capacity {})", connectionId, candidate.role(), capacity);
        checkEndpoint(connectionId);
    }

    public boolean unregisterEndpoint(String connectionId) {
        health.remove(connectionId);
        loadBalancer.forget(connectionId);
        boolean removed = candidates.remove(connectionId) != null;
        if (removed) {
            log.info("Unregistered endpoint {}", connectionId);
        }
        return removed;
    }

    public void addRule(RoutingRule rule) {
        rules.add(rule);
        rules.sort(Comparator.comparingInt(RoutingRule::priority).reversed());
    }

    public boolean removeRule(String name) {
        return rules.removeIf(rule -> rule.name().equals(name));
    }

    public List<String> getRuleNames() {
        return rules.stream().map(RoutingRule::name).collect(Collectors.toList());
    }

    public RoutingStrategy determineRouting(String query, String defaultEndpoint) {
        return determineRouting(query, defaultEndpoint, null);
    }

    /**
     * Routes a query. Never throws: without a healthy candidate, or on an unexpected error,
     * the caller's default endpoint is returned with the reason.
     */
    public RoutingStrategy determineRouting(String query, String defaultEndpoint, QueryContext context) {
        long started = System.nanoTime();
        long requestNumber = totalRequests.incrementAndGet();

        try {
            List<RouteCandidate> pool = healthyPool(query, context);

            RouteCandidate selected = null;
            RoutingRule matchedRule = null;
            for (RoutingRule rule : rules) {
                if (!rule.matches(query, context)) {
                    continue;
                }
                Optional<RouteCandidate> routed = rule.route(query, pool, context);
                if (routed.isPresent()) {
                    selected = routed.get();
                    matchedRule = rule;
                    recordRuleHit(rule.name());
                    break;
                }
            }

            if (selected == null && !pool.isEmpty()) {
                selected = loadBalancer.select(pool, query, requestNumber - 1);
            }

            RoutingStrategy strategy = RoutingStrategy.builder()
                    .targetConnection(selected != null ? selected.getConnectionId() : defaultEndpoint)
                    .loadBalancing(loadBalancer.getStrategy())
                    .priority(selected == null ? 0 : matchedRule != null ? matchedRule.priority() : LOAD_BALANCED_PRIORITY)
                    .reason(reason(selected, matchedRule))
                    .build();

            if (selected == null) {
                failoverCount.incrementAndGet();
            }
            long elapsed = System.nanoTime() - started;
            recordDecision(query, strategy, selected, elapsed);
            successfulRoutes.incrementAndGet();
            log.debug("Routed query to {}: {}", strategy.getTargetConnection(), strategy.getReason());
            return strategy;
        } catch (RuntimeException e) {
            failedRoutes.incrementAndGet();
            log.error("Routing failed, using default endpoint {}", defaultEndpoint, e);
            return RoutingStrategy.builder()
                    .targetConnection(defaultEndpoint)
                    .loadBalancing(LoadBalancingStrategy.ROUND_ROBIN)
                    .priority(0)
                    .reason(ROUTING_ERROR_REASON)
                    .build();
        } finally {
            totalRoutingNanos.addAndGet(System.nanoTime() - started);
        }
    }

    /**
     * Feeds an execution result back to the endpoint that served the most recent routing
     * decision for the same query within the last five minutes.
     *
     * @return whether a decision was found and an endpoint updated
     */
    public boolean updateWeights(String query, QueryExecutionResult result) {
        String recorded = QueryText.truncate(query, MAX_RECORDED_QUERY_LENGTH);
        Instant cutoff = clock.instant().minus(FEEDBACK_WINDOW);
        Optional<RoutingDecision> decision = routingHistory.findNewest(
                d -> d.query().equals(recorded) && d.timestamp().isAfter(cutoff));
        if (decision.isEmpty()) {
            return false;
        }

        RouteCandidate candidate = candidates.get(decision.get().connectionId());
        if (candidate == null) {
            return false;
        }

        double performance = performanceScore(result);
        synchronized (candidate) {
            double learned = candidate.getLearnedScore() * LEARNED_SCORE_KEEP + performance * (1 - LEARNED_SCORE_KEEP);
            candidate.setLearnedScore(learned);
            candidate.setWeight(learned);
        }
        log.debug("Updated learned score of {} with performance {}", candidate.getConnectionId(), performance);
        return true;
    }

    public void checkAllEndpoints() {
        for (String connectionId : new ArrayList<>(candidates.keySet())) {
            checkEndpoint(connectionId);
        }
    }

    /**
     * Probes one endpoint within the probe timeout and updates its health record and
     * candidate. A probe failure or timeout counts as a failed check.
     */
    public void checkEndpoint(String connectionId) {
        RouteCandidate candidate = candidates.get(connectionId);
        if (candidate == null) {
            return;
        }

        HealthDetails details;
        try {
            details = CompletableFuture.supplyAsync(() -> probe.checkHealth(connectionId), probeExecutor)
                    .get(probeTimeoutMs, TimeUnit.MILLISECONDS);
            if (details == null) {
                throw new IllegalStateException("No health data received");
            }
        } catch (TimeoutException e) {
            recordFailure(candidate, "Health probe timed out after " + probeTimeoutMs + " ms");
            return;
        } catch (ExecutionException e) {
            recordFailure(candidate, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(candidate, "Health probe interrupted");
            return;
        } catch (RuntimeException e) {
            recordFailure(candidate, e.getMessage());
            return;
        }

        recordCheck(candidate, details);
    }

    public RoutingStatistics getRoutingStatistics() {
        int healthy = 0;
        int unhealthy = 0;
        for (ConnectionHealth h : health.values()) {
            if (h.isHealthy()) {
                healthy++;
            } else {
                unhealthy++;
            }
        }

        Map<String, Long> distribution = new LinkedHashMap<>();
        routeDistribution.forEach((id, count) -> distribution.put(id, count.get()));

        List<RoutingRuleStats> rulesUsed = new ArrayList<>();
        synchronized (ruleStats) {
            ruleStats.values().forEach(stats -> rulesUsed.add(new RoutingRuleStats(stats.getName(),
                    stats.getHitCount(), stats.getLastUsed())));
        }

        long total = totalRequests.get();
        return RoutingStatistics.builder()
                .totalRequests(total)
                .successfulRoutes(successfulRoutes.get())
                .failedRoutes(failedRoutes.get())
                .avgRoutingTime(total > 0 ? totalRoutingNanos.get() / 1_000_000.0 / total : 0)
                .routeDistribution(distribution)
                .healthyNodes(healthy)
                .unhealthyNodes(unhealthy)
                .failoverCount(failoverCount.get())
                .routingRules(rulesUsed)
                .build();
    }

    public List<RouteCandidate> getCandidates() {
        List<RouteCandidate> copies = new ArrayList<>();
        for (RouteCandidate candidate : candidates.values()) {
            synchronized (candidate) {
                copies.add(candidate.toBuilder().tags(new ArrayList<>(candidate.getTags())).build());
            }
        }
        return copies;
    }

    public Optional<ConnectionHealth> getHealth(String connectionId) {
        return Optional.ofNullable(health.get(connectionId)).map(h -> h.toBuilder().build());
    }

    public List<RoutingDecision> getRoutingHistory() {
        return routingHistory.snapshot();
    }

    public LoadBalancingStrategy getStrategy() {
        return loadBalancer.getStrategy();
    }

    private List<RouteCandidate> healthyPool(String query, QueryContext context) {
        List<RouteCandidate> pool = new ArrayList<>();
        for (RouteCandidate candidate : candidates.values()) {
            synchronized (candidate) {
                ConnectionHealth status = health.get(candidate.getConnectionId());
                if (status == null || !status.isHealthy()) {
                    continue;
                }
                candidate.setScore(CandidateScorer.score(candidate, status, query, context));
                pool.add(candidate.toBuilder().build());
            }
        }
        pool.sort(Comparator.comparingDouble(RouteCandidate::getScore).reversed()
                .thenComparing(RouteCandidate::getConnectionId));
        return pool;
    }

    private void recordCheck(RouteCandidate candidate, HealthDetails details) {
        boolean healthy = details.isHealthy();
        synchronized (candidate) {
            ConnectionHealth previous = health.get(candidate.getConnectionId());
            double previousErrorRate = previous != null ? previous.getErrorRate() : 0;
            int failures = healthy ? 0 : (previous != null ? previous.getConsecutiveFailures() : 0) + 1;

            health.put(candidate.getConnectionId(), ConnectionHealth.builder()
                    .connectionId(candidate.getConnectionId())
                    .healthy(healthy)
                    .latency(details.getNetworkLatency())
                    .load(details.getCpuUsage() / 100)
                    .errorRate(previousErrorRate * ERROR_RATE_KEEP + (healthy ? 0 : 1 - ERROR_RATE_KEEP))
                    .lastCheck(clock.instant())
                    .consecutiveFailures(failures)
                    .details(details)
                    .build());

            candidate.setHealth(healthy ? 1.0 : 0.0);
            candidate.setLatency(details.getNetworkLatency());
            candidate.setLoad(details.getCpuUsage() / 100);
        }
        if (!healthy) {
            log.warn("Endpoint {} reported unhealthy state", candidate.getConnectionId());
        }
    }

    private void recordFailure(RouteCandidate candidate, String error) {
        log.warn("Health check failed for {}: {}", candidate.getConnectionId(), error);
        synchronized (candidate) {
            ConnectionHealth previous = health.get(candidate.getConnectionId());
            ConnectionHealth failed;
            if (previous == null) {
                failed = ConnectionHealth.builder()
                        .connectionId(candidate.getConnectionId())
                        .healthy(false)
                        .errorRate(1 - ERROR_RATE_KEEP)
                        .lastCheck(clock.instant())
                        .consecutiveFailures(1)
                        .details(HealthDetails.builder().lastError(error).build())
                        .build();
            } else {
                HealthDetails details = previous.getDetails() != null
                        ? previous.getDetails().toBuilder().lastError(error).build()
                        : HealthDetails.builder().lastError(error).build();
                failed = previous.toBuilder()
                        .healthy(false)
                        .errorRate(previous.getErrorRate() * ERROR_RATE_KEEP + (1 - ERROR_RATE_KEEP))
                        .lastCheck(clock.instant())
                        .consecutiveFailures(previous.getConsecutiveFailures() + 1)
                        .details(details)
                        .build();
            }
            health.put(candidate.getConnectionId(), failed);
            candidate.setHealth(0.0);
        }
    }

    private void runScheduledHealthCheck() {
        try {
            checkAllEndpoints();
        } catch (RuntimeException e) {
            log.error("Scheduled health check failed", e);
        }
    }

    private void recordRuleHit(String name) {
        synchronized (ruleStats) {
            RoutingRuleStats stats = ruleStats.computeIfAbsent(name,
                    n -> RoutingRuleStats.builder().name(n).build());
            stats.setHitCount(stats.getHitCount() + 1);
            stats.setLastUsed(clock.instant());
        }
    }

    private void recordDecision(String query, RoutingStrategy strategy, RouteCandidate selected, long elapsedNanos) {
        routingHistory.add(new RoutingDecision(QueryText.truncate(query, MAX_RECORDED_QUERY_LENGTH), strategy,
                strategy.getTargetConnection(), selected != null ? selected.getScore() : 0, elapsedNanos,
                clock.instant()));
        routeDistribution.computeIfAbsent(strategy.getTargetConnection(), id -> new AtomicLong()).incrementAndGet();
    }

    private String reason(RouteCandidate selected, RoutingRule matchedRule) {
        if (selected == null) {
            return NO_CANDIDATE_REASON;
        }
        if (matchedRule != null) {
            return "Routed by matching routing rule: " + matchedRule.name();
        }
        return String.format(Locale.ROOT, "Routed by %s load balancing (score: %.2f)",
                loadBalancer.getStrategy().getLabel(), selected.getScore());
    }

    /**
     * 1.0 for a fast successful run; slower runs, failures and runs above 1 GiB of memory
     * score lower. Clamped to [0, 1].
     */
    static double performanceScore(QueryExecutionResult result) {
        double score = 1.0;
        if (result.getExecutionTime() > 10_000) {
            score *= 0.5;
        } else if (result.getExecutionTime() > 5_000) {
            score *= 0.7;
        } else if (result.getExecutionTime() > 1_000) {
            score *= 0.9;
        }
        score *= result.isSuccess() ? 1.1 : 0.3;
        if (result.getMemoryUsed() > ONE_GIB) {
            score *= 0.8;
        }
        return Math.max(0, Math.min(1, score));
    }
}
