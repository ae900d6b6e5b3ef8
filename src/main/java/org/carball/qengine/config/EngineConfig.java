package org.carball.qengine.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.cache.InMemoryResultCache;
import org.carball.qengine.history.OptimizationHistory;
import org.carball.qengine.ml.MLOptimizer;
import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.predictor.PerformancePredictor;
import org.carball.qengine.router.QueryRouter;

import java.util.Locale;

@Data
@Builder(toBuilder = true)
@Slf4j
public class EngineConfig {

    // History
    @Builder.Default
    private int historyMaxSize = OptimizationHistory.DEFAULT_MAX_SIZE;

    // Performance predictor
    @Builder.Default
    private int predictorTrainingBufferSize = PerformancePredictor.DEFAULT_TRAINING_BUFFER_SIZE;

    @Builder.Default
    private int predictorRetrainThreshold = PerformancePredictor.DEFAULT_RETRAIN_THRESHOLD;

    // ML optimizer
    @Builder.Default
    private boolean mlEnabled = true;

    @Builder.Default
    private int mlTrainingBufferSize = MLOptimizer.DEFAULT_TRAINING_BUFFER_SIZE;

    @Builder.Default
    private int mlTrainingInterval = MLOptimizer.DEFAULT_TRAINING_INTERVAL;

    @Builder.Default
    private int mlMinTrainingSamples = MLOptimizer.DEFAULT_MIN_TRAINING_SAMPLES;

    // Router
    @Builder.Default
    private LoadBalancingStrategy routingStrategy = LoadBalancingStrategy.ADAPTIVE;

    @Builder.Default
    private long healthCheckInterval = QueryRouter.DEFAULT_HEALTH_CHECK_INTERVAL_MS;

    @Builder.Default
    private long failoverTimeout = 5_000;

    @Builder.Default
    private long probeTimeout = QueryRouter.DEFAULT_PROBE_TIMEOUT_MS;

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private int routingHistorySize = QueryRouter.DEFAULT_ROUTING_HISTORY_SIZE;

    // Result cache
    @Builder.Default
    private long cacheDefaultTtl = InMemoryResultCache.DEFAULT_TTL_MS;

    @Builder.Default
    private int cacheMaxSize = InMemoryResultCache.DEFAULT_MAX_SIZE;

    // Collaborators
    @Builder.Default
    private long collaboratorTimeout = 2_000;

    @Builder.Default
    private int workerThreads = 4;

    // Persistence
    @Builder.Default
    private boolean persistenceEnabled = false;

    @Builder.Default
    private String persistenceDirectory = ".qengine";

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default engine settings";

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * Logs a warning for every value that would make a component misbehave. Nothing is
     * corrected here; the components clamp what they must.
     */
    public void validate() {
        if (historyMaxSize <= 0) {
            log.warn("History max size ({}) should be positive", historyMaxSize);
        }

        if (predictorTrainingBufferSize <= 0 || mlTrainingBufferSize <= 0) {
            log.warn("Training buffer sizes should be positive (predictor: {}, ml: {})",
                    predictorTrainingBufferSize, mlTrainingBufferSize);
        }

        if (predictorRetrainThreshold <= 0) {
            log.warn("Predictor retrain threshold ({}) should be positive", predictorRetrainThreshold);
        }

        if (mlTrainingInterval <= 0) {
            log.warn("ML training interval ({}) should be positive", mlTrainingInterval);
        }

        if (mlMinTrainingSamples > mlTrainingBufferSize) {
            log.warn("ML minimum training samples ({}) exceeds the training buffer size ({}), models will never train",
                    mlMinTrainingSamples, mlTrainingBufferSize);
        }

        if (healthCheckInterval <= 0) {
            log.warn("Health check interval ({} ms) should be positive", healthCheckInterval);
        }

        if (probeTimeout <= 0 || collaboratorTimeout <= 0 || failoverTimeout <= 0) {
            log.warn("Timeouts should be positive (probe: {} ms, collaborator: {} ms, failover: {} ms)",
                    probeTimeout, collaboratorTimeout, failoverTimeout);
        }

        if (probeTimeout >= healthCheckInterval) {
            log.warn("Probe timeout ({} ms) should be shorter than the health check interval ({} ms)",
                    probeTimeout, healthCheckInterval);
        }

        if (maxRetries < 0) {
            log.warn("Max retries ({}) should not be negative", maxRetries);
        }

        if (routingHistorySize <= 0) {
            log.warn("Routing history size ({}) should be positive", routingHistorySize);
        }

        if (cacheMaxSize <= 0 || cacheDefaultTtl <= 0) {
            log.warn("Cache max size ({}) and default TTL ({} ms) should be positive", cacheMaxSize, cacheDefaultTtl);
        }

        if (workerThreads <= 0) {
            log.warn("Worker threads ({}) should be positive", workerThreads);
        }

        log.debug("Using engine configuration - Strategy: {}, History: {}, Cache: {}, Profile: {}",
                routingStrategy.getLabel(), historyMaxSize, cacheMaxSize, profileName);
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT,
                "Profile: %s | Routing: %s | History: %d | Cache: %d entries, TTL %d ms | ML: %s | Persistence: %s",
                profileName, routingStrategy.getLabel(), historyMaxSize, cacheMaxSize, cacheDefaultTtl,
                mlEnabled ? "on" : "off", persistenceEnabled ? persistenceDirectory : "off");
    }
}
