package org.carball.qengine.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.qengine.model.routing.LoadBalancingStrategy;

/**
 * YAML view of {@link EngineConfig}. Keys left out of the file stay null and do not override
 * the lower configuration layers.
 */
@Data
public class EngineConfigFile {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("history_max_size")
    private Integer historyMaxSize;

    @JsonProperty("predictor_training_buffer_size")
    private Integer predictorTrainingBufferSize;

    @JsonProperty("predictor_retrain_threshold")
    private Integer predictorRetrainThreshold;

    @JsonProperty("ml_enabled")
    private Boolean mlEnabled;

    @JsonProperty("ml_training_buffer_size")
    private Integer mlTrainingBufferSize;

    @JsonProperty("ml_training_interval")
    private Integer mlTrainingInterval;

    @JsonProperty("ml_min_training_samples")
    private Integer mlMinTrainingSamples;

    @JsonProperty("routing_strategy")
    private String routingStrategy;

    @JsonProperty("health_check_interval")
    private Long healthCheckInterval;

    @JsonProperty("failover_timeout")
    private Long failoverTimeout;

    @JsonProperty("probe_timeout")
    private Long probeTimeout;

    @JsonProperty("max_retries")
    private Integer maxRetries;

    @JsonProperty("routing_history_size")
    private Integer routingHistorySize;

    @JsonProperty("cache_default_ttl")
    private Long cacheDefaultTtl;

    @JsonProperty("cache_max_size")
    private Integer cacheMaxSize;

    @JsonProperty("collaborator_timeout")
    private Long collaboratorTimeout;

    @JsonProperty("worker_threads")
    private Integer workerThreads;

    @JsonProperty("persistence_enabled")
    private Boolean persistenceEnabled;

    @JsonProperty("persistence_directory")
    private String persistenceDirectory;

    public void applyTo(EngineConfig.EngineConfigBuilder builder) {
        if (historyMaxSize != null) builder.historyMaxSize(historyMaxSize);
        if (predictorTrainingBufferSize != null) builder.predictorTrainingBufferSize(predictorTrainingBufferSize);
        if (predictorRetrainThreshold != null) builder.predictorRetrainThreshold(predictorRetrainThreshold);
        if (mlEnabled != null) builder.mlEnabled(mlEnabled);
        if (mlTrainingBufferSize != null) builder.mlTrainingBufferSize(mlTrainingBufferSize);
        if (mlTrainingInterval != null) builder.mlTrainingInterval(mlTrainingInterval);
        if (mlMinTrainingSamples != null) builder.mlMinTrainingSamples(mlMinTrainingSamples);
        if (routingStrategy != null) builder.routingStrategy(LoadBalancingStrategy.fromName(routingStrategy));
        if (healthCheckInterval != null) builder.healthCheckInterval(healthCheckInterval);
        if (failoverTimeout != null) builder.failoverTimeout(failoverTimeout);
        if (probeTimeout != null) builder.probeTimeout(probeTimeout);
        if (maxRetries != null) builder.maxRetries(maxRetries);
        if (routingHistorySize != null) builder.routingHistorySize(routingHistorySize);
        if (cacheDefaultTtl != null) builder.cacheDefaultTtl(cacheDefaultTtl);
        if (cacheMaxSize != null) builder.cacheMaxSize(cacheMaxSize);
        if (collaboratorTimeout != null) builder.collaboratorTimeout(collaboratorTimeout);
        if (workerThreads != null) builder.workerThreads(workerThreads);
        if (persistenceEnabled != null) builder.persistenceEnabled(persistenceEnabled);
        if (persistenceDirectory != null) builder.persistenceDirectory(persistenceDirectory);
    }
}
