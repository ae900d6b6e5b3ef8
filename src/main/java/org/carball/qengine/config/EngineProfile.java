package org.carball.qengine.config;

import lombok.Getter;
import org.carball.qengine.model.routing.LoadBalancingStrategy;

import java.util.Locale;

@Getter
public enum EngineProfile {

    BALANCED("balanced", "Balanced defaults for mixed read and write workloads",
            LoadBalancingStrategy.ADAPTIVE, 1.0, 1.0),

    LOW_LATENCY("low-latency", "Short timeouts and frequent health checks for interactive traffic",
            LoadBalancingStrategy.LEAST_CONNECTIONS, 0.25, 0.5) {
        @Override
        public EngineConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .maxRetries(1) // Fail over quickly instead of retrying
                    .build();
        }
    },

    ANALYTICS("analytics", "Long-running analytical queries with generous caching",
            LoadBalancingStrategy.WEIGHTED, 2.0, 4.0) {
        @Override
        public EngineConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .historyMaxSize(50_000)
                    .cacheMaxSize(5_000)
                    .workerThreads(8)
                    .build();
        }
    },

    DEVELOPMENT("development", "Small buffers and eager retraining for local experiments",
            LoadBalancingStrategy.ROUND_ROBIN, 1.0, 0.1) {
        @Override
        public EngineConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .historyMaxSize(500)
                    .predictorTrainingBufferSize(1_000)
                    .predictorRetrainThreshold(10)
                    .mlTrainingBufferSize(1_000)
                    .mlTrainingInterval(50)
                    .mlMinTrainingSamples(20)
                    .cacheMaxSize(100)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final LoadBalancingStrategy routingStrategy;
    private final double timeoutMultiplier;
    private final double ttlMultiplier;

    EngineProfile(String name, String description, LoadBalancingStrategy routingStrategy,
                  double timeoutMultiplier, double ttlMultiplier) {
        this.name = name;
        this.description = description;
        this.routingStrategy = routingStrategy;
        this.timeoutMultiplier = timeoutMultiplier;
        this.ttlMultiplier = ttlMultiplier;
    }

    /**
     * Creates an EngineConfig from the built-in defaults scaled by this profile.
     */
    public EngineConfig buildConfig() {
        EngineConfig base = EngineConfig.defaults();

        return base.toBuilder()
                .profileName(name)
                .profileDescription(description)
                .routingStrategy(routingStrategy)
                .healthCheckInterval((long) (base.getHealthCheckInterval() * timeoutMultiplier))
                .probeTimeout((long) (base.getProbeTimeout() * timeoutMultiplier))
                .failoverTimeout((long) (base.getFailoverTimeout() * timeoutMultiplier))
                .collaboratorTimeout((long) (base.getCollaboratorTimeout() * timeoutMultiplier))
                .cacheDefaultTtl((long) (base.getCacheDefaultTtl() * ttlMultiplier))
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static EngineProfile fromName(String name) {
        for (EngineProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown engine profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (EngineProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Engine Profiles:\n\n");
        for (EngineProfile profile : values()) {
            help.append(String.format(Locale.ROOT, "  %-14s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
