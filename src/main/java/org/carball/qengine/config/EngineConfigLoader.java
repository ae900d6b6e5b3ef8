package org.carball.qengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.util.JsonMappers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

@Slf4j
public class EngineConfigLoader {

    public static final String BUNDLED_CONFIG_RESOURCE = "/engine-config.yml";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = JsonMappers.yaml();

    public EngineConfigLoader() {
        this(System.getenv());
    }

    public EngineConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public EngineConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, null, args);
    }

    public EngineConfig loadProfile(String profileName) {
        try {
            EngineProfile profile = EngineProfile.fromName(profileName);
            EngineConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Resolves the full hierarchy: CLI args > env vars > YAML file > profile > defaults.
     * A profile named on the command line wins over one named in the file. An unreadable
     * file is skipped with a warning.
     */
    public EngineConfig loadConfiguration(String profileName, Path configFile, String[] args) {
        log.debug("Loading configuration");

        Optional<EngineConfigFile> file = configFile != null ? readConfigFile(configFile) : Optional.empty();

        String effectiveProfile = profileName != null ? profileName
                : file.map(EngineConfigFile::getProfile).orElse(null);

        // 1. Profile or built-in defaults
        EngineConfig.EngineConfigBuilder builder = effectiveProfile != null
                ? loadProfile(effectiveProfile).toBuilder()
                : EngineConfig.builder();

        // 2. YAML file
        file.ifPresent(f -> applyConfigFile(builder, f, configFile));

        // 3. Environment variables
        applyEnvironmentVariables(builder);

        // 4. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        EngineConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public Optional<EngineConfigFile> readConfigFile(Path configFile) {
        if (!Files.exists(configFile)) {
            log.warn("Engine config file not found: {}, ignoring it", configFile);
            return Optional.empty();
        }

        try {
            EngineConfigFile file = yamlMapper.readValue(configFile.toFile(), EngineConfigFile.class);
            log.info("Loaded engine configuration from: {}", configFile);
            return Optional.ofNullable(file);
        } catch (IOException e) {
            log.warn("Failed to read engine config from {}: {}, ignoring it", configFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the annotated configuration template shipped with the engine.
     */
    public EngineConfigFile readBundledConfig() throws IOException {
        try (InputStream in = EngineConfigLoader.class.getResourceAsStream(BUNDLED_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled configuration not found on classpath: " + BUNDLED_CONFIG_RESOURCE);
            }
            return yamlMapper.readValue(in, EngineConfigFile.class);
        }
    }

    private void applyConfigFile(EngineConfig.EngineConfigBuilder builder, EngineConfigFile file, Path source) {
        try {
            file.applyTo(builder);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value in engine config {}: {}", source, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(EngineConfig.EngineConfigBuilder builder) {
        applyEnv("QENGINE_HISTORY_MAX_SIZE", v -> builder.historyMaxSize(Integer.parseInt(v)));
        applyEnv("QENGINE_ROUTING_STRATEGY", v -> builder.routingStrategy(LoadBalancingStrategy.fromName(v)));
        applyEnv("QENGINE_HEALTH_CHECK_INTERVAL", v -> builder.healthCheckInterval(Long.parseLong(v)));
        applyEnv("QENGINE_PROBE_TIMEOUT", v -> builder.probeTimeout(Long.parseLong(v)));
        applyEnv("QENGINE_FAILOVER_TIMEOUT", v -> builder.failoverTimeout(Long.parseLong(v)));
        applyEnv("QENGINE_MAX_RETRIES", v -> builder.maxRetries(Integer.parseInt(v)));
        applyEnv("QENGINE_CACHE_TTL", v -> builder.cacheDefaultTtl(Long.parseLong(v)));
        applyEnv("QENGINE_CACHE_MAX_SIZE", v -> builder.cacheMaxSize(Integer.parseInt(v)));
        applyEnv("QENGINE_COLLABORATOR_TIMEOUT", v -> builder.collaboratorTimeout(Long.parseLong(v)));
        applyEnv("QENGINE_WORKER_THREADS", v -> builder.workerThreads(Integer.parseInt(v)));
        applyEnv("QENGINE_ML_ENABLED", v -> builder.mlEnabled(Boolean.parseBoolean(v)));
        applyEnv("QENGINE_ML_TRAINING_INTERVAL", v -> builder.mlTrainingInterval(Integer.parseInt(v)));
        applyEnv("QENGINE_PERSISTENCE_DIR", v -> builder.persistenceEnabled(true).persistenceDirectory(v));
    }

    private void applyEnv(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for environment variable {}: {}", name, value);
        }
    }

    private void applyCLIArguments(EngineConfig.EngineConfigBuilder builder, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--engine.history-size" -> builder.historyMaxSize(Integer.parseInt(value));
                    case "--engine.routing-strategy" -> builder.routingStrategy(LoadBalancingStrategy.fromName(value));
                    case "--engine.health-check-interval" -> builder.healthCheckInterval(Long.parseLong(value));
                    case "--engine.probe-timeout" -> builder.probeTimeout(Long.parseLong(value));
                    case "--engine.failover-timeout" -> builder.failoverTimeout(Long.parseLong(value));
                    case "--engine.max-retries" -> builder.maxRetries(Integer.parseInt(value));
                    case "--engine.cache-ttl" -> builder.cacheDefaultTtl(Long.parseLong(value));
                    case "--engine.cache-size" -> builder.cacheMaxSize(Integer.parseInt(value));
                    case "--engine.collaborator-timeout" -> builder.collaboratorTimeout(Long.parseLong(value));
                    case "--engine.workers" -> builder.workerThreads(Integer.parseInt(value));
                    case "--engine.ml-enabled" -> builder.mlEnabled(Boolean.parseBoolean(value));
                    case "--engine.ml-training-interval" -> builder.mlTrainingInterval(Integer.parseInt(value));
                    case "--engine.persistence-dir" -> builder.persistenceEnabled(true).persistenceDirectory(value);
                    default -> {
                        // not a configuration override
                    }
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    public static String getConfigurationHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --engine.history-size <num>          Maximum optimization history entries
              --engine.routing-strategy <name>     round_robin|least_connections|weighted|hash|adaptive
              --engine.health-check-interval <ms>  Interval between endpoint health checks
              --engine.probe-timeout <ms>          Time budget for a single health probe
              --engine.failover-timeout <ms>       Time budget for one execution attempt
              --engine.max-retries <num>           Execution retries before falling back
              --engine.cache-ttl <ms>              Default result cache TTL
              --engine.cache-size <num>            Maximum cached results
              --engine.collaborator-timeout <ms>   Time budget for cache calls
              --engine.workers <num>               Threads for batch optimization
              --engine.ml-enabled <true|false>     Enable ML technique suggestions
              --engine.ml-training-interval <num>  Accepted samples between training passes
              --engine.persistence-dir <dir>       Persist history and training data in <dir>

            Environment Variables:
              QENGINE_HISTORY_MAX_SIZE             Same as --engine.history-size
              QENGINE_ROUTING_STRATEGY             Same as --engine.routing-strategy
              QENGINE_HEALTH_CHECK_INTERVAL        Same as --engine.health-check-interval
              QENGINE_PROBE_TIMEOUT                Same as --engine.probe-timeout
              QENGINE_FAILOVER_TIMEOUT             Same as --engine.failover-timeout
              QENGINE_MAX_RETRIES                  Same as --engine.max-retries
              QENGINE_CACHE_TTL                    Same as --engine.cache-ttl
              QENGINE_CACHE_MAX_SIZE               Same as --engine.cache-size
              QENGINE_COLLABORATOR_TIMEOUT         Same as --engine.collaborator-timeout
              QENGINE_WORKER_THREADS               Same as --engine.workers
              QENGINE_ML_ENABLED                   Same as --engine.ml-enabled
              QENGINE_ML_TRAINING_INTERVAL         Same as --engine.ml-training-interval
              QENGINE_PERSISTENCE_DIR              Same as --engine.persistence-dir

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file (--config)
              4. Profile (--profile)
              5. Built-in defaults
            """;
    }
}
