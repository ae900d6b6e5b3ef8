package org.carball.qengine.predictor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.analyzer.QueryPatternParser;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.optimization.Priority;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.prediction.BottleneckType;
import org.carball.qengine.model.prediction.ModelDescriptor;
import org.carball.qengine.model.prediction.PerformanceFeatures;
import org.carball.qengine.model.prediction.PerformancePrediction;
import org.carball.qengine.model.prediction.PerformanceRecommendation;
import org.carball.qengine.model.prediction.PredictedBottleneck;
import org.carball.qengine.model.prediction.PredictionMetrics;
import org.carball.qengine.model.prediction.RiskFactor;
import org.carball.qengine.model.prediction.Severity;
import org.carball.qengine.model.prediction.TrainingSample;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.util.BoundedBuffer;
import org.carball.qengine.util.JsonMappers;
import org.carball.qengine.util.QueryText;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Predicts duration and resource use of a query with an accuracy-weighted ensemble of
 * {@link PredictionModel}s, then derives bottlenecks, recommendations and risk factors.
 * Learns from observed executions through {@link #updateModel}.
 */
@Slf4j
public class PerformancePredictor {

    public static final int DEFAULT_TRAINING_BUFFER_SIZE = 10_000;
    public static final int DEFAULT_RETRAIN_THRESHOLD = 100;

    private static final int PREDICTION_CACHE_SIZE = 1_000;
    private static final double CACHE_CONFIDENCE_THRESHOLD = 0.7;
    private static final double SINGLE_MODEL_PENALTY = 0.9;
    private static final double EMA_KEEP = 0.9;

    private final PredictionModelRegistry registry;
    private final BoundedBuffer<TrainingSample> trainingData;
    private final int retrainThreshold;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMappers.json();
    private final AtomicLong samplesSeen = new AtomicLong();

    private final Map<String, PerformancePrediction> predictionCache = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, PerformancePrediction> eldest) {
                    return size() > PREDICTION_CACHE_SIZE;
                }
            });

    private PredictionMetrics metrics;

    public PerformancePredictor() {
        this(new PredictionModelRegistry(), DEFAULT_TRAINING_BUFFER_SIZE, DEFAULT_RETRAIN_THRESHOLD, Clock.systemUTC());
    }

    public PerformancePredictor(PredictionModelRegistry registry, int trainingBufferSize,
                                int retrainThreshold, Clock clock) {
        this.registry = registry;
        this.trainingData = new BoundedBuffer<>(trainingBufferSize);
        this.retrainThreshold = retrainThreshold;
        this.clock = clock;
        this.metrics = PredictionMetrics.builder().lastEvaluated(clock.instant()).build();
    }

    public PerformancePrediction predict(String query) {
        return predict(query, null);
    }

    public PerformancePrediction predict(String query, QueryContext context) {
        String cacheKey = cacheKey(query, context);
        PerformancePrediction cached = predictionCache.get(cacheKey);
        if (cached != null && cached.getConfidence() > CACHE_CONFIDENCE_THRESHOLD) {
            log.debug("Prediction cache hit for {}", cacheKey);
            return cached;
        }

        try {
            PerformanceFeatures features = extractFeatures(query, context);
            List<PredictionModel> models = registry.select(features);
            PerformancePrediction prediction = combine(models, features);

            predictionCache.put(cacheKey, prediction);
            synchronized (this) {
                metrics.setPredictionCount(metrics.getPredictionCount() + 1);
            }
            log.debug("Predicted {} ms with {} model(s), confidence {}", Math.round(prediction.getEstimatedDuration()),
                    models.size(), String.format("%.2f", prediction.getConfidence()));
            return prediction;
        } catch (RuntimeException e) {
            log.warn("Performance prediction failed, using conservative estimate: {}", e.getMessage());
            return conservativeEstimate();
        }
    }

    /**
     * Estimates the duration of a planned execution: the summed step costs, penalised for
     * resource classes that meet a busy system, reduced when several steps can run in
     * parallel, never below 10 ms.
     */
    public double estimateDuration(List<ExecutionStep> steps, ResourceRequirements requirements,
                                   QueryContext context) {
        double duration = steps.stream().mapToDouble(ExecutionStep::getEstimatedCost).sum();

        if (context != null && context.getSystemLoad() != null && requirements != null) {
            if (requirements.isCpuIntensive() && context.cpuUsage(0) > 80) {
                duration *= 1.5;
            }
            if (requirements.getMaxMemory() > 1024 && context.memoryUsage(0) > 80) {
                duration *= 1.3;
            }
            if (requirements.isIoIntensive() && context.diskIo(0) > 80) {
                duration *= 1.4;
            }
            if (requirements.isNetworkIntensive() && context.networkLatency(0) > 100) {
                duration *= 1.2;
            }
        }

        long parallelSteps = steps.stream().filter(ExecutionStep::isCanParallelize).count();
        if (parallelSteps > 1) {
            duration *= 1 - Math.min(parallelSteps * 0.15, 0.6);
        }

        return Math.max(duration, 10);
    }

    /**
     * Feeds an observed execution back into the models.
     */
    public void updateModel(String query, QueryExecutionResult actual, QueryContext context) {
        try {
            PerformanceFeatures features = extractFeatures(query, context);
            trainingData.add(TrainingSample.builder()
                    .queryHash(QueryText.hash(query))
                    .features(features)
                    .actualPerformance(actual)
                    .timestamp(clock.instant())
                    .build());

            long seen = samplesSeen.incrementAndGet();
            if (trainingData.size() >= retrainThreshold && seen % retrainThreshold == 0) {
                registry.retrain(trainingData.size(), clock.instant());
            }

            updateAccuracy(query, actual, context);
        } catch (RuntimeException e) {
            log.warn("Failed to update prediction models: {}", e.getMessage());
        }
    }

    public synchronized PredictionMetrics getModelMetrics() {
        return metrics.toBuilder().build();
    }

    public List<ModelDescriptor> getModelInfo() {
        return registry.describe();
    }

    public void clearCache() {
        predictionCache.clear();
    }

    public List<TrainingSample> exportTrainingData() {
        return trainingData.snapshot();
    }

    /**
     * Replaces the training buffer; only the newest samples are kept when the list exceeds
     * the buffer capacity.
     */
    public void importTrainingData(List<TrainingSample> samples) {
        trainingData.clear();
        trainingData.addAll(samples);
        log.info("Imported {} prediction training samples", trainingData.size());
    }

    public int trainingDataSize() {
        return trainingData.size();
    }

    private PerformanceFeatures extractFeatures(String query, QueryContext context) {
        QueryPattern pattern = QueryPatternParser.parse(query);
        String hash = QueryText.hash(query);
        List<TrainingSample> past = trainingData.snapshot().stream()
                .filter(sample -> hash.equals(sample.getQueryHash()))
                .collect(Collectors.toList());
        double averagePast = past.stream()
                .mapToLong(sample -> sample.getActualPerformance().getExecutionTime())
                .average()
                .orElse(0);
        return FeatureExtractor.extract(pattern, context, ZonedDateTime.now(clock), past.size(), averagePast);
    }

    private PerformancePrediction combine(List<PredictionModel> models, PerformanceFeatures features) {
        double totalWeight = 0;
        double duration = 0;
        double memory = 0;
        double cpu = 0;
        double io = 0;
        double network = 0;

        for (PredictionModel model : models) {
            double weight = registry.accuracyOf(model.id());
            ModelEstimate estimate = model.predict(features);
            duration += estimate.duration() * weight;
            memory += estimate.memoryUsage() * weight;
            cpu += estimate.cpuUsage() * weight;
            io += estimate.ioOperations() * weight;
            network += estimate.networkTraffic() * weight;
            totalWeight += weight;
        }

        if (totalWeight <= 0) {
            throw new IllegalStateException("No duration model with positive accuracy available");
        }

        double confidence = totalWeight / models.size();
        if (models.size() == 1) {
            confidence *= SINGLE_MODEL_PENALTY;
        }

        ModelEstimate combined = new ModelEstimate(duration / totalWeight, memory / totalWeight,
                cpu / totalWeight, io / totalWeight, network / totalWeight);
        List<PredictedBottleneck> bottlenecks = identifyBottlenecks(combined, features);

        return PerformancePrediction.builder()
                .estimatedDuration(combined.duration())
                .estimatedMemoryUsage(combined.memoryUsage())
                .estimatedCpuUsage(combined.cpuUsage())
                .estimatedIoOperations(combined.ioOperations())
                .estimatedNetworkTraffic(combined.networkTraffic())
                .confidence(confidence)
                .bottlenecks(bottlenecks)
                .recommendations(generateRecommendations(combined, bottlenecks))
                .riskFactors(assessRiskFactors(features))
                .build();
    }

    private List<PredictedBottleneck> identifyBottlenecks(ModelEstimate estimate, PerformanceFeatures features) {
        List<PredictedBottleneck> bottlenecks = new ArrayList<>();

        if (estimate.cpuUsage() > 80 || features.getSystemLoad() > 0.8) {
            bottlenecks.add(PredictedBottleneck.builder()
                    .type(BottleneckType.CPU)
                    .severity(estimate.cpuUsage() > 90 ? Severity.CRITICAL : Severity.HIGH)
                    .description("High CPU usage expected due to complex operations")
                    .probability(0.8)
                    .impact(estimate.cpuUsage())
                    .mitigation("Consider query optimization or adding more CPU cores")
                    .build());
        }

        if (estimate.memoryUsage() > 1024 || features.getMemoryAvailable() < 0.2) {
            bottlenecks.add(PredictedBottleneck.builder()
                    .type(BottleneckType.MEMORY)
                    .severity(estimate.memoryUsage() > 2048 ? Severity.CRITICAL : Severity.HIGH)
                    .description("High memory usage expected due to large joins or aggregations")
                    .probability(0.7)
                    .impact(estimate.memoryUsage())
                    .mitigation("Optimize joins or increase available memory")
                    .build());
        }

        if (estimate.ioOperations() > 1000 || features.getDiskUtilization() > 0.8) {
            bottlenecks.add(PredictedBottleneck.builder()
                    .type(BottleneckType.DISK)
                    .severity(estimate.ioOperations() > 5000 ? Severity.CRITICAL : Severity.MEDIUM)
                    .description("High disk I/O expected due to table scans")
                    .probability(0.6)
                    .impact(estimate.ioOperations())
                    .mitigation("Add indexes or use SSD storage")
                    .build());
        }

        if (estimate.networkTraffic() > 10240 || features.getNetworkLatency() > 100) {
            bottlenecks.add(PredictedBottleneck.builder()
                    .type(BottleneckType.NETWORK)
                    .severity(estimate.networkTraffic() > 51200 ? Severity.HIGH : Severity.MEDIUM)
                    .description("High network traffic expected due to large result sets")
                    .probability(0.5)
                    .impact(estimate.networkTraffic())
                    .mitigation("Optimize data transfer or use local processing")
                    .build());
        }

        return bottlenecks;
    }

    private List<PerformanceRecommendation> generateRecommendations(ModelEstimate estimate,
                                                                    List<PredictedBottleneck> bottlenecks) {
        List<PerformanceRecommendation> recommendations = new ArrayList<>();

        for (PredictedBottleneck bottleneck : bottlenecks) {
            switch (bottleneck.getType()) {
                case CPU -> recommendations.add(recommendation("optimization", Priority.HIGH,
                        "Optimize CPU-intensive operations",
                        "Reduce computational complexity or parallelize operations", 30, Priority.MEDIUM));
                case MEMORY -> recommendations.add(recommendation("resource", Priority.HIGH,
                        "Increase memory allocation",
                        "Add more RAM or optimize memory usage", 40, Priority.LOW));
                case DISK -> recommendations.add(recommendation("optimization", Priority.MEDIUM,
                        "Optimize disk I/O",
                        "Add indexes or use faster storage", 50, Priority.MEDIUM));
                case NETWORK -> recommendations.add(recommendation("architecture", Priority.MEDIUM,
                        "Optimize network usage",
                        "Reduce data transfer or improve network infrastructure", 25, Priority.HIGH));
            }
        }

        if (estimate.duration() > 10_000) {
            recommendations.add(recommendation("optimization", Priority.HIGH,
                    "Overall query optimization needed",
                    "Query is predicted to be slow, consider comprehensive optimization", 60, Priority.HIGH));
        }

        return recommendations;
    }

    private PerformanceRecommendation recommendation(String category, Priority priority, String title,
                                                     String description, double improvement, Priority cost) {
        return PerformanceRecommendation.builder()
                .category(category)
                .priority(priority)
                .title(title)
                .description(description)
                .expectedImprovement(improvement)
                .implementationCost(cost)
                .build();
    }

    private List<RiskFactor> assessRiskFactors(PerformanceFeatures features) {
        List<RiskFactor> risks = new ArrayList<>();

        if (features.getComplexityScore() > 100) {
            risks.add(new RiskFactor("Query Complexity", Priority.HIGH,
                    "Query has high complexity score", 0.8, "May cause performance degradation"));
        }

        if (features.getSystemLoad() > 0.8) {
            risks.add(new RiskFactor("System Load", Priority.HIGH,
                    "System is under high load", 0.9, "May cause query timeout or failure"));
        }

        if (features.getMemoryAvailable() < 0.2) {
            risks.add(new RiskFactor("Memory Availability", Priority.MEDIUM,
                    "Low memory availability", 0.7, "May cause out-of-memory errors"));
        }

        return risks;
    }

    PerformancePrediction conservativeEstimate() {
        List<PerformanceRecommendation> recommendations = new ArrayList<>();
        recommendations.add(recommendation("optimization", Priority.MEDIUM,
                "Performance analysis unavailable",
                "Unable to perform detailed analysis, consider manual optimization", 20, Priority.MEDIUM));

        List<RiskFactor> risks = new ArrayList<>();
        risks.add(new RiskFactor("Unknown Performance", Priority.MEDIUM,
                "Performance characteristics unknown", 0.5, "Unpredictable performance"));

        return PerformancePrediction.builder()
                .estimatedDuration(1000)
                .estimatedMemoryUsage(256)
                .estimatedCpuUsage(50)
                .estimatedIoOperations(100)
                .estimatedNetworkTraffic(1024)
                .confidence(0.5)
                .recommendations(recommendations)
                .riskFactors(risks)
                .fallback(true)
                .build();
    }

    private void updateAccuracy(String query, QueryExecutionResult actual, QueryContext context) {
        if (actual.getExecutionTime() <= 0) {
            return;
        }
        PerformancePrediction prediction = predictionCache.get(cacheKey(query, context));
        if (prediction == null) {
            prediction = predict(query, context);
        }

        double error = Math.abs(prediction.getEstimatedDuration() - actual.getExecutionTime());
        double accuracy = Math.max(0, 1 - error / actual.getExecutionTime());

        synchronized (this) {
            metrics.setAccuracy(metrics.getAccuracy() * EMA_KEEP + accuracy * (1 - EMA_KEEP));
            metrics.setMeanAbsoluteError(metrics.getMeanAbsoluteError() * EMA_KEEP + error * (1 - EMA_KEEP));
            metrics.setMeanSquaredError(metrics.getMeanSquaredError() * EMA_KEEP + error * error * (1 - EMA_KEEP));
            metrics.setEvaluatedCount(metrics.getEvaluatedCount() + 1);
            metrics.setLastEvaluated(clock.instant());
        }
    }

    private String cacheKey(String query, QueryContext context) {
        String queryHash = QueryText.hash(query);
        if (context == null) {
            return queryHash + "-no-context";
        }
        try {
            return queryHash + "-" + Integer.toHexString(mapper.writeValueAsString(context).hashCode());
        } catch (JsonProcessingException e) {
            log.debug("Context not serializable for prediction cache key: {}", e.getMessage());
            return queryHash + "-" + Integer.toHexString(context.hashCode());
        }
    }
}
