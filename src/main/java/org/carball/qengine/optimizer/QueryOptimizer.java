package org.carball.qengine.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.ml.MLOptimizer;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.ml.MLModel;
import org.carball.qengine.model.ml.MLPrediction;
import org.carball.qengine.model.ml.MLTrainingData;
import org.carball.qengine.model.ml.ModelMetrics;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.OptimizedQuery;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ParallelizationInfo;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Rewrites a query in three stages (rules, ML suggestions, time-series rewrites) and
 * estimates the combined improvement. Also exposes the planner and the advisor.
 */
@Slf4j
public class QueryOptimizer {

    public static final String TIME_RANGE_OPTIMIZATION = "time_range_optimization";
    public static final String TIME_AGGREGATION_OPTIMIZATION = "time_aggregation_optimization";

    private static final double MAX_ML_IMPROVEMENT = 70;
    private static final double MAX_TOTAL_IMPROVEMENT = 95;
    private static final double ML_REWRITE_CONFIDENCE = 0.5;

    private final List<OptimizationRule> rules = new CopyOnWriteArrayList<>();
    private final MLOptimizer mlOptimizer;
    private final boolean mlEnabled;
    private final ExecutionPlanner planner = new ExecutionPlanner();
    private final RecommendationAdvisor advisor = new RecommendationAdvisor();

    public QueryOptimizer() {
        this(new MLOptimizer(), true);
    }

    public QueryOptimizer(MLOptimizer mlOptimizer, boolean mlEnabled) {
        this.mlOptimizer = mlOptimizer;
        this.mlEnabled = mlEnabled;
        rules.add(new PredicatePushdownRule());
        rules.add(new JoinReorderingRule());
        rules.add(new AggregationOptimizationRule());
        rules.add(new LimitPushdownRule());
    }

    public void addRule(OptimizationRule rule) {
        rules.add(rule);
        log.info("Registered optimization rule {}", rule.name());
    }

    public List<String> getRuleNames() {
        List<String> names = new ArrayList<>();
        rules.forEach(rule -> names.add(rule.name()));
        return names;
    }

    public OptimizedQuery optimize(String query, QueryAnalysis analysis) {
        return optimize(query, analysis, null);
    }

    public OptimizedQuery optimize(String query, QueryAnalysis analysis, QueryContext context) {
        List<OptimizationTechnique> techniques = new ArrayList<>();
        QueryPattern pattern = analysis.primaryPattern();
        String optimized = query;
        double improvement = 0;

        // Stage 1: rules
        for (OptimizationRule rule : rules) {
            if (!rule.appliesTo(pattern)) {
                continue;
            }
            try {
                OptimizationRule.Outcome outcome = rule.apply(optimized, pattern);
                if (!outcome.applied()) {
                    continue;
                }
                optimized = outcome.query();
                techniques.add(OptimizationTechnique.builder()
                        .name(rule.name())
                        .description(rule.description())
                        .impact(rule.impact())
                        .appliedTo(new ArrayList<>(outcome.appliedTo()))
                        .estimatedGain(rule.estimatedGain())
                        .build());
                improvement += rule.estimatedGain();
            } catch (RuntimeException e) {
                log.warn("Optimization rule {} failed: {}", rule.name(), e.getMessage());
            }
        }

        // Stage 2: ML suggestions
        if (mlEnabled) {
            MLPrediction prediction = mlOptimizer.optimizeQuery(optimized, analysis, context);
            techniques.addAll(prediction.getTechniques());
            double mlGain = prediction.getTechniques().stream().mapToDouble(OptimizationTechnique::getEstimatedGain).sum();
            improvement += Math.min(mlGain, MAX_ML_IMPROVEMENT);
            if (prediction.getOptimizedQuery() != null && !prediction.getOptimizedQuery().equals(optimized)
                    && prediction.getConfidence() >= ML_REWRITE_CONFIDENCE) {
                log.debug("Using ML rewrite with confidence {}", prediction.getConfidence());
                optimized = prediction.getOptimizedQuery();
            }
        }

        // Stage 3: time-series rewrites
        String lower = optimized.toLowerCase(Locale.ROOT);
        if (lower.contains("where") && lower.contains("time")) {
            String normalized = TimeSeriesRewriter.normalizeTimeRange(optimized);
            if (!normalized.equals(optimized)) {
                optimized = normalized;
                techniques.add(timeSeriesTechnique(TIME_RANGE_OPTIMIZATION,
                        "Optimize time range queries for better performance", Impact.HIGH, "WHERE clause", 40));
                improvement += 40;
            }
        }
        if (TimeSeriesRewriter.hasTimeBucket(optimized)) {
            String bucketed = TimeSeriesRewriter.optimizeTimeAggregation(optimized);
            if (!bucketed.equals(optimized)) {
                optimized = bucketed;
                techniques.add(timeSeriesTechnique(TIME_AGGREGATION_OPTIMIZATION,
                        "Optimize time-based aggregations", Impact.MEDIUM, "GROUP BY clause", 25));
                improvement += 25;
            }
        }

        log.debug("Applied {} optimization technique(s)", techniques.size());
        return OptimizedQuery.builder()
                .query(optimized)
                .techniques(techniques)
                .confidence(confidence(techniques))
                .estimatedImprovement(Math.min(improvement, MAX_TOTAL_IMPROVEMENT))
                .build();
    }

    public List<ExecutionStep> generateSteps(QueryAnalysis analysis) {
        return planner.generateSteps(analysis.primaryPattern());
    }

    public ParallelizationInfo analyzeParallelization(List<ExecutionStep> steps) {
        return planner.analyzeParallelization(steps);
    }

    public ResourceRequirements calculateResourceRequirements(List<ExecutionStep> steps, QueryContext context) {
        return planner.calculateResourceRequirements(steps, context);
    }

    public List<Recommendation> recommendIndexes(QueryAnalysis analysis, QueryContext context) {
        return advisor.recommendIndexes(analysis, context);
    }

    public List<Recommendation> recommendRewrites(String query, QueryAnalysis analysis) {
        return advisor.recommendRewrites(query, analysis);
    }

    public List<Recommendation> recommendConfiguration(QueryAnalysis analysis, QueryContext context) {
        return advisor.recommendConfiguration(analysis, context);
    }

    public void trainMLModels() {
        mlOptimizer.trainModels();
    }

    public boolean addMLTrainingData(MLTrainingData data) {
        return mlOptimizer.addTrainingData(data);
    }

    public List<MLModel> getMLModelInfo() {
        return mlOptimizer.getModelInfo();
    }

    public Optional<ModelMetrics> getMLModelMetrics(String modelId) {
        return mlOptimizer.getModelMetrics(modelId);
    }

    public MLOptimizer getMlOptimizer() {
        return mlOptimizer;
    }

    /**
     * Mean impact weight of the techniques as a percentage: all high gives 100, all low 33.
     */
    static double confidence(List<OptimizationTechnique> techniques) {
        if (techniques.isEmpty()) {
            return 0;
        }
        double score = techniques.stream()
                .mapToInt(t -> t.getImpact() != null ? t.getImpact().getWeight() : Impact.LOW.getWeight())
                .sum() / (double) techniques.size();
        return Math.min(score / 3 * 100, 100);
    }

    private static OptimizationTechnique timeSeriesTechnique(String name, String description, Impact impact,
                                                             String appliedTo, double gain) {
        List<String> targets = new ArrayList<>();
        targets.add(appliedTo);
        return OptimizationTechnique.builder()
                .name(name)
                .description(description)
                .impact(impact)
                .appliedTo(targets)
                .estimatedGain(gain)
                .build();
    }
}
