package org.carball.qengine.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.engine.IntelligentQueryEngine;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.plan.ExecutionPlan;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.routing.RoutingStrategy;
import org.carball.qengine.util.JsonMappers;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
public class OptimizationReport {

    static final String ENGINE_VERSION = "1.0.0";

    private final List<QueryOptimizationResult> results;
    private final Instant timestamp;
    private final ObjectMapper objectMapper = JsonMappers.json();

    public OptimizationReport(List<QueryOptimizationResult> results) {
        this(results, Clock.systemUTC());
    }

    public OptimizationReport(List<QueryOptimizationResult> results, Clock clock) {
        this.results = results;
        this.timestamp = clock.instant();
    }

    public String toJson() {
        try {
            ReportData reportData = new ReportData();
            reportData.setMetadata(buildMetadata());
            reportData.setResults(results);
            return objectMapper.writeValueAsString(reportData);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        ReportMetadata metadata = buildMetadata();

        // Header
        md.append("# Query Optimization Report\n\n");
        md.append("**Generated:** ").append(DateTimeFormatter.ISO_INSTANT.format(timestamp)).append("  \n");
        md.append("**Engine Version:** ").append(ENGINE_VERSION).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Queries Optimized | ").append(metadata.getTotalQueries()).append(" |\n");
        md.append("| Served From Cache | ").append(metadata.getCacheHits()).append(" |\n");
        md.append("| Average Estimated Gain | ").append(percent(metadata.getAverageEstimatedGain())).append(" |\n");
        md.append("| Warnings | ").append(metadata.getTotalWarnings()).append(" |\n");
        md.append("| Recommendations | ").append(metadata.getTotalRecommendations()).append(" |\n\n");

        // Per query
        int queryNum = 1;
        for (QueryOptimizationResult result : results) {
            md.append("## Query ").append(queryNum++).append("\n\n");
            appendQueries(md, result);
            appendTechniques(md, result.getOptimizationTechniques());
            appendPlan(md, result.getExecutionPlan());
            appendRouting(md, result.getRoutingStrategy());

            if (!result.getWarnings().isEmpty()) {
                md.append("### Warnings\n\n");
                result.getWarnings().forEach(warning -> md.append("- ⚠️ ").append(warning).append("\n"));
                md.append("\n");
            }

            appendRecommendations(md, result.getRecommendations());
        }

        // Footer
        md.append("---\n\n");
        md.append("*Estimated gains and durations are heuristic predictions. ")
                .append("Feed measured executions back to the engine to improve them.*\n");

        return md.toString();
    }

    private void appendQueries(StringBuilder md, QueryOptimizationResult result) {
        md.append("**Original:**\n\n```sql\n").append(result.getOriginalQuery()).append("\n```\n\n");
        if (result.getOptimizedQuery() != null && !result.getOptimizedQuery().equals(result.getOriginalQuery())) {
            md.append("**Optimized:**\n\n```sql\n").append(result.getOptimizedQuery()).append("\n```\n\n");
        } else {
            md.append("*The query was left unchanged.*\n\n");
        }
        md.append("- **Estimated Gain:** ").append(percent(result.getEstimatedPerformanceGain())).append("\n");
        if (result.getPrediction() != null) {
            md.append("- **Predicted Duration:** ")
                    .append(String.format(Locale.ROOT, "%.0f ms", result.getPrediction().getEstimatedDuration()))
                    .append(" (confidence ")
                    .append(String.format(Locale.ROOT, "%.2f", result.getPrediction().getConfidence()))
                    .append(")\n");
        }
        md.append("\n");
    }

    private void appendTechniques(StringBuilder md, List<OptimizationTechnique> techniques) {
        if (techniques.isEmpty()) {
            return;
        }
        md.append("### Techniques\n\n");
        for (OptimizationTechnique technique : techniques) {
            md.append("- **").append(technique.getName()).append("** (")
                    .append(technique.getImpact() != null ? technique.getImpact().name().toLowerCase(Locale.ROOT) : "unknown")
                    .append(", ").append(percent(technique.getEstimatedGain())).append("): ")
                    .append(technique.getDescription()).append("\n");
        }
        md.append("\n");
    }

    private void appendPlan(StringBuilder md, ExecutionPlan plan) {
        if (plan == null || plan.getSteps().isEmpty()) {
            return;
        }
        md.append("### Execution Plan\n\n");
        md.append("| Step | Operation | Cost | Depends On | Parallel |\n");
        md.append("|------|-----------|------|------------|----------|\n");
        for (ExecutionStep step : plan.getSteps()) {
            md.append("| ").append(step.getId())
                    .append(" | ").append(step.getOperation())
                    .append(" | ").append(String.format(Locale.ROOT, "%.1f", step.getEstimatedCost()))
                    .append(" | ").append(step.getDependencies().isEmpty() ? "-" : String.join(", ", step.getDependencies()))
                    .append(" | ").append(step.isCanParallelize() ? "yes" : "no")
                    .append(" |\n");
        }
        md.append("\n");
        md.append("Estimated duration: ")
                .append(String.format(Locale.ROOT, "%.0f ms", plan.getEstimatedDuration())).append("\n\n");
    }

    private void appendRouting(StringBuilder md, RoutingStrategy routing) {
        if (routing == null) {
            return;
        }
        md.append("### Routing\n\n");
        md.append("- **Target:** `").append(routing.getTargetConnection()).append("`\n");
        if (routing.getLoadBalancing() != null) {
            md.append("- **Load Balancing:** ").append(routing.getLoadBalancing().getLabel()).append("\n");
        }
        md.append("- **Reason:** ").append(routing.getReason()).append("\n\n");
    }

    private void appendRecommendations(StringBuilder md, List<Recommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return;
        }
        md.append("### Recommendations\n\n");
        int recNum = 1;
        for (Recommendation rec : recommendations) {
            md.append(recNum++).append(". **").append(rec.getTitle()).append("**");
            if (rec.getPriority() != null) {
                md.append(" [").append(rec.getPriority().name().toLowerCase(Locale.ROOT)).append("]");
            }
            md.append(" - ").append(rec.getDescription()).append("\n");
            if (rec.getImplementation() != null && !rec.getImplementation().isBlank()) {
                md.append("   - Implementation: `").append(rec.getImplementation()).append("`\n");
            }
        }
        md.append("\n");
    }

    private ReportMetadata buildMetadata() {
        ReportMetadata metadata = new ReportMetadata();
        metadata.setGeneratedAt(timestamp);
        metadata.setEngineVersion(ENGINE_VERSION);
        metadata.setTotalQueries(results.size());
        metadata.setCacheHits((int) results.stream()
                .filter(r -> r.hasTechnique(IntelligentQueryEngine.CACHE_HIT_TECHNIQUE))
                .count());
        metadata.setAverageEstimatedGain(results.stream()
                .mapToDouble(QueryOptimizationResult::getEstimatedPerformanceGain)
                .average()
                .orElse(0));
        metadata.setTotalWarnings(results.stream().mapToInt(r -> r.getWarnings().size()).sum());
        metadata.setTotalRecommendations(results.stream().mapToInt(r -> r.getRecommendations().size()).sum());
        return metadata;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<QueryOptimizationResult> results;
    }

    @lombok.Data
    private static class ReportMetadata {
        private Instant generatedAt;
        private String engineVersion;
        private int totalQueries;
        private int cacheHits;
        private double averageEstimatedGain;
        private int totalWarnings;
        private int totalRecommendations;
    }
}
