package org.carball.qengine.history;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.history.HistoryMetadata;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.QueryOptimizationResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives the searchable tags and the summary metadata stored with every history entry.
 */
public class HistoryEntryAnnotator {

    public static final String ENGINE_VERSION = "1.0.0";
    public static final String TECHNIQUE_TAG_PREFIX = "technique:";

    private static final Pattern JOIN = Pattern.compile("join", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBQUERY = Pattern.compile("\\(\\s*select", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE = Pattern.compile("\\b(?:count|sum|avg|min|max|group_concat)\\(",
            Pattern.CASE_INSENSITIVE);

    private static final long LARGE_DATASET_ROWS = 1_000_000;
    private static final double HIGH_CPU_USAGE = 80;

    private HistoryEntryAnnotator() {
        // Utility class - prevent instantiation
    }

    public static List<String> tags(QueryOptimizationResult result, QueryContext context) {
        Set<String> tags = new LinkedHashSet<>();

        for (OptimizationTechnique technique : result.getOptimizationTechniques()) {
            tags.add(TECHNIQUE_TAG_PREFIX + technique.getName());
            if (technique.getImpact() == Impact.HIGH) {
                tags.add("high-impact");
            }
        }

        double gain = result.getEstimatedPerformanceGain();
        if (gain > 50) {
            tags.add("major-optimization");
        } else if (gain > 20) {
            tags.add("moderate-optimization");
        } else if (gain > 0) {
            tags.add("minor-optimization");
        }

        if (context != null) {
            if (context.totalRows() > LARGE_DATASET_ROWS) {
                tags.add("large-dataset");
            }
            if (context.cpuUsage(0) > HIGH_CPU_USAGE) {
                tags.add("high-system-load");
            }
        }
        return new ArrayList<>(tags);
    }

    public static HistoryMetadata metadata(QueryOptimizationResult result) {
        return HistoryMetadata.builder()
                .queryType(queryType(result.getOriginalQuery()))
                .complexity(complexity(result.getOriginalQuery()))
                .optimizationTechniques(result.getOptimizationTechniques().stream()
                        .map(OptimizationTechnique::getName)
                        .collect(Collectors.toList()))
                .estimatedBenefit(result.getEstimatedPerformanceGain())
                .actualBenefit(0)
                .confidenceScore(confidenceScore(result))
                .engineVersion(ENGINE_VERSION)
                .build();
    }

    /**
     * Leading statement verb in upper case, or OTHER.
     */
    public static String queryType(String query) {
        if (query == null) {
            return "OTHER";
        }
        String lower = query.trim().toLowerCase(Locale.ROOT);
        for (String verb : List.of("select", "insert", "update", "delete", "create", "drop")) {
            if (lower.startsWith(verb)) {
                return verb.toUpperCase(Locale.ROOT);
            }
        }
        return "OTHER";
    }

    /**
     * Text-based complexity in [0, 100]: one point per hundred characters, ten per join,
     * fifteen per subquery and five per aggregate call.
     */
    public static double complexity(String query) {
        if (query == null) {
            return 0;
        }
        double complexity = query.length() / 100.0;
        complexity += count(JOIN, query) * 10;
        complexity += count(SUBQUERY, query) * 15;
        complexity += count(AGGREGATE, query) * 5;
        return Math.min(complexity, 100);
    }

    static double confidenceScore(QueryOptimizationResult result) {
        List<OptimizationTechnique> techniques = result.getOptimizationTechniques();
        if (techniques.isEmpty()) {
            return 0;
        }
        long highImpact = techniques.stream().filter(t -> t.getImpact() == Impact.HIGH).count();
        double techniqueScore = (double) highImpact / techniques.size() * 100;
        return Math.min((techniqueScore + result.getEstimatedPerformanceGain()) / 2, 100);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
