package org.carball.qengine.optimizer;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.optimization.Priority;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.optimization.RecommendationType;
import org.carball.qengine.model.query.ClauseKind;
import org.carball.qengine.model.query.Condition;
import org.carball.qengine.model.query.OrderBy;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Advisory recommendations for indexes, query rewrites and server configuration. Each
 * recommendation carries a fixed estimated benefit.
 */
public class RecommendationAdvisor {

    private static final Pattern EXISTS_PATTERN = Pattern.compile("\\bEXISTS\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISTINCT_PATTERN = Pattern.compile("\\bDISTINCT\\b", Pattern.CASE_INSENSITIVE);

    private static final double LARGE_MEMORY_MB = 1024;
    private static final int PARALLEL_COMPLEXITY = 50;
    private static final long PARTITIONING_ROWS = 10_000_000;

    public List<Recommendation> recommendIndexes(QueryAnalysis analysis, QueryContext context) {
        List<Recommendation> recommendations = new ArrayList<>();
        QueryPattern pattern = analysis.primaryPattern();
        String table = pattern.primaryTable();
        if (table == null) {
            return recommendations;
        }

        List<String> whereColumns = pattern.getConditions().stream()
                .filter(c -> c.getClause() == ClauseKind.WHERE)
                .map(Condition::getColumn)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());

        for (String column : whereColumns) {
            if (context != null && context.hasIndexLeadingWith(column)) {
                continue;
            }
            recommendations.add(recommendation(RecommendationType.INDEX, Priority.HIGH,
                    "Create index on " + column,
                    "Creating an index on " + column + " will improve WHERE clause performance",
                    "CREATE INDEX idx_" + indexSuffix(column) + " ON " + table + " (" + column + ")", 60));
        }

        if (whereColumns.size() > 1) {
            String columns = String.join(", ", whereColumns);
            recommendations.add(recommendation(RecommendationType.INDEX, Priority.MEDIUM,
                    "Create composite index on (" + columns + ")",
                    "A composite index can optimize multiple WHERE conditions",
                    "CREATE INDEX idx_composite ON " + table + " (" + columns + ")", 75));
        }

        if (pattern.hasOrderBy()) {
            String columns = pattern.getOrderBy().stream().map(OrderBy::getColumn).collect(Collectors.joining(", "));
            recommendations.add(recommendation(RecommendationType.INDEX, Priority.MEDIUM,
                    "Create index for ORDER BY",
                    "Index on ORDER BY columns will eliminate sorting",
                    "CREATE INDEX idx_order ON " + table + " (" + columns + ")", 50));
        }

        return recommendations;
    }

    public List<Recommendation> recommendRewrites(String query, QueryAnalysis analysis) {
        List<Recommendation> recommendations = new ArrayList<>();
        QueryPattern pattern = analysis.primaryPattern();

        if (EXISTS_PATTERN.matcher(query).find()) {
            recommendations.add(recommendation(RecommendationType.QUERY_REWRITE, Priority.HIGH,
                    "Convert EXISTS to JOIN",
                    "Converting EXISTS subqueries to JOINs can improve performance",
                    "Rewrite EXISTS subquery as INNER JOIN", 40));
        }

        if (DISTINCT_PATTERN.matcher(query).find()) {
            recommendations.add(recommendation(RecommendationType.QUERY_REWRITE, Priority.MEDIUM,
                    "Optimize DISTINCT usage",
                    "Consider using GROUP BY instead of DISTINCT when possible",
                    "Replace DISTINCT with GROUP BY", 25));
        }

        if (pattern.hasOrderBy() && pattern.hasLimit()) {
            recommendations.add(recommendation(RecommendationType.QUERY_REWRITE, Priority.MEDIUM,
                    "Optimize ORDER BY with LIMIT",
                    "Consider using TOP-N optimization for ORDER BY with LIMIT",
                    "Use heap-based sorting for limited results", 35));
        }

        return recommendations;
    }

    public List<Recommendation> recommendConfiguration(QueryAnalysis analysis, QueryContext context) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (analysis.getResourceUsage() != null && analysis.getResourceUsage().getEstimatedMemory() > LARGE_MEMORY_MB) {
            recommendations.add(recommendation(RecommendationType.CONFIGURATION, Priority.HIGH,
                    "Increase memory allocation",
                    "Query requires more memory than currently allocated",
                    "Increase max_memory setting to at least 2GB", 30));
        }

        if (analysis.getComplexity() != null && analysis.getComplexity().getScore() > PARALLEL_COMPLEXITY) {
            recommendations.add(recommendation(RecommendationType.CONFIGURATION, Priority.MEDIUM,
                    "Enable parallel processing",
                    "Complex queries can benefit from parallel execution",
                    "Set max_parallel_workers to match CPU cores", 45));
        }

        if (context != null && context.totalRows() > PARTITIONING_ROWS) {
            recommendations.add(recommendation(RecommendationType.PARTITIONING, Priority.MEDIUM,
                    "Partition large tables",
                    "Tables with more than 10 million rows scan faster when partitioned",
                    "Partition by time or by a high-cardinality key used in filters", 55));
        }

        return recommendations;
    }

    private static String indexSuffix(String column) {
        return column.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static Recommendation recommendation(RecommendationType type, Priority priority, String title,
                                                 String description, String implementation, double benefit) {
        return Recommendation.builder()
                .type(type)
                .priority(priority)
                .title(title)
                .description(description)
                .implementation(implementation)
                .estimatedBenefit(benefit)
                .build();
    }
}
