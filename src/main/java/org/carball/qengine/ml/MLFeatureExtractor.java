package org.carball.qengine.ml;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.ml.FeatureVector;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.util.QueryText;

import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class MLFeatureExtractor {

    private static final Pattern SUBQUERY_PATTERN = Pattern.compile("\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);

    private MLFeatureExtractor() {
        // Utility class - prevent instantiation
    }

    public static FeatureVector extract(String query, QueryAnalysis analysis, QueryContext context,
                                        ZonedDateTime now, double averagePerformance) {
        QueryPattern pattern = analysis.primaryPattern();

        return FeatureVector.builder()
                .queryLength(query == null ? 0 : query.length())
                .tableCount(pattern.getTables().size())
                .columnCount(pattern.getColumns().size())
                .joinCount(pattern.getJoins().size())
                .aggregationCount(pattern.getAggregations().size())
                .conditionCount(pattern.getConditions().size())
                .subqueryCount(countSubqueries(query))
                .orderByCount(pattern.getOrderBy().size())
                .groupByCount(pattern.getGroupBy().size())
                .limited(pattern.hasLimit())
                .selectivity(pattern.hasLimit() ? 0.1 : pattern.hasWhereClause() ? 0.5 : 1.0)
                .complexityScore(analysis.getComplexity().getScore())
                .dataVolumeScore(context != null ? context.totalRows() : 0)
                .computationalComplexity(analysis.getResourceUsage() != null
                        ? analysis.getResourceUsage().getEstimatedCpu() : 0)
                .systemLoad(context != null ? context.cpuUsage(0) / 100 : 0)
                .memoryAvailable(context != null ? 1 - context.memoryUsage(0) / 100 : 1)
                .diskUtilization(context != null ? context.diskIo(0) / 100 : 0)
                .networkLatency(context != null ? context.networkLatency(0) : 0)
                .timeOfDay(now.getHour())
                .dayOfWeek(now.getDayOfWeek().getValue() % 7)
                .queryFrequency(frequencyIn(context, query))
                .averagePerformance(averagePerformance)
                .build();
    }

    /**
     * Blend of complexity score, tables, joins and aggregations, capped at 1.
     */
    public static double featureComplexity(FeatureVector features) {
        double complexity = features.getComplexityScore() / 100.0 * 0.3
                + features.getTableCount() / 10.0 * 0.2
                + features.getJoinCount() / 5.0 * 0.25
                + features.getAggregationCount() / 5.0 * 0.25;
        return Math.min(complexity, 1.0);
    }

    private static int countSubqueries(String query) {
        if (query == null) {
            return 0;
        }
        int count = 0;
        Matcher matcher = SUBQUERY_PATTERN.matcher(query);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int frequencyIn(QueryContext context, String query) {
        if (context == null || context.getHistoricalQueries() == null) {
            return 0;
        }
        String normalized = QueryText.normalize(query);
        return (int) context.getHistoricalQueries().stream()
                .filter(q -> QueryText.normalize(q).equals(normalized))
                .count();
    }
}
