package org.carball.qengine.predictor;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.prediction.PerformanceFeatures;
import org.carball.qengine.model.query.QueryPattern;

import java.time.ZonedDateTime;

/**
 * Pure mapping from a parsed query, its context and past executions to model features.
 */
public class FeatureExtractor {

    static final int STAR_COLUMN_COUNT = 10;
    static final double ROWS_PER_TABLE = 1_000_000;

    static final double DEFAULT_SYSTEM_LOAD = 0.5;
    static final double DEFAULT_MEMORY_AVAILABLE = 0.7;
    static final double DEFAULT_DISK_UTILIZATION = 0.3;
    static final double DEFAULT_NETWORK_LATENCY = 50;

    private FeatureExtractor() {
        // Utility class - prevent instantiation
    }

    public static PerformanceFeatures extract(QueryPattern pattern, QueryContext context, ZonedDateTime now,
                                              int queryFrequency, double averagePastDuration) {
        int tables = pattern.getTables().size();
        int joins = pattern.getJoins().size();
        int aggregations = pattern.getAggregations().size();
        int conditions = pattern.getConditions().size();

        return PerformanceFeatures.builder()
                .queryKind(pattern.getKind())
                .tableCount(tables)
                .columnCount(pattern.getColumns().isEmpty() ? STAR_COLUMN_COUNT : pattern.getColumns().size())
                .joinCount(joins)
                .aggregationCount(aggregations)
                .conditionCount(conditions)
                .complexityScore(tables * 10 + joins * 20 + aggregations * 15 + conditions * 5)
                .selectivity(selectivity(pattern))
                .dataSize(tables * ROWS_PER_TABLE)
                .indexUsage(context != null && context.hasIndexes() ? 1 : 0)
                .systemLoad(context != null && context.getSystemLoad() != null
                        ? context.getSystemLoad().getCpuUsage() / 100 : DEFAULT_SYSTEM_LOAD)
                .memoryAvailable(context != null && context.getSystemLoad() != null
                        ? 1 - context.getSystemLoad().getMemoryUsage() / 100 : DEFAULT_MEMORY_AVAILABLE)
                .diskUtilization(context != null && context.getSystemLoad() != null
                        ? context.getSystemLoad().getDiskIo() / 100 : DEFAULT_DISK_UTILIZATION)
                .networkLatency(context != null
                        ? context.networkLatency(DEFAULT_NETWORK_LATENCY) : DEFAULT_NETWORK_LATENCY)
                .timeOfDay(now.getHour())
                .dayOfWeek(now.getDayOfWeek().getValue() % 7)
                .queryFrequency(queryFrequency)
                .averagePastDuration(averagePastDuration)
                .build();
    }

    private static double selectivity(QueryPattern pattern) {
        if (pattern.hasLimit()) {
            return 0.1;
        }
        if (pattern.hasWhereClause()) {
            return 0.5;
        }
        return 1.0;
    }
}
