package org.carball.qengine.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryComplexity;
import org.carball.qengine.model.query.QueryDependency;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.model.query.QueryStatistics;
import org.carball.qengine.model.query.ResourceUsage;
import org.carball.qengine.model.query.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw query text into a {@link QueryAnalysis}: structural pattern, complexity score,
 * resource estimate, advisory warnings and tags. Also keeps the per-query execution history
 * used for statistics.
 */
@Slf4j
public class QueryAnalyzer {

    static final String EMPTY_QUERY = "Empty query";
    static final String MISSING_LIMIT = "Query without LIMIT may return large result sets";
    static final String MISSING_WHERE = "Query without WHERE clause may scan entire table";
    static final String MANY_JOINS = "Complex query with multiple joins may be slow";
    static final String MISSING_TIME_INDEX = "Time range query without time index may be inefficient";
    static final String UNGROUPED_AGGREGATION = "Aggregation without GROUP BY may produce unexpected results";

    private static final double GIB = 1024.0 * 1024 * 1024;
    private static final double MAX_SIZE_SCALE = 5;

    private final ComplexityScorer complexityScorer;
    private final QueryPerformanceTracker performanceTracker;

    public QueryAnalyzer() {
        this(new ComplexityScorer(), new QueryPerformanceTracker());
    }

    public QueryAnalyzer(ComplexityScorer complexityScorer, QueryPerformanceTracker performanceTracker) {
        this.complexityScorer = complexityScorer;
        this.performanceTracker = performanceTracker;
    }

    public QueryAnalysis analyze(String query) {
        return analyze(query, null);
    }

    public QueryAnalysis analyze(String query, QueryContext context) {
        if (query == null || query.isBlank()) {
            QueryPattern empty = QueryPattern.empty();
            return QueryAnalysis.builder()
                    .patterns(List.of(empty))
                    .complexity(complexityScorer.score(empty))
                    .resourceUsage(estimateResourceUsage(empty, context))
                    .warnings(List.of(EMPTY_QUERY))
                    .tags(List.of("select", "complexity:simple"))
                    .build();
        }

        QueryPattern pattern = QueryPatternParser.parse(query);
        QueryComplexity complexity = complexityScorer.score(pattern);

        QueryAnalysis analysis = QueryAnalysis.builder()
                .patterns(List.of(pattern))
                .complexity(complexity)
                .resourceUsage(estimateResourceUsage(pattern, context))
                .warnings(checkWarnings(pattern, context))
                .tags(generateTags(pattern, complexity))
                .build();

        log.debug("Analyzed {} query over {}: complexity {} ({})", pattern.getKind(), pattern.getTables(),
                complexity.getScore(), complexity.getLevel().getLabel());
        return analysis;
    }

    public String describeComplexity(String query) {
        QueryPattern pattern = QueryPatternParser.parse(query);
        return complexityScorer.generateComplexityReport(pattern, complexityScorer.score(pattern));
    }

    public List<QueryDependency> analyzeDependencies(List<String> queries) {
        return DependencyAnalyzer.analyze(queries);
    }

    public void recordPerformance(String query, QueryExecutionResult result) {
        recordPerformance(query, null, result);
    }

    public void recordPerformance(String query, String connectionId, QueryExecutionResult result) {
        performanceTracker.record(query, connectionId, result);
    }

    public QueryStatistics getStatistics(String connectionId) {
        return getStatistics(connectionId, null);
    }

    public QueryStatistics getStatistics(String connectionId, TimeWindow window) {
        return performanceTracker.statistics(connectionId, window);
    }

    private ResourceUsage estimateResourceUsage(QueryPattern pattern, QueryContext context) {
        int tables = pattern.getTables().size();
        int joins = pattern.getJoins().size();
        int aggregations = pattern.getAggregations().size();
        int sorts = pattern.getOrderBy().size();

        double memory = 64 + 32 * tables + 128 * joins + 64 * aggregations + 96 * sorts;
        double cpu = 10 + 50 * joins + 30 * aggregations + 40 * sorts;
        double io = 50 + 100 * tables;
        double network = 10;

        if (context != null && context.getDataSize() != null) {
            double scale = Math.min(context.totalSize() / GIB, MAX_SIZE_SCALE);
            memory *= 1 + scale;
            cpu *= 1 + 0.5 * scale;
            io *= 1 + 0.3 * scale;
        }

        return ResourceUsage.builder()
                .estimatedMemory(memory)
                .estimatedCpu(cpu)
                .estimatedIo(io)
                .estimatedNetwork(network)
                .build();
    }

    private List<String> checkWarnings(QueryPattern pattern, QueryContext context) {
        List<String> warnings = new ArrayList<>();

        if (pattern.getKind() == QueryKind.SELECT && !pattern.hasLimit()) {
            warnings.add(MISSING_LIMIT);
        }

        if (pattern.getKind() == QueryKind.SELECT && !pattern.hasWhereClause()) {
            warnings.add(MISSING_WHERE);
        }

        if (pattern.getJoins().size() > 3) {
            warnings.add(MANY_JOINS);
        }

        // only judged when index metadata is available
        if (pattern.hasTimeRange() && context != null && context.hasIndexes() && !context.hasIndexOn("time")) {
            warnings.add(MISSING_TIME_INDEX);
        }

        if (pattern.hasAggregations() && !pattern.hasGroupBy()) {
            warnings.add(UNGROUPED_AGGREGATION);
        }

        return warnings;
    }

    private List<String> generateTags(QueryPattern pattern, QueryComplexity complexity) {
        List<String> tags = new ArrayList<>();
        tags.add(pattern.getKind().name().toLowerCase());
        tags.add("complexity:" + complexity.getLevel().getLabel());
        if (pattern.hasJoins()) {
            tags.add("has_joins");
        }
        if (pattern.hasAggregations()) {
            tags.add("has_aggregations");
        }
        if (pattern.hasOrderBy()) {
            tags.add("has_sorting");
        }
        if (pattern.hasTimeRange()) {
            tags.add("time_series");
        }
        if (pattern.hasGroupBy()) {
            tags.add("has_grouping");
        }
        return tags;
    }
}
