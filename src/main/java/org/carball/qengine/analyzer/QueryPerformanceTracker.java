package org.carball.qengine.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.query.PerformanceRecord;
import org.carball.qengine.model.query.QueryExecutionResult;
import org.carball.qengine.model.query.QueryStatistics;
import org.carball.qengine.model.query.QuerySummary;
import org.carball.qengine.model.query.ResourceUtilization;
import org.carball.qengine.model.query.TimeWindow;
import org.carball.qengine.util.BoundedBuffer;
import org.carball.qengine.util.QueryText;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Rolling per-query execution history, keyed by normalised query text.
 */
@Slf4j
public class QueryPerformanceTracker {

    public static final int DEFAULT_RECORDS_PER_QUERY = 100;
    private static final double SLOW_QUERY_THRESHOLD_MS = 1000;
    private static final int FREQUENT_QUERY_THRESHOLD = 10;

    private final Map<String, BoundedBuffer<PerformanceRecord>> history = new ConcurrentHashMap<>();
    private final int recordsPerQuery;
    private final Clock clock;

    public QueryPerformanceTracker() {
        this(DEFAULT_RECORDS_PER_QUERY, Clock.systemUTC());
    }

    public QueryPerformanceTracker(int recordsPerQuery, Clock clock) {
        this.recordsPerQuery = recordsPerQuery;
        this.clock = clock;
    }

    public void record(String query, String connectionId, QueryExecutionResult result) {
        String key = QueryText.normalize(query);
        PerformanceRecord record = PerformanceRecord.builder()
                .query(QueryText.collapseWhitespace(query))
                .connectionId(connectionId)
                .timestamp(clock.instant())
                .result(result)
                .build();
        history.computeIfAbsent(key, k -> new BoundedBuffer<>(recordsPerQuery)).add(record);
        log.debug("Recorded execution of {} ms for query {}", result.getExecutionTime(), QueryText.hash(query));
    }

    public List<PerformanceRecord> recordsFor(String query) {
        BoundedBuffer<PerformanceRecord> records = history.get(QueryText.normalize(query));
        return records == null ? List.of() : records.snapshot();
    }

    /**
     * Aggregates the recorded executions. Records without a connection id match any
     * connection; a null connection id matches every record.
     */
    public QueryStatistics statistics(String connectionId, TimeWindow window) {
        List<QuerySummary> summaries = new ArrayList<>();
        List<PerformanceRecord> all = new ArrayList<>();

        for (BoundedBuffer<PerformanceRecord> buffer : history.values()) {
            List<PerformanceRecord> matching = buffer.snapshot().stream()
                    .filter(r -> connectionId == null || r.getConnectionId() == null
                            || r.getConnectionId().equals(connectionId))
                    .filter(r -> window == null || window.contains(r.getTimestamp()))
                    .collect(Collectors.toList());
            if (!matching.isEmpty()) {
                all.addAll(matching);
                summaries.add(summarize(matching));
            }
        }

        if (all.isEmpty()) {
            return QueryStatistics.builder()
                    .resourceUtilization(new ResourceUtilization())
                    .build();
        }

        double averageTime = all.stream().mapToLong(r -> r.getResult().getExecutionTime()).average().orElse(0);
        double errorRate = (double) all.stream().filter(r -> !r.getResult().isSuccess()).count() / all.size();

        List<QuerySummary> slowQueries = summaries.stream()
                .filter(s -> s.getAverageExecutionTime() > SLOW_QUERY_THRESHOLD_MS)
                .sorted(Comparator.comparingDouble(QuerySummary::getAverageExecutionTime).reversed())
                .collect(Collectors.toList());

        List<QuerySummary> frequentQueries = summaries.stream()
                .filter(s -> s.getExecutionCount() > FREQUENT_QUERY_THRESHOLD)
                .sorted(Comparator.comparingInt(QuerySummary::getExecutionCount).reversed())
                .collect(Collectors.toList());

        return QueryStatistics.builder()
                .totalQueries(all.size())
                .averageExecutionTime(averageTime)
                .slowQueries(new ArrayList<>(slowQueries))
                .frequentQueries(new ArrayList<>(frequentQueries))
                .errorRate(errorRate)
                .resourceUtilization(utilization(all))
                .build();
    }

    private QuerySummary summarize(List<PerformanceRecord> records) {
        Instant lastExecuted = records.stream()
                .map(PerformanceRecord::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElse(null);
        long failures = records.stream().filter(r -> !r.getResult().isSuccess()).count();
        return QuerySummary.builder()
                .query(records.get(records.size() - 1).getQuery())
                .executionCount(records.size())
                .averageExecutionTime(records.stream().mapToLong(r -> r.getResult().getExecutionTime()).average().orElse(0))
                .errorRate((double) failures / records.size())
                .lastExecuted(lastExecuted)
                .build();
    }

    private ResourceUtilization utilization(List<PerformanceRecord> records) {
        return ResourceUtilization.builder()
                .memory(records.stream().mapToLong(r -> r.getResult().getMemoryUsed()).average().orElse(0))
                .cpu(records.stream().mapToDouble(r -> r.getResult().getExecutionTime() / 1000.0).average().orElse(0))
                .io(records.stream().mapToLong(r -> r.getResult().getDiskReads() + r.getResult().getDiskWrites()).average().orElse(0))
                .network(records.stream().mapToLong(r -> r.getResult().getNetworkBytes()).average().orElse(0))
                .build();
    }
}
