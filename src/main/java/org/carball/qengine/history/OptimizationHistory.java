package org.carball.qengine.history;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.history.ExecutionPerformance;
import org.carball.qengine.model.history.ExportFormat;
import org.carball.qengine.model.history.ExportOptions;
import org.carball.qengine.model.history.HistoryFilter;
import org.carball.qengine.model.history.HistoryStatistics;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.history.UserFeedback;
import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.persistence.PersistenceStore;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Ledger of past optimizations, newest first and capped. Performance and feedback can be
 * attached to an entry once each. Every mutation is saved to the persistence store when one
 * is configured.
 */
@Slf4j
public class OptimizationHistory {

    public static final int DEFAULT_MAX_SIZE = 10_000;
    public static final int DEFAULT_QUERY_LIMIT = 50;
    public static final int DEFAULT_RESULT_LIMIT = 10;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;

    private static final TypeReference<List<OptimizationHistoryEntry>> ENTRY_LIST = new TypeReference<>() { };

    // newest first; guarded by this
    private final LinkedList<OptimizationHistoryEntry> entries = new LinkedList<>();
    private final int maxSize;
    private final PersistenceStore store;
    private final Clock clock;
    private final HistoryExporter exporter = new HistoryExporter();

    public OptimizationHistory() {
        this(DEFAULT_MAX_SIZE, null, Clock.systemUTC());
    }

    public OptimizationHistory(int maxSize, PersistenceStore store, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.store = store;
        this.clock = clock;
        restore();
    }

    public String recordOptimization(String connectionId, String database, String originalQuery,
                                     QueryOptimizationResult result, QueryContext context) {
        OptimizationHistoryEntry entry = OptimizationHistoryEntry.builder()
                .id(generateId())
                .timestamp(clock.instant())
                .connectionId(connectionId)
                .database(database)
                .originalQuery(originalQuery)
                .optimizedQuery(result.getOptimizedQuery())
                .optimizationResult(result)
                .context(context)
                .performance(ExecutionPerformance.pending())
                .tags(HistoryEntryAnnotator.tags(result, context))
                .metadata(HistoryEntryAnnotator.metadata(result))
                .build();

        synchronized (this) {
            entries.addFirst(entry);
            while (entries.size() > maxSize) {
                entries.removeLast();
            }
        }
        log.debug("Recorded optimization {} for {}", entry.getId(), connectionId);
        save();
        return entry.getId();
    }

    /**
     * Attaches measured performance to an entry. Returns false for unknown ids and for entries
     * whose performance was already recorded.
     */
    public boolean updatePerformance(String entryId, ExecutionPerformance performance) {
        synchronized (this) {
            OptimizationHistoryEntry entry = find(entryId);
            if (entry == null || entry.isPerformanceRecorded()) {
                return false;
            }
            entry.setPerformance(performance);
            entry.setPerformanceRecorded(true);
            if (entry.getMetadata() != null) {
                entry.getMetadata().setActualBenefit(performance.getPerformanceGain());
            }
        }
        save();
        return true;
    }

    public boolean addUserFeedback(String entryId, UserFeedback feedback) {
        synchronized (this) {
            OptimizationHistoryEntry entry = find(entryId);
            if (entry == null || entry.getUserFeedback() != null) {
                return false;
            }
            if (feedback.getTimestamp() == null) {
                feedback.setTimestamp(clock.instant());
            }
            entry.setUserFeedback(feedback);
        }
        save();
        return true;
    }

    public List<OptimizationHistoryEntry> queryHistory() {
        return queryHistory(null, DEFAULT_QUERY_LIMIT, 0);
    }

    public List<OptimizationHistoryEntry> queryHistory(HistoryFilter filter, int limit, int offset) {
        return HistoryFilters.apply(snapshot(), filter).stream()
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    public synchronized Optional<OptimizationHistoryEntry> getHistoryEntry(String entryId) {
        return Optional.ofNullable(find(entryId)).map(OptimizationHistory::copyOf);
    }

    public boolean deleteHistory(String entryId) {
        boolean removed;
        synchronized (this) {
            removed = entries.removeIf(e -> e.getId().equals(entryId));
        }
        if (removed) {
            save();
        }
        return removed;
    }

    public int deleteHistoryBatch(HistoryFilter filter) {
        int removed;
        synchronized (this) {
            int before = entries.size();
            entries.removeIf(HistoryFilters.asPredicate(filter));
            removed = before - entries.size();
        }
        log.info("Deleted {} history entries", removed);
        save();
        return removed;
    }

    public void clearHistory() {
        synchronized (this) {
            entries.clear();
        }
        log.info("Cleared optimization history");
        save();
    }

    public HistoryStatistics generateStatistics(HistoryFilter filter) {
        return HistoryStatisticsCalculator.calculate(HistoryFilters.apply(snapshot(), filter));
    }

    public List<OptimizationHistoryEntry> findSimilarQueries(String query) {
        return findSimilarQueries(query, DEFAULT_RESULT_LIMIT, DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * Entries whose original query has a token similarity of at least {@code threshold},
     * most similar first.
     */
    public List<OptimizationHistoryEntry> findSimilarQueries(String query, int limit, double threshold) {
        record Scored(OptimizationHistoryEntry entry, double similarity) { }

        return snapshot().stream()
                .map(entry -> new Scored(entry, QuerySimilarity.similarity(query, entry.getOriginalQuery())))
                .filter(scored -> scored.similarity() >= threshold)
                .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
                .limit(limit)
                .map(Scored::entry)
                .collect(Collectors.toList());
    }

    public List<OptimizationHistoryEntry> getBestOptimizations(int limit) {
        return snapshot().stream()
                .filter(e -> e.getPerformance().isSuccess() && e.getPerformance().getPerformanceGain() > 0)
                .sorted(Comparator.comparingDouble(
                        (OptimizationHistoryEntry e) -> e.getPerformance().getPerformanceGain()).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Failed runs and regressions, worst first. Entries still awaiting performance data are
     * not counted as failures.
     */
    public List<OptimizationHistoryEntry> getWorstOptimizations(int limit) {
        return snapshot().stream()
                .filter(OptimizationHistoryEntry::isPerformanceRecorded)
                .filter(e -> !e.getPerformance().isSuccess() || e.getPerformance().getPerformanceGain() < 0)
                .sorted(Comparator.comparingDouble(e -> e.getPerformance().getPerformanceGain()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public String exportHistory(ExportOptions options) {
        List<OptimizationHistoryEntry> selected = HistoryFilters.apply(snapshot(), options.getFilter());
        log.info("Exporting {} history entries as {}", selected.size(), options.getFormat());
        return exporter.export(selected, options);
    }

    /**
     * Merges exported entries in front of the current ones and re-applies the size cap.
     * Entries missing an id, timestamp, connection or either query, and ids already present,
     * are skipped.
     *
     * @return the number of entries accepted
     */
    public int importHistory(String data, ExportFormat format) {
        List<OptimizationHistoryEntry> parsed = exporter.parse(data, format);
        int accepted;
        synchronized (this) {
            Set<String> known = entries.stream().map(OptimizationHistoryEntry::getId).collect(Collectors.toSet());
            Set<String> seen = new HashSet<>();
            List<OptimizationHistoryEntry> valid = parsed.stream()
                    .filter(OptimizationHistory::isValid)
                    .filter(e -> !known.contains(e.getId()) && seen.add(e.getId()))
                    .peek(OptimizationHistory::fillDefaults)
                    .collect(Collectors.toList());

            for (int i = valid.size() - 1; i >= 0; i--) {
                entries.addFirst(valid.get(i));
            }
            while (entries.size() > maxSize) {
                entries.removeLast();
            }
            accepted = valid.size();
        }
        log.info("Imported {} of {} history entries", accepted, parsed.size());
        save();
        return accepted;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Copies of the current entries, newest first. Callers never see the ledger's own objects,
     * so performance and feedback can only be attached through this class.
     */
    private synchronized List<OptimizationHistoryEntry> snapshot() {
        return entries.stream()
                .map(OptimizationHistory::copyOf)
                .collect(Collectors.toList());
    }

    private static OptimizationHistoryEntry copyOf(OptimizationHistoryEntry entry) {
        OptimizationHistoryEntry.OptimizationHistoryEntryBuilder copy = entry.toBuilder()
                .tags(copyList(entry.getTags()));
        if (entry.getPerformance() != null) {
            copy.performance(entry.getPerformance().toBuilder().build());
        }
        if (entry.getUserFeedback() != null) {
            UserFeedback feedback = entry.getUserFeedback();
            copy.userFeedback(feedback.toBuilder()
                    .reportedIssues(copyList(feedback.getReportedIssues()))
                    .suggestedImprovements(copyList(feedback.getSuggestedImprovements()))
                    .build());
        }
        if (entry.getMetadata() != null) {
            copy.metadata(entry.getMetadata().toBuilder()
                    .optimizationTechniques(copyList(entry.getMetadata().getOptimizationTechniques()))
                    .build());
        }
        return copy.build();
    }

    private static <T> List<T> copyList(List<T> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private OptimizationHistoryEntry find(String entryId) {
        for (OptimizationHistoryEntry entry : entries) {
            if (entry.getId().equals(entryId)) {
                return entry;
            }
        }
        return null;
    }

    private static boolean isValid(OptimizationHistoryEntry entry) {
        return notBlank(entry.getId())
                && entry.getTimestamp() != null
                && notBlank(entry.getConnectionId())
                && notBlank(entry.getOriginalQuery())
                && notBlank(entry.getOptimizedQuery());
    }

    private static void fillDefaults(OptimizationHistoryEntry entry) {
        if (entry.getPerformance() == null) {
            entry.setPerformance(ExecutionPerformance.pending());
        }
        if (entry.getTags() == null) {
            entry.setTags(new ArrayList<>());
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private String generateId() {
        return "opt_" + clock.millis() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    private void restore() {
        if (store == null) {
            return;
        }
        try {
            store.load(PersistenceStore.OPTIMIZATION_HISTORY, ENTRY_LIST).ifPresent(loaded -> {
                synchronized (this) {
                    loaded.stream()
                            .filter(OptimizationHistory::isValid)
                            .limit(maxSize)
                            .peek(OptimizationHistory::fillDefaults)
                            .forEach(entries::addLast);
                    log.info("Restored {} optimization history entries", entries.size());
                }
            });
        } catch (IOException | RuntimeException e) {
            log.warn("Could not restore optimization history, starting empty: {}", e.getMessage());
        }
    }

    private void save() {
        if (store == null) {
            return;
        }
        try {
            store.save(PersistenceStore.OPTIMIZATION_HISTORY, snapshot());
        } catch (IOException | RuntimeException e) {
            log.warn("Could not persist optimization history: {}", e.getMessage());
        }
    }
}
