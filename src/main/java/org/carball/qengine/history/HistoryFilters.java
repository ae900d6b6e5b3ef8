package org.carball.qengine.history;

import org.carball.qengine.model.history.HistoryFilter;
import org.carball.qengine.model.history.OptimizationHistoryEntry;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Evaluates a {@link HistoryFilter} against entries. Unset criteria match everything.
 */
public class HistoryFilters {

    private HistoryFilters() {
        // Utility class - prevent instantiation
    }

    public static List<OptimizationHistoryEntry> apply(List<OptimizationHistoryEntry> entries, HistoryFilter filter) {
        if (filter == null) {
            return entries;
        }
        return entries.stream().filter(asPredicate(filter)).collect(Collectors.toList());
    }

    public static Predicate<OptimizationHistoryEntry> asPredicate(HistoryFilter filter) {
        return entry -> matches(entry, filter);
    }

    public static boolean matches(OptimizationHistoryEntry entry, HistoryFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.getConnectionId() != null && !filter.getConnectionId().equals(entry.getConnectionId())) {
            return false;
        }
        if (filter.getDatabase() != null && !filter.getDatabase().equals(entry.getDatabase())) {
            return false;
        }
        if (filter.getDateRange() != null && !filter.getDateRange().contains(entry.getTimestamp())) {
            return false;
        }
        if (filter.getQueryType() != null
                && (entry.getMetadata() == null || !filter.getQueryType().equalsIgnoreCase(entry.getMetadata().getQueryType()))) {
            return false;
        }

        double gain = entry.getPerformance() != null ? entry.getPerformance().getPerformanceGain() : 0;
        if (filter.getMinPerformanceGain() != null && gain < filter.getMinPerformanceGain()) {
            return false;
        }
        if (filter.getMaxPerformanceGain() != null && gain > filter.getMaxPerformanceGain()) {
            return false;
        }
        if (filter.isSuccessOnly() && (entry.getPerformance() == null || !entry.getPerformance().isSuccess())) {
            return false;
        }
        if (filter.isWithFeedback() && entry.getUserFeedback() == null) {
            return false;
        }
        if (filter.getTags() != null && !filter.getTags().isEmpty()
                && filter.getTags().stream().noneMatch(entry.getTags()::contains)) {
            return false;
        }
        return filter.getSearch() == null || filter.getSearch().isBlank() || matchesSearch(entry, filter.getSearch());
    }

    private static boolean matchesSearch(OptimizationHistoryEntry entry, String search) {
        String needle = search.toLowerCase(Locale.ROOT);
        return containsIgnoreCase(entry.getOriginalQuery(), needle)
                || containsIgnoreCase(entry.getOptimizedQuery(), needle)
                || containsIgnoreCase(entry.getDatabase(), needle)
                || entry.getTags().stream().anyMatch(tag -> containsIgnoreCase(tag, needle));
    }

    private static boolean containsIgnoreCase(String text, String lowerNeedle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
