package org.carball.qengine.history;

import org.carball.qengine.model.history.ExecutionPerformance;
import org.carball.qengine.model.history.HistoryStatistics;
import org.carball.qengine.model.history.HistoryTrend;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.history.PerformanceDistribution;
import org.carball.qengine.model.history.SatisfactionStats;
import org.carball.qengine.model.history.TechniqueStats;
import org.carball.qengine.model.history.UserFeedback;
import org.carball.qengine.model.optimization.OptimizationTechnique;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregates history entries into {@link HistoryStatistics}.
 */
public class HistoryStatisticsCalculator {

    private static final int MAX_COMMON_ISSUES = 10;

    private HistoryStatisticsCalculator() {
        // Utility class - prevent instantiation
    }

    public static HistoryStatistics calculate(List<OptimizationHistoryEntry> entries) {
        int successful = (int) entries.stream().filter(e -> performance(e).isSuccess()).count();

        return HistoryStatistics.builder()
                .totalOptimizations(entries.size())
                .successfulOptimizations(successful)
                .averagePerformanceGain(averageGain(entries))
                .mostUsedTechniques(techniqueStats(entries))
                .queryTypeDistribution(queryTypeDistribution(entries))
                .performanceDistribution(performanceDistribution(entries))
                .userSatisfaction(satisfaction(entries))
                .trends(trends(entries))
                .build();
    }

    static double averageGain(List<OptimizationHistoryEntry> entries) {
        return entries.stream().mapToDouble(e -> performance(e).getPerformanceGain()).average().orElse(0);
    }

    static List<TechniqueStats> techniqueStats(List<OptimizationHistoryEntry> entries) {
        Map<String, Accumulator> byTechnique = new LinkedHashMap<>();
        for (OptimizationHistoryEntry entry : entries) {
            if (entry.getOptimizationResult() == null) {
                continue;
            }
            for (OptimizationTechnique technique : entry.getOptimizationResult().getOptimizationTechniques()) {
                byTechnique.computeIfAbsent(technique.getName(), name -> new Accumulator()).add(entry);
            }
        }

        return byTechnique.entrySet().stream()
                .map(e -> TechniqueStats.builder()
                        .technique(e.getKey())
                        .count(e.getValue().count)
                        .averageGain(e.getValue().averageGain())
                        .successRate(e.getValue().successRate())
                        .userRating(e.getValue().averageRating())
                        .build())
                .sorted(Comparator.comparingInt(TechniqueStats::getCount).reversed())
                .collect(Collectors.toList());
    }

    static Map<String, Integer> queryTypeDistribution(List<OptimizationHistoryEntry> entries) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (OptimizationHistoryEntry entry : entries) {
            String type = entry.getMetadata() != null ? entry.getMetadata().getQueryType() : "OTHER";
            distribution.merge(type, 1, Integer::sum);
        }
        return distribution;
    }

    static PerformanceDistribution performanceDistribution(List<OptimizationHistoryEntry> entries) {
        PerformanceDistribution distribution = new PerformanceDistribution();
        entries.forEach(entry -> distribution.add(performance(entry).getPerformanceGain()));
        return distribution;
    }

    static SatisfactionStats satisfaction(List<OptimizationHistoryEntry> entries) {
        List<UserFeedback> feedback = entries.stream()
                .map(OptimizationHistoryEntry::getUserFeedback)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (feedback.isEmpty()) {
            return SatisfactionStats.empty();
        }

        Map<Integer, Integer> ratings = new TreeMap<>();
        Map<String, Integer> issues = new HashMap<>();
        int helpful = 0;
        for (UserFeedback f : feedback) {
            ratings.merge(f.getRating(), 1, Integer::sum);
            if (f.isHelpful()) {
                helpful++;
            }
            if (f.getReportedIssues() != null) {
                f.getReportedIssues().forEach(issue -> issues.merge(issue, 1, Integer::sum));
            }
        }

        List<String> commonIssues = issues.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_COMMON_ISSUES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        return SatisfactionStats.builder()
                .averageRating(feedback.stream().mapToInt(UserFeedback::getRating).average().orElse(0))
                .totalRatings(feedback.size())
                .ratingDistribution(ratings)
                .helpfulPercentage((double) helpful / feedback.size())
                .commonIssues(commonIssues)
                .build();
    }

    static List<HistoryTrend> trends(List<OptimizationHistoryEntry> entries) {
        Map<LocalDate, Accumulator> byDay = new TreeMap<>();
        for (OptimizationHistoryEntry entry : entries) {
            if (entry.getTimestamp() == null) {
                continue;
            }
            LocalDate day = entry.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
            byDay.computeIfAbsent(day, d -> new Accumulator()).add(entry);
        }

        List<HistoryTrend> trends = new ArrayList<>();
        byDay.forEach((day, acc) -> trends.add(HistoryTrend.builder()
                .date(day)
                .optimizationCount(acc.count)
                .averageGain(acc.averageGain())
                .successRate(acc.successRate())
                .userSatisfaction(acc.averageRating())
                .build()));
        return trends;
    }

    private static ExecutionPerformance performance(OptimizationHistoryEntry entry) {
        return entry.getPerformance() != null ? entry.getPerformance() : ExecutionPerformance.pending();
    }

    private static class Accumulator {
        private int count;
        private double totalGain;
        private int successCount;
        private int ratingCount;
        private double ratingTotal;

        void add(OptimizationHistoryEntry entry) {
            ExecutionPerformance performance = performance(entry);
            count++;
            totalGain += performance.getPerformanceGain();
            if (performance.isSuccess()) {
                successCount++;
            }
            if (entry.getUserFeedback() != null) {
                ratingCount++;
                ratingTotal += entry.getUserFeedback().getRating();
            }
        }

        double averageGain() {
            return count > 0 ? totalGain / count : 0;
        }

        double successRate() {
            return count > 0 ? (double) successCount / count : 0;
        }

        double averageRating() {
            return ratingCount > 0 ? ratingTotal / ratingCount : 0;
        }
    }
}
