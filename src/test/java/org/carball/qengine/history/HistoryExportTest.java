package org.carball.qengine.history;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.context.SystemLoad;
import org.carball.qengine.model.history.ExportFormat;
import org.carball.qengine.model.history.ExportOptions;
import org.carball.qengine.model.history.HistoryFilter;
import org.carball.qengine.model.history.OptimizationHistoryEntry;
import org.carball.qengine.model.history.UserFeedback;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.qengine.history.OptimizationHistoryTest.performance;
import static org.carball.qengine.history.OptimizationHistoryTest.result;
import static org.carball.qengine.history.OptimizationHistoryTest.technique;

public class HistoryExportTest {

    private MutableClock clock;
    private OptimizationHistory history;
    private String firstId;
    private String secondId;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        history = new OptimizationHistory(100, null, clock);
        QueryContext context = QueryContext.builder()
                .systemLoad(SystemLoad.builder().cpuUsage(20).build())
                .build();

        firstId = history.recordOptimization("db-1", "shop", "SELECT * FROM orders WHERE note = 'a, \"b\"'",
                result("SELECT * FROM orders WHERE note = 'a, \"b\"'", 30, technique("predicate_pushdown", Impact.HIGH)),
                context);
        secondId = history.recordOptimization("db-2", "shop", "SELECT id\nFROM users",
                result("SELECT id\nFROM users", 10), context);
        history.updatePerformance(firstId, performance(40, true));
        history.addUserFeedback(firstId, UserFeedback.builder().rating(5).helpful(true).comments("fast, nice").build());
    }

    @Test
    public void shouldRoundTripFullEntriesThroughJson() {
        // Given
        String json = history.exportHistory(ExportOptions.builder()
                .format(ExportFormat.JSON)
                .includeContext(true)
                .includePerformance(true)
                .includeFeedback(true)
                .build());
        OptimizationHistory target = new OptimizationHistory(100, null, clock);

        // When
        int imported = target.importHistory(json, ExportFormat.JSON);

        // Then
        assertThat(imported).isEqualTo(2);
        OptimizationHistoryEntry entry = target.getHistoryEntry(firstId).orElseThrow();
        assertThat(entry.getContext().getSystemLoad().getCpuUsage()).isEqualTo(20);
        assertThat(entry.getUserFeedback().getComments()).isEqualTo("fast, nice");
        assertThat(entry.getPerformance().getPerformanceGain()).isEqualTo(40);
        assertThat(target.queryHistory()).extracting(OptimizationHistoryEntry::getId).containsExactly(secondId, firstId);
    }

    @Test
    public void shouldLeaveOutSectionsThatWereNotRequested() {
        // Given
        String yaml = history.exportHistory(ExportOptions.builder().format(ExportFormat.YAML).build());
        OptimizationHistory target = new OptimizationHistory(100, null, clock);

        // When
        target.importHistory(yaml, ExportFormat.YAML);

        // Then
        OptimizationHistoryEntry entry = target.getHistoryEntry(firstId).orElseThrow();
        assertThat(entry.getContext()).isNull();
        assertThat(entry.getUserFeedback()).isNull();
        assertThat(entry.isPerformanceRecorded()).isFalse();
        assertThat(entry.getTags()).contains("technique:predicate_pushdown");
    }

    @Test
    public void shouldRebuildEntriesFromCsv() {
        // Given
        String csv = history.exportHistory(ExportOptions.builder()
                .format(ExportFormat.CSV)
                .includePerformance(true)
                .includeFeedback(true)
                .filter(HistoryFilter.builder().connectionId("db-1").build())
                .build());
        OptimizationHistory target = new OptimizationHistory(100, null, clock);

        // When
        int imported = target.importHistory(csv, ExportFormat.CSV);

        // Then
        assertThat(csv).startsWith("id,timestamp,connectionId,database,originalQuery,optimizedQuery,tags,");
        assertThat(imported).isEqualTo(1);
        OptimizationHistoryEntry entry = target.getHistoryEntry(firstId).orElseThrow();
        assertThat(entry.getOriginalQuery()).isEqualTo("SELECT * FROM orders WHERE note = 'a, \"b\"'");
        assertThat(entry.getTimestamp()).isEqualTo(clock.instant());
        assertThat(entry.getPerformance().getPerformanceGain()).isEqualTo(40);
        assertThat(entry.getPerformance().isSuccess()).isTrue();
        assertThat(entry.getUserFeedback().getRating()).isEqualTo(5);
        assertThat(entry.getUserFeedback().getComments()).isEqualTo("fast, nice");
        assertThat(entry.getMetadata().getOptimizationTechniques()).containsExactly("predicate_pushdown");
    }

    @Test
    public void shouldSkipInvalidAndDuplicateEntries() {
        // Given
        String json = history.exportHistory(ExportOptions.builder().format(ExportFormat.JSON).build());
        String broken = """
                [ { "id": "opt_x", "connectionId": "db", "originalQuery": "SELECT 1", "optimizedQuery": "SELECT 1" } ]
                """;

        // When
        int duplicates = history.importHistory(json, ExportFormat.JSON);
        int invalid = history.importHistory(broken, ExportFormat.JSON);

        // Then
        assertThat(duplicates).isZero();
        assertThat(invalid).isZero();
        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    public void shouldCapImportedHistory() {
        // Given
        String json = history.exportHistory(ExportOptions.builder().format(ExportFormat.JSON).build());
        OptimizationHistory small = new OptimizationHistory(2, null, clock);
        String local = small.recordOptimization("db", "app", "SELECT 9", result("SELECT 9", 5), null);

        // When
        small.importHistory(json, ExportFormat.JSON);

        // Then
        assertThat(small.size()).isEqualTo(2);
        assertThat(small.getHistoryEntry(local)).isEmpty();
    }

    @Test
    public void shouldRejectMalformedData() {
        assertThatThrownBy(() -> history.importHistory("{not json", ExportFormat.JSON))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid optimization history data");
        assertThatThrownBy(() -> ExportFormat.fromName("xlsx"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("json, csv, yaml");
    }
}
