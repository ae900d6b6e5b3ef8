package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.optimization.QueryOptimizationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One ledger record: what was optimized, in which context, and how it turned out.
 * Performance and feedback start out empty and are each filled in at most once.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationHistoryEntry {
    private String id;
    private Instant timestamp;
    private String connectionId;
    private String database;
    private String originalQuery;
    private String optimizedQuery;
    private QueryOptimizationResult optimizationResult;
    private QueryContext context;
    @Builder.Default
    private ExecutionPerformance performance = ExecutionPerformance.pending();
    private boolean performanceRecorded;
    private UserFeedback userFeedback;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private HistoryMetadata metadata;
}
