package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuerySummary {
    private String query;
    private int executionCount;
    private double averageExecutionTime;
    private double errorRate;
    private Instant lastExecuted;
}
