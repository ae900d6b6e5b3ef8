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
public class PerformanceRecord {
    private String query;
    private String connectionId;
    private Instant timestamp;
    private QueryExecutionResult result;
}
