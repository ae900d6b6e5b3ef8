package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Measured outcome of running a query on an execution backend. Times are milliseconds,
 * memory and network figures bytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryExecutionResult {
    private long executionTime;
    private long rowsAffected;
    private long memoryUsed;
    private long diskReads;
    private long diskWrites;
    private long networkBytes;
    private boolean success;
    private String error;
}
