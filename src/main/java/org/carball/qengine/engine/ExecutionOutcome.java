package org.carball.qengine.engine;

import org.carball.qengine.model.optimization.QueryOptimizationResult;
import org.carball.qengine.model.query.QueryExecutionResult;

/**
 * Optimization and execution of one request, with the endpoint that produced the execution
 * result and the number of attempts it took.
 */
public record ExecutionOutcome(QueryOptimizationResult optimization, QueryExecutionResult execution,
                               String connectionId, int attempts) {
}
