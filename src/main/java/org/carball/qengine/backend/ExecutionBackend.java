package org.carball.qengine.backend;

import org.carball.qengine.model.query.QueryExecutionResult;

/**
 * Runs a query on a named endpoint. The engine never talks to a database itself; embedding
 * applications plug their driver in here.
 */
@FunctionalInterface
public interface ExecutionBackend {

    QueryExecutionResult execute(String connectionId, String query);
}
