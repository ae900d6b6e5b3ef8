package org.carball.qengine.model.plan;

public enum StepOperation {
    TABLE_SCAN,
    FILTER,
    JOIN,
    AGGREGATE,
    SORT,
    LIMIT
}
