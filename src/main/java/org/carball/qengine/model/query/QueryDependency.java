package org.carball.qengine.model.query;

/**
 * Ordering constraint between two queries of a batch: {@code dependentIndex} must run after
 * {@code sourceIndex}.
 */
public record QueryDependency(int sourceIndex, int dependentIndex, String type, String strength) {

    public static final String DATA = "data";
    public static final String SCHEMA = "schema";
}
