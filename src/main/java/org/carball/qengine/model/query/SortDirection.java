package org.carball.qengine.model.query;

public enum SortDirection {
    ASC,
    DESC
}
