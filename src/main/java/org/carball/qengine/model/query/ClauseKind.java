package org.carball.qengine.model.query;

public enum ClauseKind {
    WHERE,
    HAVING
}
