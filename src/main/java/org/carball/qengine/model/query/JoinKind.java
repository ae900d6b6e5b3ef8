package org.carball.qengine.model.query;

public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    FULL,
    CROSS;

    public static JoinKind fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return INNER;
        }
        try {
            return valueOf(keyword.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return INNER;
        }
    }
}
