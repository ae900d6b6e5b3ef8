package org.carball.qengine.model.query;

public enum QueryKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    DROP,
    SHOW;

    public boolean isRead() {
        return this == SELECT || this == SHOW;
    }

    public boolean isWrite() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }

    /**
     * Classifies a query by its leading verb. Unknown verbs are treated as SELECT.
     */
    public static QueryKind fromLeadingVerb(String query) {
        if (query == null) {
            return SELECT;
        }
        String trimmed = query.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        String verb = trimmed.substring(0, end).toUpperCase();
        for (QueryKind kind : values()) {
            if (kind.name().equals(verb)) {
                return kind;
            }
        }
        return SELECT;
    }
}
