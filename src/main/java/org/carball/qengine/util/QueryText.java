package org.carball.qengine.util;

import java.util.regex.Pattern;

/**
 * Normalisation and hashing of raw query text.
 */
public class QueryText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern QUOTES = Pattern.compile("['\"]");

    private QueryText() {
        // Utility class - prevent instantiation
    }

    /**
     * Trims and collapses runs of whitespace to a single space.
     */
    public static String collapseWhitespace(String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    /**
     * Key under which executions of the same statement are grouped: lower case, collapsed
     * whitespace.
     */
    public static String normalize(String query) {
        return collapseWhitespace(query).toLowerCase();
    }

    /**
     * Normalised form used for similarity comparisons; quotes are dropped as well.
     */
    public static String normalizeForSimilarity(String query) {
        return QUOTES.matcher(normalize(query)).replaceAll("");
    }

    /**
     * Stable hash of the normalised query, rendered in hex.
     */
    public static String hash(String query) {
        return Integer.toHexString(normalize(query).hashCode());
    }

    /**
     * Non-negative bucket for hash-based distribution.
     */
    public static int bucket(String query, int buckets) {
        return Math.floorMod(normalize(query).hashCode(), buckets);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
