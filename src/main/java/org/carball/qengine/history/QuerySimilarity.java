package org.carball.qengine.history;

import org.carball.qengine.util.QueryText;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Token-level similarity of two queries.
 */
public class QuerySimilarity {

    private QuerySimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * Jaccard index of the whitespace-separated tokens after lower-casing, collapsing
     * whitespace and dropping quotes. Identical normalised queries score 1.0.
     */
    public static double similarity(String first, String second) {
        String a = QueryText.normalizeForSimilarity(first);
        String b = QueryText.normalizeForSimilarity(second);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        Set<String> tokensA = new HashSet<>(Arrays.asList(a.split(" ")));
        Set<String> tokensB = new HashSet<>(Arrays.asList(b.split(" ")));
        Set<String> union = new HashSet<>(tokensA);
        union.addAll(tokensB);
        tokensA.retainAll(tokensB);
        return (double) tokensA.size() / union.size();
    }
}
