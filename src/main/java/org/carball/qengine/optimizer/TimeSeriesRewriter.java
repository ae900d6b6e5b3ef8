package org.carball.qengine.optimizer;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites specific to time-series queries. Both operations return the input unchanged when
 * there is nothing to rewrite, so callers compare the result with the input.
 */
public class TimeSeriesRewriter {

    private static final Pattern TIME_PREDICATE = Pattern.compile(
            "\\btime\\b\\s*(>=|<=|!=|<>|=|>|<)\\s*(now\\(\\)(?:\\s*[-+]\\s*\\d+\\s*[a-z]+)?|'[^']*'|\\d+[a-z]*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RELATIVE_BOUND = Pattern.compile(
            "now\\(\\)(?:\\s*([-+])\\s*(\\d+)\\s*([a-z]+))?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_BUCKET = Pattern.compile(
            "\\bGROUP\\s+BY\\s+time\\s*\\(\\s*([^)]*?)\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern GROUP_BY_CLAUSE = Pattern.compile(
            "\\bGROUP\\s+BY\\s+.*?(?=\\s+(?:ORDER\\s+BY|LIMIT|OFFSET|SLIMIT|SOFFSET|TZ\\s*\\()|\\s*;?\\s*$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern FILL_CLAUSE = Pattern.compile("\\bfill\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE_KEYWORD = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    private TimeSeriesRewriter() {
        // Utility class - prevent instantiation
    }

    /**
     * Canonicalises the spelling of {@code time} predicates in the WHERE clause, e.g.
     * {@code time>=NOW()-1h} becomes {@code time >= now() - 1h}. Literal bounds are kept.
     */
    public static String normalizeTimeRange(String query) {
        if (query == null || !WHERE_KEYWORD.matcher(query).find()) {
            return query;
        }
        Matcher matcher = TIME_PREDICATE.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = "time " + matcher.group(1) + " " + canonicalBound(matcher.group(2));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Canonicalises {@code GROUP BY time(...)} and adds {@code fill(none)} when the query does
     * not choose a fill policy, so empty buckets are not materialised.
     */
    public static String optimizeTimeAggregation(String query) {
        if (query == null || !TIME_BUCKET.matcher(query).find()) {
            return query;
        }
        String rewritten = TIME_BUCKET.matcher(query)
                .replaceFirst(m -> Matcher.quoteReplacement("GROUP BY time(" + m.group(1) + ")"));

        if (FILL_CLAUSE.matcher(rewritten).find()) {
            return rewritten;
        }
        Matcher clause = GROUP_BY_CLAUSE.matcher(rewritten);
        if (!clause.find()) {
            return rewritten;
        }
        return rewritten.substring(0, clause.end()) + " fill(none)" + rewritten.substring(clause.end());
    }

    public static boolean hasTimeBucket(String query) {
        return query != null && TIME_BUCKET.matcher(query).find();
    }

    private static String canonicalBound(String bound) {
        Matcher relative = RELATIVE_BOUND.matcher(bound);
        if (!relative.matches()) {
            return bound;
        }
        if (relative.group(1) == null) {
            return "now()";
        }
        return "now() " + relative.group(1) + " " + relative.group(2) + relative.group(3).toLowerCase(Locale.ROOT);
    }
}
