package org.carball.qengine.analyzer;

import org.carball.qengine.model.query.Aggregation;
import org.carball.qengine.model.query.ClauseKind;
import org.carball.qengine.model.query.Condition;
import org.carball.qengine.model.query.Join;
import org.carball.qengine.model.query.JoinKind;
import org.carball.qengine.model.query.OrderBy;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.model.query.SortDirection;
import org.carball.qengine.model.query.TimeRange;
import org.carball.qengine.util.QueryText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regex-based extraction of the structural parts of a query. This is a heuristic reader,
 * not a grammar: anything it cannot recognise is left out of the pattern.
 */
public class QueryPatternParser {

    private static final String IDENTIFIER = "[\"`\\[]?([A-Za-z_][A-Za-z0-9_.]*)[\"`\\]]?";

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "\\b(?:FROM|INTO|UPDATE)\\s+" + IDENTIFIER,
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern JOIN_PATTERN = Pattern.compile(
            "\\b(?:(INNER|LEFT|RIGHT|FULL|CROSS)\\s+)?(?:OUTER\\s+)?JOIN\\s+" + IDENTIFIER +
            "(?:\\s+(?:AS\\s+)?(?!(?:ON|WHERE|INNER|LEFT|RIGHT|FULL|CROSS|OUTER|JOIN|GROUP|ORDER|LIMIT|HAVING)\\b)[A-Za-z_][A-Za-z0-9_]*)?" +
            "(?:\\s+ON\\s+(.+?)(?=\\s+(?:(?:INNER|LEFT|RIGHT|FULL|CROSS)\\s+)?(?:OUTER\\s+)?JOIN\\b" +
            "|\\s+WHERE\\b|\\s+GROUP\\s+BY\\b|\\s+ORDER\\s+BY\\b|\\s+HAVING\\b|\\s+LIMIT\\b|$))?",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SELECT_LIST_PATTERN = Pattern.compile(
            "^SELECT\\s+(?:DISTINCT\\s+)?(.*?)\\s+FROM\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ALIAS_PATTERN = Pattern.compile(
            "\\s+AS\\s+\\w+$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern WHERE_PATTERN = Pattern.compile(
            "\\bWHERE\\s+(.*?)(?=\\s+GROUP\\s+BY\\b|\\s+ORDER\\s+BY\\b|\\s+HAVING\\b|\\s+LIMIT\\b|$)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern HAVING_PATTERN = Pattern.compile(
            "\\bHAVING\\s+(.*?)(?=\\s+ORDER\\s+BY\\b|\\s+LIMIT\\b|$)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LOGICAL_SPLIT = Pattern.compile(
            "\\s+(?:AND|OR)\\s+",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern CONDITION_PATTERN = Pattern.compile(
            "^\\(*\\s*([A-Za-z_][A-Za-z0-9_.]*(?:\\([^)]*\\))?)\\s*(>=|<=|!=|<>|=|>|<|\\bLIKE\\b|\\bIN\\b)\\s*(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AGGREGATION_PATTERN = Pattern.compile(
            "\\b(COUNT|SUM|AVG|MIN|MAX|FIRST|LAST|MEAN|MEDIAN|MODE|STDDEV)\\s*\\(\\s*([^)]*?)\\s*\\)(?:\\s+AS\\s+(\\w+))?",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ORDER_BY_PATTERN = Pattern.compile(
            "\\bORDER\\s+BY\\s+(.*?)(?=\\s+LIMIT\\b|\\s+OFFSET\\b|$)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SORT_ITEM_PATTERN = Pattern.compile(
            "^(.+?)(?:\\s+(ASC|DESC))?$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GROUP_BY_PATTERN = Pattern.compile(
            "\\bGROUP\\s+BY\\s+(.*?)(?=\\s+HAVING\\b|\\s+ORDER\\s+BY\\b|\\s+LIMIT\\b|\\s+FILL\\b|$)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LIMIT_PATTERN = Pattern.compile("\\bLIMIT\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OFFSET_PATTERN = Pattern.compile("\\bOFFSET\\s+(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ABSOLUTE_TIME_RANGE = Pattern.compile(
            "\\btime\\s*>=?\\s*'([^']+)'.*?\\btime\\s*<=?\\s*'([^']+)'",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern RELATIVE_TIME_RANGE = Pattern.compile(
            "\\btime\\s*>=?\\s*now\\(\\)\\s*-\\s*([A-Za-z0-9_]+)",
            Pattern.CASE_INSENSITIVE
    );

    private QueryPatternParser() {
        // Utility class - prevent instantiation
    }

    public static QueryPattern parse(String query) {
        String sql = stripTerminator(QueryText.collapseWhitespace(query));
        if (sql.isEmpty()) {
            return QueryPattern.empty();
        }

        List<Join> joins = extractJoins(sql);
        List<String> tables = extractTables(sql, joins);
        if (!joins.isEmpty() && !tables.isEmpty()) {
            String left = tables.get(0);
            joins.forEach(join -> join.setLeftTable(left));
        }

        String selectList = extractSelectList(sql);
        List<Condition> conditions = new ArrayList<>();
        conditions.addAll(extractConditions(sql, WHERE_PATTERN, ClauseKind.WHERE));
        conditions.addAll(extractConditions(sql, HAVING_PATTERN, ClauseKind.HAVING));

        return QueryPattern.builder()
                .kind(QueryKind.fromLeadingVerb(sql))
                .tables(List.copyOf(tables))
                .columns(extractColumns(selectList))
                .conditions(List.copyOf(conditions))
                .joins(List.copyOf(joins))
                .aggregations(extractAggregations(selectList != null ? selectList : sql))
                .orderBy(extractOrderBy(sql))
                .groupBy(extractGroupBy(sql))
                .limit(extractInteger(sql, LIMIT_PATTERN))
                .offset(extractInteger(sql, OFFSET_PATTERN))
                .timeRange(extractTimeRange(sql))
                .build();
    }

    private static String stripTerminator(String sql) {
        String result = sql;
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    private static List<String> extractTables(String sql, List<Join> joins) {
        List<String> tables = new ArrayList<>();
        Matcher matcher = TABLE_PATTERN.matcher(sql);
        while (matcher.find()) {
            addDistinct(tables, matcher.group(1));
        }
        joins.forEach(join -> addDistinct(tables, join.getRightTable()));
        return tables;
    }

    private static void addDistinct(List<String> tables, String table) {
        if (table != null && tables.stream().noneMatch(t -> t.equalsIgnoreCase(table))) {
            tables.add(table);
        }
    }

    private static List<Join> extractJoins(String sql) {
        List<Join> joins = new ArrayList<>();
        Matcher matcher = JOIN_PATTERN.matcher(sql);
        while (matcher.find()) {
            joins.add(Join.builder()
                    .kind(JoinKind.fromKeyword(matcher.group(1)))
                    .rightTable(matcher.group(2))
                    .condition(matcher.group(3) != null ? matcher.group(3).trim() : null)
                    .build());
        }
        return joins;
    }

    private static String extractSelectList(String sql) {
        Matcher matcher = SELECT_LIST_PATTERN.matcher(sql);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static List<String> extractColumns(String selectList) {
        if (selectList == null) {
            return List.of();
        }
        List<String> columns = new ArrayList<>();
        for (String item : splitTopLevel(selectList)) {
            String column = ALIAS_PATTERN.matcher(item.trim()).replaceAll("").trim();
            if (!column.isEmpty() && !column.equals("*")) {
                columns.add(column);
            }
        }
        return List.copyOf(columns);
    }

    private static List<Condition> extractConditions(String sql, Pattern clausePattern, ClauseKind clause) {
        Matcher matcher = clausePattern.matcher(sql);
        if (!matcher.find() || matcher.group(1).isBlank()) {
            return List.of();
        }
        List<Condition> conditions = new ArrayList<>();
        for (String part : LOGICAL_SPLIT.split(matcher.group(1).trim())) {
            Matcher condition = CONDITION_PATTERN.matcher(part.trim());
            if (condition.matches()) {
                conditions.add(Condition.builder()
                        .column(condition.group(1))
                        .operator(condition.group(2).toUpperCase())
                        .value(stripClosingParens(condition.group(3)))
                        .clause(clause)
                        .build());
            } else {
                // unparseable predicate, kept verbatim
                conditions.add(Condition.builder()
                        .value(part.trim())
                        .clause(clause)
                        .build());
            }
        }
        return conditions;
    }

    private static String stripClosingParens(String value) {
        String result = value;
        while (result.endsWith(")") && count(result, '(') < count(result, ')')) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    private static long count(String text, char c) {
        return text.chars().filter(ch -> ch == c).count();
    }

    private static List<Aggregation> extractAggregations(String text) {
        List<Aggregation> aggregations = new ArrayList<>();
        Matcher matcher = AGGREGATION_PATTERN.matcher(text);
        while (matcher.find()) {
            aggregations.add(Aggregation.builder()
                    .function(matcher.group(1).toUpperCase())
                    .column(matcher.group(2).isEmpty() ? "*" : matcher.group(2))
                    .alias(matcher.group(3))
                    .build());
        }
        return List.copyOf(aggregations);
    }

    private static List<OrderBy> extractOrderBy(String sql) {
        Matcher matcher = ORDER_BY_PATTERN.matcher(sql);
        if (!matcher.find()) {
            return List.of();
        }
        List<OrderBy> orderBy = new ArrayList<>();
        for (String item : splitTopLevel(matcher.group(1))) {
            Matcher sort = SORT_ITEM_PATTERN.matcher(item.trim());
            if (sort.matches() && !sort.group(1).isBlank()) {
                SortDirection direction = "DESC".equalsIgnoreCase(sort.group(2))
                        ? SortDirection.DESC : SortDirection.ASC;
                orderBy.add(new OrderBy(sort.group(1).trim(), direction));
            }
        }
        return List.copyOf(orderBy);
    }

    private static List<String> extractGroupBy(String sql) {
        Matcher matcher = GROUP_BY_PATTERN.matcher(sql);
        if (!matcher.find()) {
            return List.of();
        }
        return splitTopLevel(matcher.group(1)).stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Integer extractInteger(String sql, Pattern pattern) {
        Matcher matcher = pattern.matcher(sql);
        if (matcher.find()) {
            try {
                return Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                // more digits than an int holds; treated as absent
                return null;
            }
        }
        return null;
    }

    private static TimeRange extractTimeRange(String sql) {
        Matcher absolute = ABSOLUTE_TIME_RANGE.matcher(sql);
        if (absolute.find()) {
            return new TimeRange(absolute.group(1), absolute.group(2));
        }
        Matcher relative = RELATIVE_TIME_RANGE.matcher(sql);
        if (relative.find()) {
            return new TimeRange("now() - " + relative.group(1), "now()");
        }
        return null;
    }

    /**
     * Splits on commas that are not nested inside parentheses.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }
}
