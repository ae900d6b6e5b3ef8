package org.carball.qengine.analyzer;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.qengine.model.query.QueryDependency;
import org.carball.qengine.model.query.QueryPattern;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects ordering constraints between the queries of a batch. Statements are inspected with
 * JSqlParser first; the regex pattern is used when the parser rejects the dialect.
 */
@Slf4j
public class DependencyAnalyzer {

    private static final Pattern CREATE_TABLE_PATTERN = Pattern.compile(
            "^\\s*CREATE\\s+(?:TEMP(?:ORARY)?\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?[\"`\\[]?([A-Za-z_][A-Za-z0-9_.]*)",
            Pattern.CASE_INSENSITIVE
    );

    private DependencyAnalyzer() {
        // Utility class - prevent instantiation
    }

    public static List<QueryDependency> analyze(List<String> queries) {
        List<Set<String>> tableSets = new ArrayList<>();
        List<Optional<String>> createdTables = new ArrayList<>();
        for (String query : queries) {
            tableSets.add(tablesOf(query));
            createdTables.add(createdTable(query));
        }

        List<QueryDependency> dependencies = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            for (int j = i + 1; j < queries.size(); j++) {
                Set<String> dependentTables = tableSets.get(j);
                Optional<String> created = createdTables.get(i);
                if (created.isPresent() && dependentTables.contains(created.get())) {
                    dependencies.add(new QueryDependency(i, j, QueryDependency.SCHEMA, "high"));
                } else if (overlaps(tableSets.get(i), dependentTables)) {
                    dependencies.add(new QueryDependency(i, j, QueryDependency.DATA, "medium"));
                }
            }
        }

        log.debug("Found {} dependencies among {} queries", dependencies.size(), queries.size());
        return dependencies;
    }

    private static boolean overlaps(Set<String> a, Set<String> b) {
        return a.stream().anyMatch(b::contains);
    }

    /**
     * Lower-cased names of the tables a statement reads or writes, including the table it
     * creates.
     */
    static Set<String> tablesOf(String query) {
        Set<String> tables = new LinkedHashSet<>();
        try {
            Statement statement = CCJSqlParserUtil.parse(query);
            if (statement instanceof CreateTable createTable) {
                tables.add(cleanName(createTable.getTable().getName()));
            }
            tables.addAll(lowerCase(new TablesNamesFinder().getTableList(statement)));
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("JSqlParser could not read statement, using pattern fallback: {}", e.getMessage());
            QueryPattern pattern = QueryPatternParser.parse(query);
            tables.addAll(lowerCase(pattern.getTables()));
            createdTableFromPattern(query).ifPresent(tables::add);
        }
        return tables;
    }

    static Optional<String> createdTable(String query) {
        try {
            Statement statement = CCJSqlParserUtil.parse(query);
            if (statement instanceof CreateTable createTable) {
                return Optional.of(cleanName(createTable.getTable().getName()));
            }
            return Optional.empty();
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("JSqlParser could not read statement, using pattern fallback: {}", e.getMessage());
            return createdTableFromPattern(query);
        }
    }

    private static Optional<String> createdTableFromPattern(String query) {
        Matcher matcher = CREATE_TABLE_PATTERN.matcher(query == null ? "" : query);
        return matcher.find() ? Optional.of(cleanName(matcher.group(1))) : Optional.empty();
    }

    private static Set<String> lowerCase(Iterable<String> names) {
        Set<String> result = new LinkedHashSet<>();
        names.forEach(name -> result.add(cleanName(name)));
        return result;
    }

    private static String cleanName(String name) {
        String cleaned = name.replaceAll("[\"`\\[\\]]", "");
        int dot = cleaned.lastIndexOf('.');
        if (dot >= 0) {
            cleaned = cleaned.substring(dot + 1);
        }
        return cleaned.toLowerCase(Locale.ROOT);
    }
}
