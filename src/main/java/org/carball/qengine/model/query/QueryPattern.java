package org.carball.qengine.model.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class QueryPattern {
    QueryKind kind;
    @Builder.Default
    List<String> tables = List.of();
    @Builder.Default
    List<String> columns = List.of();
    @Builder.Default
    List<Condition> conditions = List.of();
    @Builder.Default
    List<Join> joins = List.of();
    @Builder.Default
    List<Aggregation> aggregations = List.of();
    @Builder.Default
    List<OrderBy> orderBy = List.of();
    @Builder.Default
    List<String> groupBy = List.of();
    Integer limit;
    Integer offset;
    TimeRange timeRange;

    public static QueryPattern empty() {
        return QueryPattern.builder().kind(QueryKind.SELECT).build();
    }

    public boolean hasWhereClause() {
        return conditions.stream().anyMatch(c -> c.getClause() == ClauseKind.WHERE);
    }

    public long whereConditionCount() {
        return conditions.stream().filter(c -> c.getClause() == ClauseKind.WHERE).count();
    }

    public boolean hasLimit() {
        return limit != null;
    }

    public boolean hasTimeRange() {
        return timeRange != null;
    }

    public boolean hasJoins() {
        return !joins.isEmpty();
    }

    public boolean hasAggregations() {
        return !aggregations.isEmpty();
    }

    public boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    public String primaryTable() {
        return tables.isEmpty() ? null : tables.get(0);
    }
}
