package org.carball.qengine.analyzer;

import org.carball.qengine.model.query.Aggregation;
import org.carball.qengine.model.query.ClauseKind;
import org.carball.qengine.model.query.Condition;
import org.carball.qengine.model.query.Join;
import org.carball.qengine.model.query.JoinKind;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.model.query.SortDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class QueryPatternParserTest {

    @Test
    public void shouldExtractAllClausesOfJoinedAggregateQuery() {
        // Given
        String query = "SELECT u.name, COUNT(o.id) AS order_count FROM users u " +
                "INNER JOIN orders o ON u.id = o.user_id " +
                "WHERE u.active = 1 AND o.total > 100 " +
                "GROUP BY u.name ORDER BY order_count DESC LIMIT 10 OFFSET 5";

        // When
        QueryPattern pattern = QueryPatternParser.parse(query);

        // Then
        assertThat(pattern.getKind()).isEqualTo(QueryKind.SELECT);
        assertThat(pattern.getTables()).containsExactly("users", "orders");
        assertThat(pattern.getColumns()).containsExactly("u.name", "COUNT(o.id)");

        assertThat(pattern.getJoins()).hasSize(1);
        Join join = pattern.getJoins().get(0);
        assertThat(join.getKind()).isEqualTo(JoinKind.INNER);
        assertThat(join.getLeftTable()).isEqualTo("users");
        assertThat(join.getRightTable()).isEqualTo("orders");
        assertThat(join.getCondition()).isEqualTo("u.id = o.user_id");

        assertThat(pattern.getConditions()).extracting(Condition::getColumn)
                .containsExactly("u.active", "o.total");
        assertThat(pattern.getConditions()).extracting(Condition::getOperator)
                .containsExactly("=", ">");
        assertThat(pattern.getConditions()).extracting(Condition::getValue)
                .containsExactly("1", "100");

        Aggregation aggregation = pattern.getAggregations().get(0);
        assertThat(aggregation.getFunction()).isEqualTo("COUNT");
        assertThat(aggregation.getColumn()).isEqualTo("o.id");
        assertThat(aggregation.getAlias()).isEqualTo("order_count");

        assertThat(pattern.getGroupBy()).containsExactly("u.name");
        assertThat(pattern.getOrderBy()).hasSize(1);
        assertThat(pattern.getOrderBy().get(0).getColumn()).isEqualTo("order_count");
        assertThat(pattern.getOrderBy().get(0).getDirection()).isEqualTo(SortDirection.DESC);
        assertThat(pattern.getLimit()).isEqualTo(10);
        assertThat(pattern.getOffset()).isEqualTo(5);
    }

    @Test
    public void shouldDetectRelativeTimeRange() {
        // Given
        String query = "SELECT mean(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(5m)";

        // When
        QueryPattern pattern = QueryPatternParser.parse(query);

        // Then
        assertThat(pattern.getTimeRange()).isNotNull();
        assertThat(pattern.getTimeRange().getStart()).isEqualTo("now() - 1h");
        assertThat(pattern.getTimeRange().getEnd()).isEqualTo("now()");
        assertThat(pattern.getTimeRange().isRelative()).isTrue();
        assertThat(pattern.getGroupBy()).containsExactly("time(5m)");
        assertThat(pattern.getAggregations()).extracting(Aggregation::getFunction).containsExactly("MEAN");
        assertThat(pattern.getConditions().get(0).getValue()).isEqualTo("now() - 1h");
    }

    @Test
    public void shouldDetectAbsoluteTimeRange() {
        // Given
        String query = "SELECT * FROM measurements WHERE time >= '2023-01-01' AND time <= '2023-01-31'";

        // When
        QueryPattern pattern = QueryPatternParser.parse(query);

        // Then
        assertThat(pattern.getTimeRange().getStart()).isEqualTo("2023-01-01");
        assertThat(pattern.getTimeRange().getEnd()).isEqualTo("2023-01-31");
        assertThat(pattern.getColumns()).isEmpty();
        assertThat(pattern.getConditions()).hasSize(2);
    }

    @Test
    public void shouldClassifyWriteStatements() {
        // When
        QueryPattern insert = QueryPatternParser.parse("INSERT INTO orders (id, total) VALUES (1, 2)");
        QueryPattern update = QueryPatternParser.parse("update accounts set balance = 0 where id = 7;");

        // Then
        assertThat(insert.getKind()).isEqualTo(QueryKind.INSERT);
        assertThat(insert.getTables()).containsExactly("orders");
        assertThat(update.getKind()).isEqualTo(QueryKind.UPDATE);
        assertThat(update.getTables()).containsExactly("accounts");
        assertThat(update.getConditions()).hasSize(1);
    }

    @Test
    public void shouldDefaultUnknownVerbToSelect() {
        // When
        QueryPattern pattern = QueryPatternParser.parse("EXPLAIN something odd");

        // Then
        assertThat(pattern.getKind()).isEqualTo(QueryKind.SELECT);
    }

    @Test
    public void shouldKeepUnparseablePredicateVerbatim() {
        // Given
        String query = "SELECT * FROM t WHERE EXISTS (SELECT 1 FROM s)";

        // When
        QueryPattern pattern = QueryPatternParser.parse(query);

        // Then
        assertThat(pattern.getConditions()).hasSize(1);
        Condition condition = pattern.getConditions().get(0);
        assertThat(condition.getColumn()).isNull();
        assertThat(condition.getValue()).isEqualTo("EXISTS (SELECT 1 FROM s)");
        assertThat(condition.getClause()).isEqualTo(ClauseKind.WHERE);
    }

    @Test
    public void shouldParseMultipleJoinKinds() {
        // Given
        String query = "SELECT * FROM a LEFT OUTER JOIN b ON a.id = b.a_id CROSS JOIN c";

        // When
        QueryPattern pattern = QueryPatternParser.parse(query);

        // Then
        assertThat(pattern.getJoins()).extracting(Join::getKind).containsExactly(JoinKind.LEFT, JoinKind.CROSS);
        assertThat(pattern.getJoins().get(0).getCondition()).isEqualTo("a.id = b.a_id");
        assertThat(pattern.getJoins().get(1).getCondition()).isNull();
        assertThat(pattern.getTables()).containsExactly("a", "b", "c");
    }

    @Test
    public void shouldSplitOnlyTopLevelCommas() {
        // When
        List<String> parts = QueryPatternParser.splitTopLevel("a, coalesce(b, c), d");

        // Then
        assertThat(parts).hasSize(3);
        assertThat(parts.get(1).trim()).isEqualTo("coalesce(b, c)");
    }
}
