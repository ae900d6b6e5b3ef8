package org.carball.qengine.optimizer;

import org.carball.qengine.analyzer.QueryAnalyzer;
import org.carball.qengine.model.context.DataSize;
import org.carball.qengine.model.context.IndexInfo;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.optimization.Recommendation;
import org.carball.qengine.model.optimization.RecommendationType;
import org.carball.qengine.model.query.QueryAnalysis;
import org.carball.qengine.model.query.QueryComplexity;
import org.carball.qengine.model.query.ResourceUsage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RecommendationAdvisorTest {

    private static final String FILTERED_QUERY =
            "SELECT * FROM users WHERE age > 30 AND status = 'active' ORDER BY created_at DESC LIMIT 10";

    private final QueryAnalyzer analyzer = new QueryAnalyzer();
    private final RecommendationAdvisor advisor = new RecommendationAdvisor();

    @Test
    public void shouldRecommendIndexesForUnindexedColumns() {
        // Given
        QueryContext context = QueryContext.builder()
                .indexInfo(List.of(IndexInfo.builder().name("idx_status").columns(List.of("status")).build()))
                .build();

        // When
        List<Recommendation> recommendations = advisor.recommendIndexes(analyzer.analyze(FILTERED_QUERY), context);

        // Then
        assertThat(recommendations).extracting(Recommendation::getImplementation).containsExactly(
                "CREATE INDEX idx_age ON users (age)",
                "CREATE INDEX idx_composite ON users (age, status)",
                "CREATE INDEX idx_order ON users (created_at)");
        assertThat(recommendations).extracting(Recommendation::getEstimatedBenefit).containsExactly(60.0, 75.0, 50.0);
    }

    @Test
    public void shouldRecommendRewrites() {
        // Given
        String query = "SELECT DISTINCT name FROM users WHERE EXISTS (SELECT 1 FROM orders) ORDER BY name LIMIT 5";

        // When
        List<Recommendation> recommendations = advisor.recommendRewrites(query, analyzer.analyze(query));

        // Then
        assertThat(recommendations).extracting(Recommendation::getTitle).containsExactly(
                "Convert EXISTS to JOIN", "Optimize DISTINCT usage", "Optimize ORDER BY with LIMIT");
        assertThat(recommendations).allMatch(r -> r.getType() == RecommendationType.QUERY_REWRITE);
    }

    @Test
    public void shouldRecommendConfigurationForHeavyQueries() {
        // Given
        QueryAnalysis analysis = QueryAnalysis.builder()
                .complexity(QueryComplexity.of(60, List.of()))
                .resourceUsage(ResourceUsage.builder().estimatedMemory(2048).build())
                .build();
        QueryContext context = QueryContext.builder()
                .dataSize(DataSize.builder().totalRows(20_000_000).build())
                .build();

        // When
        List<Recommendation> recommendations = advisor.recommendConfiguration(analysis, context);

        // Then
        assertThat(recommendations).extracting(Recommendation::getType).containsExactly(
                RecommendationType.CONFIGURATION, RecommendationType.CONFIGURATION, RecommendationType.PARTITIONING);
        assertThat(recommendations).extracting(Recommendation::getEstimatedBenefit).containsExactly(30.0, 45.0, 55.0);
    }

    @Test
    public void shouldStayQuietForLightQueries() {
        // Given
        String query = "SELECT * FROM t";

        // When
        List<Recommendation> recommendations = advisor.recommendConfiguration(analyzer.analyze(query), null);

        // Then
        assertThat(recommendations).isEmpty();
    }
}
