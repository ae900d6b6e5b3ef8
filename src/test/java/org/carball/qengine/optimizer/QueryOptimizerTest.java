package org.carball.qengine.optimizer;

import org.carball.qengine.analyzer.QueryAnalyzer;
import org.carball.qengine.ml.MLOptimizer;
import org.carball.qengine.ml.MLTechniques;
import org.carball.qengine.model.optimization.Impact;
import org.carball.qengine.model.optimization.OptimizationTechnique;
import org.carball.qengine.model.optimization.OptimizedQuery;
import org.carball.qengine.model.query.QueryPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class QueryOptimizerTest {

    private static final String FILTERED_QUERY =
            "SELECT * FROM users WHERE age > 30 AND status = 'active' ORDER BY created_at DESC LIMIT 10";
    private static final String FIVE_TABLE_QUERY = "SELECT * FROM a JOIN b ON a.id = b.a_id JOIN c ON b.id = c.b_id " +
            "JOIN d ON c.id = d.c_id JOIN e ON d.id = e.d_id";

    private final QueryAnalyzer analyzer = new QueryAnalyzer();
    private QueryOptimizer rulesOnly;

    @BeforeEach
    public void setUp() {
        rulesOnly = new QueryOptimizer(new MLOptimizer(), false);
    }

    @Test
    public void shouldApplyMatchingRulesInOrder() {
        // When
        OptimizedQuery result = rulesOnly.optimize(FILTERED_QUERY, analyzer.analyze(FILTERED_QUERY));

        // Then
        assertThat(result.getQuery()).isEqualTo(FILTERED_QUERY);
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getName)
                .containsExactly("predicate_pushdown", "limit_pushdown");
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getImpact)
                .containsExactly(Impact.HIGH, Impact.LOW);
        assertThat(result.getTechniques().get(0).getAppliedTo()).containsExactly("age", "status");
        assertThat(result.getEstimatedImprovement()).isEqualTo(45);
        assertThat(result.getConfidence()).isCloseTo(4.0 / 2 / 3 * 100, within(1e-9));
    }

    @Test
    public void shouldReportZeroConfidenceWithoutTechniques() {
        // Given
        String query = "SELECT * FROM t";

        // When
        OptimizedQuery result = rulesOnly.optimize(query, analyzer.analyze(query));

        // Then
        assertThat(result.getTechniques()).isEmpty();
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getEstimatedImprovement()).isZero();
    }

    @Test
    public void shouldAppendMlTechniques() {
        // Given
        QueryOptimizer optimizer = new QueryOptimizer(new MLOptimizer(), true);

        // When
        OptimizedQuery result = optimizer.optimize(FIVE_TABLE_QUERY, analyzer.analyze(FIVE_TABLE_QUERY));

        // Then
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getName)
                .containsExactly("join_reordering", MLTechniques.JOIN_OPTIMIZATION, MLTechniques.JOIN_REORDERING);
        assertThat(result.getEstimatedImprovement()).isEqualTo(25 + 35 + 30);
        assertThat(result.getConfidence()).isCloseTo(7.0 / 3 / 3 * 100, within(1e-9));
    }

    @Test
    public void shouldNormalizeTimeRangeAndAddFillPolicy() {
        // Given
        String query = "SELECT mean(value) FROM cpu WHERE time>=NOW()-1h GROUP BY time( 5m )";

        // When
        OptimizedQuery result = rulesOnly.optimize(query, analyzer.analyze(query));

        // Then
        assertThat(result.getQuery())
                .isEqualTo("SELECT mean(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(5m) fill(none)");
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getName)
                .contains(QueryOptimizer.TIME_RANGE_OPTIMIZATION, QueryOptimizer.TIME_AGGREGATION_OPTIMIZATION);
    }

    @Test
    public void shouldLeaveCanonicalTimeSeriesQueryUntouched() {
        // Given
        String query = "SELECT mean(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(5m) fill(previous)";

        // When
        OptimizedQuery result = rulesOnly.optimize(query, analyzer.analyze(query));

        // Then
        assertThat(result.getQuery()).isEqualTo(query);
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getName)
                .doesNotContain(QueryOptimizer.TIME_RANGE_OPTIMIZATION, QueryOptimizer.TIME_AGGREGATION_OPTIMIZATION);
    }

    @Test
    public void shouldCapTotalImprovement() {
        // Given
        for (int i = 0; i < 5; i++) {
            rulesOnly.addRule(new FixedGainRule("custom_" + i, 30));
        }

        // When
        OptimizedQuery result = rulesOnly.optimize(FILTERED_QUERY, analyzer.analyze(FILTERED_QUERY));

        // Then
        assertThat(result.getEstimatedImprovement()).isEqualTo(95);
        assertThat(rulesOnly.getRuleNames()).hasSize(9);
    }

    @Test
    public void shouldSkipFailingRule() {
        // Given
        rulesOnly.addRule(new FixedGainRule("broken", 30) {
            @Override
            public Outcome apply(String query, QueryPattern pattern) {
                throw new IllegalStateException("boom");
            }
        });

        // When
        OptimizedQuery result = rulesOnly.optimize(FILTERED_QUERY, analyzer.analyze(FILTERED_QUERY));

        // Then
        assertThat(result.getTechniques()).extracting(OptimizationTechnique::getName).doesNotContain("broken");
    }

    private static class FixedGainRule implements OptimizationRule {

        private final String name;
        private final double gain;

        FixedGainRule(String name, double gain) {
            this.name = name;
            this.gain = gain;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String description() {
            return "Fixed gain rule";
        }

        @Override
        public double estimatedGain() {
            return gain;
        }

        @Override
        public boolean appliesTo(QueryPattern pattern) {
            return true;
        }

        @Override
        public Outcome apply(String query, QueryPattern pattern) {
            return Outcome.applied(query, List.of(name));
        }
    }
}
