package org.carball.qengine.analyzer;

import org.carball.qengine.model.query.ComplexityFactor;
import org.carball.qengine.model.query.ComplexityLevel;
import org.carball.qengine.model.query.QueryComplexity;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.model.query.TimeRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ComplexityScorerTest {

    private final ComplexityScorer scorer = new ComplexityScorer();

    @Test
    public void shouldMapScoresToLevelsAtThresholds() {
        assertThat(ComplexityLevel.fromScore(0)).isEqualTo(ComplexityLevel.SIMPLE);
        assertThat(ComplexityLevel.fromScore(19)).isEqualTo(ComplexityLevel.SIMPLE);
        assertThat(ComplexityLevel.fromScore(20)).isEqualTo(ComplexityLevel.MEDIUM);
        assertThat(ComplexityLevel.fromScore(49)).isEqualTo(ComplexityLevel.MEDIUM);
        assertThat(ComplexityLevel.fromScore(50)).isEqualTo(ComplexityLevel.COMPLEX);
        assertThat(ComplexityLevel.fromScore(99)).isEqualTo(ComplexityLevel.COMPLEX);
        assertThat(ComplexityLevel.fromScore(100)).isEqualTo(ComplexityLevel.VERY_COMPLEX);
    }

    @Test
    public void shouldListOnlyContributingFactors() {
        // Given
        QueryPattern pattern = QueryPattern.builder()
                .kind(QueryKind.SELECT)
                .tables(List.of("cpu"))
                .timeRange(new TimeRange("now() - 1h", "now()"))
                .build();

        // When
        QueryComplexity complexity = scorer.score(pattern);

        // Then
        assertThat(complexity.getScore()).isEqualTo(15);
        assertThat(complexity.getFactors()).extracting(ComplexityFactor::name)
                .containsExactly("table_count", "time_range");
    }

    @Test
    public void shouldScoreEmptyPatternAsZero() {
        // When
        QueryComplexity complexity = scorer.score(QueryPattern.empty());

        // Then
        assertThat(complexity.getScore()).isZero();
        assertThat(complexity.getFactors()).isEmpty();
        assertThat(scorer.generateComplexityReport(QueryPattern.empty(), complexity)).contains("  - none");
    }
}
