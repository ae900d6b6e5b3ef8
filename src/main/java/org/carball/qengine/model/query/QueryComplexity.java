package org.carball.qengine.model.query;

import lombok.Value;

import java.util.List;

@Value
public class QueryComplexity {
    int score;
    ComplexityLevel level;
    List<ComplexityFactor> factors;

    public static QueryComplexity of(int score, List<ComplexityFactor> factors) {
        return new QueryComplexity(score, ComplexityLevel.fromScore(score), List.copyOf(factors));
    }
}
