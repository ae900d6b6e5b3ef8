package org.carball.qengine.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public enum ComplexityLevel {
    @JsonProperty("simple")
    SIMPLE("simple", 20),
    @JsonProperty("medium")
    MEDIUM("medium", 50),
    @JsonProperty("complex")
    COMPLEX("complex", 100),
    @JsonProperty("very_complex")
    VERY_COMPLEX("very_complex", Integer.MAX_VALUE);

    private final String label;
    private final int upperBound;

    ComplexityLevel(String label, int upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public static ComplexityLevel fromScore(int score) {
        if (score < SIMPLE.upperBound) {
            return SIMPLE;
        } else if (score < MEDIUM.upperBound) {
            return MEDIUM;
        } else if (score < COMPLEX.upperBound) {
            return COMPLEX;
        } else {
            return VERY_COMPLEX;
        }
    }
}
