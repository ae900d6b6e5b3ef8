package org.carball.qengine.model.optimization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public enum Impact {
    @JsonProperty("high")
    HIGH(3),
    @JsonProperty("medium")
    MEDIUM(2),
    @JsonProperty("low")
    LOW(1);

    private final int weight;

    Impact(int weight) {
        this.weight = weight;
    }

    /**
     * Tiers an estimated percentage gain: above 25 is high, above 15 medium, the rest low.
     */
    public static Impact fromGain(double gain) {
        if (gain > 25) {
            return HIGH;
        } else if (gain > 15) {
            return MEDIUM;
        }
        return LOW;
    }
}
