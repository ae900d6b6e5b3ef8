package org.carball.qengine.model.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public enum LoadBalancingStrategy {
    @JsonProperty("round_robin")
    ROUND_ROBIN("round_robin"),
    @JsonProperty("least_connections")
    LEAST_CONNECTIONS("least_connections"),
    @JsonProperty("weighted")
    WEIGHTED("weighted"),
    @JsonProperty("hash")
    HASH("hash"),
    @JsonProperty("adaptive")
    ADAPTIVE("adaptive");

    private final String label;

    LoadBalancingStrategy(String label) {
        this.label = label;
    }

    public static LoadBalancingStrategy fromName(String name) {
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.label.equalsIgnoreCase(name) || strategy.name().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown load balancing strategy: " + name);
    }
}
