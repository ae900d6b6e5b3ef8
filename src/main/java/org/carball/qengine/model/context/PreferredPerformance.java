package org.carball.qengine.model.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PreferredPerformance {
    @JsonProperty("speed")
    SPEED,
    @JsonProperty("accuracy")
    ACCURACY,
    @JsonProperty("balanced")
    BALANCED
}
