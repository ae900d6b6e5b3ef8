package org.carball.qengine.model.optimization;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Priority {
    @JsonProperty("high")
    HIGH,
    @JsonProperty("medium")
    MEDIUM,
    @JsonProperty("low")
    LOW
}
