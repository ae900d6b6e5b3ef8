package org.carball.qengine.model.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {
    @JsonProperty("low")
    LOW,
    @JsonProperty("medium")
    MEDIUM,
    @JsonProperty("high")
    HIGH,
    @JsonProperty("critical")
    CRITICAL
}
