package org.carball.qengine.model.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BottleneckType {
    @JsonProperty("cpu")
    CPU,
    @JsonProperty("memory")
    MEMORY,
    @JsonProperty("disk")
    DISK,
    @JsonProperty("network")
    NETWORK
}
