package org.carball.qengine.model.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum NodeRole {
    @JsonProperty("primary")
    PRIMARY,
    @JsonProperty("secondary")
    SECONDARY,
    @JsonProperty("cache")
    CACHE,
    @JsonProperty("analytics")
    ANALYTICS
}
