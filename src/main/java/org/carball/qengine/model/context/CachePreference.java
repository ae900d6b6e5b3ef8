package org.carball.qengine.model.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CachePreference {
    @JsonProperty("aggressive")
    AGGRESSIVE,
    @JsonProperty("conservative")
    CONSERVATIVE,
    @JsonProperty("disabled")
    DISABLED
}
