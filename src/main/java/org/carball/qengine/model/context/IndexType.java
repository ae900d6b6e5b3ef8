package org.carball.qengine.model.context;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IndexType {
    @JsonProperty("btree")
    BTREE,
    @JsonProperty("hash")
    HASH,
    @JsonProperty("gin")
    GIN,
    @JsonProperty("gist")
    GIST
}
