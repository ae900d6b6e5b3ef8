package org.carball.qengine.model.optimization;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecommendationType {
    @JsonProperty("index")
    INDEX,
    @JsonProperty("query_rewrite")
    QUERY_REWRITE,
    @JsonProperty("caching")
    CACHING,
    @JsonProperty("partitioning")
    PARTITIONING,
    @JsonProperty("configuration")
    CONFIGURATION
}
