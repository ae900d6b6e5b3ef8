package org.carball.qengine.model.ml;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ModelType {
    @JsonProperty("regression")
    REGRESSION,
    @JsonProperty("classification")
    CLASSIFICATION,
    @JsonProperty("clustering")
    CLUSTERING,
    @JsonProperty("reinforcement")
    REINFORCEMENT
}
