package org.carball.qengine.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum ExportFormat {
    @JsonProperty("json")
    JSON,
    @JsonProperty("csv")
    CSV,
    @JsonProperty("yaml")
    YAML;

    public static ExportFormat fromName(String name) {
        for (ExportFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported history format: " + name +
                ". Available formats: " + Arrays.stream(values())
                .map(f -> f.name().toLowerCase())
                .collect(Collectors.joining(", ")));
    }
}
