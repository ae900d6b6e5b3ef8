package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptor of a registered optimization model. Models are never removed, only deactivated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MLModel {
    private String id;
    private String name;
    private ModelType type;
    private String version;
    private double accuracy;
    private int trainingSamples;
    @Builder.Default
    private List<String> features = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> hyperparameters = new LinkedHashMap<>();
    private Instant lastTrained;
    private boolean active;
}
