package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of a duration model's state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelDescriptor {
    private String id;
    private String name;
    private String version;
    private double accuracy;
    private int trainingSamples;
    private Instant lastUpdated;
    @Builder.Default
    private List<String> features = new ArrayList<>();
}
