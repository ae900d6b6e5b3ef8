package org.carball.qengine.model.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An endpoint eligible to receive routed queries. Mutated only by health checks and
 * execution feedback.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RouteCandidate {
    private String connectionId;
    // composite 0-100 score of the last routing pass
    private double score;
    private double latency;
    // 0-1
    private double load;
    private int capacity;
    // 0-1
    private double health;
    private int priority;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private RouteMetadata metadata;
    // 0-1 score learned from execution feedback
    @Builder.Default
    private double learnedScore = 1.0;
    @Builder.Default
    private double weight = 1.0;

    public NodeRole role() {
        return metadata != null && metadata.getNodeRole() != null ? metadata.getNodeRole() : NodeRole.PRIMARY;
    }
}
