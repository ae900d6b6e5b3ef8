package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.optimization.Priority;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceRecommendation {
    // optimization, resource, configuration or architecture
    private String category;
    private Priority priority;
    private String title;
    private String description;
    private double expectedImprovement;
    private Priority implementationCost;
}
