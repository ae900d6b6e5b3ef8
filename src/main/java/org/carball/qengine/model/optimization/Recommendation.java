package org.carball.qengine.model.optimization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {
    private RecommendationType type;
    private Priority priority;
    private String title;
    private String description;
    private String implementation;
    private double estimatedBenefit;

    public static final Comparator<Recommendation> BY_BENEFIT_DESC =
            Comparator.comparingDouble(Recommendation::getEstimatedBenefit).reversed();
}
