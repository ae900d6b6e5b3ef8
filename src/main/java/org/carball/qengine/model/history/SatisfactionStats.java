package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SatisfactionStats {
    private double averageRating;
    private int totalRatings;
    @Builder.Default
    private Map<Integer, Integer> ratingDistribution = new TreeMap<>();
    // fraction 0..1 of rated entries marked helpful
    private double helpfulPercentage;
    @Builder.Default
    private List<String> commonIssues = new ArrayList<>();

    public static SatisfactionStats empty() {
        return new SatisfactionStats(0, 0, new TreeMap<>(), 0, new ArrayList<>());
    }
}
