package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HistoryMetadata {
    private String queryType;
    private double complexity;
    @Builder.Default
    private List<String> optimizationTechniques = new ArrayList<>();
    private double estimatedBenefit;
    // filled in once execution performance is reported
    private double actualBenefit;
    private double confidenceScore;
    private String engineVersion;
}
