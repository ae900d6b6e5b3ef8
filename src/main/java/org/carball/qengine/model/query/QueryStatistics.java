package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryStatistics {
    private int totalQueries;
    private double averageExecutionTime;
    @Builder.Default
    private List<QuerySummary> slowQueries = new ArrayList<>();
    @Builder.Default
    private List<QuerySummary> frequentQueries = new ArrayList<>();
    private double errorRate;
    private ResourceUtilization resourceUtilization;
}
