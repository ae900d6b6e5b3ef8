package org.carball.qengine.model.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.query.QueryExecutionResult;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingSample {
    private String queryHash;
    private PerformanceFeatures features;
    private QueryExecutionResult actualPerformance;
    private Instant timestamp;
}
