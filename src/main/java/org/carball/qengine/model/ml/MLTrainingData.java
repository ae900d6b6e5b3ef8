package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.context.QueryContext;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MLTrainingData {
    private String originalQuery;
    private String optimizedQuery;
    private ObservedPerformance performance;
    private QueryContext context;
    private TrainingFeedback feedback;
    private Instant timestamp;
}
