package org.carball.qengine.model.optimization;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.qengine.model.context.QueryContext;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryOptimizationRequest {
    private String query;
    private String connectionId;
    private String database;
    private String userId;
    private QueryContext context;
}
