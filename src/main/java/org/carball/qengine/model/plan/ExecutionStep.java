package org.carball.qengine.model.plan;

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
public class ExecutionStep {
    private String id;
    private StepOperation operation;
    private String description;
    private double estimatedCost;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    private boolean canParallelize;
}
