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
public class ParallelizationInfo {
    private int maxDegreeOfParallelism;
    @Builder.Default
    private List<List<String>> parallelSteps = new ArrayList<>();
    @Builder.Default
    private List<String> bottlenecks = new ArrayList<>();
}
