package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {
    private double estimatedMemory;
    private double estimatedCpu;
    private double estimatedIo;
    private double estimatedNetwork;
}
