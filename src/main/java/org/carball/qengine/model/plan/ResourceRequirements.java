package org.carball.qengine.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Memory bounds are in megabytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRequirements {
    private double minMemory;
    private double maxMemory;
    private boolean cpuIntensive;
    private boolean ioIntensive;
    private boolean networkIntensive;
}
