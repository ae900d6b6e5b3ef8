package org.carball.qengine.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live load of the target system. CPU, memory and disk figures are percentages (0-100),
 * network latency is milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemLoad {
    private double cpuUsage;
    private double memoryUsage;
    private double diskIo;
    private double networkLatency;
}
