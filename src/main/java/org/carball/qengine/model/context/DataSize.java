package org.carball.qengine.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSize {
    private long totalRows;
    // bytes
    private long totalSize;
    private double averageRowSize;
    @Builder.Default
    private double compressionRatio = 1.0;
}
