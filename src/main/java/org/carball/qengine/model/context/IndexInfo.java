package org.carball.qengine.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexInfo {
    private String name;
    @Builder.Default
    private List<String> columns = new ArrayList<>();
    @Builder.Default
    private IndexType type = IndexType.BTREE;
    private long size;
    private double usage;
    private Instant lastUsed;

    public boolean covers(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }

    public boolean leadsWith(String column) {
        return !columns.isEmpty() && columns.get(0).equalsIgnoreCase(column);
    }
}
