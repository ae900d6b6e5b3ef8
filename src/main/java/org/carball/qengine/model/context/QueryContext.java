package org.carball.qengine.model.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime context of a query. Every part is optional; the accessor methods below apply the
 * documented defaults so callers never branch on missing sections themselves.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryContext {

    @Builder.Default
    private List<String> historicalQueries = new ArrayList<>();
    private UserPreferences userPreferences;
    private SystemLoad systemLoad;
    private DataSize dataSize;
    @Builder.Default
    private List<IndexInfo> indexInfo = new ArrayList<>();

    @JsonIgnore
    public double cpuUsage(double fallback) {
        return systemLoad != null ? systemLoad.getCpuUsage() : fallback;
    }

    @JsonIgnore
    public double memoryUsage(double fallback) {
        return systemLoad != null ? systemLoad.getMemoryUsage() : fallback;
    }

    @JsonIgnore
    public double diskIo(double fallback) {
        return systemLoad != null ? systemLoad.getDiskIo() : fallback;
    }

    @JsonIgnore
    public double networkLatency(double fallback) {
        return systemLoad != null ? systemLoad.getNetworkLatency() : fallback;
    }

    @JsonIgnore
    public long totalRows() {
        return dataSize != null ? dataSize.getTotalRows() : 0;
    }

    @JsonIgnore
    public long totalSize() {
        return dataSize != null ? dataSize.getTotalSize() : 0;
    }

    @JsonIgnore
    public CachePreference cachePreference() {
        return userPreferences != null && userPreferences.getCachePreference() != null
                ? userPreferences.getCachePreference()
                : CachePreference.CONSERVATIVE;
    }

    @JsonIgnore
    public boolean hasIndexes() {
        return indexInfo != null && !indexInfo.isEmpty();
    }

    @JsonIgnore
    public boolean hasIndexOn(String column) {
        return hasIndexes() && indexInfo.stream().anyMatch(index -> index.covers(column));
    }

    @JsonIgnore
    public boolean hasIndexLeadingWith(String column) {
        return hasIndexes() && indexInfo.stream().anyMatch(index -> index.leadsWith(column));
    }
}
