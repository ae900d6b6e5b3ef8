package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Criteria for selecting ledger entries. Unset fields do not constrain the selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryFilter {
    private String connectionId;
    private String database;
    private DateRange dateRange;
    private String queryType;
    private Double minPerformanceGain;
    private Double maxPerformanceGain;
    private boolean successOnly;
    private boolean withFeedback;
    // an entry matches when it carries any of these tags
    private List<String> tags;
    private String search;

    public static HistoryFilter none() {
        return new HistoryFilter();
    }
}
