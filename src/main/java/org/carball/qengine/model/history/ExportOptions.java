package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportOptions {
    @Builder.Default
    private ExportFormat format = ExportFormat.JSON;
    private boolean includeContext;
    private boolean includePerformance;
    private boolean includeFeedback;
    private HistoryFilter filter;
}
