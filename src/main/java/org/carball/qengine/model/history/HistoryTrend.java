package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryTrend {
    private LocalDate date;
    private int optimizationCount;
    private double averageGain;
    private double successRate;
    private double userSatisfaction;
}
