package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry counts per realized-gain bucket: excellent above 50%, good above 20%, moderate above
 * 5%, minimal above 0, negative otherwise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceDistribution {
    private int excellent;
    private int good;
    private int moderate;
    private int minimal;
    private int negative;

    public void add(double gain) {
        if (gain > 50) {
            excellent++;
        } else if (gain > 20) {
            good++;
        } else if (gain > 5) {
            moderate++;
        } else if (gain > 0) {
            minimal++;
        } else {
            negative++;
        }
    }
}
