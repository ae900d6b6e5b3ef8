package org.carball.qengine.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Time bounds of a time-series query. Bounds are kept as written, either literal timestamps
 * or relative expressions such as {@code now() - 1h}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {
    private String start;
    private String end;

    @JsonIgnore
    public boolean isRelative() {
        return start != null && start.startsWith("now()");
    }
}
