package org.carball.qengine.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Aggregation {
    private String function;
    private String column;
    private String alias;

    /**
     * Aggregate functions that can be computed as partial results and merged.
     */
    public static final Set<String> DECOMPOSABLE_FUNCTIONS = Set.of("SUM", "COUNT", "MIN", "MAX", "AVG");

    @JsonIgnore
    public boolean isDecomposable() {
        return function != null && DECOMPOSABLE_FUNCTIONS.contains(function.toUpperCase());
    }
}
