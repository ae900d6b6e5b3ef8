package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Condition {
    private String column;
    private String operator;
    private String value;
    private ClauseKind clause;

    /**
     * Comparison operators recognised in WHERE and HAVING clauses
     */
    public static final Set<String> VALID_OPERATORS = Set.of(
        "=", "!=", "<>", ">=", "<=", ">", "<", "LIKE", "IN"
    );
}
