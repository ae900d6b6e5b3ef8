package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Join {
    private JoinKind kind;
    private String leftTable;
    private String rightTable;
    private String condition;
}
