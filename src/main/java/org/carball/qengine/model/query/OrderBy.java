package org.carball.qengine.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBy {
    private String column;
    @Builder.Default
    private SortDirection direction = SortDirection.ASC;
}
