package org.carball.qengine.model.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MLAlternative {
    private String query;
    private double score;
    @Builder.Default
    private List<String> tradeoffs = new ArrayList<>();
}
