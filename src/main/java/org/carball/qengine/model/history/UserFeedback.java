package org.carball.qengine.model.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserFeedback {
    // 1 to 5
    private int rating;
    private boolean helpful;
    private String comments;
    @Builder.Default
    private List<String> reportedIssues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestedImprovements = new ArrayList<>();
    private Instant timestamp;
}
