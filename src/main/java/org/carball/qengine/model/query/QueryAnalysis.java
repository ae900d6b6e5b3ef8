package org.carball.qengine.model.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class QueryAnalysis {
    @Builder.Default
    List<QueryPattern> patterns = List.of();
    QueryComplexity complexity;
    ResourceUsage resourceUsage;
    @Builder.Default
    List<String> warnings = List.of();
    @Builder.Default
    List<String> tags = List.of();

    /**
     * Pattern of the analysed statement. Always present, possibly empty.
     */
    public QueryPattern primaryPattern() {
        return patterns.isEmpty() ? QueryPattern.empty() : patterns.get(0);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
