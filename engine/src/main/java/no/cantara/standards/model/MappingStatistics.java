package no.cantara.standards.model;

import java.util.Map;

/**
 * Aggregate view over a set of evidence mappings.
 */
public record MappingStatistics(
        int total,
        double averageConfidence,
        int meetingStandard,
        Map<String, Integer> byAccreditor,
        Map<MatchType, Integer> byMatchType
) {
    public MappingStatistics {
        byAccreditor = byAccreditor != null ? Map.copyOf(byAccreditor) : Map.of();
        byMatchType = byMatchType != null ? Map.copyOf(byMatchType) : Map.of();
    }
}
