package no.cantara.standards.model;

import java.util.List;

/**
 * How strongly a block of evidence text addresses one standard.
 *
 * @param confidence        fraction of the standard's indicators found, in {@code [0, 1]}
 * @param matchedIndicators the indicators found in the evidence, in declaration order
 * @param totalIndicators   the number of indicators the standard was scored against
 * @param rationaleSpans    short evidence excerpts containing matched indicators
 */
public record EvidenceMapping(
        String standardId,
        String accreditor,
        String title,
        double confidence,
        boolean meetsStandard,
        MatchType matchType,
        List<String> matchedIndicators,
        int totalIndicators,
        List<String> rationaleSpans,
        String explanation
) {
    public EvidenceMapping {
        matchedIndicators = matchedIndicators != null ? List.copyOf(matchedIndicators) : List.of();
        rationaleSpans = rationaleSpans != null ? List.copyOf(rationaleSpans) : List.of();
    }
}
