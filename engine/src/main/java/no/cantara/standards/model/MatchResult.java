package no.cantara.standards.model;

/**
 * A detected equivalence between a standard of one accreditor and a standard of another.
 *
 * @param score lexical similarity in {@code [0, 1]}
 */
public record MatchResult(
        String sourceId,
        String sourceTitle,
        String targetId,
        String targetTitle,
        double score
) {}
