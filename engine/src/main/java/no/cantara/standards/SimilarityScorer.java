package no.cantara.standards;

import no.cantara.standards.model.Standard;

/**
 * Scores how closely two standards correspond. Implementations must return a value in
 * {@code [0, 1]}: zero when the standards share nothing, growing as they share more.
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(Standard source, Standard target);
}
