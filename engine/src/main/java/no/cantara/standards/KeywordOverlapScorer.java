package no.cantara.standards;

import no.cantara.standards.model.Standard;

import java.util.HashSet;
import java.util.Set;

/**
 * Lexical scorer: title keyword overlap coefficient blended with description keyword
 * Jaccard similarity.
 */
public class KeywordOverlapScorer implements SimilarityScorer {

    static final double TITLE_WEIGHT = 0.75;
    static final double DESCRIPTION_WEIGHT = 0.25;

    @Override
    public double score(Standard source, Standard target) {
        double title = overlapCoefficient(Keywords.extract(source.title()), Keywords.extract(target.title()));
        double description = jaccard(Keywords.extract(source.description()), Keywords.extract(target.description()));
        return Math.min(1.0, TITLE_WEIGHT * title + DESCRIPTION_WEIGHT * description);
    }

    /** {@code |A ∩ B| / min(|A|, |B|)}; 0 when either side is empty. */
    static double overlapCoefficient(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        return (double) intersection(a, b) / Math.min(a.size(), b.size());
    }

    /** {@code |A ∩ B| / |A ∪ B|}; 0 when both sides are empty. */
    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;
        int shared = intersection(a, b);
        return (double) shared / (a.size() + b.size() - shared);
    }

    private static int intersection(Set<String> a, Set<String> b) {
        Set<String> shared = new HashSet<>(a);
        shared.retainAll(b);
        return shared.size();
    }
}
