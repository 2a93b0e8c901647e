package no.cantara.standards;

import no.cantara.standards.model.MatchResult;
import no.cantara.standards.model.Standard;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks every (source, target) standard pair of two accreditors by similarity.
 */
public final class CrossAccreditorMatcher {

    private CrossAccreditorMatcher() {}

    /**
     * Scores the full cartesian product, keeps pairs scoring at least {@code threshold},
     * sorts them by descending score (ties keep enumeration order) and returns the first
     * {@code topK}.
     *
     * @throws IllegalArgumentException if {@code threshold} is outside {@code [0, 1]} or {@code topK} is negative
     */
    public static List<MatchResult> match(List<Standard> sources,
                                          List<Standard> targets,
                                          SimilarityScorer scorer,
                                          double threshold,
                                          int topK) {
        checkArguments(threshold, topK);

        List<MatchResult> matches = new ArrayList<>();
        for (Standard source : sources) {
            for (Standard target : targets) {
                double score = clamp(scorer.score(source, target));
                if (score >= threshold) {
                    matches.add(new MatchResult(source.id(), source.title(), target.id(), target.title(), score));
                }
            }
        }

        // List.sort is stable
        matches.sort(Comparator.comparingDouble(MatchResult::score).reversed());
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : List.copyOf(matches);
    }

    static void checkArguments(double threshold, int topK) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        if (topK < 0) {
            throw new IllegalArgumentException("top_k must not be negative, got " + topK);
        }
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
