package no.cantara.standards;

/**
 * Tunables for matching.
 *
 * @param threshold         default minimum cross-accreditor score
 * @param topK              default maximum number of cross-accreditor matches
 * @param maxRationaleSpans evidence excerpts returned per mapped standard
 * @param meetsThreshold    confidence a mapping must exceed to meet the standard
 */
public record EngineSettings(
        double threshold,
        int topK,
        int maxRationaleSpans,
        double meetsThreshold
) {
    public EngineSettings {
        CrossAccreditorMatcher.checkArguments(threshold, topK);
        if (maxRationaleSpans < 0) {
            throw new IllegalArgumentException("maxRationaleSpans must not be negative, got " + maxRationaleSpans);
        }
        if (Double.isNaN(meetsThreshold) || meetsThreshold < 0.0 || meetsThreshold > 1.0) {
            throw new IllegalArgumentException("meetsThreshold must be within [0, 1], got " + meetsThreshold);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(0.2, 10, 3, 0.5);
    }

    public EngineSettings withThreshold(double value) {
        return new EngineSettings(value, topK, maxRationaleSpans, meetsThreshold);
    }

    public EngineSettings withTopK(int value) {
        return new EngineSettings(threshold, value, maxRationaleSpans, meetsThreshold);
    }

    public EngineSettings withMaxRationaleSpans(int value) {
        return new EngineSettings(threshold, topK, value, meetsThreshold);
    }
}
