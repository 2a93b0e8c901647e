package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.Clause;
import no.cantara.standards.model.CorpusLoadResult;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.MatchResult;
import no.cantara.standards.model.Standard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The accreditor &rarr; standard &rarr; clause &rarr; indicator hierarchy.
 *
 * <p>A graph is immutable once built: every record it hands out is itself immutable, so
 * any number of readers may query it concurrently. A changed corpus means a new graph,
 * built with a {@link Builder}.
 */
public final class StandardsGraph {

    /** A standard ranked by {@link #searchByKeywords}. */
    public record KeywordHit(Standard standard, double score) {}

    /** Node counts per hierarchy level. */
    public record Summary(int accreditors, int standards, int clauses, int indicators) {}

    private final Map<String, Accreditor> accreditors;
    private final Map<String, CorpusMetadata> metadata;
    private final Map<String, Standard> standardsById;
    private final Map<String, Clause> clausesById;
    private final Map<String, List<String>> indicatorsByStandard;
    private final Map<String, Set<String>> keywordsByStandard;
    private final SimilarityScorer scorer;

    private StandardsGraph(Map<String, Accreditor> accreditors,
                           Map<String, CorpusMetadata> metadata,
                           SimilarityScorer scorer) {
        this.accreditors = Collections.unmodifiableMap(accreditors);
        this.metadata = Collections.unmodifiableMap(metadata);
        this.scorer = scorer;

        Map<String, Standard> standards = new HashMap<>();
        Map<String, Clause> clauses = new HashMap<>();
        Map<String, List<String>> indicators = new HashMap<>();
        Map<String, Set<String>> keywords = new HashMap<>();
        for (Accreditor accreditor : accreditors.values()) {
            for (Standard standard : accreditor.standards()) {
                standards.put(standard.id(), standard);
                standard.clauses().forEach(c -> clauses.put(c.id(), c));
                indicators.put(standard.id(), flattenIndicators(standard));
                keywords.put(standard.id(), Collections.unmodifiableSet(keywordsOf(standard)));
            }
        }
        this.standardsById = standards;
        this.clausesById = clauses;
        this.indicatorsByStandard = indicators;
        this.keywordsByStandard = keywords;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StandardsGraph empty() {
        return builder().build();
    }

    /**
     * Builds a graph holding every accreditor of a load result, in load order.
     */
    public static StandardsGraph fromLoadResult(CorpusLoadResult result, SimilarityScorer scorer) {
        Builder builder = builder().scorer(scorer);
        for (Accreditor accreditor : result.accreditors()) {
            builder.addAccreditor(accreditor, result.metadata().get(accreditor.code()));
        }
        return builder.build();
    }

    // ── Hierarchy ─────────────────────────────────────────────────────────────────

    /** Accreditor codes in load order. */
    public List<String> accreditors() {
        return List.copyOf(accreditors.keySet());
    }

    public Optional<Accreditor> getAccreditor(String code) {
        return Optional.ofNullable(accreditors.get(normalizeCode(code)));
    }

    /**
     * All standards of an accreditor in load order; empty if the code is unknown.
     */
    public List<Standard> getAccreditorStandards(String code) {
        return getAccreditor(code).map(Accreditor::standards).orElse(List.of());
    }

    public Optional<Standard> getStandard(String standardId) {
        return Optional.ofNullable(standardId == null ? null : standardsById.get(standardId));
    }

    /**
     * Clause ids are unique in a loaded corpus. A graph assembled through the builder with
     * colliding clause ids keeps the clause added last.
     */
    public Optional<Clause> getClause(String clauseId) {
        return Optional.ofNullable(clauseId == null ? null : clausesById.get(clauseId));
    }

    public List<Clause> getClauses(String standardId) {
        return getStandard(standardId).map(Standard::clauses).orElse(List.of());
    }

    /**
     * Standard-level then clause-level indicators, de-duplicated case-insensitively.
     */
    public List<String> indicatorsOf(String standardId) {
        return standardId == null ? List.of() : indicatorsByStandard.getOrDefault(standardId, List.of());
    }

    /**
     * Metadata for every loaded accreditor. {@code standardCount} always reflects the
     * standards actually held by this graph.
     */
    public Map<String, CorpusMetadata> getCorpusMetadata() {
        return metadata;
    }

    public Summary summary() {
        int clauses = clausesById.size();
        int indicators = indicatorsByStandard.values().stream().mapToInt(List::size).sum();
        return new Summary(accreditors.size(), standardsById.size(), clauses, indicators);
    }

    // ── Queries ───────────────────────────────────────────────────────────────────

    public List<MatchResult> findCrossAccreditorMatches(String source, String target, double threshold, int topK) {
        return CrossAccreditorMatcher.match(
                getAccreditorStandards(source), getAccreditorStandards(target), scorer, threshold, topK);
    }

    /**
     * Ranks standards by the fraction of {@code query} keywords found in their text.
     * Standards sharing no keyword are omitted; ties keep load order.
     */
    public List<KeywordHit> searchByKeywords(Set<String> query, int limit) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : query) {
            if (keyword != null && !keyword.isBlank()) {
                normalized.add(keyword.strip().toLowerCase(Locale.ROOT));
            }
        }
        if (normalized.isEmpty() || limit <= 0) return List.of();

        List<KeywordHit> hits = new ArrayList<>();
        for (Accreditor accreditor : accreditors.values()) {
            for (Standard standard : accreditor.standards()) {
                Set<String> keywords = keywordsByStandard.get(standard.id());
                long found = normalized.stream().filter(keywords::contains).count();
                if (found > 0) {
                    hits.add(new KeywordHit(standard, (double) found / normalized.size()));
                }
            }
        }
        hits.sort(Comparator.comparingDouble(KeywordHit::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    // ── Internals ─────────────────────────────────────────────────────────────────

    static String normalizeCode(String code) {
        return code == null ? "" : code.strip().toUpperCase(Locale.ROOT);
    }

    private static List<String> flattenIndicators(Standard standard) {
        Map<String, String> distinct = new LinkedHashMap<>();
        standard.indicators().forEach(i -> distinct.putIfAbsent(i.toLowerCase(Locale.ROOT), i));
        for (Clause clause : standard.clauses()) {
            clause.indicators().forEach(i -> distinct.putIfAbsent(i.toLowerCase(Locale.ROOT), i));
        }
        distinct.keySet().removeIf(String::isBlank);
        return List.copyOf(distinct.values());
    }

    private static Set<String> keywordsOf(Standard standard) {
        StringBuilder text = new StringBuilder()
                .append(standard.title()).append(' ')
                .append(standard.description()).append(' ')
                .append(standard.category());
        for (Clause clause : standard.clauses()) {
            text.append(' ').append(clause.title()).append(' ').append(clause.description());
            clause.indicators().forEach(i -> text.append(' ').append(i));
        }
        standard.indicators().forEach(i -> text.append(' ').append(i));
        return Keywords.extract(text.toString());
    }

    /**
     * Assembles a graph. Not thread-safe; the graph it builds is.
     */
    public static final class Builder {

        private final Map<String, Map<String, Standard>> standards = new LinkedHashMap<>();
        private final Map<String, Accreditor> info = new HashMap<>();
        private final Map<String, CorpusMetadata> metadata = new HashMap<>();
        private SimilarityScorer scorer = new KeywordOverlapScorer();

        private Builder() {}

        public Builder scorer(SimilarityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        /**
         * Adds an accreditor with all its standards. {@code metadata} may be null.
         */
        public Builder addAccreditor(Accreditor accreditor, CorpusMetadata metadata) {
            String code = normalizeCode(accreditor.code());
            info.put(code, accreditor);
            if (metadata != null) {
                this.metadata.put(code, metadata);
            }
            standards.computeIfAbsent(code, k -> new LinkedHashMap<>());
            accreditor.standards().forEach(s -> addStandardHierarchy(code, s));
            return this;
        }

        /**
         * Inserts a normalized standard under {@code accreditor}. Re-adding an id replaces the
         * earlier standard in place.
         *
         * @throws IllegalArgumentException if the standard belongs to a different accreditor
         */
        public Builder addStandardHierarchy(String accreditor, Standard standard) {
            String code = normalizeCode(accreditor);
            if (code.isEmpty()) {
                throw new IllegalArgumentException("accreditor code is required");
            }
            if (standard.accreditor() != null && !normalizeCode(standard.accreditor()).equals(code)) {
                throw new IllegalArgumentException("standard '" + standard.id() + "' belongs to "
                        + standard.accreditor() + ", not " + code);
            }
            Standard owned = standard.accreditor() != null ? standard
                    : new Standard(standard.id(), code, standard.title(), standard.description(),
                            standard.category(), standard.version(), standard.effectiveDate(),
                            standard.clauses(), standard.indicators());
            standards.computeIfAbsent(code, k -> new LinkedHashMap<>()).put(owned.id(), owned);
            return this;
        }

        public StandardsGraph build() {
            Map<String, Accreditor> accreditors = new LinkedHashMap<>();
            Map<String, CorpusMetadata> meta = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Standard>> entry : standards.entrySet()) {
                String code = entry.getKey();
                List<Standard> list = List.copyOf(entry.getValue().values());
                Accreditor known = info.get(code);
                Accreditor accreditor = known != null
                        ? new Accreditor(code, known.name(), known.version(), known.effectiveDate(), list)
                        : new Accreditor(code, null, null, null, list);
                accreditors.put(code, accreditor);
                meta.put(code, metadataFor(accreditor, metadata.get(code)));
            }
            return new StandardsGraph(accreditors, meta, scorer);
        }

        private static CorpusMetadata metadataFor(Accreditor accreditor, CorpusMetadata declared) {
            if (declared == null) {
                return new CorpusMetadata(accreditor.code(), accreditor.name(), accreditor.version(),
                        accreditor.effectiveDate(), null, null, null, null, null,
                        accreditor.standardCount(), null);
            }
            return new CorpusMetadata(accreditor.code(), declared.name(), declared.version(),
                    declared.effectiveDate(), declared.lastUpdated(), declared.sourceUrl(),
                    declared.license(), declared.disclaimer(), declared.coverageNotes(),
                    accreditor.standardCount(), declared.file());
        }
    }
}
