package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.CorpusLoadResult;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.EvidenceMapping;
import no.cantara.standards.model.LoadFailure;
import no.cantara.standards.model.MatchResult;
import no.cantara.standards.model.Standard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for callers: owns the currently published {@link StandardsGraph} for one
 * corpus directory and answers queries against it.
 *
 * <p>{@link #reload()} builds a complete new graph and publishes it with a single
 * reference swap, so a query sees either the old corpus or the new one, never a mix.
 * Queries take no locks.
 */
public class StandardsEngine {

    private static final Logger log = LoggerFactory.getLogger(StandardsEngine.class);

    private final Path source;
    private final SimilarityScorer scorer;
    private final EngineSettings settings;
    private final EvidenceMapper mapper;
    private final AtomicReference<StandardsGraph> current = new AtomicReference<>(StandardsGraph.empty());
    private final Object reloadLock = new Object();

    public StandardsEngine(Path source) {
        this(source, new KeywordOverlapScorer(), EngineSettings.defaults());
    }

    public StandardsEngine(Path source, SimilarityScorer scorer, EngineSettings settings) {
        this.source = source;
        this.scorer = scorer;
        this.settings = settings;
        this.mapper = new EvidenceMapper(settings);
    }

    /**
     * Loads the corpus and publishes it. Same as {@link #reload()}; named for the first call.
     */
    public CorpusLoadResult loadCorpus() {
        return reload();
    }

    /**
     * Re-reads the corpus directory and atomically replaces the published graph.
     *
     * <p>An accreditor that fails to load but is present in the currently published graph
     * keeps its previous standards; the failure is still part of the returned result.
     *
     * @throws CorpusLoadException if the corpus directory itself is unusable; the published
     *                             graph is left untouched
     */
    public CorpusLoadResult reload() {
        synchronized (reloadLock) {
            StandardsGraph previous = current.get();
            CorpusLoadResult result = carryOverFailed(CorpusLoader.load(source), previous);
            StandardsGraph next = StandardsGraph.fromLoadResult(result, scorer);
            current.set(next);

            StandardsGraph.Summary summary = next.summary();
            log.info("Published standards graph from {}: {} accreditors, {} standards, {} clauses, {} indicators, {} failure(s)",
                    source, summary.accreditors(), summary.standards(), summary.clauses(),
                    summary.indicators(), result.failures().size());
            return result;
        }
    }

    private static CorpusLoadResult carryOverFailed(CorpusLoadResult result, StandardsGraph previous) {
        List<Accreditor> carried = new ArrayList<>();
        Map<String, CorpusMetadata> carriedMetadata = new LinkedHashMap<>();
        Map<String, List<Standard>> loaded = result.standardsByAccreditor();
        for (LoadFailure failure : result.failures()) {
            String code = publishedCode(previous, failure);
            if (loaded.containsKey(code) || carriedMetadata.containsKey(code)) continue;
            Optional<Accreditor> last = previous.getAccreditor(code);
            if (last.isPresent()) {
                log.warn("Keeping previously loaded {} standards for {} after failure in {}",
                        last.get().standardCount(), code, failure.file());
                carried.add(last.get());
                carriedMetadata.put(code, previous.getCorpusMetadata().get(code));
            }
        }
        return carried.isEmpty() ? result : result.withCarriedOver(carried, carriedMetadata);
    }

    /**
     * The accreditor {@code failure}'s file was last published under. A file that cannot be
     * parsed is reported under its file stem, which need not be the code it declares.
     */
    private static String publishedCode(StandardsGraph previous, LoadFailure failure) {
        for (CorpusMetadata meta : previous.getCorpusMetadata().values()) {
            if (failure.file() != null && failure.file().equals(meta.file())) {
                return meta.accreditor();
            }
        }
        return failure.accreditor();
    }

    /** The currently published graph. Safe to hold on to; it never changes. */
    public StandardsGraph graph() {
        return current.get();
    }

    public EngineSettings settings() {
        return settings;
    }

    public Path source() {
        return source;
    }

    public Map<String, CorpusMetadata> getCorpusMetadata() {
        return current.get().getCorpusMetadata();
    }

    public List<Standard> getAccreditorStandards(String accreditor) {
        return current.get().getAccreditorStandards(accreditor);
    }

    public List<MatchResult> findCrossAccreditorMatches(String source, String target) {
        return findCrossAccreditorMatches(source, target, settings.threshold(), settings.topK());
    }

    public List<MatchResult> findCrossAccreditorMatches(String source, String target, double threshold, int topK) {
        return current.get().findCrossAccreditorMatches(source, target, threshold, topK);
    }

    /**
     * @param accreditor accreditor code, or null for the whole corpus
     */
    public List<EvidenceMapping> mapEvidenceToStandards(String evidence, String accreditor) {
        return mapper.map(current.get(), evidence, accreditor);
    }

    public Map<String, List<EvidenceMapping>> mapBatch(Map<String, String> documents, String accreditor) {
        return mapper.mapBatch(current.get(), documents, accreditor);
    }
}
