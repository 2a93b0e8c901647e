package no.cantara.standards.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of loading a corpus directory. Accreditors load independently, so a result can
 * carry both loaded accreditors and failures.
 */
public record CorpusLoadResult(
        List<Accreditor> accreditors,
        Map<String, CorpusMetadata> metadata,
        List<LoadFailure> failures,
        List<String> warnings
) {
    public CorpusLoadResult {
        accreditors = accreditors != null ? List.copyOf(accreditors) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /** Accreditor code to standards, in load order. */
    public Map<String, List<Standard>> standardsByAccreditor() {
        Map<String, List<Standard>> byCode = new LinkedHashMap<>();
        for (Accreditor accreditor : accreditors) {
            byCode.put(accreditor.code(), accreditor.standards());
        }
        return Collections.unmodifiableMap(byCode);
    }

    public boolean hasFailures() { return !failures.isEmpty(); }

    public CorpusLoadResult withCarriedOver(List<Accreditor> carried, Map<String, CorpusMetadata> carriedMetadata) {
        List<Accreditor> merged = new ArrayList<>(accreditors);
        merged.addAll(carried);
        Map<String, CorpusMetadata> mergedMetadata = new LinkedHashMap<>(metadata);
        mergedMetadata.putAll(carriedMetadata);
        return new CorpusLoadResult(merged, mergedMetadata, failures, warnings);
    }
}
