package no.cantara.standards.model;

import java.time.LocalDate;

/**
 * Read-only summary of one loaded accreditor corpus.
 *
 * @param standardCount always the number of standards actually loaded
 * @param file          the corpus file the accreditor was read from
 */
public record CorpusMetadata(
        String accreditor,
        String name,
        String version,
        LocalDate effectiveDate,
        LocalDate lastUpdated,
        String sourceUrl,
        String license,
        String disclaimer,
        String coverageNotes,
        int standardCount,
        String file
) {}
