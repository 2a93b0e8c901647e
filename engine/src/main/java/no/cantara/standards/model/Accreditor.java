package no.cantara.standards.model;

import java.time.LocalDate;
import java.util.List;

/**
 * An accrediting body and its standards, in load order.
 */
public record Accreditor(
        String code,
        String name,
        String version,
        LocalDate effectiveDate,
        List<Standard> standards
) {
    public Accreditor {
        standards = standards != null ? List.copyOf(standards) : List.of();
    }

    public int standardCount() {
        return standards.size();
    }
}
