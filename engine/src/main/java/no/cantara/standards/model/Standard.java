package no.cantara.standards.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A top-level compliance requirement of one accreditor.
 *
 * <p>{@code indicators} holds standard-level indicators for simplified corpora that
 * carry no clauses; clause indicators stay on their {@link Clause}.
 */
public record Standard(
        String id,
        String accreditor,
        String title,
        String description,
        String category,
        String version,
        LocalDate effectiveDate,
        List<Clause> clauses,
        List<String> indicators
) {
    public Standard {
        category = category != null ? category : "";
        clauses = clauses != null ? List.copyOf(clauses) : List.of();
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }
}
