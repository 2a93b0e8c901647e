package no.cantara.standards.model;

import java.util.List;

/**
 * A sub-requirement within a {@link Standard}. Indicators are the phrases that signal
 * the clause is addressed by a piece of evidence.
 */
public record Clause(
        String id,
        String title,
        String description,
        List<String> indicators
) {
    public Clause {
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }
}
