package no.cantara.standards.model;

import java.util.Locale;

/**
 * Display tier of an evidence mapping.
 */
public enum MatchType {
    STRONG,
    PARTIAL,
    NONE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
