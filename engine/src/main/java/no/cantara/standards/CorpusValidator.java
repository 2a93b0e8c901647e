package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.Clause;
import no.cantara.standards.model.Standard;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a normalized {@link Accreditor} before it is admitted into the graph.
 *
 * <p>Returns a {@link ValidationResult} with separate {@code errors} (the accreditor is
 * rejected) and {@code warnings} (the accreditor loads, the problem is logged).
 */
public class CorpusValidator {

    /**
     * Immutable result of validating one accreditor.
     *
     * @param errors   Conditions that make the accreditor unusable (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(Accreditor accreditor) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String code = accreditor.code();
        String prefix = code + "_";

        if (accreditor.name() == null || accreditor.name().isBlank()) {
            warnings.add(code + ": metadata 'name' not declared");
        }
        if (accreditor.version() == null || accreditor.version().isBlank()) {
            warnings.add(code + ": no corpus version declared");
        }
        if (accreditor.standards().isEmpty()) {
            warnings.add(code + ": corpus declares no standards");
        }

        Set<String> standardIds = new HashSet<>();
        Set<String> clauseIds = new HashSet<>();

        for (Standard standard : accreditor.standards()) {
            String p = "standard '" + standard.id() + "'";

            if (!standard.id().startsWith(prefix)) {
                errors.add(p + ": id must start with '" + prefix + "'");
            }
            if (!standardIds.add(standard.id())) {
                errors.add(p + ": duplicate id within " + code);
            }
            if (standard.category().isBlank()) {
                warnings.add(p + ": no 'category'");
            }
            checkIndicators(p, standard.indicators(), errors);

            boolean hasIndicators = !standard.indicators().isEmpty();
            for (Clause clause : standard.clauses()) {
                String c = p + ", clause '" + clause.id() + "'";
                if (!clause.id().startsWith(prefix)) {
                    errors.add(c + ": id must start with '" + prefix + "'");
                }
                if (!clauseIds.add(clause.id())) {
                    errors.add(c + ": duplicate clause id within " + code);
                }
                if (clause.indicators().isEmpty()) {
                    warnings.add(c + ": no indicators");
                } else {
                    hasIndicators = true;
                }
                checkIndicators(c, clause.indicators(), errors);
            }

            if (!hasIndicators) {
                warnings.add(p + ": no indicators; evidence mapping falls back to title terms");
            }
        }

        return new ValidationResult(errors, warnings);
    }

    private static void checkIndicators(String p, List<String> indicators, List<String> errors) {
        for (String indicator : indicators) {
            if (indicator.isBlank()) {
                errors.add(p + ": blank indicator");
            }
        }
    }
}
