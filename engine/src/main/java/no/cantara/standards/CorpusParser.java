package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.Clause;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.Standard;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses one accreditor corpus document (YAML or JSON) into a normalized {@link Accreditor}.
 *
 * <p>Normalization prefixes every standard and clause id with the accreditor code and
 * fills {@code version} / {@code effective_date} from the document-level defaults.
 */
public class CorpusParser {

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    /**
     * A parsed accreditor together with the metadata block it declared.
     */
    public record ParsedCorpus(Accreditor accreditor, CorpusMetadata metadata) {}

    /**
     * Document-level values inherited by entries that do not set them.
     */
    public record Defaults(String version, LocalDate effectiveDate) {
        public static final Defaults NONE = new Defaults(null, null);
    }

    public static ParsedCorpus parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.getFileName().toString());
        }
    }

    public static ParsedCorpus parse(InputStream is, String fileName) {
        Object data;
        try {
            data = YAML.load(is);
        } catch (YAMLException e) {
            throw new CorpusFormatException(fileName + ": not a valid YAML/JSON document: " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new CorpusFormatException(fileName + ": top level must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        return fromMap(map, fileName);
    }

    @SuppressWarnings("unchecked")
    public static ParsedCorpus fromMap(Map<String, Object> data, String fileName) {
        String code = asString(data.get("accreditor"));
        if (code == null || code.isBlank()) {
            code = codeFromFileName(fileName);
        }
        code = code.strip().toUpperCase(Locale.ROOT);

        Map<String, Object> meta = asMap(data.get("metadata"), fileName + ": 'metadata'");
        String version = firstNonNull(asString(meta.get("version")), asString(data.get("version")));
        LocalDate effectiveDate = firstNonNull(
                parseDate(meta.get("effective_date"), fileName),
                parseDate(data.get("effective_date"), fileName));
        Defaults defaults = new Defaults(version, effectiveDate);

        Object rawStandards = data.getOrDefault("standards", List.of());
        if (rawStandards == null) {
            rawStandards = List.of();
        }
        if (!(rawStandards instanceof List<?> entries)) {
            throw new CorpusFormatException(fileName + ": 'standards' must be a list");
        }

        List<Standard> standards = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (!(entry instanceof Map)) {
                throw new CorpusFormatException(fileName + ": standard #" + (i + 1) + " of " + code + " is not a mapping");
            }
            try {
                standards.add(normalizeEntry(code, (Map<String, Object>) entry, defaults));
            } catch (CorpusFormatException e) {
                throw new CorpusFormatException(fileName + ": " + e.getMessage(), e);
            }
        }

        String name = asString(meta.get("name"));
        Accreditor accreditor = new Accreditor(code, name, version, effectiveDate, standards);
        CorpusMetadata metadata = new CorpusMetadata(
                code,
                name,
                version,
                effectiveDate,
                parseDate(meta.get("last_updated"), fileName),
                asString(meta.get("source_url")),
                asString(meta.get("license")),
                asString(meta.get("disclaimer")),
                asString(meta.get("coverage_notes")),
                standards.size(),
                fileName
        );
        return new ParsedCorpus(accreditor, metadata);
    }

    /**
     * Prefixes {@code rawId} with {@code ACCREDITOR_} unless it already carries the prefix
     * (compared case-insensitively; a lower-case prefix is upper-cased). Whitespace becomes
     * {@code _} and {@code /} becomes {@code .} so the id stays a safe token.
     */
    public static String ensurePrefix(String accreditor, String rawId) {
        String prefix = accreditor.toUpperCase(Locale.ROOT) + "_";
        String id = rawId.strip();
        if (id.toUpperCase(Locale.ROOT).startsWith(prefix)) {
            return prefix + id.substring(prefix.length());
        }
        String safe = id.replaceAll("\\s", "_").replace('/', '.');
        return prefix + safe;
    }

    /**
     * Turns one raw standard entry into a {@link Standard}, prefixing its id and the ids of
     * its clauses.
     *
     * @throws CorpusFormatException if {@code id}, {@code title} or {@code description} is missing
     */
    @SuppressWarnings("unchecked")
    public static Standard normalizeEntry(String accreditor, Map<String, Object> entry, Defaults defaults) {
        String rawId = asString(entry.get("id"));
        String where = "standard '" + (rawId != null ? rawId : "?") + "' of " + accreditor;
        requireFields(entry, where);

        Defaults inherited = defaults != null ? defaults : Defaults.NONE;
        String version = firstNonNull(asString(entry.get("version")), inherited.version());
        LocalDate effectiveDate = firstNonNull(parseDate(entry.get("effective_date"), where), inherited.effectiveDate());

        List<Clause> clauses = new ArrayList<>();
        for (Object raw : asList(entry.get("clauses"), where + ": 'clauses'")) {
            if (!(raw instanceof Map)) {
                throw new CorpusFormatException(where + ": clause entries must be mappings");
            }
            clauses.add(normalizeClause(accreditor, (Map<String, Object>) raw, where));
        }

        return new Standard(
                ensurePrefix(accreditor, rawId),
                accreditor,
                asString(entry.get("title")),
                asString(entry.get("description")),
                asString(entry.get("category")),
                version,
                effectiveDate,
                clauses,
                parseIndicators(entry.get("indicators"), where)
        );
    }

    private static Clause normalizeClause(String accreditor, Map<String, Object> raw, String parent) {
        String rawId = asString(raw.get("id"));
        String where = parent + ", clause '" + (rawId != null ? rawId : "?") + "'";
        requireFields(raw, where);
        return new Clause(
                ensurePrefix(accreditor, rawId),
                asString(raw.get("title")),
                asString(raw.get("description")),
                parseIndicators(raw.get("indicators"), where)
        );
    }

    private static void requireFields(Map<String, Object> entry, String where) {
        for (String field : List.of("id", "title")) {
            String value = asString(entry.get(field));
            if (value == null || value.isBlank()) {
                throw new CorpusFormatException(where + ": '" + field + "' is required");
            }
        }
        if (entry.get("description") == null) {
            throw new CorpusFormatException(where + ": 'description' is required");
        }
    }

    private static List<String> parseIndicators(Object value, String where) {
        List<String> indicators = new ArrayList<>();
        for (Object item : asList(value, where + ": 'indicators'")) {
            if (item == null) {
                throw new CorpusFormatException(where + ": indicator entries must not be null");
            }
            indicators.add(item.toString().strip());
        }
        return indicators;
    }

    static String codeFromFileName(String fileName) {
        String stem = fileName;
        int dot = stem.indexOf('.');
        if (dot > 0) stem = stem.substring(0, dot);
        return stem.toUpperCase(Locale.ROOT);
    }

    private static List<?> asList(Object value, String what) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) return list;
        throw new CorpusFormatException(what + " must be a list");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (value == null) return Map.of();
        if (value instanceof Map) return (Map<String, Object>) value;
        throw new CorpusFormatException(what + " must be a mapping");
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }

    private static LocalDate parseDate(Object value, String where) {
        if (value == null) return null;
        if (value instanceof java.util.Date d) return d.toInstant().atZone(java.time.ZoneOffset.UTC).toLocalDate();
        try {
            return LocalDate.parse(value.toString().strip());
        } catch (DateTimeParseException e) {
            throw new CorpusFormatException(where + ": invalid date '" + value + "'", e);
        }
    }
}
