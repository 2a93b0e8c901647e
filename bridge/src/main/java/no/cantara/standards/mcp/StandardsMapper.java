package no.cantara.standards.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.Clause;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.MatchResult;
import no.cantara.standards.model.Standard;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pure mapping functions: standards model → MCP schema types and JSON bodies.
 * No I/O.
 */
public final class StandardsMapper {

    private StandardsMapper() {}

    static final String MIME_JSON = "application/json";

    private static final List<McpSchema.Role> AUDIENCE =
        List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER);

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String metadataUri() {
        return "standards://corpus/metadata";
    }

    public static String accreditorUri(String code) {
        return "standards://accreditor/" + code;
    }

    public static String crosswalkUri(String source, String target) {
        return "standards://crosswalk/" + source + "/" + target;
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static McpSchema.Resource buildMetadataResource() {
        return new McpSchema.Resource(
            metadataUri(),
            "metadata",
            "Standards corpus index",
            "Accreditors, corpus versions and standard counts",
            MIME_JSON,
            null,
            new McpSchema.Annotations(AUDIENCE, 1.0, null),
            null
        );
    }

    public static McpSchema.Resource buildAccreditorResource(CorpusMetadata meta) {
        String title = meta.name() != null ? meta.name() : meta.accreditor();
        StringBuilder description = new StringBuilder()
            .append(meta.standardCount()).append(" standards");
        if (meta.version() != null) {
            description.append(", version ").append(meta.version());
        }
        return new McpSchema.Resource(
            accreditorUri(meta.accreditor()),
            meta.accreditor(),
            title,
            description.toString(),
            MIME_JSON,
            null,
            new McpSchema.Annotations(AUDIENCE, 0.8, lastModified(meta.lastUpdated())),
            null
        );
    }

    public static McpSchema.Resource buildCrosswalkResource(String source, String target) {
        return new McpSchema.Resource(
            crosswalkUri(source, target),
            "crosswalk-" + source.toLowerCase(Locale.ROOT) + "-" + target.toLowerCase(Locale.ROOT),
            source + " → " + target + " crosswalk",
            "Ranked matches from " + source + " standards to " + target + " standards",
            MIME_JSON,
            null,
            new McpSchema.Annotations(AUDIENCE, 0.5, null),
            null
        );
    }

    static String lastModified(LocalDate date) {
        if (date == null) return null;
        return date.atStartOfDay(ZoneOffset.UTC)
            .format(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'"));
    }

    // ── JSON bodies ───────────────────────────────────────────────────────────────

    public static String buildMetadataJson(Map<String, CorpusMetadata> metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"accreditor_count\":").append(metadata.size()).append(",");
        sb.append("\"accreditors\":[");
        int i = 0;
        for (CorpusMetadata m : metadata.values()) {
            if (i++ > 0) sb.append(",");
            sb.append("{");
            sb.append("\"accreditor\":").append(quoted(m.accreditor())).append(",");
            sb.append("\"uri\":").append(quoted(accreditorUri(m.accreditor()))).append(",");
            sb.append("\"name\":").append(quoted(m.name())).append(",");
            sb.append("\"version\":").append(quoted(m.version())).append(",");
            sb.append("\"effective_date\":").append(quoted(date(m.effectiveDate()))).append(",");
            sb.append("\"last_updated\":").append(quoted(date(m.lastUpdated()))).append(",");
            sb.append("\"source_url\":").append(quoted(m.sourceUrl())).append(",");
            sb.append("\"license\":").append(quoted(m.license())).append(",");
            sb.append("\"disclaimer\":").append(quoted(m.disclaimer())).append(",");
            sb.append("\"coverage_notes\":").append(quoted(m.coverageNotes())).append(",");
            sb.append("\"standard_count\":").append(m.standardCount());
            sb.append("}");
        }
        sb.append("]}");
        return sb.toString();
    }

    /**
     * The accreditor's standards with their clauses. {@code accreditor} may be null when the
     * code is no longer loaded; the body then carries an empty standards list.
     */
    public static String buildAccreditorJson(String code, Accreditor accreditor) {
        List<Standard> standards = accreditor != null ? accreditor.standards() : List.of();
        StringBuilder sb = new StringBuilder();
        sb.append("{");
        sb.append("\"accreditor\":").append(quoted(code)).append(",");
        sb.append("\"name\":").append(quoted(accreditor != null ? accreditor.name() : null)).append(",");
        sb.append("\"version\":").append(quoted(accreditor != null ? accreditor.version() : null)).append(",");
        sb.append("\"standard_count\":").append(standards.size()).append(",");
        sb.append("\"standards\":[");
        for (int i = 0; i < standards.size(); i++) {
            if (i > 0) sb.append(",");
            Standard s = standards.get(i);
            sb.append("{");
            sb.append("\"id\":").append(quoted(s.id())).append(",");
            sb.append("\"title\":").append(quoted(s.title())).append(",");
            sb.append("\"description\":").append(quoted(s.description())).append(",");
            sb.append("\"category\":").append(quoted(s.category())).append(",");
            sb.append("\"version\":").append(quoted(s.version())).append(",");
            sb.append("\"effective_date\":").append(quoted(date(s.effectiveDate()))).append(",");
            sb.append("\"indicators\":").append(jsonArray(s.indicators())).append(",");
            sb.append("\"clauses\":[");
            List<Clause> clauses = s.clauses();
            for (int j = 0; j < clauses.size(); j++) {
                if (j > 0) sb.append(",");
                Clause c = clauses.get(j);
                sb.append("{");
                sb.append("\"id\":").append(quoted(c.id())).append(",");
                sb.append("\"title\":").append(quoted(c.title())).append(",");
                sb.append("\"description\":").append(quoted(c.description())).append(",");
                sb.append("\"indicators\":").append(jsonArray(c.indicators()));
                sb.append("}");
            }
            sb.append("]}");
        }
        sb.append("]}");
        return sb.toString();
    }

    public static String buildCrosswalkJson(String source, String target, double threshold, int topK,
                                            List<MatchResult> matches) {
        StringBuilder sb = new StringBuilder();
        sb.append("{");
        sb.append("\"source\":").append(quoted(source)).append(",");
        sb.append("\"target\":").append(quoted(target)).append(",");
        sb.append("\"threshold\":").append(threshold).append(",");
        sb.append("\"top_k\":").append(topK).append(",");
        sb.append("\"matches\":[");
        for (int i = 0; i < matches.size(); i++) {
            if (i > 0) sb.append(",");
            MatchResult m = matches.get(i);
            sb.append("{");
            sb.append("\"source_id\":").append(quoted(m.sourceId())).append(",");
            sb.append("\"source_title\":").append(quoted(m.sourceTitle())).append(",");
            sb.append("\"target_id\":").append(quoted(m.targetId())).append(",");
            sb.append("\"target_title\":").append(quoted(m.targetTitle())).append(",");
            sb.append("\"score\":").append(m.score());
            sb.append("}");
        }
        sb.append("]}");
        return sb.toString();
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static String date(LocalDate date) {
        return date != null ? date.format(DateTimeFormatter.ISO_LOCAL_DATE) : null;
    }

    static String quoted(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char ch : s.toCharArray()) {
            switch (ch) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20) sb.append(String.format("\\u%04x", (int) ch));
                    else sb.append(ch);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static String jsonArray(List<String> list) {
        if (list == null || list.isEmpty()) return "[]";
        return "[" + list.stream().map(StandardsMapper::quoted).collect(Collectors.joining(",")) + "]";
    }
}
