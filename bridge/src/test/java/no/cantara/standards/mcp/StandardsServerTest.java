package no.cantara.standards.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.standards.EngineSettings;
import no.cantara.standards.KeywordOverlapScorer;
import no.cantara.standards.StandardsEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Calls buildResources() and the read handlers directly; no MCP transport is involved.
 */
class StandardsServerTest {

    private final ObjectMapper om = new ObjectMapper();

    private static Path fixture(String name) {
        URL url = StandardsServerTest.class.getClassLoader().getResource("fixtures/" + name);
        assertNotNull(url, "fixture not found: " + name);
        return Paths.get(url.getPath());
    }

    private static StandardsEngine loaded(Path dir) {
        StandardsEngine engine = new StandardsEngine(dir);
        engine.loadCorpus();
        return engine;
    }

    private JsonNode read(StandardsServer.ResourceSet rs, String uri) throws IOException {
        McpSchema.ReadResourceResult result = rs.handlers().get(uri).handle(uri);
        assertEquals(1, result.contents().size());
        McpSchema.TextResourceContents text = (McpSchema.TextResourceContents) result.contents().get(0);
        assertEquals("application/json", text.mimeType());
        assertEquals(uri, text.uri());
        return om.readTree(text.text());
    }

    // ── list_resources ────────────────────────────────────────────────────────────

    @Test void listsIndexAccreditorsAndCrosswalks() {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        List<String> uris = rs.resources().stream().map(McpSchema.Resource::uri).toList();
        assertEquals(List.of(
            "standards://corpus/metadata",
            "standards://accreditor/HLC",
            "standards://accreditor/MSCHE",
            "standards://crosswalk/HLC/MSCHE",
            "standards://crosswalk/MSCHE/HLC"), uris);
        assertEquals(uris.size(), rs.handlers().size());
    }

    @Test void emptyEngineListsOnlyTheIndex() {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(new StandardsEngine(fixture("small")));
        assertEquals(1, rs.resources().size());
    }

    @Test void indexHasPriority1() {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        assertEquals(1.0, rs.resources().get(0).annotations().priority());
    }

    // ── read_resource ─────────────────────────────────────────────────────────────

    @Test void readMetadataReturnsJson() throws Exception {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        JsonNode body = read(rs, "standards://corpus/metadata");
        assertEquals(2, body.get("accreditor_count").asInt());
        JsonNode hlc = body.get("accreditors").get(0);
        assertEquals("HLC", hlc.get("accreditor").asText());
        assertEquals("Higher Learning Commission", hlc.get("name").asText());
        assertEquals("2020", hlc.get("version").asText());
        assertEquals("2020-09-01", hlc.get("effective_date").asText());
        assertEquals(5, hlc.get("standard_count").asInt());
        assertTrue(hlc.get("license").isNull());
    }

    @Test void readAccreditorReturnsStandardsWithClauses() throws Exception {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        JsonNode body = read(rs, "standards://accreditor/HLC");
        assertEquals(5, body.get("standard_count").asInt());
        JsonNode first = body.get("standards").get(0);
        assertEquals("HLC_1", first.get("id").asText());
        assertEquals("Mission", first.get("title").asText());
        assertEquals("HLC_1.A", first.get("clauses").get(0).get("id").asText());
        assertEquals("mission statement", first.get("clauses").get(0).get("indicators").get(0).asText());
    }

    @Test void readCrosswalkUsesConfiguredSettings() throws Exception {
        EngineSettings settings = EngineSettings.defaults().withThreshold(0.5).withTopK(1);
        StandardsEngine engine = new StandardsEngine(fixture("small"), new KeywordOverlapScorer(), settings);
        engine.loadCorpus();
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(engine);

        JsonNode body = read(rs, "standards://crosswalk/HLC/MSCHE");
        assertEquals(0.5, body.get("threshold").asDouble());
        assertEquals(1, body.get("top_k").asInt());
        JsonNode matches = body.get("matches");
        assertEquals(1, matches.size());
        assertEquals("HLC_1", matches.get(0).get("source_id").asText());
        assertEquals("MSCHE_I", matches.get(0).get("target_id").asText());
        assertTrue(matches.get(0).get("score").asDouble() >= 0.5);
    }

    @Test void crosswalkMatchesMissionStandards() throws Exception {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        JsonNode matches = read(rs, "standards://crosswalk/MSCHE/HLC").get("matches");
        assertFalse(matches.isEmpty());
        boolean mission = false;
        for (JsonNode m : matches) {
            mission |= m.get("source_title").asText().contains("Mission")
                && m.get("target_title").asText().contains("Mission");
        }
        assertTrue(mission);
    }

    @Test void readUnknownHandlerReturnsNull() {
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(loaded(fixture("small")));
        // self-crosswalks and unloaded accreditors are never listed
        assertNull(rs.handlers().get("standards://accreditor/ACCJC"));
        assertNull(rs.handlers().get("standards://crosswalk/HLC/HLC"));
    }

    // ── reload ────────────────────────────────────────────────────────────────────

    @Test void handlersServeReloadedCorpus(@TempDir Path tmp) throws Exception {
        for (String name : List.of("hlc.yaml", "msche.yaml")) {
            try (InputStream in = StandardsServerTest.class.getClassLoader()
                    .getResourceAsStream("fixtures/small/" + name)) {
                assertNotNull(in, name);
                Files.copy(in, tmp.resolve(name));
            }
        }
        StandardsEngine engine = loaded(tmp);
        StandardsServer.ResourceSet rs = StandardsServer.buildResources(engine);

        Files.writeString(tmp.resolve("hlc.yaml"), String.join("\n",
            "accreditor: HLC",
            "metadata:",
            "  name: Higher Learning Commission",
            "  version: \"2025\"",
            "standards:",
            "  - id: \"1\"",
            "    title: Mission",
            "    description: The mission is clear.",
            "    category: Mission",
            "    indicators: [mission statement]",
            ""));
        engine.reload();

        JsonNode body = read(rs, "standards://accreditor/HLC");
        assertEquals("2025", body.get("version").asText());
        assertEquals(1, body.get("standard_count").asInt());
    }
}
