package no.cantara.standards.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.standards.StandardsEngine;
import no.cantara.standards.StandardsGraph;
import no.cantara.standards.model.CorpusMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and returns a configured MCP server for a loaded standards engine.
 */
public final class StandardsServer {

    private static final Logger log = LoggerFactory.getLogger(StandardsServer.class);

    private StandardsServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the resource list and per-URI read handlers built from the published corpus.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    /**
     * Lists one resource per accreditor in the engine's current graph, plus the corpus index
     * and a crosswalk for every ordered pair of distinct accreditors. Handlers query the
     * engine when invoked, so they serve whatever corpus is published at read time.
     */
    static ResourceSet buildResources(StandardsEngine engine) {
        StandardsGraph graph = engine.graph();
        List<String> codes = graph.accreditors();

        List<McpSchema.Resource>     resources = new ArrayList<>();
        Map<String, ResourceHandler> handlers  = new LinkedHashMap<>();

        // ── corpus index ──────────────────────────────────────────────────────────
        resources.add(StandardsMapper.buildMetadataResource());
        handlers.put(StandardsMapper.metadataUri(), uri ->
            json(uri, StandardsMapper.buildMetadataJson(engine.getCorpusMetadata())));

        // ── accreditors ───────────────────────────────────────────────────────────
        for (String code : codes) {
            CorpusMetadata meta = graph.getCorpusMetadata().get(code);
            resources.add(StandardsMapper.buildAccreditorResource(meta));
            handlers.put(StandardsMapper.accreditorUri(code), uri ->
                json(uri, StandardsMapper.buildAccreditorJson(
                    code, engine.graph().getAccreditor(code).orElse(null))));
        }

        // ── crosswalks ────────────────────────────────────────────────────────────
        for (String source : codes) {
            for (String target : codes) {
                if (source.equals(target)) continue;
                resources.add(StandardsMapper.buildCrosswalkResource(source, target));
                handlers.put(StandardsMapper.crosswalkUri(source, target), uri ->
                    json(uri, StandardsMapper.buildCrosswalkJson(
                        source, target,
                        engine.settings().threshold(), engine.settings().topK(),
                        engine.findCrossAccreditorMatches(source, target))));
            }
        }

        return new ResourceSet(resources, handlers);
    }

    private static McpSchema.ReadResourceResult json(String uri, String body) {
        return new McpSchema.ReadResourceResult(
            List.of(new McpSchema.TextResourceContents(uri, StandardsMapper.MIME_JSON, body, null)),
            null
        );
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Returns a configured MCP sync server over {@code engine}, which must already have
     * loaded its corpus.
     *
     * @param engine    loaded standards engine
     * @param transport MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(StandardsEngine engine, McpServerTransportProvider transport) {
        ResourceSet rs = buildResources(engine);

        StandardsGraph.Summary summary = engine.graph().summary();
        log.info("Serving {} accreditors, {} standards from {} as {} resources",
            summary.accreditors(), summary.standards(), engine.source(), rs.resources().size());
        log.info("Start with: {}", StandardsMapper.metadataUri());

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("standards-engine", "0.1.0")
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(null, null)
                .build())
            .build();

        for (McpSchema.Resource resource : rs.resources()) {
            ResourceHandler handler = rs.handlers().get(resource.uri());
            server.addResource(new McpServerFeatures.SyncResourceSpecification(
                resource,
                (exchange, request) -> handler.handle(request.uri())
            ));
        }

        return server;
    }
}
