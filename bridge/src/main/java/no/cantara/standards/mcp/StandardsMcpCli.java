package no.cantara.standards.mcp;

import io.modelcontextprotocol.json.McpJsonDefaults;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import no.cantara.standards.CorpusLoadException;
import no.cantara.standards.EngineSettings;
import no.cantara.standards.KeywordOverlapScorer;
import no.cantara.standards.StandardsEngine;
import no.cantara.standards.model.CorpusLoadResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for standards-mcp.
 *
 * <pre>
 * Usage: standards-mcp [corpus-dir] [--threshold x] [--top-k n] [--no-warnings]
 * </pre>
 */
public class StandardsMcpCli {

    static final String USAGE = "Usage: standards-mcp [corpus-dir] [--threshold x] [--top-k n] [--no-warnings]";

    record Options(Path corpusDir, EngineSettings settings, boolean warnOnValidation) {}

    /**
     * @throws IllegalArgumentException on a malformed or out-of-range flag value
     */
    static Options parse(String[] args) {
        Path           corpusDir        = Path.of("data/standards");
        EngineSettings settings         = EngineSettings.defaults();
        boolean        warnOnValidation = true;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--threshold"   -> settings = settings.withThreshold(Double.parseDouble(value(args, ++i)));
                case "--top-k"       -> settings = settings.withTopK(Integer.parseInt(value(args, ++i)));
                case "--no-warnings" -> warnOnValidation = false;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("unknown option " + args[i]);
                    }
                    corpusDir = Path.of(args[i]);
                }
            }
        }
        return new Options(corpusDir, settings, warnOnValidation);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("missing value for " + args[i - 1]);
        }
        return args[i];
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("[standards-mcp] Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        if (!Files.isDirectory(options.corpusDir())) {
            System.err.println("[standards-mcp] Error: corpus directory not found at " + options.corpusDir());
            System.exit(1);
        }

        StandardsEngine engine = new StandardsEngine(
            options.corpusDir(), new KeywordOverlapScorer(), options.settings());

        McpSyncServer server;
        try {
            CorpusLoadResult result = engine.loadCorpus();
            if (options.warnOnValidation()) {
                result.warnings().forEach(w -> System.err.println("[standards-mcp] ⚠ " + w));
            }
            result.failures().forEach(f ->
                System.err.println("[standards-mcp] Skipped " + f.file() + ": " + f.message()));

            StdioServerTransportProvider transport =
                new StdioServerTransportProvider(McpJsonDefaults.getMapper());
            server = StandardsServer.createServer(engine, transport);
        } catch (CorpusLoadException e) {
            System.err.println("[standards-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Block the main thread; transport handles I/O on daemon threads.
        // The process exits when stdin is closed (e.g. MCP client disconnects).
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
