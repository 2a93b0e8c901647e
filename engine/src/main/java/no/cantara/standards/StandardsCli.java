package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.CorpusLoadResult;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.EvidenceMapping;
import no.cantara.standards.model.MatchResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line interface for the standards engine.
 * Usage: java -jar standards-engine.jar &lt;command&gt; &lt;corpus-dir&gt; [args] [options]
 */
public class StandardsCli {

    static final String USAGE = String.join("\n",
            "Usage: java -jar standards-engine.jar <command> <corpus-dir> [args] [options]",
            "  validate  <corpus-dir>",
            "  metadata  <corpus-dir>",
            "  crosswalk <corpus-dir> <SOURCE> <TARGET> [--threshold x] [--top-k n]",
            "  map       <corpus-dir> <evidence-file> [ACCREDITOR] [--spans n]");

    static final String LOG_CONFIG = "standards-cli-logback.xml";

    public static void main(String[] args) {
        // must be set before the first logger is created
        if (System.getProperty("logback.configurationFile") == null) {
            System.setProperty("logback.configurationFile", LOG_CONFIG);
        }
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command and returns the process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        EngineSettings settings = EngineSettings.defaults();
        List<String> positional = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--threshold" -> settings = settings.withThreshold(Double.parseDouble(value(args, ++i)));
                    case "--top-k"     -> settings = settings.withTopK(Integer.parseInt(value(args, ++i)));
                    case "--spans"     -> settings = settings.withMaxRationaleSpans(Integer.parseInt(value(args, ++i)));
                    default -> positional.add(args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        if (positional.size() < 2) {
            err.println(USAGE);
            return 1;
        }

        String command = positional.get(0);
        Path corpusDir = Path.of(positional.get(1));
        StandardsEngine engine = new StandardsEngine(corpusDir, new KeywordOverlapScorer(), settings);

        CorpusLoadResult result;
        try {
            result = engine.loadCorpus();
        } catch (CorpusLoadException e) {
            err.println("Load error: " + e.getMessage());
            return 1;
        }

        return switch (command) {
            case "validate"  -> validate(result, corpusDir, out, err);
            case "metadata"  -> metadata(engine, out);
            case "crosswalk" -> crosswalk(engine, positional, out, err);
            case "map"       -> map(engine, positional, out, err);
            default -> {
                err.println("Unknown command: " + command);
                err.println(USAGE);
                yield 1;
            }
        };
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static int validate(CorpusLoadResult result, Path corpusDir, PrintStream out, PrintStream err) {
        result.accreditors().forEach(a -> out.printf("  %-10s %3d standard(s)%n", a.code(), a.standardCount()));
        result.warnings().forEach(w -> err.println("  ⚠ " + w));
        if (result.hasFailures()) {
            err.println("Load failed: " + result.failures().size() + " file(s):");
            result.failures().forEach(f -> err.println("  • " + f.file() + " (" + f.accreditor() + "): " + f.message()));
            return 1;
        }
        int standards = result.accreditors().stream().mapToInt(Accreditor::standardCount).sum();
        out.printf("✓ %s is valid: %d accreditor(s), %d standard(s)%n",
                corpusDir, result.accreditors().size(), standards);
        return 0;
    }

    private static int metadata(StandardsEngine engine, PrintStream out) {
        for (CorpusMetadata m : engine.getCorpusMetadata().values()) {
            out.printf("%-10s %-45s version %-8s %3d standard(s)%n",
                    m.accreditor(),
                    m.name() != null ? m.name() : "-",
                    m.version() != null ? m.version() : "-",
                    m.standardCount());
        }
        return 0;
    }

    private static int crosswalk(StandardsEngine engine, List<String> positional, PrintStream out, PrintStream err) {
        if (positional.size() < 4) {
            err.println(USAGE);
            return 1;
        }
        List<MatchResult> matches = engine.findCrossAccreditorMatches(positional.get(2), positional.get(3));
        if (matches.isEmpty()) {
            out.println("No matches.");
        }
        for (MatchResult m : matches) {
            out.printf(Locale.ROOT, "%.3f  %s (%s)  ->  %s (%s)%n",
                    m.score(), m.sourceId(), m.sourceTitle(), m.targetId(), m.targetTitle());
        }
        return 0;
    }

    private static int map(StandardsEngine engine, List<String> positional, PrintStream out, PrintStream err) {
        if (positional.size() < 3) {
            err.println(USAGE);
            return 1;
        }
        String evidence;
        try {
            evidence = Files.readString(Path.of(positional.get(2)));
        } catch (IOException e) {
            err.println("Cannot read evidence file: " + e.getMessage());
            return 1;
        }
        String accreditor = positional.size() > 3 ? positional.get(3) : null;

        for (EvidenceMapping m : engine.mapEvidenceToStandards(evidence, accreditor)) {
            if (m.confidence() == 0.0) continue;
            out.printf(Locale.ROOT, "%.3f  %-7s %s %s  %s%n",
                    m.confidence(), m.matchType().label(), m.meetsStandard() ? "✓" : " ", m.standardId(), m.title());
            m.rationaleSpans().forEach(s -> out.println("         \"" + s + "\""));
        }
        return 0;
    }
}
