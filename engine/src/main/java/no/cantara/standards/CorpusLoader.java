package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.CorpusLoadResult;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.LoadFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads every accreditor corpus file in a directory.
 *
 * <p>Each file is parsed, normalized and validated on its own: a malformed file fails
 * only its accreditor and is reported as a {@link LoadFailure}; the remaining files
 * still load.
 */
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private static final Set<String> SUFFIXES = Set.of(".yaml", ".yml", ".json");

    /**
     * @throws CorpusLoadException if {@code dir} does not exist, is not a directory, or cannot be listed
     */
    public static CorpusLoadResult load(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            throw new CorpusLoadException("Standards corpus directory not found: " + dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new CorpusLoadException("Standards corpus path is not a directory: " + dir);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(CorpusLoader::isCorpusFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CorpusLoadException("Cannot list standards corpus directory " + dir, e);
        }

        List<Accreditor> accreditors = new ArrayList<>();
        Map<String, CorpusMetadata> metadata = new LinkedHashMap<>();
        List<LoadFailure> failures = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            CorpusParser.ParsedCorpus parsed;
            try {
                parsed = CorpusParser.parse(file);
            } catch (IOException | CorpusFormatException e) {
                log.error("Failed loading {}: {}", fileName, e.getMessage());
                failures.add(new LoadFailure(fileName, CorpusParser.codeFromFileName(fileName), e.getMessage()));
                continue;
            }

            Accreditor accreditor = parsed.accreditor();
            String code = accreditor.code();
            if (metadata.containsKey(code)) {
                String message = "duplicate accreditor " + code + " (already loaded from "
                        + metadata.get(code).file() + ")";
                log.error("Failed loading {}: {}", fileName, message);
                failures.add(new LoadFailure(fileName, code, message));
                continue;
            }

            CorpusValidator.ValidationResult result = CorpusValidator.validate(accreditor);
            result.warnings().forEach(w -> log.warn("{}: {}", fileName, w));
            if (!result.isValid()) {
                String message = String.join("; ", result.errors());
                log.error("Failed loading {}: {}", fileName, message);
                failures.add(new LoadFailure(fileName, code, message));
                continue;
            }

            warnings.addAll(result.warnings());
            accreditors.add(accreditor);
            metadata.put(code, parsed.metadata());
            log.info("Loaded {} standards for {} from {}", accreditor.standardCount(), code, fileName);
        }

        return new CorpusLoadResult(accreditors, metadata, failures, warnings);
    }

    private static boolean isCorpusFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 && SUFFIXES.contains(name.substring(dot));
    }
}
