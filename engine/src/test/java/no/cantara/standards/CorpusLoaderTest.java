package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.Clause;
import no.cantara.standards.model.CorpusLoadResult;
import no.cantara.standards.model.CorpusMetadata;
import no.cantara.standards.model.LoadFailure;
import no.cantara.standards.model.Standard;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CorpusLoaderTest {

    private static final String HLC = String.join("\n",
            "accreditor: HLC",
            "metadata:",
            "  name: Higher Learning Commission",
            "  version: \"2020\"",
            "standards:",
            "  - id: \"1\"",
            "    title: Mission",
            "    description: The mission is clear.",
            "    category: Mission",
            "    indicators: [mission statement]",
            "");

    private static final String MSCHE = String.join("\n",
            "accreditor: MSCHE",
            "metadata:",
            "  name: Middle States Commission on Higher Education",
            "  version: \"14\"",
            "standards:",
            "  - id: I",
            "    title: Mission and Goals",
            "    description: Mission defines purpose.",
            "    category: Mission",
            "    indicators: [mission statement]",
            "");

    // -----------------------------------------------------------------------
    // Regional fixture corpus
    // -----------------------------------------------------------------------

    @Test
    void loadsAllRegionalAccreditors() {
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        Set<String> codes = result.accreditors().stream().map(Accreditor::code).collect(Collectors.toSet());
        assertEquals(Set.of("SACSCOC", "HLC", "MSCHE", "WASC", "NWCCU", "NECHE"), codes);
        assertFalse(result.hasFailures(), () -> "unexpected failures: " + result.failures());
        result.accreditors().forEach(a -> assertFalse(a.standards().isEmpty(), a.code() + " has no standards"));
    }

    @Test
    void metadataCountsMatchLoadedStandards() {
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        for (Accreditor accreditor : result.accreditors()) {
            CorpusMetadata meta = result.metadata().get(accreditor.code());
            assertNotNull(meta, accreditor.code());
            assertEquals(accreditor.standardCount(), meta.standardCount(), accreditor.code());
            assertEquals(accreditor.standards().size(), result.standardsByAccreditor().get(accreditor.code()).size());
        }
    }

    @Test
    void everyIdCarriesItsAccreditorPrefix() {
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        result.standardsByAccreditor().forEach((code, standards) -> {
            for (Standard standard : standards) {
                assertTrue(standard.id().startsWith(code + "_"), standard.id());
                for (Clause clause : standard.clauses()) {
                    assertTrue(clause.id().startsWith(code + "_"), clause.id());
                }
            }
        });
    }

    @Test
    void loadsFilesInNameOrder() {
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        List<String> files = result.metadata().values().stream().map(CorpusMetadata::file).toList();
        assertEquals(List.of("hlc.yaml", "msche.yaml", "neche.yaml", "nwccu.json", "sacscoc.yaml", "wasc.yaml"), files);
    }

    @Test
    void recordsDocumentLevelMetadata() {
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        CorpusMetadata sacscoc = result.metadata().get("SACSCOC");
        assertEquals("2024", sacscoc.version());
        assertEquals("https://sacscoc.org/accrediting-standards/", sacscoc.sourceUrl());
        assertEquals("sacscoc.yaml", sacscoc.file());
    }

    @Test
    void collectsValidationWarnings() {
        // MSCHE IV declares neither clauses nor indicators
        CorpusLoadResult result = CorpusLoader.load(Fixtures.regional());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("MSCHE_IV") && w.contains("no indicators")));
    }

    // -----------------------------------------------------------------------
    // Failure isolation
    // -----------------------------------------------------------------------

    @Test
    void malformedFileFailsOnlyItsAccreditor(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("hlc.yaml"), HLC);
        Files.writeString(dir.resolve("msche.yaml"), MSCHE);
        Files.writeString(dir.resolve("neche.yaml"), String.join("\n",
                "accreditor: NECHE",
                "standards:",
                "  - id: \"1\"",
                "    description: Title is missing.",
                ""));

        CorpusLoadResult result = CorpusLoader.load(dir);

        assertEquals(List.of("HLC", "MSCHE"), result.accreditors().stream().map(Accreditor::code).toList());
        assertEquals(1, result.failures().size());
        LoadFailure failure = result.failures().get(0);
        assertEquals("neche.yaml", failure.file());
        assertEquals("NECHE", failure.accreditor());
        assertTrue(failure.message().contains("title"));
        assertFalse(result.metadata().containsKey("NECHE"));
    }

    @Test
    void unparsableFileIsReportedUnderItsStem(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("hlc.yaml"), HLC);
        Files.writeString(dir.resolve("wasc.yaml"), "standards: [ {id: 1, title: unclosed\n");

        CorpusLoadResult result = CorpusLoader.load(dir);

        assertEquals(1, result.accreditors().size());
        assertEquals("WASC", result.failures().get(0).accreditor());
    }

    @Test
    void validationErrorFailsAccreditor(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("hlc.yaml"), String.join("\n",
                "accreditor: HLC",
                "standards:",
                "  - id: \"1\"",
                "    title: Mission",
                "    description: First.",
                "  - id: HLC_1",
                "    title: Mission again",
                "    description: Same id after prefixing.",
                ""));

        CorpusLoadResult result = CorpusLoader.load(dir);

        assertTrue(result.accreditors().isEmpty());
        assertTrue(result.failures().get(0).message().contains("duplicate id"));
    }

    @Test
    void duplicateAccreditorCodeKeepsFirstFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a-hlc.yaml"), HLC);
        Files.writeString(dir.resolve("b-hlc.yaml"), HLC);

        CorpusLoadResult result = CorpusLoader.load(dir);

        assertEquals(1, result.accreditors().size());
        assertEquals("a-hlc.yaml", result.metadata().get("HLC").file());
        LoadFailure failure = result.failures().get(0);
        assertEquals("b-hlc.yaml", failure.file());
        assertTrue(failure.message().contains("duplicate accreditor"));
    }

    @Test
    void ignoresNonCorpusFilesAndDirectories(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("hlc.yml"), HLC);
        Files.writeString(dir.resolve("README.md"), "# Standards");
        Files.createDirectory(dir.resolve("archive.yaml"));

        CorpusLoadResult result = CorpusLoader.load(dir);

        assertEquals(1, result.accreditors().size());
        assertFalse(result.hasFailures());
    }

    @Test
    void emptyDirectoryLoadsNothing(@TempDir Path dir) {
        CorpusLoadResult result = CorpusLoader.load(dir);
        assertTrue(result.accreditors().isEmpty());
        assertTrue(result.metadata().isEmpty());
    }

    @Test
    void missingDirectoryIsALoadError(@TempDir Path dir) {
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> CorpusLoader.load(dir.resolve("nope")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void fileInsteadOfDirectoryIsALoadError(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("hlc.yaml"), HLC);
        assertThrows(CorpusLoadException.class, () -> CorpusLoader.load(file));
    }
}
