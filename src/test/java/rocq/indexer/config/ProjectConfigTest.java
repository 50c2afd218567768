package rocq.indexer.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rocq.indexer.classify.Classifier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Project file")
class ProjectConfigTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Loads a full project file and resolves directories")
    void fullFile() throws IOException {
        final Path yaml = dir.resolve("dual.yaml");
        Files.writeString(yaml, """
                name: dual
                title: Dual formalization
                description: Lemmas of the dual paper
                index: README.md
                source:
                  repo: https://example.org/dual.git
                  branch: main
                  directories:
                    - theories
                    - /abs/src
                  recursive: false
                markers: [key, central]
                nestedComments: true
                """);

        final ProjectConfig cfg = ProjectConfig.load(yaml);
        assertEquals("dual", cfg.name());
        assertEquals("Dual formalization", cfg.titleOrName());
        assertEquals(List.of(dir.resolve("theories"), Path.of("/abs/src")), cfg.directories(dir));
        assertFalse(cfg.recursiveOr(true));
        assertTrue(cfg.nestedCommentsOr(false));
        assertEquals(List.of("key", "central"), cfg.markersOrDefault());
    }

    @Test
    @DisplayName("Missing values fall back to defaults")
    void defaults() throws IOException {
        final Path yaml = dir.resolve("min.yaml");
        Files.writeString(yaml, "name: minimal\n");

        final ProjectConfig cfg = ProjectConfig.load(yaml);
        assertEquals("minimal", cfg.titleOrName());
        assertTrue(cfg.directories(dir).isEmpty());
        assertTrue(cfg.recursiveOr(true));
        assertFalse(cfg.nestedCommentsOr(false));
        assertEquals(Classifier.DEFAULT_MARKERS, cfg.markersOrDefault());
    }

    @Test
    @DisplayName("Missing file is an IOException")
    void missingFile() {
        assertThrows(IOException.class, () -> ProjectConfig.load(dir.resolve("nope.yaml")));
    }
}
