package rocq.indexer.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Corpus scanning")
class CorpusScannerTest {

    @TempDir
    Path root;

    private Path write(String rel, String content) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Records carry root-relative paths in input order")
    void relativePathsInOrder() throws IOException {
        final Path a = write("a.v", "Lemma a1 : True. Admitted.\nLemma a2 : True. Admitted.\n");
        final Path b = write("sub/b.v", "Theorem b1 : True.\r\nProof.\r\n  exact I.\r\nQed.\r\n");

        final CorpusScanner corpus = new CorpusScanner(new DeclarationScanner(), false);
        final List<ScannedDeclaration> out = corpus.scanFiles(root, List.of(a, b));

        assertEquals(List.of("a1", "a2", "b1"), out.stream().map(ScannedDeclaration::name).toList());
        assertEquals("a.v", out.get(0).file());
        assertEquals("sub/b.v", out.get(2).file());
        assertEquals(3, out.get(2).proofLines());
        assertEquals("Proof.\n  exact I.\nQed.", out.get(2).proof().text());
        assertEquals(2, corpus.filesScanned());
        assertEquals(0, corpus.readWarningCount());
    }

    @Test
    @DisplayName("An unreadable file is reported and skipped")
    void unreadableFileIsSkipped() throws IOException {
        final Path good = write("good.v", "Lemma ok : True. Admitted.\n");
        final Path missing = root.resolve("missing.v");

        final CorpusScanner corpus = new CorpusScanner(new DeclarationScanner(), false);
        final List<ScannedDeclaration> out = corpus.scanFiles(root, List.of(missing, good));

        assertEquals(List.of("ok"), out.stream().map(ScannedDeclaration::name).toList());
        assertEquals(1, corpus.readWarningCount());
        assertEquals(1, corpus.filesScanned());
    }

    @Test
    @DisplayName("Parallel scan returns the sequential result")
    void parallelMatchesSequential() {
        final List<SourceText> sources = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            sources.add(SourceText.of("f" + i + ".v",
                    "Section S" + i + ".\nLemma l" + i + " : True.\nProof.\n  exact I.\nQed.\nEnd S" + i + ".\n"));
        }
        final List<ScannedDeclaration> sequential = new CorpusScanner(new DeclarationScanner(), false).scan(sources);
        final List<ScannedDeclaration> parallel = new CorpusScanner(new DeclarationScanner(), true).scan(sources);
        assertEquals(sequential, parallel);
        assertEquals(40, parallel.size());
        assertEquals("S7", parallel.get(7).section());
    }
}
