package rocq.indexer.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rocq.indexer.model.DeclarationKind;
import rocq.indexer.model.StatsRow;
import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Proof lookup from stats rows")
class ProofLocatorTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Finds the proof in the home file, first root wins")
    void locatesProof() throws IOException {
        final Path first = Files.createDirectories(root.resolve("first"));
        final Path second = Files.createDirectories(root.resolve("second"));
        Files.writeString(second.resolve("m.v"), """
                Theorem t : True.
                Proof.
                  apply helper.
                Qed.
                """);

        final StatsRow row = new StatsRow("m.v", "Top-level", "t", null, 3, "Theorem t : True.", "");
        final ProofLocator locator = new ProofLocator(List.of(first, second), new DeclarationScanner());
        final List<ScannedDeclaration> out = locator.locate(List.of(row));

        assertEquals(1, out.size());
        assertEquals(DeclarationKind.THEOREM, out.get(0).kind());
        assertTrue(out.get(0).proof().text().contains("apply helper."));
        assertEquals(0, locator.warningCount());
    }

    @Test
    @DisplayName("Unresolvable rows keep an empty proof")
    void unresolvable() throws IOException {
        Files.writeString(root.resolve("m.v"), "Lemma other : True. Admitted.\n");

        final List<StatsRow> rows = List.of(
                new StatsRow("gone.v", "Top-level", "x", "Lemma", 2, "Lemma x : True.", ""),
                new StatsRow("gone.v", "Top-level", "y", "Fact", 2, "Fact y : True.", ""),
                new StatsRow("m.v", "Top-level", "renamed", "Lemma", 2, "Lemma renamed : True.", ""));
        final ProofLocator locator = new ProofLocator(List.of(root), new DeclarationScanner());
        final List<ScannedDeclaration> out = locator.locate(rows);

        assertEquals(3, out.size());
        assertTrue(out.stream().allMatch(d -> d.proof().isEmpty()));
        assertEquals(DeclarationKind.FACT, out.get(1).kind());
        // one missing file (looked up once) + one missing declaration
        assertEquals(2, locator.warningCount());
    }
}
