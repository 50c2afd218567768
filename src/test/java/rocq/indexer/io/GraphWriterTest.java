package rocq.indexer.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import rocq.indexer.graph.DependencyGraphBuilder;
import rocq.indexer.graph.Graph;
import rocq.indexer.scan.CorpusScanner;
import rocq.indexer.scan.DeclarationScanner;
import rocq.indexer.scan.SourceText;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON output")
class GraphWriterTest {

    @TempDir
    Path outDir;

    static Graph sampleGraph() {
        final SourceText src = SourceText.of("arith/double.v", """
                (* doubles a number *)
                Lemma double_ok : forall n, double n = n + n.
                Proof.
                  induction n; simpl; auto.
                Qed.

                (* Main result *)
                Theorem quadruple_ok : forall n, double (double n) = 4 * n.
                Proof.
                  intros n. rewrite !double_ok.
                  lia.
                Qed.
                """);
        return new DependencyGraphBuilder().build(
                new CorpusScanner(new DeclarationScanner(), false).scan(List.of(src)));
    }

    @Test
    @DisplayName("Writes declarations, adjacency maps and the master index")
    void writesAllFiles() throws IOException {
        new GraphWriter(outDir).writeAll(sampleGraph(), "Arithmetic", "2024-01-01T00:00:00Z");

        final ObjectMapper mapper = new ObjectMapper();
        final List<String> lines = Files.readAllLines(outDir.resolve(GraphWriter.DECLARATIONS_FILE), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        final JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("double_ok", first.get("name").asText());
        assertEquals("Lemma", first.get("kind").asText());
        assertEquals("supporting", first.get("role").asText());
        assertEquals(3, first.get("proofLines").asInt());
        assertEquals("quadruple_ok", first.get("usedBy").get(0).asText());

        final JsonNode uses = mapper.readTree(outDir.resolve(GraphWriter.USES_FILE).toFile());
        assertEquals("double_ok", uses.get("quadruple_ok").get(0).asText());

        final JsonNode usedBy = mapper.readTree(outDir.resolve(GraphWriter.USED_BY_FILE).toFile());
        assertEquals(0, usedBy.get("quadruple_ok").size());

        final JsonNode index = mapper.readTree(outDir.resolve(GraphWriter.INDEX_FILE).toFile());
        assertEquals(GraphWriter.SCHEMA_VERSION, index.get("schema").asText());
        assertEquals("Arithmetic", index.get("title").asText());
        final JsonNode summary = index.get("summary");
        assertEquals(2, summary.get("totalDeclarations").asInt());
        assertEquals(1, summary.get("primary").asInt());
        assertEquals(7, summary.get("totalProofLines").asInt());
        assertEquals(1, summary.get("edges").asInt());
        assertEquals("arith/double.v", summary.get("files").get(0).get("file").asText());
    }
}
