package rocq.indexer.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import rocq.indexer.graph.Graph;
import rocq.indexer.model.Declaration;
import rocq.indexer.model.Role;

public final class GraphWriter {

    public static final String SCHEMA_VERSION = "rocq-stats/v1";

    public static final String DECLARATIONS_FILE = "declarations.jsonl";
    public static final String USES_FILE = "dependencies.json";
    public static final String USED_BY_FILE = "used-by.json";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public void writeAll(Graph graph, String title, String generatedAt) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        writeJsonl(outDir.resolve(DECLARATIONS_FILE), graph.declarations());
        writeJson(outDir.resolve(USES_FILE), graph.uses());
        writeJson(outDir.resolve(USED_BY_FILE), graph.usedBy());

        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                title == null ? "" : title,
                generatedAt,
                DECLARATIONS_FILE,
                USES_FILE,
                USED_BY_FILE,
                summarize(graph)
        );
        writeJson(outDir.resolve(INDEX_FILE), idx);
    }

    static Summary summarize(Graph graph) {
        // file -> counters, sorted by file
        final Map<String, int[]> perFile = new TreeMap<>();
        int primary = 0;
        int proofLines = 0;
        for (Declaration d : graph.declarations()) {
            final int[] c = perFile.computeIfAbsent(d.file(), k -> new int[3]);
            c[0]++;
            c[2] += d.proofLines();
            if (d.role() == Role.PRIMARY) {
                c[1]++;
                primary++;
            }
            proofLines += d.proofLines();
        }

        final List<FileSummary> files = new ArrayList<>(perFile.size());
        for (var e : perFile.entrySet()) {
            final int[] c = e.getValue();
            files.add(new FileSummary(e.getKey(), c[0], c[1], c[2]));
        }

        return new Summary(
                graph.declarations().size(),
                primary,
                proofLines,
                graph.edgeCount(),
                graph.duplicates().size(),
                graph.warnings(),
                files
        );
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        // overwrite each time (simple + deterministic)
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String title,
            String generatedAt,
            String declarations,
            String uses,
            String usedBy,
            Summary summary
    ) {
    }

    public record Summary(
            int totalDeclarations,
            int primary,
            int totalProofLines,
            int edges,
            int duplicateNames,
            int warnings,
            List<FileSummary> files
    ) {
    }

    public record FileSummary(
            String file,
            int declarations,
            int primary,
            int proofLines
    ) {
    }
}
