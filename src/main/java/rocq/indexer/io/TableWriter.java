package rocq.indexer.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import rocq.indexer.model.Declaration;
import rocq.indexer.model.DependencyRow;
import rocq.indexer.model.StatsRow;

/**
 * Renders the stats table (one row per declaration) and the dependency table
 * as CSV, TSV or Markdown.
 */
public final class TableWriter {

    public static final String STATS_FILE = "stats";
    public static final String DEPENDENCIES_FILE = "dependencies";

    // quote only values that need it (separator, quote, line break)
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final ObjectMapper jsonlMapper = new ObjectMapper();

    public String stats(List<Declaration> declarations, TableFormat format) throws IOException {
        Objects.requireNonNull(declarations, "declarations");
        final List<StatsRow> rows = new ArrayList<>(declarations.size());
        for (Declaration d : declarations) {
            rows.add(StatsRow.of(d));
        }
        return switch (format) {
            case CSV -> csv(rows, StatsRow.class, ',');
            case TSV -> csv(tsvSafeStats(rows), StatsRow.class, '\t');
            case MARKDOWN -> statsMarkdown(rows);
            case JSON -> jsonl(declarations);
        };
    }

    public String dependencies(List<Declaration> declarations, TableFormat format) throws IOException {
        Objects.requireNonNull(declarations, "declarations");
        final List<DependencyRow> rows = new ArrayList<>(declarations.size());
        for (Declaration d : declarations) {
            rows.add(DependencyRow.of(d));
        }
        return switch (format) {
            case CSV -> csv(rows, DependencyRow.class, ',');
            case JSON -> jsonl(dependencyLines(declarations));
            case TSV -> csv(rows, DependencyRow.class, '\t');
            case MARKDOWN -> dependenciesMarkdown(declarations);
        };
    }

    /**
     * Writes stats.csv and dependencies.csv into {@code outDir}.
     */
    public void writeTables(Path outDir, List<Declaration> declarations) throws IOException {
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve(STATS_FILE + ".csv"),
                stats(declarations, TableFormat.CSV), StandardCharsets.UTF_8);
        Files.writeString(outDir.resolve(DEPENDENCIES_FILE + ".csv"),
                dependencies(declarations, TableFormat.CSV), StandardCharsets.UTF_8);
    }

    private <T> String csv(List<T> rows, Class<T> type, char separator) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(type).withHeader().withColumnSeparator(separator);
        if (separator == '\t') {
            schema = schema.withoutQuoteChar();
        }
        return csvMapper.writer(schema).writeValueAsString(rows);
    }

    private <T> String jsonl(List<T> lines) throws IOException {
        final StringBuilder sb = new StringBuilder();
        for (T line : lines) {
            sb.append(jsonlMapper.writeValueAsString(line)).append('\n');
        }
        return sb.toString();
    }

    private static List<DependencyLine> dependencyLines(List<Declaration> declarations) {
        final List<DependencyLine> out = new ArrayList<>(declarations.size());
        for (Declaration d : declarations) {
            out.add(new DependencyLine(d.name(), d.uses(), d.usedBy()));
        }
        return out;
    }

    private static List<StatsRow> tsvSafeStats(List<StatsRow> rows) {
        final List<StatsRow> out = new ArrayList<>(rows.size());
        for (StatsRow r : rows) {
            out.add(new StatsRow(r.file(), r.section(), r.name(), r.kind(), r.proofLines(),
                    noTabs(r.signature()), noTabs(r.meaning())));
        }
        return out;
    }

    private static String statsMarkdown(List<StatsRow> rows) {
        final StringBuilder sb = new StringBuilder();
        sb.append("| File | Section | Name | Kind | Lines | Signature | Meaning |\n");
        sb.append("|------|---------|------|------|------:|-----------|---------|\n");
        for (StatsRow r : rows) {
            sb.append("| ").append(r.file())
                    .append(" | ").append(r.section())
                    .append(" | `").append(r.name()).append('`')
                    .append(" | ").append(r.kind())
                    .append(" | ").append(r.proofLines())
                    .append(" | `").append(escapePipes(r.signature())).append('`')
                    .append(" | ").append(escapePipes(r.meaning()))
                    .append(" |\n");
        }
        return sb.toString();
    }

    private static String dependenciesMarkdown(List<Declaration> declarations) {
        final StringBuilder sb = new StringBuilder();
        sb.append("| Lemma | File | Section | Dependencies |\n");
        sb.append("|-------|------|---------|--------------|\n");
        for (Declaration d : declarations) {
            final String deps;
            if (d.uses().isEmpty()) {
                deps = "—";
            } else {
                final List<String> quoted = new ArrayList<>(d.uses().size());
                for (String u : d.uses()) {
                    quoted.add('`' + u + '`');
                }
                deps = String.join(", ", quoted);
            }
            sb.append("| `").append(d.name()).append('`')
                    .append(" | ").append(d.file())
                    .append(" | ").append(d.section())
                    .append(" | ").append(deps)
                    .append(" |\n");
        }
        return sb.toString();
    }

    private static String escapePipes(String text) {
        return text == null ? "" : text.replace("|", "\\|");
    }

    private static String noTabs(String text) {
        return text == null ? "" : text.replace('\t', ' ');
    }

    public record DependencyLine(String name, List<String> uses, List<String> usedBy) {
    }
}
