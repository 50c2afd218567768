package rocq.indexer.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import rocq.indexer.model.StatsRow;

/**
 * Reads a stats table written by {@link TableWriter} (or by older tools without the Kind column).
 * Files ending in {@code .tsv} are read tab-separated.
 */
public final class StatsCsvReader {

    private final CsvMapper csvMapper = new CsvMapper();

    public List<StatsRow> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Stats file not found: " + file);
        }
        final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        if (name.endsWith(".tsv")) {
            schema = schema.withColumnSeparator('\t').withoutQuoteChar();
        }
        try (MappingIterator<StatsRow> it = csvMapper.readerFor(StatsRow.class).with(schema).readValues(file.toFile())) {
            return it.readAll();
        }
    }
}
