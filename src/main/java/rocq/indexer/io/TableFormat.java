package rocq.indexer.io;

import java.util.Locale;

/**
 * Textual table formats for standard output and table files.
 */
public enum TableFormat {
    MARKDOWN("md"),
    CSV("csv"),
    TSV("tsv"),
    JSON("jsonl");

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static TableFormat parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "markdown", "md" -> MARKDOWN;
            case "csv" -> CSV;
            case "tsv" -> TSV;
            case "json", "jsonl" -> JSON;
            default -> throw new IllegalArgumentException("unknown format: " + value);
        };
    }
}
