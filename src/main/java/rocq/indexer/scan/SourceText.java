package rocq.indexer.scan;

import java.util.List;
import java.util.Objects;

/**
 * Lines of one source file under its logical (root-relative) path.
 */
public record SourceText(String path, List<String> lines) {

    public SourceText {
        Objects.requireNonNull(path, "path");
        lines = List.copyOf(lines);
    }

    /**
     * Splits on '\n' and drops a trailing '\r' per line. A final newline yields a last empty line.
     */
    public static SourceText of(String path, String content) {
        final String[] raw = content.split("\n", -1);
        final String[] lines = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            final String line = raw[i];
            lines[i] = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        }
        return new SourceText(path, List.of(lines));
    }
}
