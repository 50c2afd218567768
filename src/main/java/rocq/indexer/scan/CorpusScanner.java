package rocq.indexer.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import rocq.indexer.model.Ids;
import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

/**
 * First pass over a corpus: one {@link DeclarationScanner} run per file.
 * Files share nothing, so with {@code parallel} they are scanned on the common pool;
 * results always come back in input order.
 */
public final class CorpusScanner {

    private final DeclarationScanner scanner;
    private final boolean parallel;
    private final AtomicInteger readWarnings = new AtomicInteger();
    private final AtomicInteger filesScanned = new AtomicInteger();

    public CorpusScanner(DeclarationScanner scanner, boolean parallel) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.parallel = parallel;
    }

    /**
     * Scans already loaded sources.
     */
    public List<ScannedDeclaration> scan(List<SourceText> sources) {
        Objects.requireNonNull(sources, "sources");
        return collect(sources, src -> {
            filesScanned.incrementAndGet();
            return scanner.scan(src.path(), src.lines());
        });
    }

    /**
     * Reads and scans {@code files}; paths in the records are relative to {@code root}.
     * An unreadable file is reported and contributes nothing.
     */
    public List<ScannedDeclaration> scanFiles(Path root, List<Path> files) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(files, "files");
        return collect(files, file -> {
            final SourceText src = read(root, file);
            if (src == null) {
                return List.of();
            }
            filesScanned.incrementAndGet();
            return scanner.scan(src.path(), src.lines());
        });
    }

    /**
     * @return the file's lines, or null after reporting a read failure
     */
    public SourceText read(Path root, Path file) {
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8);
            return SourceText.of(Ids.relativeFile(root, file), content);
        } catch (IOException ex) {
            readWarnings.incrementAndGet();
            System.err.println("WARN: could not read " + file + " -> "
                    + ex.getClass().getSimpleName() + ": " + Ids.safeMsg(ex.getMessage()));
            return null;
        }
    }

    private <T> List<ScannedDeclaration> collect(List<T> inputs,
                                                 Function<T, List<ScannedDeclaration>> perFile) {
        final Stream<T> stream = parallel ? inputs.parallelStream() : inputs.stream();
        final List<List<ScannedDeclaration>> perInput = stream.map(perFile).toList();

        final List<ScannedDeclaration> out = new ArrayList<>();
        for (var declarations : perInput) {
            out.addAll(declarations);
        }
        return out;
    }

    public int readWarningCount() {
        return readWarnings.get();
    }

    public int filesScanned() {
        return filesScanned.get();
    }
}
