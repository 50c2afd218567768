package rocq.indexer.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import rocq.indexer.model.StatsRow;
import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

/**
 * Recovers proofs for declarations known only from a stats table.
 * Each row's file is looked up in the source roots in order (first hit wins); the home file
 * is scanned once and the first declaration with the row's name supplies the proof.
 * Rows that cannot be located keep an empty proof, so their dependencies stay empty.
 */
public final class ProofLocator {

    private final List<Path> roots;
    private final CorpusScanner corpus;
    private final DeclarationScanner scanner;
    private int warnings;

    public ProofLocator(List<Path> roots, DeclarationScanner scanner) {
        this.roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.corpus = new CorpusScanner(scanner, false);
    }

    public List<ScannedDeclaration> locate(List<StatsRow> rows) {
        Objects.requireNonNull(rows, "rows");
        // file -> declarations by name (first occurrence), null when unresolvable
        final Map<String, Map<String, ScannedDeclaration>> byFile = new HashMap<>();
        final List<ScannedDeclaration> out = new ArrayList<>(rows.size());

        for (StatsRow row : rows) {
            if (!byFile.containsKey(row.file())) {
                byFile.put(row.file(), scanHomeFile(row.file()));
            }
            final Map<String, ScannedDeclaration> scanned = byFile.get(row.file());
            final ScannedDeclaration found = scanned == null ? null : scanned.get(row.name());
            if (found == null) {
                if (scanned != null) {
                    warnings++;
                    System.err.println("WARN: declaration " + row.name() + " not found in " + row.file());
                }
                out.add(unresolved(row));
                continue;
            }
            out.add(new ScannedDeclaration(row.file(), row.section(), row.name(), found.kind(),
                    row.signature(), row.meaning(), found.line(), found.proof()));
        }
        return out;
    }

    private Map<String, ScannedDeclaration> scanHomeFile(String fileRel) {
        for (Path root : roots) {
            final Path candidate = root.resolve(fileRel);
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            final SourceText src = corpus.read(root, candidate);
            if (src == null) {
                warnings++;
                return null;
            }
            final Map<String, ScannedDeclaration> byName = new HashMap<>();
            for (ScannedDeclaration d : scanner.scan(fileRel, src.lines())) {
                byName.putIfAbsent(d.name(), d);
            }
            return byName;
        }
        warnings++;
        System.err.println("WARN: could not find file " + fileRel);
        return null;
    }

    private static ScannedDeclaration unresolved(StatsRow row) {
        return new ScannedDeclaration(row.file(), row.section(), row.name(), row.kindOrDefault(),
                row.signature(), row.meaning(), -1, ProofBoundaryExtractor.ProofBody.EMPTY);
    }

    public int warningCount() {
        return warnings;
    }
}
