package rocq.indexer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import rocq.indexer.classify.Classifier;
import rocq.indexer.graph.DependencyGraphBuilder;
import rocq.indexer.graph.Graph;
import rocq.indexer.model.StatsRow;
import rocq.indexer.scan.CommentStripper;
import rocq.indexer.scan.CorpusScanner;
import rocq.indexer.scan.DeclarationScanner;
import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;
import rocq.indexer.scan.ProofLocator;
import rocq.indexer.scan.SourceFileFinder;
import rocq.indexer.scan.SourceText;

/**
 * Runs both passes over a corpus: every file is scanned before the graph is built.
 */
public final class CorpusIndexer {

    public record Options(
            boolean recursive,
            List<String> markers,
            CommentStripper.Mode commentMode,
            boolean parallel
    ) {
        public Options {
            markers = List.copyOf(markers);
            Objects.requireNonNull(commentMode, "commentMode");
        }

        public static Options defaults() {
            return new Options(true, Classifier.DEFAULT_MARKERS, CommentStripper.Mode.FLAT, false);
        }
    }

    private final Options options;
    private final CommentStripper stripper;
    private final DeclarationScanner scanner;
    private int filesScanned;

    public CorpusIndexer(Options options) {
        this.options = Objects.requireNonNull(options, "options");
        this.stripper = CommentStripper.of(options.commentMode());
        this.scanner = new DeclarationScanner(stripper);
    }

    /**
     * Indexes the {@code *.v} files of each directory; file paths are relative to their directory.
     */
    public Graph indexDirectories(List<Path> directories) throws IOException {
        final SourceFileFinder finder = new SourceFileFinder(options.recursive());
        final Map<Path, List<Path>> filesByDir = finder.findAll(directories);

        final CorpusScanner corpus = new CorpusScanner(scanner, options.parallel());
        final List<ScannedDeclaration> scanned = new ArrayList<>();
        for (var e : filesByDir.entrySet()) {
            scanned.addAll(corpus.scanFiles(e.getKey(), e.getValue()));
        }
        filesScanned = corpus.filesScanned();
        return graph(scanned, finder.warningCount() + corpus.readWarningCount());
    }

    /**
     * Indexes sources that are already in memory.
     */
    public Graph indexSources(List<SourceText> sources) {
        final CorpusScanner corpus = new CorpusScanner(scanner, options.parallel());
        final List<ScannedDeclaration> scanned = corpus.scan(sources);
        filesScanned = corpus.filesScanned();
        return graph(scanned, 0);
    }

    /**
     * Builds the graph for declarations listed in a stats table, re-reading proofs from {@code roots}.
     */
    public Graph indexStats(List<StatsRow> rows, List<Path> roots) {
        final ProofLocator locator = new ProofLocator(roots, scanner);
        final List<ScannedDeclaration> scanned = locator.locate(rows);
        return graph(scanned, locator.warningCount());
    }

    private Graph graph(List<ScannedDeclaration> scanned, int priorWarnings) {
        final DependencyGraphBuilder builder = new DependencyGraphBuilder(
                new Classifier(options.markers()), stripper, options.parallel());
        return builder.build(scanned, priorWarnings);
    }

    public int filesScanned() {
        return filesScanned;
    }
}
