package rocq.indexer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import rocq.indexer.classify.Classifier;
import rocq.indexer.config.ProjectConfig;
import rocq.indexer.graph.Graph;
import rocq.indexer.io.GraphWriter;
import rocq.indexer.io.StatsCsvReader;
import rocq.indexer.io.TableFormat;
import rocq.indexer.io.TableWriter;
import rocq.indexer.model.Declaration;
import rocq.indexer.model.Ids;
import rocq.indexer.model.StatsRow;
import rocq.indexer.scan.CommentStripper;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) {
        final List<Path> directories = new ArrayList<>();
        Path outDir = null;
        Path configFile = null;
        Path statsFile = null;
        TableFormat format = TableFormat.MARKDOWN;
        Boolean recursive = null;
        Boolean nestedComments = null;
        boolean parallel = false;
        List<String> markers = null;
        String title = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--stats=")) {
                    statsFile = Paths.get(arg.substring("--stats=".length()));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = TableFormat.parse(arg.substring("--format=".length()));
                    continue;
                }
                if (arg.startsWith("--recursive=")) {
                    recursive = Boolean.parseBoolean(arg.substring("--recursive=".length()));
                    continue;
                }
                if (arg.startsWith("--nestedComments=")) {
                    nestedComments = Boolean.parseBoolean(arg.substring("--nestedComments=".length()));
                    continue;
                }
                if (arg.startsWith("--parallel=")) {
                    parallel = Boolean.parseBoolean(arg.substring("--parallel=".length()));
                    continue;
                }
                if (arg.startsWith("--markers=")) {
                    markers = Arrays.stream(arg.substring("--markers=".length()).split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList();
                    continue;
                }
                if (arg.startsWith("--title=")) {
                    title = arg.substring("--title=".length());
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage(System.err);
                    return 2;
                }
                directories.add(Paths.get(arg));
            }

            if (configFile != null) {
                final ProjectConfig cfg = ProjectConfig.load(configFile);
                final Path base = configFile.toAbsolutePath().normalize().getParent();
                if (directories.isEmpty()) {
                    directories.addAll(cfg.directories(base));
                }
                recursive = recursive != null ? recursive : cfg.recursiveOr(true);
                nestedComments = nestedComments != null ? nestedComments : cfg.nestedCommentsOr(false);
                markers = markers != null ? markers : cfg.markersOrDefault();
                title = title != null ? title : cfg.titleOrName();
            }
            if (directories.isEmpty()) {
                directories.add(Paths.get("."));
            }

            final CorpusIndexer.Options options = new CorpusIndexer.Options(
                    recursive == null || recursive,
                    markers == null ? Classifier.DEFAULT_MARKERS : markers,
                    Boolean.TRUE.equals(nestedComments) ? CommentStripper.Mode.NESTED : CommentStripper.Mode.FLAT,
                    parallel);
            final CorpusIndexer indexer = new CorpusIndexer(options);

            final Graph graph;
            if (statsFile != null) {
                final List<StatsRow> rows = new StatsCsvReader().read(statsFile);
                graph = indexer.indexStats(rows, directories);
            } else {
                graph = indexer.indexDirectories(directories);
            }

            if (graph.declarations().isEmpty()) {
                System.err.println("ERROR: no declarations found in any directory");
                return 1;
            }

            final TableWriter tables = new TableWriter();
            if (outDir != null) {
                new GraphWriter(outDir).writeAll(graph, title, Instant.now().toString());
                tables.writeTables(outDir, graph.declarations());
                out.println("Graph written to: " + outDir.toAbsolutePath().normalize());
                out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
            } else if (statsFile != null) {
                out.print(tables.dependencies(graph.declarations(), format));
            } else {
                out.print(tables.stats(graph.declarations(), format));
            }

            System.err.println("# Total: " + graph.declarations().size() + " declarations in "
                    + (statsFile != null ? countFiles(graph) : indexer.filesScanned()) + " files, "
                    + graph.edgeCount() + " dependencies");
            if (graph.warnings() > 0) {
                System.err.println("WARN: warnings: " + graph.warnings());
            }
            return 0;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + Ids.safeMsg(ex.getMessage()));
            printUsage(System.err);
            return 2;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + Ids.safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + Ids.safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static long countFiles(Graph graph) {
        return graph.declarations().stream().map(Declaration::file).distinct().count();
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: rocq-indexer [dir ...] [options]");
        ps.println("Options:");
        ps.println("  --config=<path>           YAML project file (source directories, markers, ...)");
        ps.println("  --outDir=<path>           Write JSON/JSONL/CSV files instead of printing a table");
        ps.println("  --format=<fmt>            markdown | csv | tsv | json (default: markdown)");
        ps.println("  --recursive=<bool>        Search directories recursively (default: true)");
        ps.println("  --markers=<w1,w2>         Description words that mark a main result (default: main)");
        ps.println("  --nestedComments=<bool>   Strip nested comments by depth (default: false)");
        ps.println("  --parallel=<bool>         Scan files in parallel (default: false)");
        ps.println("  --stats=<csv>             Read declarations from a stats table, print dependencies");
        ps.println("  --title=<text>            Title recorded in index.json");
        ps.println("  --help, -h                Show this help");
    }
}
