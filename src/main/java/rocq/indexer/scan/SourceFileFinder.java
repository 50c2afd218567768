package rocq.indexer.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Finds Rocq sources ({@code *.v}) in each source directory.
 * - recursive: whole tree below the directory, skipping build and VCS dirs
 * - flat: direct children only
 */
public final class SourceFileFinder {

    public static final String EXTENSION = ".v";

    private final boolean recursive;
    private int warnings;

    public SourceFileFinder(boolean recursive) {
        this.recursive = recursive;
    }

    /**
     * @return directory -> sorted source files, in the given directory order;
     * missing or empty directories are reported and left out
     */
    public Map<Path, List<Path>> findAll(List<Path> directories) throws IOException {
        Objects.requireNonNull(directories, "directories");
        final Map<Path, List<Path>> out = new LinkedHashMap<>();

        for (Path dir : directories) {
            if (!Files.isDirectory(dir)) {
                warnings++;
                System.err.println("WARN: directory '" + dir + "' does not exist, skipping");
                continue;
            }
            final List<Path> files = recursive ? walk(dir) : list(dir);
            if (files.isEmpty()) {
                warnings++;
                System.err.println("WARN: no " + EXTENSION + " files found in " + dir);
                continue;
            }
            out.put(dir, files);
        }
        return out;
    }

    private static List<Path> list(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(Files::isRegularFile)
                    .filter(SourceFileFinder::isSource)
                    .sorted()
                    .toList();
        }
    }

    private static List<Path> walk(Path dir) throws IOException {
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                final String name = d.getFileName() != null ? d.getFileName().toString() : "";
                if (!d.equals(dir) && (".git".equals(name) || "_build".equals(name) || "node_modules".equals(name))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isSource(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }

    private static boolean isSource(Path file) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(EXTENSION);
    }

    public int warningCount() {
        return warnings;
    }
}
