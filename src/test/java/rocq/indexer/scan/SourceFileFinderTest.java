package rocq.indexer.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source file discovery")
class SourceFileFinderTest {

    @TempDir
    Path root;

    private void touch(String rel) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    @Test
    @DisplayName("Recursive walk finds nested sources and skips build dirs")
    void recursive() throws IOException {
        touch("b.v");
        touch("a.v");
        touch("nested/c.v");
        touch("_build/d.v");
        touch(".git/e.v");
        touch("notes.txt");

        final Map<Path, List<Path>> found = new SourceFileFinder(true).findAll(List.of(root));
        final List<String> names = found.get(root).stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .toList();
        assertEquals(List.of("a.v", "b.v", "nested/c.v"), names);
    }

    @Test
    @DisplayName("Flat listing ignores subdirectories")
    void flat() throws IOException {
        touch("a.v");
        touch("nested/c.v");

        final Map<Path, List<Path>> found = new SourceFileFinder(false).findAll(List.of(root));
        assertEquals(List.of(root.resolve("a.v")), found.get(root));
    }

    @Test
    @DisplayName("Missing and empty directories are warnings")
    void missingAndEmpty() throws IOException {
        final Path empty = Files.createDirectories(root.resolve("empty"));
        final SourceFileFinder finder = new SourceFileFinder(true);
        final Map<Path, List<Path>> found = finder.findAll(List.of(root.resolve("nope"), empty));
        assertTrue(found.isEmpty());
        assertEquals(2, finder.warningCount());
    }
}
