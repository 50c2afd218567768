package rocq.indexer.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import rocq.indexer.classify.Classifier;

/**
 * Project file (YAML), e.g.
 * <pre>
 * name: dual
 * title: Dual formalization
 * source:
 *   directories: [theories]
 *   recursive: true
 * markers: [main]
 * nestedComments: false
 * </pre>
 * Relative source directories resolve against the directory holding the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
        String name,
        String title,
        String description,
        Source source,
        List<String> markers,
        Boolean nestedComments
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(List<String> directories, Boolean recursive) {
    }

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ProjectConfig load(Path yamlFile) throws IOException {
        Objects.requireNonNull(yamlFile, "yamlFile");
        if (!Files.isRegularFile(yamlFile)) {
            throw new IOException("Project file not found: " + yamlFile);
        }
        final ProjectConfig cfg = YAML.readValue(yamlFile.toFile(), ProjectConfig.class);
        if (cfg == null) {
            throw new IOException("Empty project file: " + yamlFile);
        }
        return cfg;
    }

    /**
     * Source directories, resolved against {@code baseDir} when relative.
     */
    public List<Path> directories(Path baseDir) {
        final List<Path> out = new ArrayList<>();
        if (source == null || source.directories() == null) {
            return out;
        }
        for (String dir : source.directories()) {
            if (dir == null || dir.isBlank()) {
                continue;
            }
            final Path p = Path.of(dir.trim());
            out.add(p.isAbsolute() ? p.normalize() : baseDir.resolve(p).normalize());
        }
        return out;
    }

    public boolean recursiveOr(boolean fallback) {
        return source != null && source.recursive() != null ? source.recursive() : fallback;
    }

    public List<String> markersOrDefault() {
        return markers == null || markers.isEmpty() ? Classifier.DEFAULT_MARKERS : markers;
    }

    public boolean nestedCommentsOr(boolean fallback) {
        return nestedComments != null ? nestedComments : fallback;
    }

    public String titleOrName() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return name == null ? "" : name;
    }
}
