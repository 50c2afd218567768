package rocq.indexer.classify;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import rocq.indexer.model.DeclarationKind;
import rocq.indexer.model.Role;

/**
 * Assigns {@link Role#PRIMARY} to theorems and to declarations whose description
 * mentions a marker word (case-insensitive substring); everything else is supporting.
 */
public final class Classifier {

    public static final List<String> DEFAULT_MARKERS = List.of("main");

    private final List<String> markers;

    public Classifier(List<String> markers) {
        Objects.requireNonNull(markers, "markers");
        this.markers = markers.stream()
                .map(String::trim)
                .filter(m -> !m.isEmpty())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .toList();
    }

    public Classifier() {
        this(DEFAULT_MARKERS);
    }

    public Role classify(DeclarationKind kind, String description) {
        if (kind == DeclarationKind.THEOREM) {
            return Role.PRIMARY;
        }
        final String lower = description == null ? "" : description.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return Role.PRIMARY;
            }
        }
        return Role.SUPPORTING;
    }

    public List<String> markers() {
        return markers;
    }
}
