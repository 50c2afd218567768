package rocq.indexer.scan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import rocq.indexer.model.Ids;

/**
 * Recovers the description comment written directly above a declaration.
 * Only an adjacent comment counts; blank lines between it and the declaration are allowed.
 */
public final class CommentAssociator {

    private static final String OPEN = "(*";
    private static final String CLOSE = "*)";

    public String describe(List<String> lines, int declarationLine) {
        Objects.requireNonNull(lines, "lines");
        int idx = declarationLine - 1;
        while (idx >= 0 && lines.get(idx).isBlank()) {
            idx--;
        }
        if (idx < 0) {
            return "";
        }

        final String nearest = lines.get(idx).trim();
        if (nearest.length() >= 4 && nearest.startsWith(OPEN) && nearest.endsWith(CLOSE)) {
            return Ids.collapseWhitespace(stripStars(nearest.substring(2, nearest.length() - 2)));
        }

        final Deque<String> fragments = new ArrayDeque<>();
        boolean inComment = false;
        for (; idx >= 0; idx--) {
            final String line = lines.get(idx).trim();
            if (!inComment) {
                if (!line.endsWith(CLOSE)) {
                    // code or stray text right above: not a description
                    break;
                }
                if (line.indexOf(OPEN) > 0) {
                    // trailing comment after code on the same line
                    break;
                }
                inComment = true;
                addFragment(fragments, line.substring(0, line.length() - 2));
                if (line.startsWith(OPEN)) {
                    break;
                }
                continue;
            }
            if (line.startsWith(OPEN)) {
                addFragment(fragments, line.substring(2));
                break;
            }
            addFragment(fragments, line);
        }

        return Ids.collapseWhitespace(String.join(" ", fragments));
    }

    private static void addFragment(Deque<String> fragments, String raw) {
        final String cleaned = stripStars(raw).trim();
        if (!cleaned.isEmpty()) {
            fragments.addFirst(cleaned);
        }
    }

    // leading '*' continuation markers, including the extra star of "(**"
    private static String stripStars(String text) {
        int i = 0;
        final String trimmed = text.trim();
        while (i < trimmed.length() && trimmed.charAt(i) == '*') {
            i++;
        }
        return trimmed.substring(i);
    }
}
