package rocq.indexer.scan;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Removes {@code (* ... *)} comments so keyword and name matching only sees code.
 * <p>
 * {@link Mode#FLAT} matches spans non-greedily and non-recursively: in
 * {@code (* a (* b *) c *)} the first closer ends the match and {@code  c *)} survives.
 * {@link Mode#NESTED} counts depth instead and drops text while depth &gt; 0;
 * an unmatched closer is kept verbatim.
 */
public final class CommentStripper {

    public enum Mode {
        FLAT,
        NESTED
    }

    private static final Pattern LINE_COMMENT = Pattern.compile("\\(\\*.*?\\*\\)");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("\\(\\*.*?\\*\\)", Pattern.DOTALL);

    private static final CommentStripper FLAT = new CommentStripper(Mode.FLAT);
    private static final CommentStripper NESTED = new CommentStripper(Mode.NESTED);

    private final Mode mode;

    private CommentStripper(Mode mode) {
        this.mode = mode;
    }

    public static CommentStripper of(Mode mode) {
        Objects.requireNonNull(mode, "mode");
        return mode == Mode.NESTED ? NESTED : FLAT;
    }

    public static CommentStripper flat() {
        return FLAT;
    }

    public Mode mode() {
        return mode;
    }

    /**
     * Strips comments from a single line; a span never crosses a newline.
     */
    public String strip(String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        if (mode == Mode.NESTED) {
            return stripNested(line);
        }
        return LINE_COMMENT.matcher(line).replaceAll("");
    }

    /**
     * Strips comments from a multi-line text such as a proof body; spans may cross newlines.
     */
    public String stripBlock(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (mode == Mode.NESTED) {
            return stripNested(text);
        }
        return BLOCK_COMMENT.matcher(text).replaceAll("");
    }

    private static String stripNested(String text) {
        final StringBuilder out = new StringBuilder(text.length());
        // pending holds the text of the open comment, restored if it never closes
        final StringBuilder pending = new StringBuilder();
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            final char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (c == '(' && next == '*') {
                depth++;
                pending.append("(*");
                i += 2;
                continue;
            }
            if (c == '*' && next == ')' && depth > 0) {
                depth--;
                i += 2;
                if (depth == 0) {
                    pending.setLength(0);
                } else {
                    pending.append("*)");
                }
                continue;
            }
            if (depth > 0) {
                pending.append(c);
            } else {
                out.append(c);
            }
            i++;
        }
        // unterminated comment at the end: nothing to strip against
        out.append(pending);
        return out.toString();
    }
}
