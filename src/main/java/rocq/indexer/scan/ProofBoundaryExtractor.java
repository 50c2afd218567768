package rocq.indexer.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Locates a declaration's proof: from {@code Proof} to the first {@code Qed}, {@code Defined}
 * or {@code Admitted}. Keywords are matched on the comment-stripped line, the returned text is verbatim.
 * <p>
 * Every scan is bounded: 30 lines to find the opening keyword, 500 accumulated lines to find
 * the terminator, and never at or past {@code limit} (the next declaration's line).
 * Hitting a bound is a degraded result, never an error.
 */
public final class ProofBoundaryExtractor {

    public static final int MAX_SEARCH_LINES = 30;
    public static final int MAX_PROOF_LINES = 500;

    private static final Pattern PROOF_OPEN = Pattern.compile("\\bProof\\b");
    private static final Pattern TERMINATOR = Pattern.compile("\\b(Qed|Defined|Admitted)\\b");

    private final CommentStripper stripper;

    public ProofBoundaryExtractor(CommentStripper stripper) {
        this.stripper = Objects.requireNonNull(stripper, "stripper");
    }

    public ProofBody extract(List<String> lines, int start) {
        return extract(lines, start, lines.size());
    }

    public ProofBody extract(List<String> lines, int start, int limit) {
        Objects.requireNonNull(lines, "lines");
        final int end = Math.min(limit, lines.size());

        int open = -1;
        for (int idx = start; idx < end && idx - start < MAX_SEARCH_LINES; idx++) {
            final String code = stripper.strip(lines.get(idx));
            if (PROOF_OPEN.matcher(code).find()) {
                open = idx;
                break;
            }
            if (TERMINATOR.matcher(code).find()) {
                return new ProofBody(lines.get(idx), 1, false);
            }
        }
        if (open < 0) {
            return ProofBody.EMPTY;
        }

        final List<String> body = new ArrayList<>();
        int counted = 0;
        boolean terminated = false;
        for (int idx = open; idx < end && body.size() < MAX_PROOF_LINES; idx++) {
            final String line = lines.get(idx);
            body.add(line);
            if (isCountable(line)) {
                counted++;
            }
            if (TERMINATOR.matcher(stripper.strip(line)).find()) {
                terminated = true;
                break;
            }
        }
        return new ProofBody(String.join("\n", body), Math.max(1, counted), !terminated);
    }

    // non-blank and not starting a comment
    static boolean isCountable(String line) {
        final String trimmed = line.trim();
        return !trimmed.isEmpty() && !trimmed.startsWith("(*");
    }

    /**
     * Verbatim proof text and its line count.
     *
     * @param truncated true when the terminator was not reached before a bound
     */
    public record ProofBody(String text, int lineCount, boolean truncated) {

        public static final ProofBody EMPTY = new ProofBody("", 0, false);

        public boolean isEmpty() {
            return lineCount == 0;
        }
    }
}
