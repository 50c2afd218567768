package rocq.indexer.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import rocq.indexer.model.Ids;

/**
 * Joins the lines of a declaration statement into one normalized signature.
 */
public final class SignatureAssembler {

    public static final int MAX_LINES = 20;

    private static final Pattern PROOF_WORD = Pattern.compile("\\bProof\\b");
    private static final Pattern TRAILING_PROOF = Pattern.compile("\\s*\\bProof\\.?\\s*$");

    private final CommentStripper stripper;

    public SignatureAssembler(CommentStripper stripper) {
        this.stripper = Objects.requireNonNull(stripper, "stripper");
    }

    public String assemble(List<String> lines, int start) {
        Objects.requireNonNull(lines, "lines");
        final List<String> parts = new ArrayList<>();
        int balance = 0;
        boolean colonSeen = false;

        for (int idx = start; idx < lines.size() && idx - start < MAX_LINES; idx++) {
            String line = stripper.strip(lines.get(idx)).trim();

            final Matcher proof = PROOF_WORD.matcher(line);
            if (proof.find()) {
                // statement and "Proof." on the same line: keep the statement part only
                parts.add(line.substring(0, proof.start()).trim());
                break;
            }

            parts.add(line);
            balance += bracketDelta(line);
            if (line.indexOf(':') >= 0) {
                colonSeen = true;
            }
            if (line.endsWith(".") && balance <= 0 && colonSeen) {
                break;
            }
        }

        final String sig = Ids.collapseWhitespace(String.join(" ", parts));
        return TRAILING_PROOF.matcher(sig).replaceAll("").trim();
    }

    static int bracketDelta(String line) {
        int delta = 0;
        for (int i = 0; i < line.length(); i++) {
            switch (line.charAt(i)) {
                case '(', '[', '{' -> delta++;
                case ')', ']', '}' -> delta--;
                default -> {
                }
            }
        }
        return delta;
    }
}
