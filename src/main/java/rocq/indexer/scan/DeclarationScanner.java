package rocq.indexer.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import rocq.indexer.model.DeclarationKind;

/**
 * Extracts declarations from the lines of one file.
 * <p>
 * Declarations and section markers are recognized only as the first token of a line.
 * All scan state lives in the call, so one instance can serve many files and threads.
 */
public final class DeclarationScanner {

    static final Pattern DECLARATION = Pattern.compile(
            "^\\s*(" + DeclarationKind.alternation() + ")\\s+(\\w+)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final SignatureAssembler signatures;
    private final CommentAssociator comments;
    private final ProofBoundaryExtractor proofs;

    public DeclarationScanner(CommentStripper stripper) {
        Objects.requireNonNull(stripper, "stripper");
        this.signatures = new SignatureAssembler(stripper);
        this.comments = new CommentAssociator();
        this.proofs = new ProofBoundaryExtractor(stripper);
    }

    public DeclarationScanner() {
        this(CommentStripper.flat());
    }

    public List<ScannedDeclaration> scan(String fileRel, List<String> lines) {
        Objects.requireNonNull(fileRel, "fileRel");
        Objects.requireNonNull(lines, "lines");

        final List<Integer> starts = declarationStarts(lines);
        final List<ScannedDeclaration> out = new ArrayList<>(starts.size());
        final SectionTracker sections = new SectionTracker();

        int next = 0;
        for (int idx = 0; idx < lines.size(); idx++) {
            final String line = lines.get(idx);
            if (sections.accept(line)) {
                continue;
            }
            final Matcher m = DECLARATION.matcher(line);
            if (!m.lookingAt()) {
                continue;
            }
            next++;
            final int limit = next < starts.size() ? starts.get(next) : lines.size();

            out.add(new ScannedDeclaration(
                    fileRel,
                    sections.current(),
                    m.group(2),
                    DeclarationKind.fromKeyword(m.group(1)),
                    signatures.assemble(lines, idx),
                    comments.describe(lines, idx),
                    idx,
                    proofs.extract(lines, idx, limit)
            ));
        }
        return out;
    }

    // section markers never match DECLARATION, so this lines up with the main loop
    private static List<Integer> declarationStarts(List<String> lines) {
        final List<Integer> starts = new ArrayList<>();
        for (int idx = 0; idx < lines.size(); idx++) {
            if (DECLARATION.matcher(lines.get(idx)).lookingAt()) {
                starts.add(idx);
            }
        }
        return starts;
    }

    public record ScannedDeclaration(
            String file,
            String section,
            String name,
            DeclarationKind kind,
            String signature,
            String description,
            int line,      // 0-based index of the declaration keyword
            ProofBoundaryExtractor.ProofBody proof
    ) {
        public int proofLines() {
            return proof.lineCount();
        }
    }
}
