package rocq.indexer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declaration keywords recognized at the start of a line.
 */
public enum DeclarationKind {
    LEMMA("Lemma"),
    THEOREM("Theorem"),
    COROLLARY("Corollary"),
    PROPOSITION("Proposition"),
    FACT("Fact"),
    REMARK("Remark");

    private final String keyword;

    DeclarationKind(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String keyword() {
        return keyword;
    }

    @JsonCreator
    public static DeclarationKind fromKeyword(String keyword) {
        for (DeclarationKind k : values()) {
            if (k.keyword.equals(keyword)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown declaration keyword: " + keyword);
    }

    /**
     * Regex alternation of all keywords, e.g. {@code Lemma|Theorem|...}.
     */
    public static String alternation() {
        final StringBuilder sb = new StringBuilder();
        for (DeclarationKind k : values()) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(k.keyword);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
