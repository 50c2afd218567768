package rocq.indexer.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a declaration in the corpus: a main result or a fact supporting one.
 */
public enum Role {
    PRIMARY,
    SUPPORTING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
