package rocq.indexer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the stats table (CSV/TSV). {@code kind} may be null in tables written without that column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"File", "Section", "Name", "Kind", "ProofLines", "Signature", "Meaning"})
public record StatsRow(
        @JsonProperty("File") String file,
        @JsonProperty("Section") String section,
        @JsonProperty("Name") String name,
        @JsonProperty("Kind") String kind,
        @JsonProperty("ProofLines") int proofLines,
        @JsonProperty("Signature") String signature,
        @JsonProperty("Meaning") String meaning
) {

    public static StatsRow of(Declaration d) {
        return new StatsRow(d.file(), d.section(), d.name(), d.kind().keyword(),
                d.proofLines(), d.signature(), d.description());
    }

    public DeclarationKind kindOrDefault() {
        if (kind == null || kind.isBlank()) {
            return DeclarationKind.LEMMA;
        }
        return DeclarationKind.fromKeyword(kind.trim());
    }
}
