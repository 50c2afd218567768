package rocq.indexer.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the dependency table; {@code dependencies} is the comma-joined uses list.
 */
@JsonPropertyOrder({"Lemma", "File", "Section", "Dependencies", "Dep_Count"})
public record DependencyRow(
        @JsonProperty("Lemma") String lemma,
        @JsonProperty("File") String file,
        @JsonProperty("Section") String section,
        @JsonProperty("Dependencies") String dependencies,
        @JsonProperty("Dep_Count") int count
) {

    public static DependencyRow of(Declaration d) {
        final List<String> uses = d.uses();
        return new DependencyRow(d.name(), d.file(), d.section(), String.join(", ", uses), uses.size());
    }
}
