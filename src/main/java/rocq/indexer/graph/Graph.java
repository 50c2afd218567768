package rocq.indexer.graph;

import java.util.List;
import java.util.Map;

import rocq.indexer.model.Declaration;

/**
 * Fully built corpus graph, ready for writing.
 * - declarations in scan order, each carrying uses/usedBy
 * - uses / usedBy adjacency keyed by name (sorted maps, sorted lists)
 * - duplicates: names declared more than once (last one wins in lookups)
 */
public record Graph(
        List<Declaration> declarations,
        Map<String, List<String>> uses,
        Map<String, List<String>> usedBy,
        List<String> duplicates,
        int warnings
) {

    public int edgeCount() {
        int edges = 0;
        for (Declaration d : declarations) {
            edges += d.uses().size();
        }
        return edges;
    }
}
