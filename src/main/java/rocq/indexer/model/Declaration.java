package rocq.indexer.model;

import java.util.List;

/**
 * JSONL line for declarations.jsonl
 */
public record Declaration(
        String file,           // relative to its source root, '/'-separated
        String section,        // innermost open Section or "Top-level"
        String name,
        DeclarationKind kind,
        Role role,
        String signature,
        String description,
        int proofLines,        // 0 = no proof found, 1 = terminator-only proof
        List<String> uses,     // sorted, never contains name
        List<String> usedBy    // sorted, inverse of uses over the corpus
) {
}
