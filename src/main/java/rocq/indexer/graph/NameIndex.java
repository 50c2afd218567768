package rocq.indexer.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

/**
 * Corpus-wide table of declaration names.
 * - name -> declaration, last registration wins
 * - name -> whole-word pattern, compiled once in {@link #finalizeIndex()}
 * Read-only after finalization, so it can be shared across threads.
 */
public final class NameIndex {

    private final Map<String, ScannedDeclaration> byName = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new HashMap<>();
    private final Map<String, Pattern> patterns = new HashMap<>();
    private List<String> sortedNames = List.of();
    private boolean finalized;

    public void register(ScannedDeclaration declaration) {
        if (finalized) {
            throw new IllegalStateException("index already finalized");
        }
        byName.put(declaration.name(), declaration);
        counts.merge(declaration.name(), 1, Integer::sum);
    }

    public void finalizeIndex() {
        for (String name : byName.keySet()) {
            patterns.put(name, Pattern.compile("\\b" + Pattern.quote(name) + "\\b",
                    Pattern.UNICODE_CHARACTER_CLASS));
        }
        sortedNames = List.copyOf(new TreeSet<>(byName.keySet()));
        finalized = true;
    }

    /**
     * Names referenced as whole words in {@code text}, sorted, without {@code self}.
     */
    public List<String> referencedIn(String text, String self) {
        if (!finalized) {
            throw new IllegalStateException("index not finalized");
        }
        final List<String> used = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return used;
        }
        for (String name : sortedNames) {
            if (name.equals(self)) {
                continue;
            }
            if (patterns.get(name).matcher(text).find()) {
                used.add(name);
            }
        }
        return used;
    }

    /**
     * Declaration registered last under {@code name}, or null.
     */
    public ScannedDeclaration lookup(String name) {
        return byName.get(name);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public Set<String> names() {
        return byName.keySet();
    }

    /**
     * Names declared more than once in the corpus.
     */
    public List<String> duplicates() {
        final List<String> dups = new ArrayList<>();
        for (var e : counts.entrySet()) {
            if (e.getValue() > 1) {
                dups.add(e.getKey());
            }
        }
        dups.sort(null);
        return dups;
    }
}
