package rocq.indexer.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.IntStream;

import rocq.indexer.classify.Classifier;
import rocq.indexer.model.Declaration;
import rocq.indexer.scan.CommentStripper;
import rocq.indexer.scan.DeclarationScanner.ScannedDeclaration;

/**
 * Second pass over a corpus: proof text -> uses, then uses -> usedBy.
 * Must only run once every file of the corpus has been scanned.
 */
public final class DependencyGraphBuilder {

    private final Classifier classifier;
    private final CommentStripper stripper;
    private final boolean parallel;

    public DependencyGraphBuilder(Classifier classifier, CommentStripper stripper, boolean parallel) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.stripper = Objects.requireNonNull(stripper, "stripper");
        this.parallel = parallel;
    }

    public DependencyGraphBuilder() {
        this(new Classifier(), CommentStripper.flat(), false);
    }

    public Graph build(List<ScannedDeclaration> scanned) {
        return build(scanned, 0);
    }

    /**
     * @param priorWarnings warnings already reported by the scan phase, carried into the graph
     */
    public Graph build(List<ScannedDeclaration> scanned, int priorWarnings) {
        Objects.requireNonNull(scanned, "scanned");
        int warnings = priorWarnings;

        // Step 1: corpus-wide names (last write wins)
        final NameIndex names = new NameIndex();
        for (ScannedDeclaration d : scanned) {
            names.register(d);
        }
        names.finalizeIndex();

        for (String dup : names.duplicates()) {
            warnings++;
            System.err.println("WARN: " + dup + " is declared more than once; the last declaration wins in lookups");
        }

        // Step 2: uses per declaration; reads only its own proof and the finalized index
        final IntStream indices = IntStream.range(0, scanned.size());
        final List<List<String>> uses = (parallel ? indices.parallel() : indices)
                .mapToObj(i -> usesOf(scanned.get(i), names))
                .toList();

        for (ScannedDeclaration d : scanned) {
            if (d.proof().isEmpty()) {
                warnings++;
                System.err.println("WARN: no proof found for " + d.name() + " in " + d.file());
            }
        }

        // Step 3: invert once, after every uses list is final
        final Map<String, Set<String>> usedBySets = new TreeMap<>();
        for (int i = 0; i < scanned.size(); i++) {
            for (String target : uses.get(i)) {
                usedBySets.computeIfAbsent(target, k -> new TreeSet<>()).add(scanned.get(i).name());
            }
        }

        final Map<String, List<String>> usesByName = new TreeMap<>();
        final Map<String, List<String>> usedByName = new TreeMap<>();
        final List<Declaration> declarations = new ArrayList<>(scanned.size());
        for (int i = 0; i < scanned.size(); i++) {
            final ScannedDeclaration d = scanned.get(i);
            final List<String> dUses = uses.get(i);
            final List<String> dUsedBy = List.copyOf(usedBySets.getOrDefault(d.name(), Collections.emptySet()));

            usesByName.put(d.name(), dUses);
            usedByName.put(d.name(), dUsedBy);

            declarations.add(new Declaration(
                    d.file(),
                    d.section(),
                    d.name(),
                    d.kind(),
                    classifier.classify(d.kind(), d.description()),
                    d.signature(),
                    d.description(),
                    d.proofLines(),
                    dUses,
                    dUsedBy
            ));
        }

        return new Graph(
                List.copyOf(declarations),
                Collections.unmodifiableMap(usesByName),
                Collections.unmodifiableMap(usedByName),
                names.duplicates(),
                warnings);
    }

    private List<String> usesOf(ScannedDeclaration d, NameIndex names) {
        if (d.proof().isEmpty()) {
            return List.of();
        }
        final String code = stripper.stripBlock(d.proof().text());
        return List.copyOf(names.referencedIn(code, d.name()));
    }
}
