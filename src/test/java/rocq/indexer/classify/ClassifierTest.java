package rocq.indexer.classify;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import rocq.indexer.model.DeclarationKind;
import rocq.indexer.model.Role;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Role classification")
class ClassifierTest {

    @Test
    @DisplayName("Theorems are primary whatever their description")
    void theoremIsPrimary() {
        final Classifier classifier = new Classifier();
        assertEquals(Role.PRIMARY, classifier.classify(DeclarationKind.THEOREM, ""));
        assertEquals(Role.PRIMARY, classifier.classify(DeclarationKind.THEOREM, null));
    }

    @Test
    @DisplayName("Marker word in the description makes a lemma primary")
    void markerWord() {
        final Classifier classifier = new Classifier();
        assertEquals(Role.PRIMARY, classifier.classify(DeclarationKind.LEMMA, "The MAIN soundness result"));
        assertEquals(Role.SUPPORTING, classifier.classify(DeclarationKind.LEMMA, "doubles a number"));
        assertEquals(Role.SUPPORTING, classifier.classify(DeclarationKind.COROLLARY, null));
    }

    @Test
    @DisplayName("Marker words are configurable")
    void customMarkers() {
        final Classifier classifier = new Classifier(List.of(" Key ", "", "central"));
        assertEquals(List.of("key", "central"), classifier.markers());
        assertEquals(Role.PRIMARY, classifier.classify(DeclarationKind.FACT, "Key lemma"));
        assertEquals(Role.SUPPORTING, classifier.classify(DeclarationKind.FACT, "main lemma"));
    }
}
