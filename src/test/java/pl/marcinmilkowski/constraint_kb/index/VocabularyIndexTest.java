package pl.marcinmilkowski.constraint_kb.index;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.constraint_kb.model.ItemScope;
import pl.marcinmilkowski.constraint_kb.model.VocabularyItem;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VocabularyIndex.
 */
class VocabularyIndexTest {

    private static final Map<String, List<String>> CONTEXTS = Map.of(
        "f1", List.of("xk", "qt"),
        "f2", List.of("xk", "qt", "qt"),
        "f3", List.of("xk"),
        "f4", List.of("xk"),
        "f5", List.of("xk", "ee")
    );

    private ClassIndex classes() {
        ClassIndex.Builder builder = ClassIndex.builder()
            .registerClass(1, List.of("t1"), "R")
            .registerClass(2, List.of("t2"), "R");
        builder.addVocabulary(1, Set.of("xk", "qt"));
        builder.addVocabulary(2, Set.of("xk"));
        return builder.build();
    }

    @Test
    @DisplayName("Spread 5 is UNIVERSAL, spread 2 is RESTRICTED")
    void testSpreadScenario() {
        VocabularyIndex index = VocabularyIndex.build(classes(), CONTEXTS);

        assertEquals(5, index.spread("xk"));
        assertEquals(ItemScope.UNIVERSAL, index.scope("xk"));
        assertEquals(2, index.spread("qt"));
        assertEquals(ItemScope.RESTRICTED, index.scope("qt"));
    }

    @Test
    @DisplayName("Threshold boundary: spread 3 is RESTRICTED, spread 4 is UNIVERSAL")
    void testThresholdBoundary() {
        Map<String, Integer> spread = VocabularyIndex.computeSpread(Map.of(
            "a", Set.of("three", "four"),
            "b", Set.of("three", "four"),
            "c", Set.of("three", "four"),
            "d", Set.of("four")));
        assertEquals(3, spread.get("three"));
        assertEquals(ItemScope.RESTRICTED, ItemScope.ofSpread(3));
        assertEquals(4, spread.get("four"));
        assertEquals(ItemScope.UNIVERSAL, ItemScope.ofSpread(4));
    }

    @Test
    @DisplayName("Duplicate entries inside one context count once; computeSpread is pure")
    void testComputeSpreadPure() {
        Map<String, Integer> first = VocabularyIndex.computeSpread(CONTEXTS);
        Map<String, Integer> second = VocabularyIndex.computeSpread(CONTEXTS);
        assertEquals(first, second);
        assertEquals(2, first.get("qt"));
        assertEquals(1, first.get("ee"));
    }

    @Test
    @DisplayName("classesFor unions declaring classes; unknown items are empty and RESTRICTED")
    void testClassesFor() {
        VocabularyIndex index = VocabularyIndex.build(classes(), CONTEXTS);

        assertEquals(Set.of(1, 2), index.classesFor("xk"));
        assertEquals(Set.of(1), index.classesFor("qt"));
        assertEquals(Set.of(), index.classesFor("zz"));
        assertEquals(0, index.spread("zz"));

        VocabularyItem unknown = index.describe("zz");
        assertEquals(ItemScope.RESTRICTED, unknown.scope());
        assertFalse(unknown.isUniversal());
    }

    @Test
    @DisplayName("restrictedSubset drops UNIVERSAL items")
    void testRestrictedSubset() {
        VocabularyIndex index = VocabularyIndex.build(classes(), CONTEXTS);
        assertEquals(Set.of("qt", "ee"), index.restrictedSubset(List.of("xk", "qt", "ee")));
        assertEquals(Set.of("xk"), index.universalItems());
    }
}
