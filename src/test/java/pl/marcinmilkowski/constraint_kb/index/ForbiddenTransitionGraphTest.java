package pl.marcinmilkowski.constraint_kb.index;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.constraint_kb.index.ForbiddenTransitionGraph.ClassPair;
import pl.marcinmilkowski.constraint_kb.ingest.Diagnostic;
import pl.marcinmilkowski.constraint_kb.ingest.SourceBundle.ClassTransitions;
import pl.marcinmilkowski.constraint_kb.model.ForbiddenTransition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ForbiddenTransitionGraph.
 */
class ForbiddenTransitionGraphTest {

    private static final ForbiddenTransition AB_CD =
        new ForbiddenTransition(4, 7, "ab", "cd", "PHASE_ORDERING", 0.8);

    @Test
    @DisplayName("Transitions are retrievable by token pair and by class pair")
    void testLookup() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ForbiddenTransitionGraph graph = ForbiddenTransitionGraph.build(
            List.of(new ClassTransitions(4, 7, List.of(AB_CD))), Set.of(4, 7), diagnostics);

        assertEquals(AB_CD, graph.lookup("ab", "cd").orElseThrow());
        assertEquals(0.8, graph.lookup("ab", "cd").orElseThrow().severity(), 1e-9);
        assertTrue(graph.lookup("cd", "ab").isEmpty());
        assertTrue(graph.isForbidden(4, 7));
        assertFalse(graph.isForbidden(7, 4));
        assertEquals(List.of(AB_CD), graph.transitionsFrom(4));
        assertEquals(List.of(), graph.transitionsFrom(7));
        assertEquals(Set.of(4, 7), graph.involvedClasses());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    @DisplayName("Identical duplicates collapse with a warning")
    void testIdenticalDuplicate() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ForbiddenTransitionGraph graph = ForbiddenTransitionGraph.build(
            List.of(new ClassTransitions(4, 7, List.of(AB_CD, AB_CD))), Set.of(4, 7), diagnostics);

        assertEquals(1, graph.size());
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).isWarning());
    }

    @Test
    @DisplayName("A token pair with conflicting data fails loudly")
    void testConflictingDuplicate() {
        ForbiddenTransition conflicting = new ForbiddenTransition(4, 7, "ab", "cd", "PHASE_ORDERING", 0.5);
        assertThrows(InvariantViolationException.class, () -> ForbiddenTransitionGraph.build(
            List.of(new ClassTransitions(4, 7, List.of(AB_CD, conflicting))), Set.of(4, 7), new ArrayList<>()));
    }

    @Test
    @DisplayName("Pairs referencing undeclared classes are kept and reported")
    void testUndeclaredClass() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ForbiddenTransitionGraph graph = ForbiddenTransitionGraph.build(
            List.of(new ClassTransitions(4, 7, List.of(AB_CD))), Set.of(4), diagnostics);

        assertTrue(graph.isForbidden(4, 7));
        assertEquals(1, diagnostics.size());
    }

    @Test
    @DisplayName("Active pairs need both classes present")
    void testActivePairs() {
        ForbiddenTransitionGraph graph = ForbiddenTransitionGraph.build(List.of(
            new ClassTransitions(4, 7, List.of(AB_CD)),
            new ClassTransitions(7, 9, List.of())), Set.of(4, 7, 9), new ArrayList<>());

        assertEquals(Set.of(new ClassPair(4, 7)), graph.activePairs(Set.of(4, 7)));
        assertEquals(Set.of(new ClassPair(4, 7), new ClassPair(7, 9)), graph.activePairs(Set.of(4, 7, 9)));
        assertTrue(graph.activePairs(Set.of(4)).isEmpty());
        assertEquals("4->7", new ClassPair(4, 7).toString());
    }

    @Test
    @DisplayName("Severity outside [0,1] is rejected")
    void testSeverityRange() {
        assertThrows(IllegalArgumentException.class,
            () -> new ForbiddenTransition(1, 2, "a", "b", "X", 1.5));
    }
}
