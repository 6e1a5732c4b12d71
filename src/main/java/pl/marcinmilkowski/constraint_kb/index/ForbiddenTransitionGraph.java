package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.ingest.Diagnostic;
import pl.marcinmilkowski.constraint_kb.ingest.SourceBundle.ClassTransitions;
import pl.marcinmilkowski.constraint_kb.ingest.SourceKind;
import pl.marcinmilkowski.constraint_kb.model.ForbiddenTransition;
import pl.marcinmilkowski.constraint_kb.model.ForbiddenTransition.TokenPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Registry of transitions never observed in the corpus.
 *
 * Each token pair appears at most once. The graph is read by reports; the
 * compatibility filter does not consult it.
 */
public final class ForbiddenTransitionGraph {

    private final Map<TokenPair, ForbiddenTransition> byTokens;
    private final Set<ClassPair> classPairs;
    private final Map<Integer, List<ForbiddenTransition>> byFromClass;

    private ForbiddenTransitionGraph(Map<TokenPair, ForbiddenTransition> byTokens, Set<ClassPair> classPairs) {
        this.byTokens = Collections.unmodifiableMap(byTokens);
        this.classPairs = Collections.unmodifiableSet(classPairs);
        Map<Integer, List<ForbiddenTransition>> grouped = new TreeMap<>();
        for (ForbiddenTransition t : byTokens.values()) {
            grouped.computeIfAbsent(t.fromClass(), k -> new ArrayList<>()).add(t);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        this.byFromClass = Collections.unmodifiableMap(grouped);
    }

    public static ForbiddenTransitionGraph empty() {
        return new ForbiddenTransitionGraph(new LinkedHashMap<>(), new TreeSet<>());
    }

    /**
     * Register every class pair and token transition.
     *
     * @param declaredClasses Classes known to the class index; pairs outside it are reported
     * @throws InvariantViolationException if a token pair recurs with different content
     */
    public static ForbiddenTransitionGraph build(List<ClassTransitions> sources, Set<Integer> declaredClasses,
                                                 List<Diagnostic> diagnostics) {
        Map<TokenPair, ForbiddenTransition> byTokens = new LinkedHashMap<>();
        Set<ClassPair> pairs = new TreeSet<>();

        for (ClassTransitions entry : sources) {
            ClassPair pair = new ClassPair(entry.fromClass(), entry.toClass());
            pairs.add(pair);
            if (!declaredClasses.contains(pair.fromClass()) || !declaredClasses.contains(pair.toClass())) {
                diagnostics.add(Diagnostic.warning(SourceKind.FORBIDDEN_TRANSITIONS.key(),
                    "forbidden pair " + pair + " references an undeclared class"));
            }

            for (ForbiddenTransition t : entry.tokenTransitions()) {
                ForbiddenTransition existing = byTokens.putIfAbsent(t.tokenPair(), t);
                if (existing == null) {
                    continue;
                }
                if (!existing.equals(t)) {
                    throw new InvariantViolationException("Token pair " + t.tokenPair()
                        + " registered twice with conflicting data: " + existing + " vs " + t);
                }
                diagnostics.add(Diagnostic.warning(SourceKind.FORBIDDEN_TRANSITIONS.key(),
                    "duplicate forbidden transition " + t.tokenPair() + " collapsed"));
            }
        }
        return new ForbiddenTransitionGraph(byTokens, pairs);
    }

    public Optional<ForbiddenTransition> lookup(String fromToken, String toToken) {
        return Optional.ofNullable(byTokens.get(new TokenPair(fromToken, toToken)));
    }

    public boolean isForbidden(int fromClass, int toClass) {
        return classPairs.contains(new ClassPair(fromClass, toClass));
    }

    public List<ForbiddenTransition> transitionsFrom(int classId) {
        return byFromClass.getOrDefault(classId, List.of());
    }

    public Collection<ForbiddenTransition> transitions() {
        return byTokens.values();
    }

    public Set<ClassPair> classPairs() {
        return classPairs;
    }

    /** Forbidden class pairs whose both ends are in the given class set */
    public Set<ClassPair> activePairs(Set<Integer> classes) {
        Set<ClassPair> active = new TreeSet<>();
        for (ClassPair pair : classPairs) {
            if (classes.contains(pair.fromClass()) && classes.contains(pair.toClass())) {
                active.add(pair);
            }
        }
        return active;
    }

    /** Classes at either end of a forbidden pair */
    public Set<Integer> involvedClasses() {
        Set<Integer> out = new TreeSet<>();
        for (ClassPair pair : classPairs) {
            out.add(pair.fromClass());
            out.add(pair.toClass());
        }
        return out;
    }

    public int size() {
        return byTokens.size();
    }

    /**
     * Ordered pair of class ids.
     */
    public record ClassPair(int fromClass, int toClass) implements Comparable<ClassPair> {

        private static final Comparator<ClassPair> ORDER =
            Comparator.comparingInt(ClassPair::fromClass).thenComparingInt(ClassPair::toClass);

        @Override
        public int compareTo(ClassPair other) {
            return ORDER.compare(this, other);
        }

        @Override
        public String toString() {
            return fromClass + "->" + toClass;
        }
    }
}
