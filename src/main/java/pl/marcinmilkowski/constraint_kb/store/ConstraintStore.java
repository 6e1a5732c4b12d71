package pl.marcinmilkowski.constraint_kb.store;

import pl.marcinmilkowski.constraint_kb.index.ClassIndex;
import pl.marcinmilkowski.constraint_kb.index.ForbiddenTransitionGraph;
import pl.marcinmilkowski.constraint_kb.index.ProtectedClassSet;
import pl.marcinmilkowski.constraint_kb.index.TokenInventory;
import pl.marcinmilkowski.constraint_kb.index.VocabularyIndex;
import pl.marcinmilkowski.constraint_kb.model.Context;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.FolioMetrics;
import pl.marcinmilkowski.constraint_kb.model.HazardType;
import pl.marcinmilkowski.constraint_kb.model.InstructionClass;
import pl.marcinmilkowski.constraint_kb.model.Regime;
import pl.marcinmilkowski.constraint_kb.morphology.Morphology;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The built constraint knowledge base.
 *
 * Immutable and safe to share between threads. Lookups of unknown classes,
 * items or contexts return empty values instead of failing.
 * Obtain instances from {@link ConstraintStoreBuilder}; a rebuild produces a new store.
 */
public final class ConstraintStore {

    private final ClassIndex classes;
    private final VocabularyIndex vocabulary;
    private final ProtectedClassSet protectedClasses;
    private final ForbiddenTransitionGraph forbiddenTransitions;
    private final TokenInventory tokens;
    private final Morphology morphology;
    private final Map<String, Context> contexts;
    private final Map<String, ContextActivation> activations;
    private final Map<String, Regime> regimes;
    private final Map<String, FolioMetrics> metrics;
    private final Map<String, Set<String>> zoneLegality;
    private final Map<String, Set<Integer>> footprints;

    ConstraintStore(ClassIndex classes,
                    VocabularyIndex vocabulary,
                    ProtectedClassSet protectedClasses,
                    ForbiddenTransitionGraph forbiddenTransitions,
                    TokenInventory tokens,
                    Morphology morphology,
                    Map<String, Context> contexts,
                    Map<String, ContextActivation> activations,
                    Map<String, Regime> regimes,
                    Map<String, FolioMetrics> metrics,
                    Map<String, Set<String>> zoneLegality,
                    Map<String, Set<Integer>> footprints) {
        this.classes = classes;
        this.vocabulary = vocabulary;
        this.protectedClasses = protectedClasses;
        this.forbiddenTransitions = forbiddenTransitions;
        this.tokens = tokens;
        this.morphology = morphology;
        this.contexts = sorted(contexts);
        this.activations = sorted(activations);
        this.regimes = sorted(regimes);
        this.metrics = sorted(metrics);
        this.zoneLegality = sorted(zoneLegality);
        this.footprints = sorted(footprints);
    }

    private static <V> Map<String, V> sorted(Map<String, V> map) {
        return Collections.unmodifiableMap(new TreeMap<>(map));
    }

    // --- classes ---

    public Optional<InstructionClass> instructionClass(int classId) {
        return classes.get(classId);
    }

    public Set<Integer> classesFor(String item) {
        return vocabulary.classesFor(item);
    }

    public Set<String> itemsFor(int classId) {
        return classes.itemsFor(classId);
    }

    public boolean isAtomic(int classId) {
        return classes.get(classId).map(c -> c.hazardType() == HazardType.ATOMIC).orElse(false);
    }

    public boolean isDecomposable(int classId) {
        return classes.get(classId).map(c -> c.hazardType() == HazardType.DECOMPOSABLE).orElse(false);
    }

    public boolean isProtected(int classId) {
        return protectedClasses.contains(classId);
    }

    // --- contexts ---

    /** Ids of contexts with metadata, in lexical order */
    public Set<String> contextIds() {
        return contexts.keySet();
    }

    /** Ids of contexts with an activated vocabulary, in lexical order */
    public Set<String> activatedContextIds() {
        return activations.keySet();
    }

    public Optional<Context> context(String contextId) {
        return contextId == null ? Optional.empty() : Optional.ofNullable(contexts.get(contextId));
    }

    /** Activated vocabulary of a context, {@link ContextActivation#EMPTY} if none is known */
    public ContextActivation activation(String contextId) {
        return contextId == null ? ContextActivation.EMPTY : activations.getOrDefault(contextId, ContextActivation.EMPTY);
    }

    public Optional<Regime> regime(String contextId) {
        return contextId == null ? Optional.empty() : Optional.ofNullable(regimes.get(contextId));
    }

    /** Ids of contexts with a regime assignment */
    public Set<String> regimeContextIds() {
        return regimes.keySet();
    }

    public Optional<FolioMetrics> metrics(String contextId) {
        return contextId == null ? Optional.empty() : Optional.ofNullable(metrics.get(contextId));
    }

    /** Zones in which an item is legal; empty if the item has no legality record */
    public Set<String> legalZones(String item) {
        return item == null ? Set.of() : zoneLegality.getOrDefault(item, Set.of());
    }

    public boolean hasZoneLegality(String item) {
        return item != null && zoneLegality.containsKey(item);
    }

    /** Classes used by a consumer context; empty if unknown */
    public Set<Integer> footprint(String contextId) {
        return contextId == null ? Set.of() : footprints.getOrDefault(contextId, Set.of());
    }

    public Set<String> footprintContextIds() {
        return footprints.keySet();
    }

    // --- indices ---

    public ClassIndex classes() {
        return classes;
    }

    public VocabularyIndex vocabulary() {
        return vocabulary;
    }

    public ProtectedClassSet protectedClasses() {
        return protectedClasses;
    }

    public ForbiddenTransitionGraph forbiddenTransitions() {
        return forbiddenTransitions;
    }

    public TokenInventory tokens() {
        return tokens;
    }

    public Morphology morphology() {
        return morphology;
    }

    @Override
    public String toString() {
        return String.format("ConstraintStore[%d classes, %d items, %d tokens, %d contexts, %d protected, %d forbidden]",
            classes.size(), vocabulary.items().size(), tokens.size(), contexts.size(),
            protectedClasses.size(), forbiddenTransitions.size());
    }
}
