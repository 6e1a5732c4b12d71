package pl.marcinmilkowski.constraint_kb.ingest;

import pl.marcinmilkowski.constraint_kb.model.Context;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.FolioMetrics;
import pl.marcinmilkowski.constraint_kb.model.ForbiddenTransition;
import pl.marcinmilkowski.constraint_kb.model.Regime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed records decoded from all sources, before any cross-referencing.
 *
 * Every field carries its declared default, so the store builder never
 * repeats fallback logic. Absent optional sources leave their collections empty.
 */
public record SourceBundle(
    Set<SourceKind> loaded,
    List<ClassDefinition> classDefinitions,
    Map<String, Set<Integer>> middleToClasses,
    Map<Integer, ClassMorphology> classMorphology,
    List<HazardProfile> hazardProfiles,
    List<ClassTransitions> classTransitions,
    List<Context> contexts,
    Map<String, Set<String>> zoneLegality,
    Map<String, Set<Integer>> classFootprints,
    Map<String, ContextActivation> contextVocabulary,
    Map<String, Regime> regimeAssignments,
    Map<String, FolioMetrics> folioMetrics
) {

    public SourceBundle {
        loaded = loaded.isEmpty() ? Collections.unmodifiableSet(EnumSet.noneOf(SourceKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(loaded));
        classDefinitions = List.copyOf(classDefinitions);
        middleToClasses = Collections.unmodifiableMap(new LinkedHashMap<>(middleToClasses));
        classMorphology = Collections.unmodifiableMap(new LinkedHashMap<>(classMorphology));
        hazardProfiles = List.copyOf(hazardProfiles);
        classTransitions = List.copyOf(classTransitions);
        contexts = List.copyOf(contexts);
        zoneLegality = Collections.unmodifiableMap(new LinkedHashMap<>(zoneLegality));
        classFootprints = Collections.unmodifiableMap(new LinkedHashMap<>(classFootprints));
        contextVocabulary = Collections.unmodifiableMap(new LinkedHashMap<>(contextVocabulary));
        regimeAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(regimeAssignments));
        folioMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(folioMetrics));
    }

    public boolean isLoaded(SourceKind kind) {
        return loaded.contains(kind);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** One class definition entry */
    public record ClassDefinition(int id, List<String> members, String role) {
        public ClassDefinition {
            members = List.copyOf(members);
            role = role == null || role.isBlank() ? "UNKNOWN" : role;
        }
    }

    /** Authoritative per-class morphology */
    public record ClassMorphology(Set<String> middles, Set<String> prefixes) {
        public ClassMorphology {
            middles = Set.copyOf(middles);
            prefixes = Set.copyOf(prefixes);
        }
    }

    /** Structural hazard profile counters of one class */
    public record HazardProfile(int classId, int exclusiveCount, int sharedCount) {
    }

    /** Forbidden class pair with its token-level transitions */
    public record ClassTransitions(int fromClass, int toClass, List<ForbiddenTransition> tokenTransitions) {
        public ClassTransitions {
            tokenTransitions = List.copyOf(tokenTransitions);
        }
    }

    /**
     * Assembles a bundle in memory, for tests and for callers that decode
     * their sources themselves.
     */
    public static class Builder {
        private final Set<SourceKind> loaded = EnumSet.noneOf(SourceKind.class);
        private final List<ClassDefinition> classDefinitions = new ArrayList<>();
        private final Map<String, Set<Integer>> middleToClasses = new LinkedHashMap<>();
        private final Map<Integer, ClassMorphology> classMorphology = new LinkedHashMap<>();
        private final List<HazardProfile> hazardProfiles = new ArrayList<>();
        private final List<ClassTransitions> classTransitions = new ArrayList<>();
        private final List<Context> contexts = new ArrayList<>();
        private final Map<String, Set<String>> zoneLegality = new LinkedHashMap<>();
        private final Map<String, Set<Integer>> classFootprints = new LinkedHashMap<>();
        private final Map<String, ContextActivation> contextVocabulary = new LinkedHashMap<>();
        private final Map<String, Regime> regimeAssignments = new LinkedHashMap<>();
        private final Map<String, FolioMetrics> folioMetrics = new LinkedHashMap<>();

        public Builder markLoaded(SourceKind kind) {
            loaded.add(kind);
            return this;
        }

        public Builder addClass(int id, List<String> members, String role) {
            loaded.add(SourceKind.CLASS_DEFINITIONS);
            classDefinitions.add(new ClassDefinition(id, members, role));
            return this;
        }

        public Builder mapMiddle(String middle, Set<Integer> classIds) {
            loaded.add(SourceKind.MIDDLE_CLASS_INDEX);
            middleToClasses.put(middle, Set.copyOf(classIds));
            return this;
        }

        public Builder classMorphology(int classId, Set<String> middles, Set<String> prefixes) {
            loaded.add(SourceKind.MIDDLE_CLASS_INDEX);
            classMorphology.put(classId, new ClassMorphology(middles, prefixes));
            return this;
        }

        public Builder hazardProfile(int classId, int exclusiveCount, int sharedCount) {
            loaded.add(SourceKind.MIDDLE_CLASS_INDEX);
            hazardProfiles.add(new HazardProfile(classId, exclusiveCount, sharedCount));
            return this;
        }

        public Builder classTransitions(int fromClass, int toClass, List<ForbiddenTransition> tokens) {
            loaded.add(SourceKind.FORBIDDEN_TRANSITIONS);
            classTransitions.add(new ClassTransitions(fromClass, toClass, tokens));
            return this;
        }

        public Builder addContext(Context context) {
            loaded.add(SourceKind.CONTEXT_METADATA);
            contexts.add(context);
            return this;
        }

        public Builder zoneLegality(String middle, Set<String> legalZones) {
            loaded.add(SourceKind.ZONE_LEGALITY);
            zoneLegality.put(middle, Set.copyOf(legalZones));
            return this;
        }

        public Builder classFootprint(String contextId, Set<Integer> classIds) {
            loaded.add(SourceKind.CLASS_FOOTPRINTS);
            classFootprints.put(contextId, Set.copyOf(classIds));
            return this;
        }

        public Builder contextVocabulary(String contextId, ContextActivation activation) {
            loaded.add(SourceKind.CONTEXT_VOCABULARY);
            contextVocabulary.put(contextId, activation);
            return this;
        }

        public Builder regime(String contextId, Regime regime) {
            loaded.add(SourceKind.REGIME_ASSIGNMENT);
            regimeAssignments.put(contextId, regime);
            return this;
        }

        public Builder folioMetrics(String contextId, FolioMetrics metrics) {
            loaded.add(SourceKind.FOLIO_METRICS);
            folioMetrics.put(contextId, metrics);
            return this;
        }

        public SourceBundle build() {
            return new SourceBundle(loaded, classDefinitions, middleToClasses, classMorphology,
                hazardProfiles, classTransitions, contexts, zoneLegality, classFootprints,
                contextVocabulary, regimeAssignments, folioMetrics);
        }
    }
}
