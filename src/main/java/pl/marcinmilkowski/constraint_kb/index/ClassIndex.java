package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.model.HazardType;
import pl.marcinmilkowski.constraint_kb.model.InstructionClass;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registry of instruction classes.
 *
 * Built in two phases: every class is registered first, then vocabulary
 * enrichment is attached. Once enrichment starts, registration is closed.
 */
public final class ClassIndex {

    private final Map<Integer, InstructionClass> classes;
    private final Map<String, Integer> tokenToClass;

    private ClassIndex(Map<Integer, InstructionClass> classes, Map<String, Integer> tokenToClass) {
        this.classes = Collections.unmodifiableMap(new TreeMap<>(classes));
        this.tokenToClass = Collections.unmodifiableMap(new HashMap<>(tokenToClass));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<InstructionClass> get(int classId) {
        return Optional.ofNullable(classes.get(classId));
    }

    public boolean contains(int classId) {
        return classes.containsKey(classId);
    }

    /** Class ids in ascending order */
    public Set<Integer> classIds() {
        return classes.keySet();
    }

    public Collection<InstructionClass> all() {
        return classes.values();
    }

    public int size() {
        return classes.size();
    }

    /** The class declaring a member token, if any */
    public Optional<Integer> classOfToken(String token) {
        return Optional.ofNullable(tokenToClass.get(token));
    }

    /** Vocabulary of a class, empty for an unknown id */
    public Set<String> itemsFor(int classId) {
        InstructionClass cls = classes.get(classId);
        return cls != null ? cls.middles() : Set.of();
    }

    /** Distinct functional roles in class-id order */
    public Set<String> roles() {
        return classes.values().stream()
            .map(InstructionClass::role)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<Integer> classesWithRole(String role) {
        return classes.values().stream()
            .filter(c -> c.role().equals(role))
            .map(InstructionClass::id)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<Integer> classesWithHazard(HazardType type) {
        return classes.values().stream()
            .filter(c -> c.hazardType() == type)
            .map(InstructionClass::id)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public static final class Builder {
        private final Map<Integer, InstructionClass> classes = new TreeMap<>();
        private final Map<String, Integer> tokenToClass = new HashMap<>();
        private boolean registrationOpen = true;

        private Builder() {
        }

        /**
         * Phase one: declare a class.
         *
         * @throws InvariantViolationException for an out-of-range or duplicate id,
         *         or a member token already declared by another class
         */
        public Builder registerClass(int id, List<String> members, String role) {
            if (!registrationOpen) {
                throw new IllegalStateException("Class registration is closed once enrichment has started");
            }
            if (!ConstraintPolicy.isValidClassId(id)) {
                throw new InvariantViolationException(
                    "Class id " + id + " outside 1.." + ConstraintPolicy.MAX_CLASS_ID);
            }
            if (classes.containsKey(id)) {
                throw new InvariantViolationException("Duplicate class id " + id);
            }
            for (String token : members) {
                Integer owner = tokenToClass.putIfAbsent(token, id);
                if (owner != null && owner != id) {
                    throw new InvariantViolationException(
                        "Token '" + token + "' declared by classes " + owner + " and " + id);
                }
            }
            classes.put(id, InstructionClass.registered(id, members, role));
            return this;
        }

        /**
         * Union vocabulary into a class (additive enrichment).
         *
         * @return false if the class is not registered
         */
        public boolean addVocabulary(int id, Set<String> middles) {
            registrationOpen = false;
            InstructionClass cls = classes.get(id);
            if (cls == null) {
                return false;
            }
            Set<String> merged = new TreeSet<>(cls.middles());
            merged.addAll(middles);
            classes.put(id, cls.withMorphology(merged, cls.prefixes()));
            return true;
        }

        /**
         * Phase two: replace vocabulary and prefixes of a class with
         * authoritative morphology (overriding enrichment).
         *
         * @return false if the class is not registered
         */
        public boolean attachMorphology(int id, Set<String> middles, Set<String> prefixes) {
            registrationOpen = false;
            InstructionClass cls = classes.get(id);
            if (cls == null) {
                return false;
            }
            classes.put(id, cls.withMorphology(middles, prefixes));
            return true;
        }

        /**
         * Assign hazard types. Classes not in the map keep {@link HazardType#NONE}.
         */
        public Builder applyHazardTypes(Map<Integer, HazardType> hazardTypes) {
            registrationOpen = false;
            for (Map.Entry<Integer, HazardType> e : hazardTypes.entrySet()) {
                InstructionClass cls = classes.get(e.getKey());
                if (cls == null) {
                    throw new InvariantViolationException("Hazard type for undeclared class " + e.getKey());
                }
                classes.put(cls.id(), cls.withHazardType(e.getValue()));
            }
            return this;
        }

        public Set<Integer> registeredIds() {
            return Collections.unmodifiableSet(classes.keySet());
        }

        public ClassIndex build() {
            return new ClassIndex(classes, tokenToClass);
        }
    }
}
