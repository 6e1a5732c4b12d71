package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.config.InfrastructureClasses;
import pl.marcinmilkowski.constraint_kb.model.HazardType;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classes that vocabulary filtering can never prune:
 * atomic hazard classes plus the curated infrastructure classes.
 *
 * Protection says nothing about hazard type; an infrastructure class may
 * also be a decomposable hazard class.
 */
public final class ProtectedClassSet {

    private final Set<Integer> classIds;
    private final Set<Integer> atomicHazards;
    private final InfrastructureClasses infrastructure;

    private ProtectedClassSet(Set<Integer> atomicHazards, InfrastructureClasses infrastructure) {
        Set<Integer> all = new TreeSet<>(atomicHazards);
        all.addAll(infrastructure.classIds());
        this.classIds = Collections.unmodifiableSet(all);
        this.atomicHazards = Collections.unmodifiableSet(new TreeSet<>(atomicHazards));
        this.infrastructure = infrastructure;
    }

    /**
     * @throws InvariantViolationException if the infrastructure constant names an
     *         undeclared class or the resulting set is empty
     */
    public static ProtectedClassSet derive(ClassIndex classes, InfrastructureClasses infrastructure) {
        for (int classId : infrastructure.classIds()) {
            if (!classes.contains(classId)) {
                throw new InvariantViolationException("Infrastructure constant " + infrastructure.revision()
                    + " references undeclared class " + classId);
            }
        }
        ProtectedClassSet set = new ProtectedClassSet(classes.classesWithHazard(HazardType.ATOMIC), infrastructure);
        if (set.classIds.isEmpty()) {
            throw new InvariantViolationException("Protected class set is empty: no atomic hazard classes and "
                + "no infrastructure classes in " + infrastructure.revision());
        }
        return set;
    }

    public boolean contains(int classId) {
        return classIds.contains(classId);
    }

    public Set<Integer> asSet() {
        return classIds;
    }

    public int size() {
        return classIds.size();
    }

    public Set<Integer> atomicHazards() {
        return atomicHazards;
    }

    public InfrastructureClasses infrastructure() {
        return infrastructure;
    }

    /** Declared classes that vocabulary filtering may prune */
    public Set<Integer> prunable(ClassIndex classes) {
        Set<Integer> out = new TreeSet<>(classes.classIds());
        out.removeAll(classIds);
        return out;
    }

    @Override
    public String toString() {
        return "ProtectedClassSet" + classIds + " (atomic " + atomicHazards + ", " + infrastructure + ")";
    }
}
