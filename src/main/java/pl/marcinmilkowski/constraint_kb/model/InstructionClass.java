package pl.marcinmilkowski.constraint_kb.model;

import java.util.List;
import java.util.Set;

/**
 * One of the instruction equivalence classes of the grammar.
 *
 * Instances are immutable; the index replaces an instance when a later
 * enrichment pass changes its vocabulary.
 */
public record InstructionClass(
    int id,
    List<String> members,      // member tokens, in source order
    String role,               // functional role label
    Set<String> middles,       // MIDDLE vocabulary
    Set<String> prefixes,
    HazardType hazardType
) {

    public InstructionClass {
        members = List.copyOf(members);
        middles = Set.copyOf(middles);
        prefixes = Set.copyOf(prefixes);
        if (hazardType == null) {
            hazardType = HazardType.NONE;
        }
    }

    /**
     * Create a freshly registered class with no morphology and no hazard.
     */
    public static InstructionClass registered(int id, List<String> members, String role) {
        return new InstructionClass(id, members, role, Set.of(), Set.of(), HazardType.NONE);
    }

    public boolean isHazardInvolved() {
        return hazardType != HazardType.NONE;
    }

    public InstructionClass withMorphology(Set<String> newMiddles, Set<String> newPrefixes) {
        return new InstructionClass(id, members, role, newMiddles, newPrefixes, hazardType);
    }

    public InstructionClass withHazardType(HazardType type) {
        return new InstructionClass(id, members, role, middles, prefixes, type);
    }

    @Override
    public String toString() {
        return String.format("Class[%d %s, %d members, %d middles, hazard=%s]",
            id, role, members.size(), middles.size(), hazardType);
    }
}
