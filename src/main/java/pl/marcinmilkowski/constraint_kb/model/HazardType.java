package pl.marcinmilkowski.constraint_kb.model;

/**
 * Hazard taxonomy of an instruction class.
 */
public enum HazardType {
    /** Not implicated in any forbidden transition */
    NONE,

    /** Hazard class without vocabulary dependency; unaffected by vocabulary filtering */
    ATOMIC,

    /** Vocabulary-bearing hazard class; prunable by context */
    DECOMPOSABLE
}
