package pl.marcinmilkowski.constraint_kb.model;

import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;

/**
 * Cross-context classification of a vocabulary item.
 */
public enum ItemScope {
    /** Appears in many contexts; cannot establish or deny pairwise compatibility */
    UNIVERSAL,

    /** Appears in few contexts (including none); decisive for compatibility */
    RESTRICTED;

    /**
     * Classify a spread value using the fixed policy threshold.
     */
    public static ItemScope ofSpread(int spread) {
        return spread >= ConstraintPolicy.UNIVERSAL_SPREAD_THRESHOLD ? UNIVERSAL : RESTRICTED;
    }
}
