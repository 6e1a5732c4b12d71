package pl.marcinmilkowski.constraint_kb.config;

import java.util.List;

/**
 * Named thresholds and structural constants of the constraint model.
 *
 * Frequency-derived thresholds live here, apart from the algorithms that
 * use them, so they can be revised without touching the filter.
 */
public final class ConstraintPolicy {

    /** Number of instruction classes in the reference grammar */
    public static final int CLASS_COUNT = 49;

    /** Valid class ids are 1..MAX_CLASS_ID */
    public static final int MAX_CLASS_ID = CLASS_COUNT;

    /**
     * Items in this many distinct contexts or more are UNIVERSAL.
     * Fixed; not exposed as a tunable.
     */
    public static final int UNIVERSAL_SPREAD_THRESHOLD = 4;

    /** Historical tolerance band for the size of the protected class set */
    public static final int PROTECTED_SIZE_MIN = 5;
    public static final int PROTECTED_SIZE_MAX = 9;

    /** Zone labels used by categorical zone legality */
    public static final List<String> LEGALITY_ZONES = List.of("C", "P", "R", "S");

    /** REGIME_4 contexts are sufficient only with at least this LINK density */
    public static final double REGIME_4_MIN_LINK_DENSITY = 0.25;

    /** REGIME_3 contexts are sufficient only with at least this many recovery operations */
    public static final int REGIME_3_MIN_RECOVERY_OPS = 2;

    private ConstraintPolicy() {
    }

    public static boolean isValidClassId(int classId) {
        return classId >= 1 && classId <= MAX_CLASS_ID;
    }
}
