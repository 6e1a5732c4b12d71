package pl.marcinmilkowski.constraint_kb.ingest;

/**
 * The independent upstream sources the knowledge base is built from.
 *
 * Optional sources are produced by separate pipelines that may not have run yet.
 */
public enum SourceKind {
    /** Class definitions: id, member tokens, functional role */
    CLASS_DEFINITIONS("class_definitions", true,
        "phases/01-09_early_hypothesis/phase20a_operator_equivalence.json"),

    /** MIDDLE/class mapping, class morphology and hazard profiles */
    MIDDLE_CLASS_INDEX("middle_class_index", true,
        "phases/AZC_REACHABILITY_SUPPRESSION/middle_class_index.json"),

    /** Forbidden transition inventory */
    FORBIDDEN_TRANSITIONS("forbidden_transitions", true,
        "phases/AZC_REACHABILITY_SUPPRESSION/phase1_results.json"),

    /** Per-context metadata */
    CONTEXT_METADATA("context_metadata", true,
        "results/azc_folio_features.json"),

    /** Categorical per-item zone legality */
    ZONE_LEGALITY("zone_legality", false,
        "results/middle_zone_legality.json"),

    /** Classes actually used by each consumer context */
    CLASS_FOOTPRINTS("class_footprints", false,
        "results/b_folio_class_footprints.json"),

    /** Activated vocabulary keyed by context id */
    CONTEXT_VOCABULARY("context_vocabulary", false,
        "results/azc_folio_middles.json"),

    /** Regime label to context ids */
    REGIME_ASSIGNMENT("regime_assignment", false,
        "results/regime_folio_mapping.json"),

    /** Per-context completeness metrics */
    FOLIO_METRICS("folio_metrics", false,
        "results/unified_folio_profiles.json");

    private final String key;
    private final boolean required;
    private final String defaultPath;

    SourceKind(String key, boolean required, String defaultPath) {
        this.key = key;
        this.required = required;
        this.defaultPath = defaultPath;
    }

    /** Key used in manifests and diagnostics */
    public String key() { return key; }

    public boolean isRequired() { return required; }

    /** Path relative to the data root in the original project layout */
    public String defaultPath() { return defaultPath; }

    public static SourceKind fromKey(String key) {
        for (SourceKind kind : values()) {
            if (kind.key.equalsIgnoreCase(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + key);
    }
}
