package pl.marcinmilkowski.constraint_kb.model;

/**
 * Advisory completeness metrics for a context.
 * Never used by structural classification.
 */
public record FolioMetrics(
    double linkDensity,        // 0.0 - 1.0
    int recoveryOpsCount
) {

    public FolioMetrics {
        if (linkDensity < 0.0 || linkDensity > 1.0 || Double.isNaN(linkDensity)) {
            throw new IllegalArgumentException("link_density out of range [0,1]: " + linkDensity);
        }
        if (recoveryOpsCount < 0) {
            throw new IllegalArgumentException("recovery_ops_count must be >= 0: " + recoveryOpsCount);
        }
    }
}
