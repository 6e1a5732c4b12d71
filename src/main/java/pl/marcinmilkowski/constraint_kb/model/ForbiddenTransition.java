package pl.marcinmilkowski.constraint_kb.model;

/**
 * A token transition that is never observed in the corpus.
 */
public record ForbiddenTransition(
    int fromClass,
    int toClass,
    String fromToken,
    String toToken,
    String hazardLabel,
    double severity            // 0.0 - 1.0
) {

    public ForbiddenTransition {
        if (severity < 0.0 || severity > 1.0 || Double.isNaN(severity)) {
            throw new IllegalArgumentException(
                "Severity out of range [0,1] for " + fromToken + "->" + toToken + ": " + severity);
        }
        fromToken = fromToken == null ? "" : fromToken;
        toToken = toToken == null ? "" : toToken;
        hazardLabel = hazardLabel == null ? "" : hazardLabel;
    }

    public TokenPair tokenPair() {
        return new TokenPair(fromToken, toToken);
    }

    /**
     * Key identifying a transition by its tokens.
     */
    public record TokenPair(String fromToken, String toToken) {
        @Override
        public String toString() {
            return fromToken + "->" + toToken;
        }
    }
}
