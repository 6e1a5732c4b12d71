package pl.marcinmilkowski.constraint_kb.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The four observational regime labels a context may carry.
 */
public enum Regime {
    REGIME_1,
    REGIME_2,
    REGIME_3,
    REGIME_4;

    /**
     * Parse a regime label, e.g. "REGIME_3" or "regime_3".
     */
    public static Optional<Regime> parse(String label) {
        if (label == null) return Optional.empty();
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
