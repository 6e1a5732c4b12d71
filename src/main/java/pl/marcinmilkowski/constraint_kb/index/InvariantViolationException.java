package pl.marcinmilkowski.constraint_kb.index;

/**
 * Source data or a curated constant contradicts a structural invariant.
 * Signals drift in the upstream data; the build must not continue.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
