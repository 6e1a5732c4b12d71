package pl.marcinmilkowski.constraint_kb.ingest;

/**
 * A non-fatal observation made while building the store.
 */
public record Diagnostic(Severity severity, String source, String message) {

    public enum Severity {
        INFO,
        WARNING
    }

    public static Diagnostic info(String source, String message) {
        return new Diagnostic(Severity.INFO, source, message);
    }

    public static Diagnostic warning(String source, String message) {
        return new Diagnostic(Severity.WARNING, source, message);
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    @Override
    public String toString() {
        return severity + " [" + source + "] " + message;
    }
}
