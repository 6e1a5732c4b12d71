package pl.marcinmilkowski.constraint_kb.store;

import pl.marcinmilkowski.constraint_kb.ingest.Diagnostic;

import java.util.List;

/**
 * A built store with the diagnostics collected while building it.
 */
public record BuildResult(ConstraintStore store, List<Diagnostic> diagnostics) {

    public BuildResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(Diagnostic::isWarning).toList();
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(Diagnostic::isWarning);
    }
}
