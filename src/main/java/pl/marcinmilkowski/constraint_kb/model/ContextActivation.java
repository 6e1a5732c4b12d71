package pl.marcinmilkowski.constraint_kb.model;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The vocabulary a context activates, per morphological slot.
 *
 * An empty prefix or suffix set means the slot is unconstrained, not that
 * nothing is allowed. The MIDDLE set is always binding.
 */
public record ContextActivation(
    Set<String> middles,
    Set<String> prefixes,
    Set<String> suffixes
) {

    public static final ContextActivation EMPTY = new ContextActivation(Set.of(), Set.of(), Set.of());

    public ContextActivation {
        middles = copyOf(middles);
        prefixes = copyOf(prefixes);
        suffixes = copyOf(suffixes);
    }

    // null sets and null entries are dropped
    private static Set<String> copyOf(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public static ContextActivation ofMiddles(Set<String> middles) {
        return new ContextActivation(middles, Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return middles.isEmpty() && prefixes.isEmpty() && suffixes.isEmpty();
    }
}
