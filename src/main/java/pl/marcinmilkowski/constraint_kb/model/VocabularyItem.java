package pl.marcinmilkowski.constraint_kb.model;

import java.util.Set;

/**
 * A MIDDLE vocabulary item with the classes declaring it and its context spread.
 */
public record VocabularyItem(
    String key,
    Set<Integer> classes,   // classes whose vocabulary contains this item
    int spread,             // distinct contexts whose activated vocabulary contains it
    ItemScope scope
) {

    public VocabularyItem {
        if (spread < 0) {
            throw new IllegalArgumentException("Negative spread for item " + key + ": " + spread);
        }
        classes = Set.copyOf(classes);
    }

    public boolean isUniversal() {
        return scope == ItemScope.UNIVERSAL;
    }

    @Override
    public String toString() {
        return String.format("%s spread=%d %s classes=%s", key, spread, scope, classes);
    }
}
