package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.model.InstructionClass;
import pl.marcinmilkowski.constraint_kb.model.ItemScope;
import pl.marcinmilkowski.constraint_kb.model.VocabularyItem;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Bidirectional MIDDLE/class map plus per-item context spread.
 *
 * Spread is a snapshot of the per-context vocabularies given at build time;
 * when those change, build a new index.
 */
public final class VocabularyIndex {

    private final Map<String, Set<Integer>> itemToClasses;
    private final Map<String, Integer> spread;
    private final Set<String> items;

    private VocabularyIndex(Map<String, Set<Integer>> itemToClasses, Map<String, Integer> spread) {
        this.itemToClasses = Collections.unmodifiableMap(itemToClasses);
        this.spread = Collections.unmodifiableMap(spread);
        Set<String> all = new TreeSet<>(itemToClasses.keySet());
        all.addAll(spread.keySet());
        this.items = Collections.unmodifiableSet(all);
    }

    /**
     * Invert the final class vocabularies and attach spread.
     *
     * @param classes Enriched class index
     * @param perContextVocabularies Context id to activated MIDDLEs
     */
    public static VocabularyIndex build(ClassIndex classes, Map<String, ? extends Collection<String>> perContextVocabularies) {
        Map<String, Set<Integer>> inverted = new HashMap<>();
        for (InstructionClass cls : classes.all()) {
            for (String middle : cls.middles()) {
                inverted.computeIfAbsent(middle, k -> new TreeSet<>()).add(cls.id());
            }
        }
        Map<String, Set<Integer>> frozen = new HashMap<>();
        inverted.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return new VocabularyIndex(frozen, computeSpread(perContextVocabularies));
    }

    /**
     * Count, for every item, the distinct contexts whose vocabulary contains it.
     * Pure; duplicate entries inside one context count once.
     */
    public static Map<String, Integer> computeSpread(Map<String, ? extends Collection<String>> perContextVocabularies) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Collection<String> vocabulary : perContextVocabularies.values()) {
            for (String item : new HashSet<>(vocabulary)) {
                counts.merge(item, 1, Integer::sum);
            }
        }
        return counts;
    }

    /** Classes declaring the item; empty for an unknown item */
    public Set<Integer> classesFor(String item) {
        if (item == null) {
            return Set.of();
        }
        return itemToClasses.getOrDefault(item, Set.of());
    }

    /** Distinct contexts containing the item; 0 for an unknown item */
    public int spread(String item) {
        if (item == null) {
            return 0;
        }
        return spread.getOrDefault(item, 0);
    }

    public ItemScope scope(String item) {
        return ItemScope.ofSpread(spread(item));
    }

    public boolean isUniversal(String item) {
        return scope(item) == ItemScope.UNIVERSAL;
    }

    /** Full description of an item; unknown items describe as RESTRICTED with spread 0 */
    public VocabularyItem describe(String item) {
        int s = spread(item);
        return new VocabularyItem(item, classesFor(item), s, ItemScope.ofSpread(s));
    }

    /** Every item known from class vocabularies or context vocabularies */
    public Set<String> items() {
        return items;
    }

    /** Items declared by at least one class */
    public Set<String> classVocabulary() {
        return itemToClasses.keySet();
    }

    public Set<String> universalItems() {
        return items.stream()
            .filter(this::isUniversal)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<String> restrictedItems() {
        return items.stream()
            .filter(i -> !isUniversal(i))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /** The RESTRICTED part of an arbitrary item set; null entries are skipped */
    public Set<String> restrictedSubset(Collection<String> candidates) {
        if (candidates == null) {
            return new TreeSet<>();
        }
        return candidates.stream()
            .filter(Objects::nonNull)
            .filter(i -> !isUniversal(i))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public Map<String, Integer> spreadMap() {
        return spread;
    }
}
