package pl.marcinmilkowski.constraint_kb.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.index.TokenInventory;
import pl.marcinmilkowski.constraint_kb.index.VocabularyIndex;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.morphology.TokenMorphology;
import pl.marcinmilkowski.constraint_kb.store.ConstraintStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes which tokens and classes stay reachable under a context's
 * activated vocabulary.
 *
 * <p>A token is legal when its MIDDLE is activated and each of its affixes
 * passes the {@link SlotPolicy}. Legal classes are the classes of legal tokens
 * plus every protected class, unconditionally. Forbidden transitions play no
 * part in legality.</p>
 *
 * <p>Pairwise compatibility between contexts only counts RESTRICTED items;
 * sharing UNIVERSAL items never makes two contexts compatible.</p>
 *
 * <p>Results for contexts with a stored activation are memoized by context
 * id; every other id shares one protected-only result. Null tokens, items and
 * ids are skipped, so no query method throws on them. Instances are
 * thread-safe.</p>
 */
public class CompatibilityFilter {
    private static final Logger logger = LoggerFactory.getLogger(CompatibilityFilter.class);

    private final ConstraintStore store;
    private final SlotPolicy slotPolicy;
    private final Map<String, FilterResult> memo = new ConcurrentHashMap<>();
    private final FilterResult protectedOnly;

    public CompatibilityFilter(ConstraintStore store) {
        this(store, SlotPolicy.UNCONSTRAINED_WHEN_EMPTY);
    }

    public CompatibilityFilter(ConstraintStore store, SlotPolicy slotPolicy) {
        this.store = store;
        this.slotPolicy = slotPolicy;
        this.protectedOnly = filter(ContextActivation.EMPTY, Set.of());
    }

    public SlotPolicy getSlotPolicy() {
        return slotPolicy;
    }

    public ConstraintStore getStore() {
        return store;
    }

    /**
     * Filter the whole global vocabulary.
     */
    public FilterResult filter(ContextActivation activation) {
        return filter(activation, store.tokens().tokens());
    }

    /**
     * Filter the given candidate tokens. Candidates outside the global
     * vocabulary and null candidates are dropped; never throws. Legal tokens
     * are reported in their normalised form.
     */
    public FilterResult filter(ContextActivation activation, Collection<String> candidates) {
        ContextActivation act = activation == null ? ContextActivation.EMPTY : activation;
        TokenInventory inventory = store.tokens();

        Set<String> legalTokens = new TreeSet<>();
        Set<Integer> legalClasses = new TreeSet<>(store.protectedClasses().asSet());

        if (candidates != null) {
            for (String token : candidates) {
                if (token == null) {
                    continue;
                }
                Optional<TokenInventory.Entry> entry = inventory.get(token);
                if (entry.isPresent() && isLegal(entry.get().morphology(), act)) {
                    legalTokens.add(entry.get().token());
                    legalClasses.add(entry.get().classId());
                }
            }
        }

        Set<Integer> pruned = new TreeSet<>(store.classes().classIds());
        pruned.removeAll(legalClasses);
        return new FilterResult(legalTokens, legalClasses, pruned);
    }

    /**
     * Filter under the stored activation of a context. Contexts without an
     * activation, null included, get the protected-only result and are not
     * memoized.
     */
    public FilterResult filterContext(String contextId) {
        if (contextId == null || !store.activatedContextIds().contains(contextId)) {
            return protectedOnly;
        }
        return memo.computeIfAbsent(contextId, id -> {
            FilterResult result = filter(store.activation(id));
            logger.debug("Filtered context {}: {}", id, result);
            return result;
        });
    }

    /**
     * Legality of one segmented token. Depends only on its prefix, MIDDLE and
     * suffix and the three activation sets.
     */
    public boolean isLegal(TokenMorphology morphology, ContextActivation activation) {
        if (morphology == null || activation == null) {
            return false;
        }
        if (!morphology.hasMiddle() || !activation.middles().contains(morphology.middle())) {
            return false;
        }
        return slotPolicy.admits(morphology.prefix(), activation.prefixes())
            && slotPolicy.admits(morphology.suffix(), activation.suffixes());
    }

    /**
     * Two stored contexts are compatible when their activations share at
     * least one RESTRICTED item.
     */
    public boolean compatible(String contextA, String contextB) {
        return compatible(store.activation(contextA), store.activation(contextB));
    }

    public boolean compatible(ContextActivation a, ContextActivation b) {
        if (a == null || b == null) {
            return false;
        }
        VocabularyIndex vocabulary = store.vocabulary();
        Set<String> shared = vocabulary.restrictedSubset(a.middles());
        shared.retainAll(b.middles());
        return !shared.isEmpty();
    }

    /**
     * Stored contexts that could host the given active items: every attested
     * RESTRICTED active item must be in the context's vocabulary. With no such
     * item, every context qualifies.
     */
    public Set<String> compatibleContexts(Collection<String> activeItems) {
        Set<String> binding = bindingItems(activeItems);
        Set<String> out = new TreeSet<>();
        for (String contextId : store.activatedContextIds()) {
            if (store.activation(contextId).middles().containsAll(binding)) {
                out.add(contextId);
            }
        }
        return out;
    }

    /**
     * Zone survival of the RESTRICTED items among the given active items.
     */
    public ZoneLegalityProfile zoneLegality(Collection<String> activeItems) {
        Set<String> binding = store.vocabulary().restrictedSubset(activeItems);
        Map<String, Boolean> survival = new LinkedHashMap<>();
        for (String zone : ConstraintPolicy.LEGALITY_ZONES) {
            survival.put(zone, true);
        }
        for (String item : binding) {
            if (!store.hasZoneLegality(item)) {
                continue;
            }
            Set<String> legal = store.legalZones(item);
            for (String zone : ConstraintPolicy.LEGALITY_ZONES) {
                if (!legal.contains(zone)) {
                    survival.put(zone, false);
                }
            }
        }
        return new ZoneLegalityProfile(binding, survival);
    }

    // RESTRICTED items seen in at least one context
    private Set<String> bindingItems(Collection<String> activeItems) {
        VocabularyIndex vocabulary = store.vocabulary();
        Set<String> binding = new TreeSet<>();
        if (activeItems == null) {
            return binding;
        }
        for (String item : activeItems) {
            if (item != null && vocabulary.spread(item) > 0 && !vocabulary.isUniversal(item)) {
                binding.add(item);
            }
        }
        return binding;
    }

    /** Number of memoized context results */
    int cachedContextCount() {
        return memo.size();
    }

    /** Drop memoized results */
    public void clearCache() {
        memo.clear();
    }
}
