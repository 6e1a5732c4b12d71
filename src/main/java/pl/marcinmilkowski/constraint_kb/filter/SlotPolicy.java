package pl.marcinmilkowski.constraint_kb.filter;

import java.util.Set;

/**
 * How an affix slot of a token is checked against the context's activation set for that slot.
 */
public enum SlotPolicy {

    /** An empty activation set leaves the slot unconstrained */
    UNCONSTRAINED_WHEN_EMPTY {
        @Override
        public boolean admits(String affix, Set<String> activated) {
            return affix == null || affix.isEmpty() || activated.isEmpty() || activated.contains(affix);
        }
    },

    /**
     * Affixed tokens need their affix activated; with an empty activation set
     * only tokens without that affix pass.
     */
    STRICT {
        @Override
        public boolean admits(String affix, Set<String> activated) {
            return affix == null || affix.isEmpty() || activated.contains(affix);
        }
    };

    public abstract boolean admits(String affix, Set<String> activated);
}
