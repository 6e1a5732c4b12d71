package pl.marcinmilkowski.constraint_kb.filter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tokens and classes that stay reachable under one activation.
 *
 * @param legalTokens Legal tokens, all from the global vocabulary
 * @param legalClasses Classes of legal tokens plus every protected class
 * @param prunedClasses Declared classes not in {@code legalClasses}
 */
public record FilterResult(Set<String> legalTokens, Set<Integer> legalClasses, Set<Integer> prunedClasses) {

    public FilterResult {
        legalTokens = Collections.unmodifiableSet(new TreeSet<>(legalTokens));
        legalClasses = Collections.unmodifiableSet(new TreeSet<>(legalClasses));
        prunedClasses = Collections.unmodifiableSet(new TreeSet<>(prunedClasses));
    }

    public boolean isLegal(String token) {
        return legalTokens.contains(token);
    }

    public boolean isReachable(int classId) {
        return legalClasses.contains(classId);
    }

    @Override
    public String toString() {
        return String.format("FilterResult[%d tokens, %d classes, %d pruned]",
            legalTokens.size(), legalClasses.size(), prunedClasses.size());
    }
}
