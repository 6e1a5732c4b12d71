package pl.marcinmilkowski.constraint_kb.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.filter.CompatibilityFilter;
import pl.marcinmilkowski.constraint_kb.filter.FilterResult;
import pl.marcinmilkowski.constraint_kb.index.ClassIndex;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.Regime;
import pl.marcinmilkowski.constraint_kb.store.ConstraintStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregates filter results into a {@link ReachabilityReport}.
 *
 * Reads filter results and the forbidden transition graph; writes nothing back.
 */
public class ReachabilityReporter {
    private static final Logger logger = LoggerFactory.getLogger(ReachabilityReporter.class);

    private final CompatibilityFilter filter;
    private final ConstraintStore store;

    public ReachabilityReporter(CompatibilityFilter filter) {
        this.filter = filter;
        this.store = filter.getStore();
    }

    /**
     * Report over every context with an activated vocabulary.
     */
    public ReachabilityReport report(FragmentCorpus consumerCorpus) {
        return report(store.activatedContextIds(), consumerCorpus);
    }

    public ReachabilityReport report(Collection<String> contextIds, FragmentCorpus consumerCorpus) {
        List<ContextReachability> rows = new ArrayList<>();
        for (String contextId : contextIds) {
            rows.add(reachability(contextId, consumerCorpus));
        }

        double tokenSum = 0.0;
        double classSum = 0.0;
        int tokenPairs = 0;
        int classPairs = 0;
        for (int i = 0; i < rows.size(); i++) {
            for (int j = i + 1; j < rows.size(); j++) {
                FilterResult a = rows.get(i).result();
                FilterResult b = rows.get(j).result();
                Optional<Double> tokens = jaccard(a.legalTokens(), b.legalTokens());
                if (tokens.isPresent()) {
                    tokenSum += tokens.get();
                    tokenPairs++;
                }
                Optional<Double> classes = jaccard(a.legalClasses(), b.legalClasses());
                if (classes.isPresent()) {
                    classSum += classes.get();
                    classPairs++;
                }
            }
        }

        ReachabilityReport report = new ReachabilityReport(rows,
            tokenPairs == 0 ? 0.0 : tokenSum / tokenPairs,
            classPairs == 0 ? 0.0 : classSum / classPairs,
            tokenPairs,
            regimeSufficiency());
        logger.info("Reachability over {} contexts: mean legality {}, mean token Jaccard {} ({} pairs)",
            rows.size(), String.format("%.4f", report.meanLegalityRatio()),
            String.format("%.4f", report.meanTokenJaccard()), tokenPairs);
        return report;
    }

    /**
     * Reachability of a single context against the consumer corpus.
     */
    public ContextReachability reachability(String contextId, FragmentCorpus consumerCorpus) {
        FilterResult result = filter.filterContext(contextId);
        ClassIndex classes = store.classes();

        int vocabularySize = store.tokens().size();
        double legality = vocabularySize == 0 ? 0.0 : (double) result.legalTokens().size() / vocabularySize;

        Set<String> roles = classes.roles();
        long covered = roles.stream()
            .filter(role -> classes.classesWithRole(role).stream().anyMatch(result::isReachable))
            .count();
        double roleCoverage = roles.isEmpty() ? 0.0 : (double) covered / roles.size();

        FragmentCorpus corpus = consumerCorpus == null ? FragmentCorpus.empty() : consumerCorpus;
        double emptyRate = corpus.emptyFragmentRate(result.legalTokens());

        Map<String, Double> footprintCoverage = new LinkedHashMap<>();
        for (String consumer : store.footprintContextIds()) {
            Set<Integer> footprint = store.footprint(consumer);
            if (footprint.isEmpty()) {
                continue;
            }
            long kept = footprint.stream().filter(result::isReachable).count();
            footprintCoverage.put(consumer, (double) kept / footprint.size());
        }

        return new ContextReachability(contextId, result, legality, roleCoverage, emptyRate,
            store.forbiddenTransitions().activePairs(result.legalClasses()), footprintCoverage);
    }

    /**
     * Reachability under a bundle of active items. The bundle activates the
     * stored contexts that hold all of its attested RESTRICTED items; those
     * contexts are alternatives, so per zone a class is reachable when the
     * filter keeps it under at least one of them, with each context's MIDDLEs
     * cut down to the ones legal in that zone. With no compatible context
     * every class is pruned, protected ones included.
     */
    public BundleReachability bundleReachability(Collection<String> activeItems) {
        Set<String> active = new TreeSet<>();
        if (activeItems != null) {
            activeItems.stream().filter(Objects::nonNull).forEach(active::add);
        }
        Set<String> compatible = filter.compatibleContexts(active);
        ClassIndex classes = store.classes();

        Set<String> effective = new TreeSet<>();
        for (String contextId : compatible) {
            effective.addAll(store.activation(contextId).middles());
        }

        Map<String, GrammarState> grammarByZone = new LinkedHashMap<>();
        for (String zone : ConstraintPolicy.LEGALITY_ZONES) {
            Set<Integer> reachable = new TreeSet<>();
            for (String contextId : compatible) {
                ContextActivation activation = store.activation(contextId);
                Set<String> zoneMiddles = activation.middles().stream()
                    .filter(item -> !store.hasZoneLegality(item) || store.legalZones(item).contains(zone))
                    .collect(Collectors.toSet());
                reachable.addAll(filter.filter(
                    new ContextActivation(zoneMiddles, activation.prefixes(), activation.suffixes())).legalClasses());
            }
            grammarByZone.put(zone, GrammarState.of(reachable, classes));
        }

        Map<String, ConsumerReachability> consumers = new TreeMap<>();
        for (String consumer : store.footprintContextIds()) {
            RegimeSufficiency sufficiency = store.regime(consumer)
                .map(regime -> RegimeSufficiency.evaluate(consumer, regime, store.metrics(consumer).orElse(null)))
                .orElse(null);
            consumers.put(consumer, ConsumerReachability.classify(consumer, store.footprint(consumer),
                grammarByZone, sufficiency));
        }

        BundleReachability result = new BundleReachability(active, compatible, effective,
            filter.zoneLegality(active), grammarByZone, consumers);
        if (result.isBlocked()) {
            logger.info("Bundle {} has no compatible context; all classes pruned", active);
        } else {
            logger.info("Bundle {}: {} compatible contexts, {}", active, compatible.size(), result.grammarState());
        }
        return result;
    }

    /**
     * Advisory sufficiency verdict for every context with a regime.
     */
    public List<RegimeSufficiency> regimeSufficiency() {
        List<RegimeSufficiency> out = new ArrayList<>();
        Set<String> ids = new TreeSet<>(store.contextIds());
        ids.addAll(store.regimeContextIds());
        for (String contextId : ids) {
            Optional<Regime> regime = store.regime(contextId);
            if (regime.isPresent()) {
                out.add(RegimeSufficiency.evaluate(contextId, regime.get(), store.metrics(contextId).orElse(null)));
            }
        }
        return out;
    }

    /**
     * Jaccard similarity, or empty when either set is empty.
     */
    static <T> Optional<Double> jaccard(Set<T> a, Set<T> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        Set<T> union = new HashSet<>(a);
        union.addAll(b);
        long intersection = a.stream().filter(b::contains).count();
        return Optional.of((double) intersection / union.size());
    }
}
