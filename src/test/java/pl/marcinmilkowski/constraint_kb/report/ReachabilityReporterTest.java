package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.constraint_kb.config.InfrastructureClasses;
import pl.marcinmilkowski.constraint_kb.config.SourceManifest;
import pl.marcinmilkowski.constraint_kb.filter.CompatibilityFilter;
import pl.marcinmilkowski.constraint_kb.filter.ZoneLegalityProfile;
import pl.marcinmilkowski.constraint_kb.index.ForbiddenTransitionGraph.ClassPair;
import pl.marcinmilkowski.constraint_kb.model.FolioMetrics;
import pl.marcinmilkowski.constraint_kb.model.Regime;
import pl.marcinmilkowski.constraint_kb.store.ConstraintStore;
import pl.marcinmilkowski.constraint_kb.store.ConstraintStoreBuilder;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReachabilityReporter and the report records.
 */
class ReachabilityReporterTest {

    private static ConstraintStore store;
    private static FragmentCorpus corpus;

    @BeforeAll
    static void setUp() throws IOException {
        store = new ConstraintStoreBuilder()
            .withInfrastructure(InfrastructureClasses.of("fixture", 4))
            .build(SourceManifest.load(Paths.get("src/test/resources/sources/manifest.json")))
            .store();
        corpus = FragmentCorpus.load(Paths.get("src/test/resources/fragments.txt"));
    }

    @Test
    @DisplayName("Per-context ratios, coverage and empty-fragment rate")
    void testContextReachability() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        ContextReachability f1 = reporter.reachability("f1", corpus);

        assertEquals(3.0 / 8.0, f1.legalityRatio(), 1e-9);
        assertEquals(4.0 / 5.0, f1.roleCoverage(), 1e-9);
        assertEquals(0.5, f1.emptyFragmentRate(), 1e-9);
        assertEquals(3.0 / 8.0 * 0.8 * 0.5, f1.usability(), 1e-9);
    }

    @Test
    @DisplayName("Active forbidden pairs and footprint coverage are read after filtering")
    void testGraphAndFootprints() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));

        ContextReachability f1 = reporter.reachability("f1", corpus);
        assertEquals(Set.of(new ClassPair(3, 2)), f1.activeForbiddenPairs());
        assertEquals(Map.of("b1", 1.0, "b2", 0.5), f1.footprintCoverage());

        ContextReachability f4 = reporter.reachability("f4", corpus);
        assertTrue(f4.activeForbiddenPairs().isEmpty());
        assertEquals(2.0 / 3.0, f4.footprintCoverage().get("b1"), 1e-9);
    }

    @Test
    @DisplayName("Report aggregates means and pairwise Jaccard")
    void testReport() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        ReachabilityReport report = reporter.report(List.of("f1", "f4"), corpus);

        assertEquals(2, report.contexts().size());
        // f1 {chedy, ol, qokeedy} vs f4 {chedy, shedy}
        assertEquals(1.0 / 4.0, report.meanTokenJaccard(), 1e-9);
        // classes {1,2,3,4} vs {1,2,4}
        assertEquals(3.0 / 4.0, report.meanClassJaccard(), 1e-9);
        assertEquals(1, report.comparedPairs());
        assertEquals((3.0 / 8.0 + 2.0 / 8.0) / 2.0, report.meanLegalityRatio(), 1e-9);
        assertTrue(report.context("f4").isPresent());
        assertTrue(report.context("f9").isEmpty());
    }

    @Test
    @DisplayName("Pairs with an empty legal token set are skipped in Jaccard means")
    void testJaccardSkipsEmpty() {
        assertTrue(ReachabilityReporter.jaccard(Set.of(), Set.of("a")).isEmpty());
        assertEquals(1.0 / 3.0, ReachabilityReporter.jaccard(Set.of("a", "b"), Set.of("b", "c")).orElseThrow(), 1e-9);

        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        ReachabilityReport report = reporter.report(List.of("f1", "nowhere"), corpus);
        assertEquals(0, report.comparedPairs());
        assertEquals(0.0, report.meanTokenJaccard(), 1e-9);
    }

    @Test
    @DisplayName("Regime sufficiency is advisory and follows the metric thresholds")
    void testRegimeSufficiency() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        Map<String, RegimeSufficiency.Status> statuses = new TreeMap<>();
        for (RegimeSufficiency s : reporter.regimeSufficiency()) {
            statuses.put(s.contextId(), s.status());
        }

        assertEquals(Map.of(
            "b1", RegimeSufficiency.Status.SUFFICIENT,
            "b2", RegimeSufficiency.Status.INSUFFICIENT,
            "f1", RegimeSufficiency.Status.NO_REQUIREMENT), statuses);
        assertEquals(RegimeSufficiency.Status.UNKNOWN,
            RegimeSufficiency.evaluate("x", Regime.REGIME_4, null).status());
        assertEquals(RegimeSufficiency.Status.SUFFICIENT,
            RegimeSufficiency.evaluate("x", Regime.REGIME_3, new FolioMetrics(0.0, 2)).status());
    }

    @Test
    @DisplayName("toJson exports summary, contexts and regime verdicts")
    void testToJson() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        JSONObject json = reporter.report(corpus).toJson();

        JSONObject summary = json.getJSONObject("summary");
        assertEquals(5, summary.getIntValue("context_count"));
        assertEquals(5, json.getJSONArray("contexts").size());

        JSONObject f1 = json.getJSONArray("contexts").getJSONObject(0);
        assertEquals("f1", f1.getString("context"));
        assertEquals(3, f1.getIntValue("legal_token_count"));
        assertEquals(List.of("3->2"), f1.getJSONArray("active_forbidden_pairs").toJavaList(String.class));
        assertEquals("SUFFICIENT", json.getJSONObject("regime_sufficiency").getJSONObject("b1").getString("status"));
    }

    @Test
    @DisplayName("Bundle reachability: compatible contexts, per-zone grammar and hazard breakdown")
    void testBundleReachability() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        BundleReachability bundle = reporter.bundleReachability(List.of("ke"));

        assertEquals(Set.of("f1", "f5"), bundle.compatibleContexts());
        assertEquals(Set.of("edy", "ke", "ol"), bundle.effectiveItems());
        assertFalse(bundle.isBlocked());
        assertEquals(ZoneLegalityProfile.ExecutionMode.MID_COMMITMENT, bundle.zoneLegality().executionMode());

        GrammarState c = bundle.grammarByZone().get("C");
        assertEquals(Set.of(1, 2, 3, 4), c.reachableClasses());
        assertEquals(Set.of(5), c.prunedClasses());
        assertEquals(Set.of(1), c.atomicHazardsReachable());
        assertEquals(Set.of(3), c.decomposableHazardsReachable());
        assertTrue(c.decomposableHazardsPruned().isEmpty());
        assertEquals(0.8, c.reachabilityRatio(), 1e-9);
        assertSame(c, bundle.grammarState());

        // ke is not legal in R or S
        GrammarState r = bundle.grammarByZone().get("R");
        assertEquals(Set.of(1, 2, 4), r.reachableClasses());
        assertEquals(Set.of(3), r.decomposableHazardsPruned());
        assertEquals(r, bundle.grammarByZone().get("S"));
    }

    @Test
    @DisplayName("Consumer contexts are REACHABLE, CONDITIONAL or UNREACHABLE from their footprints")
    void testConsumerStatus() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        BundleReachability bundle = reporter.bundleReachability(List.of("ke"));

        ConsumerReachability b1 = bundle.consumer("b1").orElseThrow();
        assertEquals(ConsumerReachability.Status.CONDITIONAL, b1.status());
        assertEquals(List.of("C", "P"), b1.reachableZones());
        assertEquals(Set.of(1, 2, 3), b1.availableClasses());
        assertTrue(b1.missingClasses().isEmpty());
        assertEquals(1.0, b1.coverage(), 1e-9);
        assertEquals(RegimeSufficiency.Status.SUFFICIENT, b1.sufficiency().status());

        ConsumerReachability b2 = bundle.consumer("b2").orElseThrow();
        assertEquals(ConsumerReachability.Status.UNREACHABLE, b2.status());
        assertEquals(Set.of(4), b2.availableClasses());
        assertEquals(Set.of(5), b2.missingClasses());
        assertEquals(0.5, b2.coverage(), 1e-9);

        // Universal-only bundle: every context is compatible and al keeps class 5 in every zone
        BundleReachability universal = reporter.bundleReachability(List.of("edy"));
        assertEquals(store.activatedContextIds(), universal.compatibleContexts());
        assertEquals(ConsumerReachability.Status.REACHABLE, universal.consumer("b2").orElseThrow().status());
        assertEquals(List.of(universal.consumer("b2").orElseThrow()),
            universal.consumersWith(ConsumerReachability.Status.REACHABLE));
    }

    @Test
    @DisplayName("A bundle no context can host prunes every class, protected ones included")
    void testBlockedBundle() {
        ReachabilityReporter reporter = new ReachabilityReporter(new CompatibilityFilter(store));
        BundleReachability bundle = reporter.bundleReachability(Arrays.asList("ke", "al", null));

        assertTrue(bundle.isBlocked());
        assertEquals(Set.of("al", "ke"), bundle.activeItems());
        for (GrammarState state : bundle.grammarByZone().values()) {
            assertTrue(state.reachableClasses().isEmpty());
            assertEquals(Set.of(1, 2, 3, 4, 5), state.prunedClasses());
            assertEquals(Set.of(3), state.decomposableHazardsPruned());
        }
        assertEquals(2, bundle.consumersWith(ConsumerReachability.Status.UNREACHABLE).size());
        assertEquals(Set.of(4, 5), bundle.consumer("b2").orElseThrow().missingClasses());

        JSONObject json = bundle.toJson();
        assertEquals(0, json.getJSONObject("grammar").getJSONArray("reachable_classes").size());
        assertEquals(2, json.getJSONObject("consumer_status_counts").getIntValue("UNREACHABLE"));
        assertEquals(2, json.getJSONArray("consumers").size());
    }
}
