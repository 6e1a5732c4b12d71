package pl.marcinmilkowski.constraint_kb.ingest;

import com.alibaba.fastjson2.JSON;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.constraint_kb.config.SourceManifest;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.Regime;
import pl.marcinmilkowski.constraint_kb.model.Zone;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SourceIngestor: decoding, defaults and the partial-availability policy.
 */
class SourceIngestorTest {

    private static final Path FIXTURES = Paths.get("src/test/resources/sources/manifest.json");

    @TempDir
    Path tempDir;

    /** Write the four required sources with minimal content */
    private SourceManifest writeRequired() throws IOException {
        Map<SourceKind, Path> paths = new EnumMap<>(SourceKind.class);
        paths.put(SourceKind.CLASS_DEFINITIONS, write("classes.json",
            "{\"equivalence_classes\": [{\"id\": 1, \"members\": [\"daiin\"], \"role\": \"CORE_CONTROL\"},"
                + " {\"id\": 2, \"members\": [\"ol\"]}]}"));
        paths.put(SourceKind.MIDDLE_CLASS_INDEX, write("mci.json",
            "{\"middle_to_classes\": {\"iin\": [1]}, \"hazard_class_profiles\": {\"1\": {}}}"));
        paths.put(SourceKind.FORBIDDEN_TRANSITIONS, write("ft.json", "{\"class_transitions\": {}}"));
        paths.put(SourceKind.CONTEXT_METADATA, write("ctx.json", "{\"folios\": {\"f1\": {}}}"));
        return SourceManifest.of(tempDir, paths);
    }

    private Path write(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    @Test
    @DisplayName("Fixture sources decode into typed records")
    void testIngestFixtures() throws IOException {
        List<Diagnostic> diagnostics = new ArrayList<>();
        SourceBundle bundle = new SourceIngestor(SourceManifest.load(FIXTURES)).ingest(diagnostics);

        assertTrue(diagnostics.isEmpty(), "unexpected diagnostics: " + diagnostics);
        assertEquals(SourceKind.values().length, bundle.loaded().size());
        assertEquals(5, bundle.classDefinitions().size());
        assertEquals("FLOW_OPERATOR", bundle.classDefinitions().get(2).role());
        assertEquals(Set.of(3, 2), bundle.middleToClasses().get("ke"));
        assertEquals(Set.of("ke", "k"), bundle.classMorphology().get(3).middles());
        assertEquals(2, bundle.hazardProfiles().size());
        assertEquals(1, bundle.classTransitions().size());
        assertEquals(0.7, bundle.classTransitions().get(0).tokenTransitions().get(0).severity(), 1e-9);
        assertEquals("PHASE_ORDERING", bundle.classTransitions().get(0).tokenTransitions().get(0).hazardLabel());
        assertEquals(Set.of("C", "P"), bundle.zoneLegality().get("ke"));
        assertEquals(Set.of("C", "P", "R", "S"), bundle.zoneLegality().get("al"));
        assertEquals(Regime.REGIME_4, bundle.regimeAssignments().get("b1"));
        assertEquals(2, bundle.folioMetrics().size(), "profiles without b_metrics are skipped");
        assertEquals(Set.of("ch", "qo"), bundle.contextVocabulary().get("f1").prefixes());
        assertEquals(ContextActivation.ofMiddles(Set.of("ke")), bundle.contextVocabulary().get("f5"));
    }

    @Test
    @DisplayName("Placement vector folds into six zones; missing fields take defaults")
    void testContextDefaults() throws IOException {
        SourceBundle bundle = new SourceIngestor(SourceManifest.load(FIXTURES)).ingest(new ArrayList<>());

        var f1 = bundle.contexts().stream().filter(c -> c.id().equals("f1")).findFirst().orElseThrow();
        assertEquals(0.6, f1.zoneOccupancy().get(Zone.C), 1e-9);
        assertEquals(0.1, f1.zoneOccupancy().get(Zone.S), 1e-9);
        assertEquals(0.0, f1.zoneOccupancy().get(Zone.R2), 1e-9);
        assertEquals(80, f1.uniqueTypeCount());

        var f4 = bundle.contexts().stream().filter(c -> c.id().equals("f4")).findFirst().orElseThrow();
        assertEquals("U", f4.section());
        assertEquals(6, f4.zoneOccupancy().size());
    }

    @Test
    @DisplayName("Alternate keys and defaults are accepted")
    void testAlternateKeys() throws IOException {
        SourceBundle bundle = new SourceIngestor(writeRequired()).ingest(new ArrayList<>());

        assertEquals(2, bundle.classDefinitions().size());
        assertEquals("CORE_CONTROL", bundle.classDefinitions().get(0).role());
        assertEquals("UNKNOWN", bundle.classDefinitions().get(1).role());
        assertEquals(0, bundle.hazardProfiles().get(0).exclusiveCount());
        assertEquals(0, bundle.contexts().get(0).tokenCount());
    }

    @Test
    @DisplayName("Absent optional sources warn and leave their structures empty")
    void testMissingOptionalSources() throws IOException {
        List<Diagnostic> diagnostics = new ArrayList<>();
        SourceBundle bundle = new SourceIngestor(writeRequired()).ingest(diagnostics);

        assertEquals(5, diagnostics.size());
        assertTrue(diagnostics.stream().allMatch(Diagnostic::isWarning));
        assertTrue(diagnostics.stream().anyMatch(d -> d.source().equals("zone_legality")));
        assertFalse(bundle.isLoaded(SourceKind.ZONE_LEGALITY));
        assertTrue(bundle.zoneLegality().isEmpty());
        assertTrue(bundle.contextVocabulary().isEmpty());
        assertTrue(bundle.regimeAssignments().isEmpty());
    }

    @Test
    @DisplayName("A missing required source aborts ingestion naming the source")
    void testMissingRequiredSource() throws IOException {
        SourceManifest manifest = writeRequired();
        Files.delete(manifest.pathFor(SourceKind.FORBIDDEN_TRANSITIONS));

        SourceFormatException e = assertThrows(SourceFormatException.class,
            () -> new SourceIngestor(manifest).ingest(new ArrayList<>()));
        assertEquals("forbidden_transitions", e.getSource());
    }

    @Test
    @DisplayName("Malformed JSON in a present optional source is fatal")
    void testMalformedOptionalSource() throws IOException {
        Map<SourceKind, Path> paths = new EnumMap<>(SourceKind.class);
        SourceManifest base = writeRequired();
        for (SourceKind kind : SourceKind.values()) {
            paths.put(kind, base.pathFor(kind));
        }
        paths.put(SourceKind.ZONE_LEGALITY, write("zones.json", "{\"ke\": [\"C\""));

        SourceFormatException e = assertThrows(SourceFormatException.class,
            () -> new SourceIngestor(SourceManifest.of(tempDir, paths)).ingest(new ArrayList<>()));
        assertEquals("zone_legality", e.getSource());
    }

    @Test
    @DisplayName("Wrongly shaped entries name their location")
    void testEntryLocation() {
        SourceFormatException e = assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(
            SourceKind.CLASS_DEFINITIONS,
            JSON.parseObject("{\"classes\": [{\"class_id\": 1}, {\"members\": []}]}"),
            SourceBundle.builder()));
        assertEquals("classes[1]", e.getLocation());
        assertTrue(e.getMessage().startsWith("class_definitions at classes[1]"));

        SourceFormatException severity = assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(
            SourceKind.FORBIDDEN_TRANSITIONS,
            JSON.parseObject("{\"class_transitions\": {\"4->7\": {\"from_class\": 4, \"to_class\": 7,"
                + " \"token_transitions\": [{\"from_token\": \"ab\", \"to_token\": \"cd\", \"severity\": 1.8}]}}}"),
            SourceBundle.builder()));
        assertEquals("class_transitions.4->7.token_transitions[0]", severity.getLocation());
    }

    @Test
    @DisplayName("Regime labels must be known and each context gets at most one regime")
    void testRegimes() throws SourceFormatException {
        SourceBundle.Builder builder = SourceBundle.builder();
        SourceIngestor.decode(SourceKind.REGIME_ASSIGNMENT,
            JSON.parseObject("{\"REGIME_2\": [\"b1\", \"b1\"], \"REGIME_3\": [\"b2\"]}"), builder);
        assertEquals(Map.of("b1", Regime.REGIME_2, "b2", Regime.REGIME_3), builder.build().regimeAssignments());

        assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(SourceKind.REGIME_ASSIGNMENT,
            JSON.parseObject("{\"REGIME_9\": [\"b1\"]}"), SourceBundle.builder()));
        assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(SourceKind.REGIME_ASSIGNMENT,
            JSON.parseObject("{\"REGIME_1\": [\"b1\"], \"REGIME_4\": [\"b1\"]}"), SourceBundle.builder()));
    }

    @Test
    @DisplayName("Out-of-range completeness metrics are a source error")
    void testInvalidMetrics() {
        SourceFormatException e = assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(
            SourceKind.FOLIO_METRICS,
            JSON.parseObject("{\"profiles\": {\"b1\": {\"b_metrics\": {\"link_density\": 1.5}}}}"),
            SourceBundle.builder()));
        assertEquals("profiles.b1.b_metrics", e.getLocation());
    }

    @Test
    @DisplayName("Integers beyond the int range are a source error, not wrapped")
    void testIntegerOverflow() {
        SourceFormatException counter = assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(
            SourceKind.MIDDLE_CLASS_INDEX,
            JSON.parseObject("{\"hazard_class_profiles\": {\"2\": {\"exclusive_middles\": 4294967296}}}"),
            SourceBundle.builder()));
        assertEquals("hazard_class_profiles.2.exclusive_middles", counter.getLocation());

        SourceFormatException id = assertThrows(SourceFormatException.class, () -> SourceIngestor.decode(
            SourceKind.CLASS_DEFINITIONS,
            JSON.parseObject("{\"classes\": [{\"class_id\": 4294967297, \"members\": [\"daiin\"]}]}"),
            SourceBundle.builder()));
        assertEquals("classes[0].class_id", id.getLocation());
    }
}
