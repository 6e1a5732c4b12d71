package pl.marcinmilkowski.constraint_kb.ingest;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.constraint_kb.config.SourceManifest;
import pl.marcinmilkowski.constraint_kb.model.Context;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.FolioMetrics;
import pl.marcinmilkowski.constraint_kb.model.ForbiddenTransition;
import pl.marcinmilkowski.constraint_kb.model.Regime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes the upstream JSON sources into a {@link SourceBundle}.
 *
 * Required sources must be present and well-formed; the first problem aborts
 * ingestion with a {@link SourceFormatException}. An absent optional source
 * only produces a warning diagnostic and leaves its part of the bundle empty.
 * A present optional source is decoded as strictly as a required one.
 */
public class SourceIngestor {
    private static final Logger logger = LoggerFactory.getLogger(SourceIngestor.class);

    private final SourceManifest manifest;

    public SourceIngestor(SourceManifest manifest) {
        this.manifest = manifest;
    }

    /**
     * Read every source named by the manifest.
     *
     * @param diagnostics Receives warnings about absent optional sources
     * @return The decoded records
     * @throws SourceFormatException if a required source is missing or any source is malformed
     */
    public SourceBundle ingest(List<Diagnostic> diagnostics) throws SourceFormatException {
        SourceBundle.Builder builder = SourceBundle.builder();

        for (SourceKind kind : SourceKind.values()) {
            Optional<JSONObject> root = read(kind, diagnostics);
            if (root.isEmpty()) {
                continue;
            }
            decode(kind, root.get(), builder);
            builder.markLoaded(kind);
        }

        SourceBundle bundle = builder.build();
        logger.info("Ingested {} of {} sources: {} classes, {} contexts, {} forbidden class pairs",
            bundle.loaded().size(), SourceKind.values().length, bundle.classDefinitions().size(),
            bundle.contexts().size(), bundle.classTransitions().size());
        return bundle;
    }

    /**
     * Decode a single source document into the builder.
     */
    public static void decode(SourceKind kind, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        JsonFields fields = new JsonFields(kind.key());
        switch (kind) {
            case CLASS_DEFINITIONS -> decodeClassDefinitions(fields, root, builder);
            case MIDDLE_CLASS_INDEX -> decodeMiddleClassIndex(fields, root, builder);
            case FORBIDDEN_TRANSITIONS -> decodeForbiddenTransitions(fields, root, builder);
            case CONTEXT_METADATA -> decodeContexts(fields, root, builder);
            case ZONE_LEGALITY -> decodeZoneLegality(fields, root, builder);
            case CLASS_FOOTPRINTS -> decodeFootprints(fields, root, builder);
            case CONTEXT_VOCABULARY -> decodeContextVocabulary(fields, root, builder);
            case REGIME_ASSIGNMENT -> decodeRegimes(fields, root, builder);
            case FOLIO_METRICS -> decodeFolioMetrics(fields, root, builder);
        }
    }

    private Optional<JSONObject> read(SourceKind kind, List<Diagnostic> diagnostics) throws SourceFormatException {
        Path path = manifest.pathFor(kind);
        if (!Files.exists(path)) {
            if (kind.isRequired()) {
                throw new SourceFormatException(kind.key(), "", "required source not found: " + path);
            }
            Diagnostic warning = Diagnostic.warning(kind.key(),
                "optional source not found: " + path + "; dependent structures stay empty");
            diagnostics.add(warning);
            logger.warn("{}", warning);
            return Optional.empty();
        }

        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new SourceFormatException(kind.key(), "", "cannot read " + path, e);
        }

        try {
            JSONObject root = JSON.parseObject(content);
            if (root == null) {
                throw new SourceFormatException(kind.key(), "", "empty document: " + path);
            }
            return Optional.of(root);
        } catch (JSONException e) {
            throw new SourceFormatException(kind.key(), "", "malformed JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    private static void decodeClassDefinitions(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        Object classesValue = f.first(root, "classes", "equivalence_classes");
        if (classesValue == null) {
            throw f.error("classes", "missing 'classes' array");
        }
        JSONArray classes = f.array(classesValue, "classes");
        for (int i = 0; i < classes.size(); i++) {
            String location = "classes[" + i + "]";
            JSONObject entry = f.object(classes.get(i), location);
            int id = f.requireInt(entry, location, "class_id", "id");
            List<String> members = f.stringList(entry, location, "members");
            String role = f.stringOr(entry, "UNKNOWN", "functional_role", "role");
            builder.addClass(id, members, role);
        }
    }

    private static void decodeMiddleClassIndex(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        JSONObject middleToClasses = f.objectOrEmpty(root, "", "middle_to_classes");
        for (String middle : middleToClasses.keySet()) {
            builder.mapMiddle(middle, f.intSet(middleToClasses.get(middle), "middle_to_classes." + middle));
        }

        JSONObject morphology = f.objectOrEmpty(root, "", "class_morphology");
        for (String key : morphology.keySet()) {
            String location = "class_morphology." + key;
            int classId = f.parseIntKey(key, location);
            JSONObject entry = f.object(morphology.get(key), location);
            builder.classMorphology(classId,
                f.stringSet(entry, location, "middles"),
                f.stringSet(entry, location, "prefixes"));
        }

        JSONObject profiles = f.objectOrEmpty(root, "", "hazard_class_profiles");
        for (String key : profiles.keySet()) {
            String location = "hazard_class_profiles." + key;
            int classId = f.parseIntKey(key, location);
            JSONObject profile = f.object(profiles.get(key), location);
            int exclusive = f.intOr(profile, location, 0, "exclusive_middles", "exclusive_count");
            int shared = f.intOr(profile, location, 0, "shared_middles", "shared_count");
            if (exclusive < 0 || shared < 0) {
                throw f.error(location, "hazard profile counters must be non-negative");
            }
            builder.hazardProfile(classId, exclusive, shared);
        }
    }

    private static void decodeForbiddenTransitions(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        JSONObject pairs = f.objectOrEmpty(root, "", "class_transitions");
        for (String pairKey : pairs.keySet()) {
            String location = "class_transitions." + pairKey;
            JSONObject pair = f.object(pairs.get(pairKey), location);
            int fromClass = f.requireInt(pair, location, "from_class");
            int toClass = f.requireInt(pair, location, "to_class");

            List<ForbiddenTransition> tokens = new ArrayList<>();
            Object tokenValue = f.first(pair, "token_transitions");
            if (tokenValue != null) {
                JSONArray tokenArray = f.array(tokenValue, location + ".token_transitions");
                for (int i = 0; i < tokenArray.size(); i++) {
                    String tokenLocation = location + ".token_transitions[" + i + "]";
                    JSONObject t = f.object(tokenArray.get(i), tokenLocation);
                    double severity = f.doubleOr(t, tokenLocation, 0.0, "severity");
                    if (severity < 0.0 || severity > 1.0) {
                        throw f.error(tokenLocation, "severity out of range [0,1]: " + severity);
                    }
                    tokens.add(new ForbiddenTransition(fromClass, toClass,
                        f.stringOr(t, "", "from_token"),
                        f.stringOr(t, "", "to_token"),
                        f.stringOr(t, "", "hazard_class", "hazard_label"),
                        severity));
                }
            }
            builder.classTransitions(fromClass, toClass, tokens);
        }
    }

    private static void decodeContexts(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        JSONObject folios = f.objectOrEmpty(root, "", "folios", "contexts");
        for (String id : folios.keySet()) {
            String location = "folios." + id;
            JSONObject entry = f.object(folios.get(id), location);
            JSONObject placement = f.objectOrEmpty(entry, location, "placement_vector");
            builder.addContext(Context.fromPlacement(
                id,
                f.stringOr(entry, Context.UNKNOWN_SECTION, "section"),
                f.intOr(entry, location, 0, "token_count"),
                f.intOr(entry, location, 0, "unique_types", "unique_type_count"),
                f.numberMap(placement, location + ".placement_vector")));
        }
    }

    private static void decodeZoneLegality(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        for (String middle : root.keySet()) {
            Object value = root.get(middle);
            String location = middle;
            Set<String> zones;
            if (value instanceof JSONArray) {
                zones = Set.copyOf(f.stringList(value, location));
            } else {
                zones = f.stringSet(f.object(value, location), location, "legal_zones");
            }
            builder.zoneLegality(middle, zones);
        }
    }

    private static void decodeFootprints(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        for (String contextId : root.keySet()) {
            builder.classFootprint(contextId, f.intSet(root.get(contextId), contextId));
        }
    }

    private static void decodeContextVocabulary(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        for (String contextId : root.keySet()) {
            Object value = root.get(contextId);
            ContextActivation activation;
            if (value instanceof JSONArray) {
                activation = ContextActivation.ofMiddles(Set.copyOf(f.stringList(value, contextId)));
            } else {
                JSONObject entry = f.object(value, contextId);
                activation = new ContextActivation(
                    f.stringSet(entry, contextId, "middles"),
                    f.stringSet(entry, contextId, "prefixes"),
                    f.stringSet(entry, contextId, "suffixes"));
            }
            builder.contextVocabulary(contextId, activation);
        }
    }

    private static void decodeRegimes(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        // Inverted: {"REGIME_1": [contexts...]} -> {context: REGIME_1}
        Map<String, Regime> assigned = new HashMap<>();
        for (String label : root.keySet()) {
            Regime regime = Regime.parse(label)
                .orElseThrow(() -> f.error(label, "unknown regime label"));
            List<String> contextIds = f.stringList(root.get(label), label);
            for (String contextId : contextIds) {
                Regime previous = assigned.putIfAbsent(contextId, regime);
                if (previous != null && previous != regime) {
                    throw f.error(label, "context " + contextId + " already assigned to " + previous);
                }
                builder.regime(contextId, regime);
            }
        }
    }

    private static void decodeFolioMetrics(JsonFields f, JSONObject root, SourceBundle.Builder builder)
            throws SourceFormatException {
        JSONObject profiles = f.objectOrEmpty(root, "", "profiles");
        for (String contextId : profiles.keySet()) {
            String location = "profiles." + contextId;
            JSONObject profile = f.object(profiles.get(contextId), location);
            Object metricsValue = f.first(profile, "b_metrics");
            if (metricsValue == null) {
                // Only procedural contexts carry metrics
                continue;
            }
            String metricsLocation = location + ".b_metrics";
            JSONObject metrics = f.object(metricsValue, metricsLocation);
            double linkDensity = f.doubleOr(metrics, metricsLocation, 0.0, "link_density");
            int recoveryOps = f.intOr(metrics, metricsLocation, 0, "recovery_ops_count");
            try {
                builder.folioMetrics(contextId, new FolioMetrics(linkDensity, recoveryOps));
            } catch (IllegalArgumentException e) {
                throw new SourceFormatException(f.source(), metricsLocation, e.getMessage(), e);
            }
        }
    }
}
