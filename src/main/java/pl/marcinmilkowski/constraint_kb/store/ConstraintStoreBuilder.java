package pl.marcinmilkowski.constraint_kb.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.config.InfrastructureClasses;
import pl.marcinmilkowski.constraint_kb.config.SourceManifest;
import pl.marcinmilkowski.constraint_kb.index.ClassIndex;
import pl.marcinmilkowski.constraint_kb.index.ForbiddenTransitionGraph;
import pl.marcinmilkowski.constraint_kb.index.HazardClassifier;
import pl.marcinmilkowski.constraint_kb.index.ProtectedClassSet;
import pl.marcinmilkowski.constraint_kb.index.TokenInventory;
import pl.marcinmilkowski.constraint_kb.index.VocabularyEnrichment;
import pl.marcinmilkowski.constraint_kb.index.VocabularyIndex;
import pl.marcinmilkowski.constraint_kb.ingest.Diagnostic;
import pl.marcinmilkowski.constraint_kb.ingest.SourceBundle;
import pl.marcinmilkowski.constraint_kb.ingest.SourceFormatException;
import pl.marcinmilkowski.constraint_kb.ingest.SourceIngestor;
import pl.marcinmilkowski.constraint_kb.ingest.SourceKind;
import pl.marcinmilkowski.constraint_kb.model.Context;
import pl.marcinmilkowski.constraint_kb.model.ContextActivation;
import pl.marcinmilkowski.constraint_kb.model.HazardType;
import pl.marcinmilkowski.constraint_kb.morphology.Morphology;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ConstraintStore} from its sources.
 *
 * <p>Build order: register classes, run the vocabulary enrichment passes,
 * classify hazards, index vocabulary and spread, derive the protected set,
 * register forbidden transitions and segment the token inventory.</p>
 *
 * <p>Each call to {@code build} yields an independent store; nothing is cached
 * between calls.</p>
 */
public class ConstraintStoreBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ConstraintStoreBuilder.class);

    private InfrastructureClasses infrastructure = InfrastructureClasses.CURRENT;
    private Morphology morphology = new Morphology();

    public ConstraintStoreBuilder withInfrastructure(InfrastructureClasses infrastructure) {
        this.infrastructure = infrastructure;
        return this;
    }

    public ConstraintStoreBuilder withMorphology(Morphology morphology) {
        this.morphology = morphology;
        return this;
    }

    /**
     * Ingest the sources named by the manifest and build the store.
     *
     * @throws SourceFormatException if a required source is missing or any source is malformed
     * @throws pl.marcinmilkowski.constraint_kb.index.InvariantViolationException if the sources are inconsistent
     */
    public BuildResult build(SourceManifest manifest) throws SourceFormatException {
        logger.info("Building constraint store from {}", manifest.getDataRoot());
        List<Diagnostic> diagnostics = new ArrayList<>();
        SourceBundle bundle = new SourceIngestor(manifest).ingest(diagnostics);
        return assemble(bundle, diagnostics);
    }

    /**
     * Build the store from already decoded sources.
     *
     * @throws pl.marcinmilkowski.constraint_kb.index.InvariantViolationException if the sources are inconsistent
     */
    public BuildResult build(SourceBundle bundle) {
        return assemble(bundle, new ArrayList<>());
    }

    private BuildResult assemble(SourceBundle bundle, List<Diagnostic> diagnostics) {
        long start = System.currentTimeMillis();

        ClassIndex.Builder classBuilder = ClassIndex.builder();
        for (SourceBundle.ClassDefinition def : bundle.classDefinitions()) {
            classBuilder.registerClass(def.id(), def.members(), def.role());
        }
        int declared = classBuilder.registeredIds().size();
        if (declared != ConstraintPolicy.CLASS_COUNT) {
            diagnostics.add(Diagnostic.warning(SourceKind.CLASS_DEFINITIONS.key(),
                "expected " + ConstraintPolicy.CLASS_COUNT + " classes, found " + declared));
        }

        VocabularyEnrichment.applyAll(bundle, classBuilder, diagnostics);
        Map<Integer, HazardType> hazardTypes =
            HazardClassifier.classify(bundle.hazardProfiles(), classBuilder.registeredIds());
        classBuilder.applyHazardTypes(hazardTypes);
        ClassIndex classes = classBuilder.build();

        Map<String, Set<String>> perContextMiddles = new LinkedHashMap<>();
        for (Map.Entry<String, ContextActivation> e : bundle.contextVocabulary().entrySet()) {
            perContextMiddles.put(e.getKey(), e.getValue().middles());
        }
        VocabularyIndex vocabulary = VocabularyIndex.build(classes, perContextMiddles);

        ProtectedClassSet protectedClasses = ProtectedClassSet.derive(classes, infrastructure);
        ForbiddenTransitionGraph forbidden =
            ForbiddenTransitionGraph.build(bundle.classTransitions(), classes.classIds(), diagnostics);
        TokenInventory tokens = TokenInventory.build(classes, morphology);

        Map<String, Context> contexts = new LinkedHashMap<>();
        for (Context context : bundle.contexts()) {
            if (contexts.putIfAbsent(context.id(), context) != null) {
                diagnostics.add(Diagnostic.warning(SourceKind.CONTEXT_METADATA.key(),
                    "duplicate context " + context.id() + "; first entry kept"));
            }
        }
        checkFootprints(bundle, classes, diagnostics);

        ConstraintStore store = new ConstraintStore(classes, vocabulary, protectedClasses, forbidden, tokens,
            morphology, contexts, bundle.contextVocabulary(), bundle.regimeAssignments(), bundle.folioMetrics(),
            bundle.zoneLegality(), bundle.classFootprints());

        for (Diagnostic d : diagnostics) {
            if (d.isWarning()) {
                logger.warn("{}", d);
            } else {
                logger.debug("{}", d);
            }
        }
        logger.info("Built {} in {} ms ({} diagnostics)", store, System.currentTimeMillis() - start,
            diagnostics.size());
        return new BuildResult(store, diagnostics);
    }

    private static void checkFootprints(SourceBundle bundle, ClassIndex classes, List<Diagnostic> diagnostics) {
        for (Map.Entry<String, Set<Integer>> e : bundle.classFootprints().entrySet()) {
            for (int classId : e.getValue()) {
                if (!classes.contains(classId)) {
                    diagnostics.add(Diagnostic.warning(SourceKind.CLASS_FOOTPRINTS.key(),
                        "footprint of " + e.getKey() + " references undeclared class " + classId));
                }
            }
        }
    }
}
