package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.ingest.Diagnostic;
import pl.marcinmilkowski.constraint_kb.ingest.SourceBundle;
import pl.marcinmilkowski.constraint_kb.ingest.SourceKind;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Passes that attach vocabulary to registered classes.
 *
 * Passes run in {@link #ORDER}. An OVERRIDING pass replaces what earlier
 * passes produced for the classes it covers, so reordering changes results.
 */
public enum VocabularyEnrichment {

    /** Coarse MIDDLE -> classes map, unioned into class vocabularies */
    COARSE_MIDDLE_MAP(MergeMode.ADDITIVE) {
        @Override
        void apply(SourceBundle sources, ClassIndex.Builder classes, List<Diagnostic> diagnostics) {
            Map<Integer, Set<String>> byClass = new TreeMap<>();
            for (Map.Entry<String, Set<Integer>> e : sources.middleToClasses().entrySet()) {
                for (Integer classId : e.getValue()) {
                    byClass.computeIfAbsent(classId, k -> new TreeSet<>()).add(e.getKey());
                }
            }
            for (Map.Entry<Integer, Set<String>> e : byClass.entrySet()) {
                if (!classes.addVocabulary(e.getKey(), e.getValue())) {
                    skipped(diagnostics, e.getKey());
                }
            }
        }
    },

    /** Authoritative per-class morphology; replaces vocabulary and prefixes */
    CLASS_MORPHOLOGY(MergeMode.OVERRIDING) {
        @Override
        void apply(SourceBundle sources, ClassIndex.Builder classes, List<Diagnostic> diagnostics) {
            for (Map.Entry<Integer, SourceBundle.ClassMorphology> e : new TreeMap<>(sources.classMorphology()).entrySet()) {
                SourceBundle.ClassMorphology morph = e.getValue();
                if (!classes.attachMorphology(e.getKey(), morph.middles(), morph.prefixes())) {
                    skipped(diagnostics, e.getKey());
                }
            }
        }
    };

    /** Application order */
    public static final List<VocabularyEnrichment> ORDER = List.of(COARSE_MIDDLE_MAP, CLASS_MORPHOLOGY);

    public enum MergeMode {
        /** Union with existing vocabulary */
        ADDITIVE,
        /** Replace existing vocabulary */
        OVERRIDING
    }

    private final MergeMode mode;

    VocabularyEnrichment(MergeMode mode) {
        this.mode = mode;
    }

    public MergeMode mode() {
        return mode;
    }

    abstract void apply(SourceBundle sources, ClassIndex.Builder classes, List<Diagnostic> diagnostics);

    /**
     * Run all passes in order.
     */
    public static void applyAll(SourceBundle sources, ClassIndex.Builder classes, List<Diagnostic> diagnostics) {
        for (VocabularyEnrichment pass : ORDER) {
            pass.apply(sources, classes, diagnostics);
        }
    }

    private static void skipped(List<Diagnostic> diagnostics, int classId) {
        diagnostics.add(Diagnostic.warning(SourceKind.MIDDLE_CLASS_INDEX.key(),
            "vocabulary for undeclared class " + classId + " ignored"));
    }
}
