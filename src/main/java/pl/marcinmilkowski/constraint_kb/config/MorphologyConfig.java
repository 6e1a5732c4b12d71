package pl.marcinmilkowski.constraint_kb.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Affix inventories for token segmentation.
 *
 * Lists are kept longest-first so segmentation can use first match.
 */
public record MorphologyConfig(
    List<String> prefixes,
    List<String> suffixes,
    List<String> articulators
) {

    private static final List<String> CORE_PREFIXES = List.of(
        "ch", "sh", "qo", "da", "ok", "ot", "ol", "ct");

    private static final List<String> EXTENDED_PREFIXES = List.of(
        "pch", "tch", "kch", "dch", "fch", "rch", "sch", "lch",
        "lk", "yk", "lsh",
        "ke", "te", "se", "de", "pe",
        "ko", "to", "so", "do", "po",
        "ka", "ta", "sa",
        "al", "ar", "or");

    private static final List<String> SUFFIXES = List.of(
        "aiin", "oiin", "eiin", "iin",
        "ain", "oin", "ein",
        "eey", "edy", "ey",
        "eeol", "eol", "ool",
        "ol", "or", "ar", "al", "er", "el",
        "in", "an", "on", "en",
        "am", "om", "em", "im",
        "dy", "hy", "ly", "ry",
        "y", "l", "r", "m", "n", "s", "g");

    private static final List<String> ARTICULATORS = List.of(
        "y", "k", "l", "p", "d", "f", "r", "s", "t");

    public MorphologyConfig {
        prefixes = longestFirst(prefixes);
        suffixes = longestFirst(suffixes);
        articulators = List.copyOf(articulators);
    }

    /**
     * Default affix inventory of the transcription's segmentation model.
     */
    public static MorphologyConfig defaults() {
        List<String> allPrefixes = new ArrayList<>(CORE_PREFIXES);
        allPrefixes.addAll(EXTENDED_PREFIXES);
        return new MorphologyConfig(allPrefixes, SUFFIXES, ARTICULATORS);
    }

    private static List<String> longestFirst(List<String> affixes) {
        List<String> sorted = new ArrayList<>(new LinkedHashSet<>(affixes));
        sorted.removeIf(a -> a == null || a.isEmpty());
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(sorted);
    }
}
