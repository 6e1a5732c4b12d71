package pl.marcinmilkowski.constraint_kb.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A consumer corpus of short text fragments (lines), used to measure how
 * many fragments keep at least one legal token.
 *
 * <p>File format: one fragment per line, either {@code id<TAB>text} or bare
 * text. Blank lines and lines starting with {@code #} are skipped.</p>
 */
public final class FragmentCorpus {
    private static final Logger logger = LoggerFactory.getLogger(FragmentCorpus.class);

    private final List<Fragment> fragments;

    private FragmentCorpus(List<Fragment> fragments) {
        this.fragments = List.copyOf(fragments);
    }

    public static FragmentCorpus empty() {
        return new FragmentCorpus(List.of());
    }

    public static FragmentCorpus load(Path path) throws IOException {
        FragmentAnalyzer analyzer = new FragmentAnalyzer();
        List<Fragment> fragments = new ArrayList<>();
        try (analyzer; BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                int tab = line.indexOf('\t');
                String id = tab >= 0 ? line.substring(0, tab).trim() : "line" + lineNumber;
                String text = tab >= 0 ? line.substring(tab + 1) : line;
                fragments.add(new Fragment(id, analyzer.tokenize(text)));
            }
        }
        logger.info("Loaded {} fragments from {}", fragments.size(), path);
        return new FragmentCorpus(fragments);
    }

    /**
     * Corpus from in-memory texts keyed by fragment id.
     */
    public static FragmentCorpus of(Map<String, String> texts) {
        List<Fragment> fragments = new ArrayList<>();
        try (FragmentAnalyzer analyzer = new FragmentAnalyzer()) {
            for (Map.Entry<String, String> e : texts.entrySet()) {
                fragments.add(new Fragment(e.getKey(), analyzer.tokenize(e.getValue())));
            }
        }
        return new FragmentCorpus(fragments);
    }

    public List<Fragment> fragments() {
        return fragments;
    }

    public int size() {
        return fragments.size();
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * Fraction of fragments with no legal token. An empty corpus counts as fully empty (1.0).
     */
    public double emptyFragmentRate(Set<String> legalTokens) {
        if (fragments.isEmpty()) {
            return 1.0;
        }
        long empty = fragments.stream().filter(f -> !f.containsAny(legalTokens)).count();
        return (double) empty / fragments.size();
    }

    /**
     * One line of the corpus.
     */
    public record Fragment(String id, List<String> tokens) {
        public Fragment {
            tokens = List.copyOf(tokens);
        }

        public boolean containsAny(Collection<String> candidates) {
            for (String token : tokens) {
                if (candidates.contains(token)) {
                    return true;
                }
            }
            return false;
        }
    }
}
