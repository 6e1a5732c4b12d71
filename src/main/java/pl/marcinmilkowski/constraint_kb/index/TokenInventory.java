package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.model.InstructionClass;
import pl.marcinmilkowski.constraint_kb.morphology.Morphology;
import pl.marcinmilkowski.constraint_kb.morphology.TokenMorphology;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The globally observed token vocabulary: every class member token that
 * segments to a non-empty MIDDLE, with its segmentation and owning class.
 *
 * <p>Tokens are keyed in the trimmed, lowercased form the segmenter and the
 * corpus analyzer produce; lookups normalise the same way.</p>
 */
public final class TokenInventory {

    private final Map<String, Entry> tokens;
    private final Set<String> middles;
    private final Set<String> prefixes;
    private final Set<String> suffixes;

    private TokenInventory(Map<String, Entry> tokens) {
        this.tokens = Collections.unmodifiableMap(tokens);
        Set<String> m = new TreeSet<>();
        Set<String> p = new TreeSet<>();
        Set<String> s = new TreeSet<>();
        for (Entry e : tokens.values()) {
            m.add(e.morphology().middle());
            if (e.morphology().hasPrefix()) p.add(e.morphology().prefix());
            if (e.morphology().hasSuffix()) s.add(e.morphology().suffix());
        }
        this.middles = Collections.unmodifiableSet(m);
        this.prefixes = Collections.unmodifiableSet(p);
        this.suffixes = Collections.unmodifiableSet(s);
    }

    public static TokenInventory build(ClassIndex classes, Morphology morphology) {
        Map<String, Entry> tokens = new TreeMap<>();
        for (InstructionClass cls : classes.all()) {
            for (String token : cls.members()) {
                TokenMorphology morph = morphology.extract(token);
                if (!morph.hasMiddle()) {
                    continue;
                }
                Entry previous = tokens.putIfAbsent(morph.token(), new Entry(morph.token(), morph, cls.id()));
                if (previous != null && previous.classId() != cls.id()) {
                    throw new InvariantViolationException("Token '" + morph.token()
                        + "' normalises into both class " + previous.classId() + " and class " + cls.id());
                }
            }
        }
        return new TokenInventory(tokens);
    }

    public boolean contains(String token) {
        return get(token).isPresent();
    }

    /** Entry of a token in any case; empty for null or unknown tokens */
    public Optional<Entry> get(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(normalise(token)));
    }

    static String normalise(String token) {
        return token.trim().toLowerCase(Locale.ROOT);
    }

    /** Tokens in lexical order */
    public Set<String> tokens() {
        return tokens.keySet();
    }

    public Iterable<Entry> entries() {
        return tokens.values();
    }

    public Set<String> middles() {
        return middles;
    }

    public Set<String> prefixes() {
        return prefixes;
    }

    public Set<String> suffixes() {
        return suffixes;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * A segmented token and the class that declares it.
     */
    public record Entry(String token, TokenMorphology morphology, int classId) {
    }
}
