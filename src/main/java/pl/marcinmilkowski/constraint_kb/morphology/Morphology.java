package pl.marcinmilkowski.constraint_kb.morphology;

import pl.marcinmilkowski.constraint_kb.config.MorphologyConfig;

import java.util.Locale;

/**
 * Longest-match affix segmentation.
 *
 * The MIDDLE is the primary discriminator, so when prefix and suffix would
 * consume the whole token an alternative parse with a non-empty MIDDLE is
 * preferred: prefix+MIDDLE, otherwise the bare token as MIDDLE.
 */
public class Morphology {

    private final MorphologyConfig config;

    public Morphology(MorphologyConfig config) {
        this.config = config;
    }

    public Morphology() {
        this(MorphologyConfig.defaults());
    }

    public MorphologyConfig getConfig() {
        return config;
    }

    /**
     * Segment a token. Never throws; an empty or null token yields an unparsed result.
     */
    public TokenMorphology extract(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return TokenMorphology.unparsed(rawToken);
        }
        String token = rawToken.trim().toLowerCase(Locale.ROOT);

        String articulator = null;
        String prefix = findPrefix(token);
        String remainder = prefix == null ? token : token.substring(prefix.length());

        if (prefix == null) {
            for (String art : config.articulators()) {
                if (token.startsWith(art) && token.length() > art.length()) {
                    String afterArticulator = token.substring(art.length());
                    String maybePrefix = findPrefix(afterArticulator);
                    if (maybePrefix != null) {
                        articulator = art;
                        prefix = maybePrefix;
                        remainder = afterArticulator.substring(maybePrefix.length());
                        break;
                    }
                }
            }
        }

        String suffix = findSuffix(remainder);
        String middle = suffix == null ? remainder : remainder.substring(0, remainder.length() - suffix.length());

        if (!middle.isEmpty()) {
            return new TokenMorphology(token, articulator, prefix, middle, suffix);
        }

        // Prefix and suffix consumed everything: keep the prefix, drop the suffix
        if (prefix != null) {
            return new TokenMorphology(token, articulator, prefix, remainder, null);
        }
        return new TokenMorphology(token, articulator, null, token, null);
    }

    private String findPrefix(String token) {
        for (String p : config.prefixes()) {
            if (token.startsWith(p) && token.length() > p.length()) {
                return p;
            }
        }
        return null;
    }

    private String findSuffix(String token) {
        for (String s : config.suffixes()) {
            if (token.endsWith(s)) {
                return s;
            }
        }
        return null;
    }
}
