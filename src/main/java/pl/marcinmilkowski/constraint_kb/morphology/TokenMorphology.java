package pl.marcinmilkowski.constraint_kb.morphology;

/**
 * Segmentation of a token into [ARTICULATOR] + PREFIX + MIDDLE + [SUFFIX].
 * Absent slots are null.
 */
public record TokenMorphology(
    String token,
    String articulator,
    String prefix,
    String middle,
    String suffix
) {

    public static TokenMorphology unparsed(String token) {
        return new TokenMorphology(token, null, null, null, null);
    }

    public boolean hasMiddle() {
        return middle != null && !middle.isEmpty();
    }

    public boolean hasPrefix() {
        return prefix != null && !prefix.isEmpty();
    }

    public boolean hasSuffix() {
        return suffix != null && !suffix.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%s = %s+%s+%s+%s", token,
            articulator == null ? "-" : articulator,
            prefix == null ? "-" : prefix,
            middle == null ? "-" : middle,
            suffix == null ? "-" : suffix);
    }
}
