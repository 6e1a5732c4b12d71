package pl.marcinmilkowski.constraint_kb.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hand-curated set of infrastructure classes that mediate kernel access and
 * are never pruned by vocabulary filtering.
 *
 * The set is a versioned design decision. It is never derived from corpus
 * statistics; changing it means creating a new revision.
 */
public record InfrastructureClasses(String revision, Set<Integer> classIds) {

    /**
     * Current revision: auxiliary roles covering 85-99% of procedural folios.
     */
    public static final InfrastructureClasses CURRENT = of("2026-01-18", 36, 42, 44, 46);

    public InfrastructureClasses {
        if (revision == null || revision.isBlank()) {
            throw new IllegalArgumentException("Infrastructure class set requires a revision");
        }
        classIds = Collections.unmodifiableSet(new TreeSet<>(classIds));
    }

    public static InfrastructureClasses of(String revision, Integer... classIds) {
        return new InfrastructureClasses(revision, new TreeSet<>(Arrays.asList(classIds)));
    }

    public boolean contains(int classId) {
        return classIds.contains(classId);
    }

    @Override
    public String toString() {
        return "InfrastructureClasses[" + revision + " " + classIds + "]";
    }
}
