package pl.marcinmilkowski.constraint_kb.index;

import pl.marcinmilkowski.constraint_kb.ingest.SourceBundle.HazardProfile;
import pl.marcinmilkowski.constraint_kb.model.HazardType;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Splits hazard-involved classes into ATOMIC and DECOMPOSABLE.
 *
 * The test is structural: a class with no exclusive and no shared MIDDLE
 * involvement is atomic. Corpus frequency plays no part.
 */
public final class HazardClassifier {

    private HazardClassifier() {
    }

    public static HazardType classify(int exclusiveCount, int sharedCount) {
        return exclusiveCount == 0 && sharedCount == 0 ? HazardType.ATOMIC : HazardType.DECOMPOSABLE;
    }

    /**
     * Classify every profiled class. Classes without a profile are not hazard classes
     * and do not appear in the result.
     *
     * @throws InvariantViolationException if a class is profiled twice or is not declared
     */
    public static Map<Integer, HazardType> classify(List<HazardProfile> profiles, Set<Integer> declaredClasses) {
        Map<Integer, HazardType> types = new TreeMap<>();
        for (HazardProfile profile : profiles) {
            int classId = profile.classId();
            if (!declaredClasses.contains(classId)) {
                throw new InvariantViolationException("Hazard profile for undeclared class " + classId);
            }
            HazardType type = classify(profile.exclusiveCount(), profile.sharedCount());
            HazardType previous = types.put(classId, type);
            if (previous != null) {
                throw new InvariantViolationException(
                    "Class " + classId + " has more than one hazard profile (" + previous + ", " + type + ")");
            }
        }
        return Collections.unmodifiableMap(types);
    }
}
