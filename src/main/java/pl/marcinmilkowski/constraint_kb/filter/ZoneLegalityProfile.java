package pl.marcinmilkowski.constraint_kb.filter;

import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Zones through which an activation survives: a zone survives when every
 * active RESTRICTED item is legal in it. Items without a legality record are
 * legal in every zone.
 */
public record ZoneLegalityProfile(Set<String> activeItems, Map<String, Boolean> survival) {

    public ZoneLegalityProfile {
        activeItems = Set.copyOf(activeItems);
        survival = Collections.unmodifiableMap(new LinkedHashMap<>(survival));
    }

    public boolean survives(String zone) {
        return survival.getOrDefault(zone, false);
    }

    public boolean survivesAll() {
        return !survival.containsValue(false);
    }

    /** First zone, in {@link ConstraintPolicy#LEGALITY_ZONES} order, that does not survive */
    public Optional<String> commitmentZone() {
        for (String zone : ConstraintPolicy.LEGALITY_ZONES) {
            if (!survives(zone)) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    public ExecutionMode executionMode() {
        return commitmentZone().map(zone -> switch (zone) {
            case "S" -> ExecutionMode.LATE_COMMITMENT;
            case "R" -> ExecutionMode.MID_COMMITMENT;
            case "P" -> ExecutionMode.EARLY_COMMITMENT;
            default -> ExecutionMode.BLOCKED;
        }).orElse(ExecutionMode.FULL_SURVIVAL);
    }

    public enum ExecutionMode {
        FULL_SURVIVAL,
        LATE_COMMITMENT,
        MID_COMMITMENT,
        EARLY_COMMITMENT,
        BLOCKED
    }
}
