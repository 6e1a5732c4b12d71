package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Whether a consumer context can still run under a bundle's per-zone grammar.
 *
 * @param requiredClasses Footprint of the consumer context
 * @param reachableZones Zones whose grammar keeps every required class
 * @param availableClasses Required classes reachable in the best-covered zone
 * @param missingClasses Required classes pruned in the best-covered zone
 * @param coverage Best per-zone fraction of required classes kept; 1 for an empty footprint
 * @param sufficiency Regime verdict of the consumer, or null when it has no regime
 */
public record ConsumerReachability(
    String contextId,
    Status status,
    List<String> reachableZones,
    Set<Integer> requiredClasses,
    Set<Integer> availableClasses,
    Set<Integer> missingClasses,
    double coverage,
    RegimeSufficiency sufficiency
) {

    public enum Status {
        /** Every zone keeps the full footprint */
        REACHABLE,
        /** Some zones, not all */
        CONDITIONAL,
        /** No zone keeps the full footprint */
        UNREACHABLE
    }

    public ConsumerReachability {
        reachableZones = List.copyOf(reachableZones);
        requiredClasses = Collections.unmodifiableSet(new TreeSet<>(requiredClasses));
        availableClasses = Collections.unmodifiableSet(new TreeSet<>(availableClasses));
        missingClasses = Collections.unmodifiableSet(new TreeSet<>(missingClasses));
    }

    /**
     * Classify a consumer footprint against per-zone grammar states keyed by
     * the labels of {@link ConstraintPolicy#LEGALITY_ZONES}.
     */
    public static ConsumerReachability classify(String contextId, Set<Integer> required,
                                                Map<String, GrammarState> grammarByZone,
                                                RegimeSufficiency sufficiency) {
        List<String> reachableZones = new ArrayList<>();
        String bestZone = null;
        double bestCoverage = 0.0;

        for (String zone : ConstraintPolicy.LEGALITY_ZONES) {
            GrammarState state = grammarByZone.get(zone);
            if (state == null) {
                continue;
            }
            long kept = required.stream().filter(state.reachableClasses()::contains).count();
            double coverage = required.isEmpty() ? 1.0 : (double) kept / required.size();
            if (coverage > bestCoverage) {
                bestCoverage = coverage;
                bestZone = zone;
            }
            if (kept == required.size()) {
                reachableZones.add(zone);
            }
        }

        Status status;
        if (reachableZones.size() == ConstraintPolicy.LEGALITY_ZONES.size()) {
            status = Status.REACHABLE;
        } else if (!reachableZones.isEmpty()) {
            status = Status.CONDITIONAL;
        } else {
            status = Status.UNREACHABLE;
        }

        GrammarState best = grammarByZone.get(bestZone == null ? ConstraintPolicy.LEGALITY_ZONES.get(0) : bestZone);
        Set<Integer> available = new TreeSet<>(required);
        if (best == null) {
            available.clear();
        } else {
            available.retainAll(best.reachableClasses());
        }
        Set<Integer> missing = new TreeSet<>(required);
        missing.removeAll(available);

        return new ConsumerReachability(contextId, status, reachableZones, required, available, missing,
            bestCoverage, sufficiency);
    }

    public boolean isFullyReachable() {
        return status == Status.REACHABLE;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("context", contextId);
        obj.put("status", status.name());
        obj.put("reachable_zones", new JSONArray(reachableZones));
        obj.put("required_classes", new JSONArray(requiredClasses));
        obj.put("available_classes", new JSONArray(availableClasses));
        obj.put("missing_classes", new JSONArray(missingClasses));
        obj.put("coverage", coverage);
        if (sufficiency != null) {
            obj.put("sufficiency", sufficiency.toJson());
        }
        return obj;
    }
}
