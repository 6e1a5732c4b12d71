package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.constraint_kb.index.ClassIndex;
import pl.marcinmilkowski.constraint_kb.model.HazardType;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reachable and pruned classes of the grammar in one zone, with the hazard
 * classes broken out. The grammar itself never changes; only the reachable
 * subset does.
 */
public record GrammarState(
    Set<Integer> reachableClasses,
    Set<Integer> prunedClasses,
    Set<Integer> atomicHazardsReachable,
    Set<Integer> decomposableHazardsReachable,
    Set<Integer> decomposableHazardsPruned
) {

    public GrammarState {
        reachableClasses = sorted(reachableClasses);
        prunedClasses = sorted(prunedClasses);
        atomicHazardsReachable = sorted(atomicHazardsReachable);
        decomposableHazardsReachable = sorted(decomposableHazardsReachable);
        decomposableHazardsPruned = sorted(decomposableHazardsPruned);
    }

    /**
     * State of the grammar when exactly the given classes are reachable.
     */
    public static GrammarState of(Set<Integer> reachable, ClassIndex classes) {
        Set<Integer> kept = new TreeSet<>(reachable);
        kept.retainAll(classes.classIds());
        Set<Integer> pruned = new TreeSet<>(classes.classIds());
        pruned.removeAll(kept);

        Set<Integer> atomicReachable = new TreeSet<>(classes.classesWithHazard(HazardType.ATOMIC));
        atomicReachable.retainAll(kept);
        Set<Integer> decomposable = classes.classesWithHazard(HazardType.DECOMPOSABLE);
        Set<Integer> decomposableReachable = new TreeSet<>(decomposable);
        decomposableReachable.retainAll(kept);
        Set<Integer> decomposablePruned = new TreeSet<>(decomposable);
        decomposablePruned.removeAll(kept);

        return new GrammarState(kept, pruned, atomicReachable, decomposableReachable, decomposablePruned);
    }

    public int reachableCount() {
        return reachableClasses.size();
    }

    public int prunedCount() {
        return prunedClasses.size();
    }

    /** Reachable classes over all classes of the grammar */
    public double reachabilityRatio() {
        int total = reachableClasses.size() + prunedClasses.size();
        return total == 0 ? 0.0 : (double) reachableClasses.size() / total;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("reachable_classes", new JSONArray(reachableClasses));
        obj.put("pruned_classes", new JSONArray(prunedClasses));
        obj.put("reachability_ratio", reachabilityRatio());
        obj.put("atomic_hazards_reachable", new JSONArray(atomicHazardsReachable));
        obj.put("decomposable_hazards_reachable", new JSONArray(decomposableHazardsReachable));
        obj.put("decomposable_hazards_pruned", new JSONArray(decomposableHazardsPruned));
        return obj;
    }

    @Override
    public String toString() {
        return String.format("%d/%d classes reachable | %d pruned | atomic hazards: %d | decomposable hazards: %d reachable, %d pruned",
            reachableCount(), reachableCount() + prunedCount(), prunedCount(), atomicHazardsReachable.size(),
            decomposableHazardsReachable.size(), decomposableHazardsPruned.size());
    }

    private static Set<Integer> sorted(Set<Integer> values) {
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }
}
