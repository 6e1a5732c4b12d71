package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Reachability across a set of contexts.
 *
 * Jaccard means are taken over context pairs where both sets are non-empty;
 * with no such pair they are 0.
 */
public record ReachabilityReport(
    List<ContextReachability> contexts,
    double meanTokenJaccard,
    double meanClassJaccard,
    int comparedPairs,
    List<RegimeSufficiency> regimeSufficiency
) {

    public ReachabilityReport {
        contexts = List.copyOf(contexts);
        regimeSufficiency = List.copyOf(regimeSufficiency);
    }

    public Optional<ContextReachability> context(String contextId) {
        return contexts.stream().filter(c -> c.contextId().equals(contextId)).findFirst();
    }

    public double meanLegalityRatio() {
        return mean(ContextReachability::legalityRatio);
    }

    public double meanRoleCoverage() {
        return mean(ContextReachability::roleCoverage);
    }

    public double meanEmptyFragmentRate() {
        return mean(ContextReachability::emptyFragmentRate);
    }

    public double meanUsability() {
        return mean(ContextReachability::usability);
    }

    private double mean(ToDoubleFunction<ContextReachability> metric) {
        return contexts.stream().mapToDouble(metric).average().orElse(0.0);
    }

    public JSONObject toJson() {
        JSONObject summary = new JSONObject();
        summary.put("context_count", contexts.size());
        summary.put("mean_legality_ratio", meanLegalityRatio());
        summary.put("mean_role_coverage", meanRoleCoverage());
        summary.put("mean_empty_fragment_rate", meanEmptyFragmentRate());
        summary.put("mean_usability", meanUsability());
        summary.put("mean_token_jaccard", meanTokenJaccard);
        summary.put("mean_class_jaccard", meanClassJaccard);
        summary.put("compared_pairs", comparedPairs);

        JSONArray contextArray = new JSONArray();
        for (ContextReachability c : contexts) {
            contextArray.add(c.toJson());
        }

        JSONObject regimes = new JSONObject();
        for (RegimeSufficiency s : regimeSufficiency) {
            regimes.put(s.contextId(), s.toJson());
        }

        JSONObject root = new JSONObject();
        root.put("summary", summary);
        root.put("contexts", contextArray);
        root.put("regime_sufficiency", regimes);
        return root;
    }
}
