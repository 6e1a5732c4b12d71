package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.constraint_kb.filter.FilterResult;
import pl.marcinmilkowski.constraint_kb.index.ForbiddenTransitionGraph.ClassPair;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reachability figures of one context.
 *
 * @param legalityRatio Legal tokens over the whole token vocabulary
 * @param roleCoverage Fraction of functional roles with at least one legal class
 * @param emptyFragmentRate Fraction of consumer fragments without a legal token
 * @param activeForbiddenPairs Forbidden class pairs with both classes still legal
 * @param footprintCoverage Per consumer context, the fraction of its footprint classes still legal
 */
public record ContextReachability(
    String contextId,
    FilterResult result,
    double legalityRatio,
    double roleCoverage,
    double emptyFragmentRate,
    Set<ClassPair> activeForbiddenPairs,
    Map<String, Double> footprintCoverage
) {

    public ContextReachability {
        activeForbiddenPairs = Collections.unmodifiableSet(new TreeSet<>(activeForbiddenPairs));
        footprintCoverage = Collections.unmodifiableMap(new TreeMap<>(footprintCoverage));
    }

    /** legality x role coverage x (1 - empty fragment rate) */
    public double usability() {
        return legalityRatio * roleCoverage * (1.0 - emptyFragmentRate);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("context", contextId);
        obj.put("legal_token_count", result.legalTokens().size());
        obj.put("legal_classes", new JSONArray(result.legalClasses()));
        obj.put("pruned_classes", new JSONArray(result.prunedClasses()));
        obj.put("legality_ratio", legalityRatio);
        obj.put("role_coverage", roleCoverage);
        obj.put("empty_fragment_rate", emptyFragmentRate);
        obj.put("usability", usability());
        JSONArray pairs = new JSONArray();
        for (ClassPair pair : activeForbiddenPairs) {
            pairs.add(pair.toString());
        }
        obj.put("active_forbidden_pairs", pairs);
        if (!footprintCoverage.isEmpty()) {
            obj.put("footprint_coverage", new JSONObject(footprintCoverage));
        }
        return obj;
    }
}
