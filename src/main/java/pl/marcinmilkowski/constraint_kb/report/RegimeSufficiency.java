package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.model.FolioMetrics;
import pl.marcinmilkowski.constraint_kb.model.Regime;

/**
 * Advisory check of a context's completeness metrics against its regime.
 *
 * REGIME_4 needs enough link density and REGIME_3 enough recovery operations;
 * the other regimes have no requirement. The verdict never affects filtering.
 */
public record RegimeSufficiency(String contextId, Regime regime, FolioMetrics metrics, Status status) {

    public enum Status {
        SUFFICIENT,
        INSUFFICIENT,
        NO_REQUIREMENT,
        /** No metrics recorded for the context */
        UNKNOWN
    }

    public static RegimeSufficiency evaluate(String contextId, Regime regime, FolioMetrics metrics) {
        return new RegimeSufficiency(contextId, regime, metrics, statusOf(regime, metrics));
    }

    static Status statusOf(Regime regime, FolioMetrics metrics) {
        if (regime != Regime.REGIME_3 && regime != Regime.REGIME_4) {
            return Status.NO_REQUIREMENT;
        }
        if (metrics == null) {
            return Status.UNKNOWN;
        }
        boolean ok = regime == Regime.REGIME_4
            ? metrics.linkDensity() >= ConstraintPolicy.REGIME_4_MIN_LINK_DENSITY
            : metrics.recoveryOpsCount() >= ConstraintPolicy.REGIME_3_MIN_RECOVERY_OPS;
        return ok ? Status.SUFFICIENT : Status.INSUFFICIENT;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("regime", regime.name());
        obj.put("status", status.name());
        if (metrics != null) {
            obj.put("link_density", metrics.linkDensity());
            obj.put("recovery_ops_count", metrics.recoveryOpsCount());
        }
        return obj;
    }
}
