package pl.marcinmilkowski.constraint_kb.report;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.constraint_kb.config.ConstraintPolicy;
import pl.marcinmilkowski.constraint_kb.filter.ZoneLegalityProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * What a bundle of active items leaves reachable: the stored contexts that
 * can host it, the grammar in each zone, and the status of every consumer
 * context with a footprint.
 *
 * @param effectiveItems Union of the MIDDLE vocabularies of the compatible contexts
 * @param grammarByZone Grammar state per zone, in zone order
 */
public record BundleReachability(
    Set<String> activeItems,
    Set<String> compatibleContexts,
    Set<String> effectiveItems,
    ZoneLegalityProfile zoneLegality,
    Map<String, GrammarState> grammarByZone,
    Map<String, ConsumerReachability> consumers
) {

    public BundleReachability {
        activeItems = Collections.unmodifiableSet(new TreeSet<>(activeItems));
        compatibleContexts = Collections.unmodifiableSet(new TreeSet<>(compatibleContexts));
        effectiveItems = Collections.unmodifiableSet(new TreeSet<>(effectiveItems));
        grammarByZone = Collections.unmodifiableMap(new LinkedHashMap<>(grammarByZone));
        consumers = Collections.unmodifiableMap(new TreeMap<>(consumers));
    }

    /** No stored context can host the bundle */
    public boolean isBlocked() {
        return compatibleContexts.isEmpty();
    }

    /** Overall grammar: the state in the first, most permissive zone */
    public GrammarState grammarState() {
        return grammarByZone.get(ConstraintPolicy.LEGALITY_ZONES.get(0));
    }

    public Optional<ConsumerReachability> consumer(String contextId) {
        return Optional.ofNullable(consumers.get(contextId));
    }

    public List<ConsumerReachability> consumersWith(ConsumerReachability.Status status) {
        return consumers.values().stream()
            .filter(c -> c.status() == status)
            .collect(Collectors.toList());
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("active_items", new JSONArray(activeItems));
        obj.put("compatible_contexts", new JSONArray(compatibleContexts));
        obj.put("effective_item_count", effectiveItems.size());
        obj.put("execution_mode", zoneLegality.executionMode().name());
        zoneLegality.commitmentZone().ifPresent(zone -> obj.put("commitment_zone", zone));
        obj.put("grammar", grammarState().toJson());

        JSONObject zones = new JSONObject();
        for (Map.Entry<String, GrammarState> e : grammarByZone.entrySet()) {
            zones.put(e.getKey(), e.getValue().toJson());
        }
        obj.put("grammar_by_zone", zones);

        JSONObject counts = new JSONObject();
        for (ConsumerReachability.Status status : ConsumerReachability.Status.values()) {
            counts.put(status.name(), consumersWith(status).size());
        }
        obj.put("consumer_status_counts", counts);

        JSONArray rows = new JSONArray();
        for (ConsumerReachability consumer : consumers.values()) {
            rows.add(consumer.toJson());
        }
        obj.put("consumers", rows);
        return obj;
    }
}
