package pl.marcinmilkowski.constraint_kb.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A unit of text (e.g. a manuscript folio) with its structural metadata.
 * The activated vocabulary is held by the store, not by the context.
 */
public record Context(
    String id,
    String section,
    int tokenCount,
    int uniqueTypeCount,
    Map<Zone, Double> zoneOccupancy
) {

    public static final String UNKNOWN_SECTION = "U";

    public Context {
        section = section == null || section.isBlank() ? UNKNOWN_SECTION : section;
        EnumMap<Zone, Double> occupancy = new EnumMap<>(Zone.class);
        for (Zone zone : Zone.values()) {
            occupancy.put(zone, zoneOccupancy == null ? 0.0 : zoneOccupancy.getOrDefault(zone, 0.0));
        }
        zoneOccupancy = Collections.unmodifiableMap(occupancy);
    }

    /**
     * Build a context from a raw placement vector, folding sub-zones.
     */
    public static Context fromPlacement(String id, String section, int tokenCount, int uniqueTypeCount,
                                        Map<String, Double> placementVector) {
        EnumMap<Zone, Double> occupancy = new EnumMap<>(Zone.class);
        for (Zone zone : Zone.values()) {
            occupancy.put(zone, zone.aggregate(placementVector));
        }
        return new Context(id, section, tokenCount, uniqueTypeCount, occupancy);
    }
}
