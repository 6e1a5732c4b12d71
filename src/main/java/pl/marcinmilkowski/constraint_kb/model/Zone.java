package pl.marcinmilkowski.constraint_kb.model;

import java.util.Map;

/**
 * Six-way positional zones used for context occupancy.
 */
public enum Zone {
    C("C", "C1"),
    P("P", "P1"),
    R1("R1"),
    R2("R2"),
    R3("R3", "R4"),
    S("S", "S1", "S2");

    private final String[] placementKeys;

    Zone(String... placementKeys) {
        this.placementKeys = placementKeys;
    }

    /**
     * Sum the raw placement-vector entries that fold into this zone.
     */
    public double aggregate(Map<String, Double> placementVector) {
        double total = 0.0;
        for (String key : placementKeys) {
            total += placementVector.getOrDefault(key, 0.0);
        }
        return total;
    }
}
