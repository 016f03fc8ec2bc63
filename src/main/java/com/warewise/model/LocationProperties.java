package com.warewise.model;

/**
 * Derived properties of one canonical code within one warehouse template.
 * {@code reason} is set only when {@code exists} is false.
 */
public record LocationProperties(
    String code,
    boolean exists,
    LocationType type,
    String zone,
    int capacity,
    String reason
) {

    public static final String MALFORMED = "malformed";

    public static LocationProperties storage(String code, String zone, int capacity) {
        return new LocationProperties(code, true, LocationType.STORAGE, zone, capacity, null);
    }

    public static LocationProperties special(String code, SpecialArea area) {
        return new LocationProperties(code, true, area.type(), area.zone(), area.capacity(), null);
    }

    public static LocationProperties zoned(String code, LocationType type, String zone, int capacity) {
        return new LocationProperties(code, true, type, zone, capacity, null);
    }

    public static LocationProperties invalid(String code, String reason) {
        return new LocationProperties(code, false, LocationType.UNKNOWN, "UNKNOWN", 0, reason);
    }

    public static LocationProperties missing() {
        return new LocationProperties("", false, LocationType.MISSING, "UNKNOWN", 0, "empty or null location code");
    }

    public static LocationProperties malformed(String code) {
        return invalid(code, MALFORMED);
    }

    /**
     * Properties inferred from the code's shape alone, used when no warehouse template is resolved.
     */
    public static LocationProperties unresolved(String code, LocationType inferredType) {
        return new LocationProperties(code, false, inferredType, inferredType.name(), 0, "no warehouse template resolved");
    }
}
