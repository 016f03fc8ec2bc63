package com.warewise.model;

import java.util.Locale;

public enum TemperatureClass {
    FROZEN,
    REFRIGERATED,
    AMBIENT;

    /**
     * Best-effort class for a zone name that has no explicit mapping in its template.
     */
    public static TemperatureClass inferFromZoneName(String zone) {
        if (zone == null) {
            return AMBIENT;
        }
        String z = zone.toUpperCase(Locale.ROOT);
        if (z.contains("FROZEN") || z.contains("FREEZ")) {
            return FROZEN;
        }
        if (z.contains("REFRIG") || z.contains("COLD") || z.contains("CHILL") || z.contains("COOL")) {
            return REFRIGERATED;
        }
        return AMBIENT;
    }
}
