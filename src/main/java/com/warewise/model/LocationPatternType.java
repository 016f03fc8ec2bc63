package com.warewise.model;

import java.util.Locale;

/**
 * Code grammar declared by a template's location format configuration.
 */
public enum LocationPatternType {
    CANONICAL,
    ZONE_BASED;

    public static LocationPatternType fromName(String name) {
        if (name == null || name.isBlank()) {
            return CANONICAL;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "zone_based", "zone-based", "zone" -> ZONE_BASED;
            default -> CANONICAL;
        };
    }
}
