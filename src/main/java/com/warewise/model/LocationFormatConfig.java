package com.warewise.model;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Non-default location code grammar for a warehouse, e.g. zone-prefixed codes like {@code PICK-A-001}.
 */
public record LocationFormatConfig(
    LocationPatternType patternType,
    List<String> businessZones,
    List<String> transitionalZones,
    double confidence
) {

    public static final List<String> DEFAULT_BUSINESS_ZONES = List.of("PICK", "BULK", "OVER", "CASE", "EACH");
    public static final List<String> DEFAULT_TRANSITIONAL_ZONES = List.of("TRAN", "FLOW", "TRANSIT");

    public LocationFormatConfig {
        patternType = patternType == null ? LocationPatternType.CANONICAL : patternType;
        businessZones = normalize(businessZones, DEFAULT_BUSINESS_ZONES);
        transitionalZones = normalize(transitionalZones, DEFAULT_TRANSITIONAL_ZONES);
    }

    public static LocationFormatConfig zoneBased(List<String> businessZones, List<String> transitionalZones, double confidence) {
        return new LocationFormatConfig(LocationPatternType.ZONE_BASED, businessZones, transitionalZones, confidence);
    }

    public boolean isZoneBased() {
        return patternType == LocationPatternType.ZONE_BASED;
    }

    public Pattern businessZonePattern() {
        return zonePrefixPattern(businessZones);
    }

    public Pattern transitionalZonePattern() {
        return zonePrefixPattern(transitionalZones);
    }

    private static Pattern zonePrefixPattern(List<String> zones) {
        String alternatives = zones.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile("^(" + alternatives + ")(-[A-Z0-9]+)+$");
    }

    private static List<String> normalize(List<String> zones, List<String> defaults) {
        if (zones == null || zones.isEmpty()) {
            return defaults;
        }
        return zones.stream()
                .filter(z -> z != null && !z.isBlank())
                .map(z -> z.trim().toUpperCase(Locale.ROOT))
                .toList();
    }
}
