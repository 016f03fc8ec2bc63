package com.warewise.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of anomaly rule types. Each constant has exactly one evaluator.
 */
public enum RuleType {
    STAGNANT_PALLETS("Stagnant Pallet", 3),
    UNCOORDINATED_LOTS("Lot Straggler", 3),
    OVERCAPACITY("Overcapacity", 2),
    INVALID_LOCATION("Invalid Location", 1),
    LOCATION_SPECIFIC_STAGNANT("Location-Specific Stagnant", 3),
    TEMPERATURE_ZONE_MISMATCH("Temperature Zone Violation", 2),
    DATA_INTEGRITY("Data Integrity", 1),
    LOCATION_TYPE_MISMATCH("Location Type Mismatch", 2),
    MISSING_LOCATION("Missing Location", 1);

    private final String anomalyLabel;
    private final int defaultPrecedence;

    RuleType(String anomalyLabel, int defaultPrecedence) {
        this.anomalyLabel = anomalyLabel;
        this.defaultPrecedence = defaultPrecedence;
    }

    public String anomalyLabel() {
        return anomalyLabel;
    }

    public int defaultPrecedence() {
        return defaultPrecedence;
    }

    public static Optional<RuleType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RuleType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
