package com.warewise.model;

import java.util.Locale;
import java.util.Map;

/**
 * Which warehouse an inventory snapshot belongs to, and how sure the engine is.
 *
 * @param candidateScores match score per candidate warehouse, empty for explicit selection
 */
public record WarehouseContextResult(
    String warehouseId,
    ConfidenceTier confidenceTier,
    double matchScore,
    int matchedLocations,
    int totalLocations,
    Map<String, Double> candidateScores
) {

    public WarehouseContextResult {
        candidateScores = candidateScores == null ? Map.of() : Map.copyOf(candidateScores);
    }

    public static WarehouseContextResult explicit(String warehouseId) {
        return new WarehouseContextResult(warehouseId.trim().toUpperCase(Locale.ROOT), ConfidenceTier.EXPLICIT, 1.0, 0, 0, Map.of());
    }

    public static WarehouseContextResult none(int totalLocations, Map<String, Double> candidateScores) {
        return new WarehouseContextResult(null, ConfidenceTier.NONE, 0.0, 0, totalLocations, candidateScores);
    }

    public boolean isResolved() {
        return warehouseId != null && confidenceTier != ConfidenceTier.NONE;
    }

    public boolean isExplicit() {
        return confidenceTier == ConfidenceTier.EXPLICIT;
    }
}
