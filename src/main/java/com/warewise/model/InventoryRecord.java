package com.warewise.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One physical unit (pallet) of an inventory snapshot.
 *
 * The derived fields ({@code canonicalLocation} onwards) are empty on ingestion and filled
 * by a single normalization pass through {@link #withNormalization}. Records are not
 * touched again once rule evaluation starts.
 */
@Builder(toBuilder = true)
public record InventoryRecord(
    String unitId,
    String rawLocation,
    String lotId,
    LocalDateTime createdAt,
    String description,
    BigDecimal quantity,
    BigDecimal weight,
    String declaredLocationType,
    Map<String, String> attributes,
    String canonicalLocation,
    CanonicalKind canonicalKind,
    LocationType locationType,
    String locationZone
) {

    public InventoryRecord {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public InventoryRecord withNormalization(CanonicalResult canonical, LocationProperties properties) {
        return toBuilder()
                .canonicalLocation(canonical.value())
                .canonicalKind(canonical.kind())
                .locationType(properties.type())
                .locationZone(properties.zone())
                .build();
    }

    public boolean isNormalized() {
        return canonicalKind != null;
    }

    public boolean hasLocation() {
        return rawLocation != null && !rawLocation.isBlank();
    }

    /**
     * Location as reported in anomalies: canonical when available, otherwise the raw value.
     */
    public String reportedLocation() {
        if (canonicalLocation != null && !canonicalLocation.isEmpty()) {
            return canonicalLocation;
        }
        return hasLocation() ? rawLocation.trim() : "N/A";
    }
}
