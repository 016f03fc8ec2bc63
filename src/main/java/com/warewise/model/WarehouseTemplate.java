package com.warewise.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Compact description of a warehouse's addressable space.
 *
 * Dimensional bounds are the only source of truth for which positional codes exist;
 * no per-slot record is ever required. Read-only to the engine.
 */
@Builder(toBuilder = true)
public record WarehouseTemplate(
    String warehouseId,
    Integer numAisles,
    Integer racksPerAisle,
    Integer positionsPerRack,
    Integer levelsPerPosition,
    String levelNames,
    Integer defaultCapacity,
    List<SpecialArea> specialAreas,
    Boolean autoCreateAisleAreas,
    String storageZone,
    Map<Integer, String> aisleZones,
    Map<String, TemperatureClass> zoneTemperatureClasses,
    LocationFormatConfig locationFormatConfig,
    Instant updatedAt
) {

    public static final int DEFAULT_AISLES = 2;
    public static final int DEFAULT_RACKS = 2;
    public static final int DEFAULT_POSITIONS = 35;
    public static final int DEFAULT_LEVELS = 4;
    public static final int DEFAULT_CAPACITY = 1;
    public static final String DEFAULT_STORAGE_ZONE = "GENERAL";

    public WarehouseTemplate {
        Objects.requireNonNull(warehouseId, "warehouseId");
        warehouseId = warehouseId.trim().toUpperCase(Locale.ROOT);
        numAisles = positiveOrDefault(numAisles, DEFAULT_AISLES, "numAisles");
        racksPerAisle = positiveOrDefault(racksPerAisle, DEFAULT_RACKS, "racksPerAisle");
        positionsPerRack = positiveOrDefault(positionsPerRack, DEFAULT_POSITIONS, "positionsPerRack");
        defaultCapacity = positiveOrDefault(defaultCapacity, DEFAULT_CAPACITY, "defaultCapacity");

        if (levelNames == null || levelNames.isBlank()) {
            int levels = positiveOrDefault(levelsPerPosition, DEFAULT_LEVELS, "levelsPerPosition");
            if (levels > 26) {
                throw new IllegalArgumentException("levelsPerPosition must be at most 26, got " + levels);
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < levels; i++) {
                sb.append((char) ('A' + i));
            }
            levelNames = sb.toString();
        } else {
            levelNames = levelNames.trim().toUpperCase(Locale.ROOT);
        }
        levelsPerPosition = levelNames.length();

        specialAreas = specialAreas == null ? List.of() : List.copyOf(specialAreas);
        autoCreateAisleAreas = autoCreateAisleAreas == null ? Boolean.TRUE : autoCreateAisleAreas;
        storageZone = storageZone == null || storageZone.isBlank() ? DEFAULT_STORAGE_ZONE : storageZone.trim().toUpperCase(Locale.ROOT);
        aisleZones = aisleZones == null ? Map.of() : Map.copyOf(aisleZones);
        zoneTemperatureClasses = zoneTemperatureClasses == null ? Map.of() : Map.copyOf(zoneTemperatureClasses);
    }

    public boolean hasLevel(char level) {
        return levelNames.indexOf(level) >= 0;
    }

    public boolean isZoneBased() {
        return locationFormatConfig != null && locationFormatConfig.isZoneBased();
    }

    /**
     * Zone of a storage slot in the given aisle.
     */
    public String storageZoneForAisle(int aisle) {
        return aisleZones.getOrDefault(aisle, storageZone);
    }

    public TemperatureClass temperatureClassOf(String zone) {
        if (zone == null) {
            return TemperatureClass.AMBIENT;
        }
        TemperatureClass declared = zoneTemperatureClasses.get(zone.toUpperCase(Locale.ROOT));
        return declared != null ? declared : TemperatureClass.inferFromZoneName(zone);
    }

    private static int positiveOrDefault(Integer value, int defaultValue, String field) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
        return value;
    }
}
