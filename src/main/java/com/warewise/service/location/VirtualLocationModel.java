package com.warewise.service.location;

import com.warewise.model.CanonicalKind;
import com.warewise.model.CanonicalResult;
import com.warewise.model.LocationFormatConfig;
import com.warewise.model.LocationProperties;
import com.warewise.model.LocationType;
import com.warewise.model.SpecialArea;
import com.warewise.model.StandardLocationCode;
import com.warewise.model.WarehouseTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers "does this location exist and what is it" for one warehouse template, by arithmetic
 * on the template's dimensions. No per-slot record is ever materialized, so a lookup costs the
 * same for a 10-slot warehouse as for a 10-million-slot one.
 *
 * Built once per template and immutable afterwards; safe to share across worker threads.
 */
@Slf4j
public final class VirtualLocationModel {

    public static final int AISLE_AREA_CAPACITY = 10;
    public static final int TRANSITIONAL_ZONE_CAPACITY = 10;

    private final WarehouseTemplate template;
    private final LocationCanonicalizer canonicalizer;
    private final Map<String, SpecialArea> specialAreas;
    private final Pattern businessZonePattern;
    private final Pattern transitionalZonePattern;

    private VirtualLocationModel(WarehouseTemplate template, LocationCanonicalizer canonicalizer) {
        this.template = template;
        this.canonicalizer = canonicalizer;
        this.specialAreas = buildSpecialAreas(template);
        LocationFormatConfig format = template.locationFormatConfig();
        if (format != null && format.isZoneBased()) {
            this.businessZonePattern = format.businessZonePattern();
            this.transitionalZonePattern = format.transitionalZonePattern();
        } else {
            this.businessZonePattern = null;
            this.transitionalZonePattern = null;
        }
    }

    public static VirtualLocationModel of(WarehouseTemplate template) {
        return of(template, new LocationCanonicalizer());
    }

    public static VirtualLocationModel of(WarehouseTemplate template, LocationCanonicalizer baseCanonicalizer) {
        VirtualLocationModel model = new VirtualLocationModel(template, baseCanonicalizer.forTemplate(template));
        log.debug("Virtual location model built for {}: {} storage slots, {} special areas",
                template.warehouseId(), model.totalStorageLocations(), model.specialAreas.size());
        return model;
    }

    /**
     * Declared special areas plus one {@code AISLE-NN} transitional area per aisle when enabled.
     * Declared areas win over generated ones with the same code.
     */
    private static Map<String, SpecialArea> buildSpecialAreas(WarehouseTemplate template) {
        Map<String, SpecialArea> areas = new LinkedHashMap<>();
        for (SpecialArea area : template.specialAreas()) {
            String code = LocationCanonicalizer.normalizeSpecialCode(area.code());
            areas.put(code, new SpecialArea(code, area.type(), area.capacity(), area.zone()));
        }
        if (Boolean.TRUE.equals(template.autoCreateAisleAreas())) {
            for (int aisle = 1; aisle <= template.numAisles(); aisle++) {
                String code = String.format("AISLE-%02d", aisle);
                areas.putIfAbsent(code, new SpecialArea(code, LocationType.TRANSITIONAL,
                        AISLE_AREA_CAPACITY, WarehouseTemplate.DEFAULT_STORAGE_ZONE));
            }
        }
        return Collections.unmodifiableMap(areas);
    }

    public WarehouseTemplate template() {
        return template;
    }

    public String warehouseId() {
        return template.warehouseId();
    }

    public LocationCanonicalizer canonicalizer() {
        return canonicalizer;
    }

    public Map<String, SpecialArea> specialAreas() {
        return specialAreas;
    }

    public Optional<SpecialArea> specialArea(String code) {
        return Optional.ofNullable(code == null ? null : specialAreas.get(code));
    }

    /**
     * Canonicalizes with this template's vocabulary, then resolves.
     */
    public LocationProperties resolveRaw(String rawLocation) {
        return resolve(canonicalizer.canonicalize(rawLocation));
    }

    public LocationProperties resolve(CanonicalResult canonical) {
        if (canonical == null || canonical.isEmpty()) {
            return LocationProperties.missing();
        }
        if (canonical.kind() == CanonicalKind.UNPARSEABLE) {
            return resolveZoned(canonical.value())
                    .orElseGet(() -> LocationProperties.invalid(canonical.value(),
                            "unparseable location code '" + canonical.value() + "'"));
        }
        if (canonical.kind() == CanonicalKind.SPECIAL && !specialAreas.containsKey(canonical.value())) {
            return LocationProperties.invalid(canonical.value(),
                    "special area " + canonical.value() + " is not declared for warehouse " + template.warehouseId());
        }
        return resolve(canonical.value());
    }

    /**
     * Resolves an already-canonical code. Malformed input yields {@code exists=false, reason="malformed"}.
     */
    public LocationProperties resolve(String canonicalCode) {
        if (canonicalCode == null || canonicalCode.isBlank()) {
            return LocationProperties.missing();
        }
        SpecialArea area = specialAreas.get(canonicalCode);
        if (area != null) {
            return LocationProperties.special(canonicalCode, area);
        }
        Optional<LocationProperties> zoned = resolveZoned(canonicalCode);
        if (zoned.isPresent()) {
            return zoned.get();
        }
        return StandardLocationCode.parse(canonicalCode)
                .map(code -> checkBounds(canonicalCode, code))
                .orElseGet(() -> LocationProperties.malformed(canonicalCode));
    }

    public boolean exists(String canonicalCode) {
        return resolve(canonicalCode).exists();
    }

    private Optional<LocationProperties> resolveZoned(String code) {
        if (businessZonePattern == null) {
            return Optional.empty();
        }
        Matcher business = businessZonePattern.matcher(code);
        if (business.matches()) {
            return Optional.of(LocationProperties.zoned(code, LocationType.STORAGE, business.group(1),
                    template.defaultCapacity()));
        }
        Matcher transitional = transitionalZonePattern.matcher(code);
        if (transitional.matches()) {
            return Optional.of(LocationProperties.zoned(code, LocationType.TRANSITIONAL, transitional.group(1),
                    TRANSITIONAL_ZONE_CAPACITY));
        }
        return Optional.empty();
    }

    private LocationProperties checkBounds(String canonicalCode, StandardLocationCode code) {
        String reason = boundsViolation("aisle", code.aisle(), template.numAisles());
        if (reason == null) {
            reason = boundsViolation("rack", code.rack(), template.racksPerAisle());
        }
        if (reason == null) {
            reason = boundsViolation("position", code.position(), template.positionsPerRack());
        }
        if (reason == null && !template.hasLevel(code.level())) {
            reason = "level '" + code.level() + "' not in " + template.levelNames();
        }
        if (reason != null) {
            return LocationProperties.invalid(canonicalCode, reason);
        }
        return LocationProperties.storage(canonicalCode, template.storageZoneForAisle(code.aisle()),
                template.defaultCapacity());
    }

    private static String boundsViolation(String field, int value, int max) {
        if (value < 1) {
            return field + " " + value + " is below minimum 1";
        }
        if (value > max) {
            return field + " " + value + " exceeds template maximum " + max;
        }
        return null;
    }

    public long totalStorageLocations() {
        return (long) template.numAisles() * template.racksPerAisle()
                * template.positionsPerRack() * template.levelsPerPosition();
    }

    public long totalLocations() {
        return totalStorageLocations() + specialAreas.size();
    }

    public ModelSummary summary() {
        return new ModelSummary(
                template.warehouseId(),
                totalLocations(),
                totalStorageLocations(),
                specialAreas.size(),
                template.numAisles(),
                template.racksPerAisle(),
                template.positionsPerRack(),
                template.levelsPerPosition(),
                List.copyOf(specialAreas.keySet()));
    }

    /**
     * Validates a batch of raw location codes against this warehouse.
     */
    public BatchValidationResult validateAll(Collection<String> rawLocations) {
        List<String> valid = new ArrayList<>();
        Map<String, String> invalid = new LinkedHashMap<>();
        for (String raw : rawLocations) {
            LocationProperties properties = resolveRaw(raw);
            if (properties.exists()) {
                valid.add(properties.code());
            } else {
                invalid.put(raw == null ? "" : raw, properties.reason());
            }
        }
        int total = rawLocations.size();
        long uniqueValid = valid.stream().distinct().count();
        long possible = totalLocations();
        log.debug("Validated {} locations for {}: {} valid, {} invalid",
                total, template.warehouseId(), valid.size(), invalid.size());
        return new BatchValidationResult(
                total,
                List.copyOf(valid),
                Collections.unmodifiableMap(invalid),
                total == 0 ? 0.0 : valid.size() * 100.0 / total,
                possible == 0 ? 0.0 : uniqueValid * 100.0 / possible);
    }

    public record ModelSummary(
            String warehouseId,
            long totalLocations,
            long storageLocations,
            int specialAreaCount,
            int aisles,
            int racksPerAisle,
            int positionsPerRack,
            int levelsPerPosition,
            List<String> specialAreaCodes
    ) {}

    /**
     * @param invalidLocations raw code to reason
     */
    public record BatchValidationResult(
            int totalLocations,
            List<String> validLocations,
            Map<String, String> invalidLocations,
            double successRatePercent,
            double coveragePercent
    ) {}
}
