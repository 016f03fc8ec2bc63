package com.warewise.repository;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warewise.model.LocationFormatConfig;
import com.warewise.model.LocationPatternType;
import com.warewise.model.LocationType;
import com.warewise.model.SpecialArea;
import com.warewise.model.TemperatureClass;
import com.warewise.model.WarehouseTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads warehouse templates from JSON.
 *
 * Special areas may be given as one {@code special_areas} list with explicit types, or as the
 * older {@code receiving_areas} / {@code staging_areas} / {@code dock_areas} lists.
 */
@Component
@Slf4j
public class WarehouseTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath*:templates/*.json";

    private static final int DEFAULT_RECEIVING_CAPACITY = 10;
    private static final int DEFAULT_STAGING_CAPACITY = 5;
    private static final int DEFAULT_DOCK_CAPACITY = 2;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public WarehouseTemplateLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads every template under {@code templates/} on the classpath, ordered by file name.
     */
    public List<WarehouseTemplate> loadAll() {
        return loadAll(DEFAULT_LOCATION);
    }

    public List<WarehouseTemplate> loadAll(String locationPattern) {
        Resource[] resources;
        try {
            resources = ResourcePatternUtils.getResourcePatternResolver(resourceLoader).getResources(locationPattern);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list warehouse templates: " + locationPattern, e);
        }
        List<WarehouseTemplate> templates = new ArrayList<>();
        Arrays.stream(resources)
                .sorted(Comparator.comparing(r -> String.valueOf(r.getFilename())))
                .forEach(resource -> templates.add(load(resource)));
        log.info("Loaded {} warehouse templates from {}", templates.size(), locationPattern);
        return templates;
    }

    public WarehouseTemplate load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return toTemplate(objectMapper.readValue(in, TemplateJson.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load warehouse template: " + resource.getDescription(), e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid warehouse template " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    public WarehouseTemplate parse(String json) {
        try {
            return toTemplate(objectMapper.readValue(json, TemplateJson.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed warehouse template JSON: " + e.getOriginalMessage(), e);
        } catch (NullPointerException e) {
            throw new IllegalArgumentException("Invalid warehouse template: " + e.getMessage(), e);
        }
    }

    private WarehouseTemplate toTemplate(TemplateJson json) {
        List<SpecialArea> areas = new ArrayList<>();
        if (json.specialAreas() != null) {
            json.specialAreas().forEach(a -> areas.add(toArea(a, parseType(a.type()), DEFAULT_RECEIVING_CAPACITY)));
        }
        addAreas(areas, json.receivingAreas(), LocationType.RECEIVING, DEFAULT_RECEIVING_CAPACITY);
        addAreas(areas, json.stagingAreas(), LocationType.STAGING, DEFAULT_STAGING_CAPACITY);
        addAreas(areas, json.dockAreas(), LocationType.DOCK, DEFAULT_DOCK_CAPACITY);

        Map<String, TemperatureClass> temperatureClasses = new LinkedHashMap<>();
        if (json.zoneTemperatureClasses() != null) {
            json.zoneTemperatureClasses().forEach((zone, cls) ->
                    temperatureClasses.put(zone.trim().toUpperCase(Locale.ROOT),
                            TemperatureClass.valueOf(cls.trim().toUpperCase(Locale.ROOT))));
        }

        WarehouseTemplate template = WarehouseTemplate.builder()
                .warehouseId(json.warehouseId())
                .numAisles(json.numAisles())
                .racksPerAisle(json.racksPerAisle())
                .positionsPerRack(json.positionsPerRack())
                .levelsPerPosition(json.levelsPerPosition())
                .levelNames(json.levelNames())
                .defaultCapacity(json.defaultCapacity())
                .specialAreas(areas)
                .autoCreateAisleAreas(json.autoCreateAisleAreas())
                .storageZone(json.storageZone())
                .aisleZones(json.aisleZones())
                .zoneTemperatureClasses(temperatureClasses)
                .locationFormatConfig(toFormat(json.locationFormatConfig()))
                .updatedAt(json.updatedAt())
                .build();
        log.debug("Parsed warehouse template {} ({} aisles, {} special areas)",
                template.warehouseId(), template.numAisles(), template.specialAreas().size());
        return template;
    }

    private static void addAreas(List<SpecialArea> target, List<AreaJson> areas, LocationType type, int defaultCapacity) {
        if (areas != null) {
            areas.forEach(a -> target.add(toArea(a, type, defaultCapacity)));
        }
    }

    private static SpecialArea toArea(AreaJson json, LocationType type, int defaultCapacity) {
        int capacity = json.capacity() != null ? json.capacity() : defaultCapacity;
        return new SpecialArea(json.code().trim().toUpperCase(Locale.ROOT), type, capacity, json.zone());
    }

    private static LocationType parseType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("special area type is required");
        }
        return LocationType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }

    private static LocationFormatConfig toFormat(FormatJson json) {
        if (json == null) {
            return null;
        }
        return new LocationFormatConfig(
                LocationPatternType.fromName(json.patternType()),
                json.businessZones(),
                json.transitionalZones(),
                json.confidence() != null ? json.confidence() : 0.0);
    }

    record TemplateJson(
            @JsonProperty("warehouse_id") String warehouseId,
            @JsonProperty("num_aisles") Integer numAisles,
            @JsonProperty("racks_per_aisle") Integer racksPerAisle,
            @JsonProperty("positions_per_rack") Integer positionsPerRack,
            @JsonProperty("levels_per_position") Integer levelsPerPosition,
            @JsonProperty("level_names") String levelNames,
            @JsonProperty("default_pallet_capacity") Integer defaultCapacity,
            @JsonProperty("special_areas") List<AreaJson> specialAreas,
            @JsonProperty("receiving_areas") List<AreaJson> receivingAreas,
            @JsonProperty("staging_areas") List<AreaJson> stagingAreas,
            @JsonProperty("dock_areas") List<AreaJson> dockAreas,
            @JsonProperty("auto_create_aisle_areas") Boolean autoCreateAisleAreas,
            @JsonProperty("storage_zone") String storageZone,
            @JsonProperty("aisle_zones") Map<Integer, String> aisleZones,
            @JsonProperty("zone_temperature_classes") Map<String, String> zoneTemperatureClasses,
            @JsonProperty("location_format_config") FormatJson locationFormatConfig,
            @JsonProperty("updated_at") Instant updatedAt
    ) {}

    record AreaJson(
            @JsonProperty("code") String code,
            @JsonProperty("type") String type,
            @JsonProperty("capacity") Integer capacity,
            @JsonProperty("zone") String zone
    ) {}

    record FormatJson(
            @JsonProperty("pattern_type") String patternType,
            @JsonProperty("business_zones") List<String> businessZones,
            @JsonProperty("transitional_zones") List<String> transitionalZones,
            @JsonProperty("confidence") Double confidence
    ) {}
}
