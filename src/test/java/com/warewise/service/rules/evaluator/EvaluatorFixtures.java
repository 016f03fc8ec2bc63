package com.warewise.service.rules.evaluator;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationType;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.model.SpecialArea;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.LocationCanonicalizer;
import com.warewise.service.location.VirtualLocationModel;
import com.warewise.service.pattern.PatternResolver;
import com.warewise.service.preload.AnalysisContext;
import com.warewise.service.preload.InventoryNormalizationService;
import com.warewise.service.preload.InventoryNormalizationService.NormalizedInventory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds normalized analysis contexts for evaluator tests.
 */
final class EvaluatorFixtures {

    static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    private static final AtomicLong RULE_IDS = new AtomicLong(100);

    private EvaluatorFixtures() {
    }

    /**
     * Two aisles, two racks, 25 positions, levels ABC. Aisle 2 is the FROZEN zone.
     */
    static WarehouseTemplate template() {
        return WarehouseTemplate.builder()
                .warehouseId("WH01")
                .numAisles(2)
                .racksPerAisle(2)
                .positionsPerRack(25)
                .levelNames("ABC")
                .defaultCapacity(1)
                .specialAreas(List.of(
                        new SpecialArea("RECV-01", LocationType.RECEIVING, 3, null),
                        new SpecialArea("STAGE-01", LocationType.STAGING, 2, null),
                        new SpecialArea("DOCK-01", LocationType.DOCK, 2, null)))
                .aisleZones(Map.of(2, "FROZEN"))
                .build();
    }

    static AnalysisContext context(List<InventoryRecord> inventory) {
        return context(inventory, template());
    }

    static AnalysisContext context(List<InventoryRecord> inventory, WarehouseTemplate template) {
        VirtualLocationModel model = template != null ? VirtualLocationModel.of(template) : null;
        NormalizedInventory normalized = new InventoryNormalizationService(new LocationCanonicalizer(), 500)
                .normalize(inventory, model, null, null);
        WarehouseContextResult warehouse = template != null
                ? WarehouseContextResult.explicit(template.warehouseId())
                : WarehouseContextResult.none(0, Map.of());
        return AnalysisContext.builder()
                .analysisId("test-run")
                .inventory(normalized.records())
                .propertiesByLocation(normalized.propertiesByLocation())
                .unitsByLocation(normalized.unitsByLocation())
                .warehouseContext(warehouse)
                .template(template)
                .locationModel(model)
                .patternResolver(new PatternResolver(
                        id -> model != null && model.warehouseId().equals(id) ? Optional.of(model) : Optional.empty(),
                        Caffeine.newBuilder().build()))
                .now(NOW)
                .build();
    }

    static InventoryRecord unit(String unitId, String location) {
        return InventoryRecord.builder().unitId(unitId).rawLocation(location).build();
    }

    static InventoryRecord unit(String unitId, String location, double hoursAgo) {
        return InventoryRecord.builder()
                .unitId(unitId)
                .rawLocation(location)
                .createdAt(NOW.minusMinutes(Math.round(hoursAgo * 60)))
                .build();
    }

    static RuleDefinition rule(RuleType type) {
        return rule(type, Map.of());
    }

    static RuleDefinition rule(RuleType type, Map<String, ?> conditions) {
        return RuleDefinition.builder()
                .id(RULE_IDS.incrementAndGet())
                .name(type.anomalyLabel())
                .ruleType(type.name())
                .conditions(RuleConditions.of(conditions))
                .active(true)
                .build();
    }
}
