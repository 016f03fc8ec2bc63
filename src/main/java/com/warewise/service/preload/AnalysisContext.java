package com.warewise.service.preload;

import com.warewise.model.CancellationToken;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.MissingConfigurationException;
import com.warewise.model.PatternSet;
import com.warewise.model.RuleType;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.VirtualLocationModel;
import com.warewise.service.pattern.PatternResolver;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything an evaluator may read during one analysis run.
 * Built once after normalization and read-only from then on, so evaluators can share it across threads.
 */
@Getter
@Builder
public class AnalysisContext {

    private final String analysisId;
    private final List<InventoryRecord> inventory;
    private final Map<String, LocationProperties> propertiesByLocation;
    /** Units grouped by canonical location, in inventory order. Units without a location are left out. */
    private final Map<String, List<InventoryRecord>> unitsByLocation;
    private final WarehouseContextResult warehouseContext;
    private final WarehouseTemplate template;
    private final VirtualLocationModel locationModel;
    private final PatternResolver patternResolver;
    private final LocalDateTime now;
    @Builder.Default
    private final CancellationToken cancellationToken = CancellationToken.none();

    public String getWarehouseId() {
        return warehouseContext != null ? warehouseContext.warehouseId() : null;
    }

    public boolean hasTemplate() {
        return template != null;
    }

    /**
     * Template of the resolved warehouse, for rules that cannot run without one.
     */
    public WarehouseTemplate requireTemplate(RuleType ruleType) {
        if (template != null) {
            return template;
        }
        if (getWarehouseId() == null) {
            throw new MissingConfigurationException(ruleType + " requires a warehouse context but none was resolved");
        }
        throw new MissingConfigurationException(ruleType + " requires a template for warehouse " + getWarehouseId());
    }

    public VirtualLocationModel requireLocationModel(RuleType ruleType) {
        requireTemplate(ruleType);
        return locationModel;
    }

    public PatternSet patternsFor(RuleType ruleType) {
        return patternResolver.getPatterns(getWarehouseId(), ruleType);
    }

    /**
     * Resolved properties of a unit's location; {@link LocationProperties#missing()} for units without one.
     */
    public LocationProperties propertiesOf(InventoryRecord record) {
        if (!record.hasLocation()) {
            return LocationProperties.missing();
        }
        LocationProperties properties = propertiesByLocation != null ? propertiesByLocation.get(record.canonicalLocation()) : null;
        return properties != null ? properties : LocationProperties.malformed(record.reportedLocation());
    }
}
