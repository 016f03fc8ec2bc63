package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.LocationType;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags every unit whose location does not exist in the resolved warehouse, with the model's reason.
 * Units with no location at all belong to the missing-location rule.
 */
@Component
@Slf4j
public class InvalidLocationEvaluator extends AbstractRuleEvaluator {

    @Override
    public RuleType ruleType() {
        return RuleType.INVALID_LOCATION;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        String warehouseId = context.requireTemplate(ruleType()).warehouseId();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        int invalidLocations = 0;
        for (Map.Entry<String, List<InventoryRecord>> entry : context.getUnitsByLocation().entrySet()) {
            InventoryRecord first = entry.getValue().get(0);
            LocationProperties properties = context.propertiesOf(first);
            if (properties.exists() || properties.type() == LocationType.MISSING) {
                continue;
            }
            invalidLocations++;
            String description = "Location '" + entry.getKey() + "' not defined in warehouse " + warehouseId
                    + ": " + properties.reason();
            for (InventoryRecord unit : entry.getValue()) {
                anomalies.add(anomaly(rule, unit, description, Map.of(
                        "reason", properties.reason(),
                        "raw_location", unit.rawLocation().trim(),
                        "canonical_kind", String.valueOf(unit.canonicalKind()))));
            }
        }
        log.debug("Invalid locations: {} locations, {} units", invalidLocations, anomalies.size());
        return anomalies;
    }
}
