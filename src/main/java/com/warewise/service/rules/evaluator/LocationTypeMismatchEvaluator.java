package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-checks a caller-supplied location type column against the resolved type.
 * Disabled unless {@code app.engine.rules.location-type-mismatch.enabled} is set; most feeds
 * lack the column and the resolved type is authoritative.
 */
@Component
@Slf4j
public class LocationTypeMismatchEvaluator extends AbstractRuleEvaluator {

    @Override
    public RuleType ruleType() {
        return RuleType.LOCATION_TYPE_MISMATCH;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        context.requireTemplate(ruleType());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (InventoryRecord record : context.getInventory()) {
            String declared = record.declaredLocationType();
            if (declared == null || declared.isBlank()) {
                continue;
            }
            LocationProperties properties = context.propertiesOf(record);
            if (!properties.exists()) {
                continue;
            }
            String normalized = declared.trim().toUpperCase(Locale.ROOT);
            if (!normalized.equals(properties.type().name())) {
                anomalies.add(anomaly(rule, record,
                        "Location '" + record.canonicalLocation() + "' declared as " + normalized
                                + " but resolves to " + properties.type(),
                        Map.of("declared_type", normalized, "resolved_type", properties.type().name())));
            }
        }
        log.debug("Location type mismatches: {}", anomalies.size());
        return anomalies;
    }
}
