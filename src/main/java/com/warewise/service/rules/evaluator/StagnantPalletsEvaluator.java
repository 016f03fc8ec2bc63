package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationType;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags units that sat longer than {@code time_threshold_hours} in one of {@code location_types}.
 */
@Component
@Slf4j
public class StagnantPalletsEvaluator extends AbstractRuleEvaluator {

    static final double DEFAULT_THRESHOLD_HOURS = 6;
    static final List<String> DEFAULT_LOCATION_TYPES = List.of("RECEIVING");

    @Override
    public RuleType ruleType() {
        return RuleType.STAGNANT_PALLETS;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        RuleConditions conditions = rule.conditions();
        double threshold = conditions.getNonNegativeDouble("time_threshold_hours", DEFAULT_THRESHOLD_HOURS);
        Set<LocationType> types = parseLocationTypes("location_types",
                conditions.getStringList("location_types", DEFAULT_LOCATION_TYPES));

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (InventoryRecord record : context.getInventory()) {
            if (!types.contains(record.locationType())) {
                continue;
            }
            double hours = hoursSince(record.createdAt(), context.getNow());
            if (hours > threshold) {
                anomalies.add(anomaly(rule, record,
                        "Pallet in " + record.locationType() + " for " + formatHours(hours) + "h (threshold: " + formatHours(threshold) + "h)",
                        Map.of("hours_stagnant", formatHours(hours),
                                "threshold_hours", formatHours(threshold),
                                "location_type", record.locationType().name())));
            }
        }
        log.debug("Stagnant pallets: {} of {} units over {}h in {}", anomalies.size(), context.getInventory().size(), threshold, types);
        return anomalies;
    }
}
