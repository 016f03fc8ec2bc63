package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.Priority;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags units in locations holding more units than their capacity.
 *
 * Modes:
 * <ul>
 *   <li>{@code legacy}: every unit of every over-capacity location</li>
 *   <li>{@code differentiated}: as legacy, but special areas get {@code special_area_priority}</li>
 *   <li>{@code statistical}: only when the number of over-capacity locations is significantly above
 *       what the warehouse's overall utilization would predict</li>
 * </ul>
 * Locations that do not exist are checked against the template's default capacity; the
 * precedence pass drops those findings for units the invalid-location rule has flagged.
 * Statistical mode only considers existing locations.
 */
@Component
@Slf4j
public class OvercapacityEvaluator extends AbstractRuleEvaluator {

    static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 1.0;
    static final double DEFAULT_MIN_SEVERITY_RATIO = 1.2;

    enum Mode { LEGACY, DIFFERENTIATED, STATISTICAL }

    @Override
    public RuleType ruleType() {
        return RuleType.OVERCAPACITY;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        int defaultCapacity = context.requireTemplate(ruleType()).defaultCapacity();
        Mode mode = mode(rule.conditions());

        List<OverCapacityLocation> over = new ArrayList<>();
        int existingLocations = 0;
        int unitsAtExisting = 0;
        for (Map.Entry<String, List<InventoryRecord>> entry : context.getUnitsByLocation().entrySet()) {
            LocationProperties properties = context.propertiesOf(entry.getValue().get(0));
            int capacity = properties.exists() ? properties.capacity() : defaultCapacity;
            if (properties.exists()) {
                existingLocations++;
                unitsAtExisting += entry.getValue().size();
            }
            if (entry.getValue().size() > capacity) {
                over.add(new OverCapacityLocation(entry.getKey(), properties, capacity, entry.getValue()));
            }
        }

        List<AnomalyRecord> anomalies = switch (mode) {
            case LEGACY -> flagAll(rule, over, false, Map.of());
            case DIFFERENTIATED -> flagAll(rule, over, true, Map.of());
            case STATISTICAL -> evaluateStatistically(rule,
                    over.stream().filter(o -> o.properties().exists()).toList(),
                    existingLocations, unitsAtExisting);
        };
        log.debug("Overcapacity ({}): {} locations over capacity, {} anomalies", mode, over.size(), anomalies.size());
        return anomalies;
    }

    private static Mode mode(RuleConditions conditions) {
        if (conditions.getBoolean("use_statistical_analysis", false)) {
            return Mode.STATISTICAL;
        }
        String mode = conditions.getString("mode", "legacy");
        try {
            return Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleContractViolationException("Rule parameter 'mode' must be legacy, differentiated or statistical, was '" + mode + "'", e);
        }
    }

    private List<AnomalyRecord> flagAll(RuleDefinition rule, List<OverCapacityLocation> locations,
                                        boolean differentiated, Map<String, String> extraEvidence) {
        Priority specialPriority = differentiated
                ? Priority.fromName(rule.conditions().getString("special_area_priority", rule.priority().name()))
                : rule.priority();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (OverCapacityLocation location : locations) {
            boolean special = location.properties().type().isSpecialArea();
            Priority priority = special ? specialPriority : rule.priority();
            Map<String, String> evidence = new HashMap<>(extraEvidence);
            evidence.put("unit_count", String.valueOf(location.units().size()));
            evidence.put("capacity", String.valueOf(location.capacity()));
            evidence.put("location_type", location.properties().type().name());
            if (!location.properties().exists()) {
                evidence.put("capacity_source", "template_default");
            }
            if (differentiated) {
                evidence.put("location_category", special ? "SPECIAL" : "STORAGE");
            }
            String description = "Location '" + location.code() + "' has " + location.units().size()
                    + " pallets (capacity: " + location.capacity() + ")";
            for (InventoryRecord unit : location.units()) {
                anomalies.add(anomaly(rule, unit, ruleType().anomalyLabel(), priority, description, evidence));
            }
        }
        return anomalies;
    }

    private List<AnomalyRecord> evaluateStatistically(RuleDefinition rule, List<OverCapacityLocation> over,
                                                      int distinctLocations, int units) {
        if (distinctLocations == 0 || over.isEmpty()) {
            return List.of();
        }
        RuleConditions conditions = rule.conditions();
        double significance = conditions.getNonNegativeDouble("significance_threshold", DEFAULT_SIGNIFICANCE_THRESHOLD);
        double minSeverity = conditions.getNonNegativeDouble("min_severity_ratio", DEFAULT_MIN_SEVERITY_RATIO);

        double expected = expectedOvercapacity(units, distinctLocations);
        double severity = over.size() / expected;
        boolean significant = severity >= minSeverity && over.size() >= significance * expected;
        log.debug("Statistical overcapacity: utilization={}, expected={}, actual={}, severity={}, significant={}",
                String.format(Locale.ROOT, "%.2f", (double) units / distinctLocations),
                String.format(Locale.ROOT, "%.2f", expected), over.size(),
                String.format(Locale.ROOT, "%.2f", severity), significant);
        if (!significant) {
            return List.of();
        }
        return flagAll(rule, over, false, Map.of(
                "expected_overcapacity_locations", String.format(Locale.ROOT, "%.2f", expected),
                "severity_ratio", String.format(Locale.ROOT, "%.2f", severity)));
    }

    /**
     * Number of over-capacity locations expected by chance at the given overall utilization.
     */
    static double expectedOvercapacity(int units, int distinctLocations) {
        double utilization = (double) units / distinctLocations;
        double expected;
        if (utilization <= 1.0) {
            expected = distinctLocations * utilization * utilization / 2;
            if (utilization < 0.3) {
                expected = Math.max(1.0, expected * 0.5);
            }
        } else {
            expected = distinctLocations * 0.3 * (utilization - 1) + distinctLocations * 0.1;
        }
        return expected;
    }

    private record OverCapacityLocation(String code, LocationProperties properties, int capacity, List<InventoryRecord> units) {}
}
