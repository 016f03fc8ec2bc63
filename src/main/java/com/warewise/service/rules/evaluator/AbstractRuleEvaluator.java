package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationType;
import com.warewise.model.Priority;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.rules.RuleEvaluator;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shared helpers for building anomalies and reading common parameters.
 */
public abstract class AbstractRuleEvaluator implements RuleEvaluator {

    protected AnomalyRecord anomaly(RuleDefinition rule, InventoryRecord record, String description,
                                    Map<String, String> evidence) {
        return anomaly(rule, record, ruleType().anomalyLabel(), rule.priority(), description, evidence);
    }

    protected AnomalyRecord anomaly(RuleDefinition rule, InventoryRecord record, String anomalyType,
                                    Priority priority, String description, Map<String, String> evidence) {
        return new AnomalyRecord(
                record.unitId(),
                record.reportedLocation(),
                anomalyType,
                priority,
                rule.id(),
                ruleType(),
                rule.precedenceLevel(),
                description,
                evidence);
    }

    /**
     * Hours between creation and now, or -1 when the record has no timestamp.
     */
    protected static double hoursSince(LocalDateTime createdAt, LocalDateTime now) {
        if (createdAt == null || now == null) {
            return -1;
        }
        return Duration.between(createdAt, now).toMillis() / 3_600_000.0;
    }

    protected static String formatHours(double hours) {
        return String.format(Locale.ROOT, "%.1f", hours);
    }

    protected static Set<LocationType> parseLocationTypes(String key, List<String> names) {
        Set<LocationType> types = EnumSet.noneOf(LocationType.class);
        for (String name : names) {
            try {
                types.add(LocationType.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new RuleContractViolationException("Rule parameter '" + key + "' has unknown location type '" + name + "'", e);
            }
        }
        return types;
    }
}
