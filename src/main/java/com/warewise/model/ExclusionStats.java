package com.warewise.model;

import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of the precedence pass.
 *
 * @param excludedByRuleType number of anomalies dropped, keyed by the rule type that produced them
 */
public record ExclusionStats(
    int totalBefore,
    int totalAfter,
    Map<RuleType, Integer> excludedByRuleType
) {

    public static final ExclusionStats NONE = new ExclusionStats(0, 0, Map.of());

    public ExclusionStats {
        excludedByRuleType = excludedByRuleType == null ? Map.of() : Map.copyOf(excludedByRuleType);
    }

    public static ExclusionStats unchanged(int total) {
        return new ExclusionStats(total, total, Map.of());
    }

    public int totalExcluded() {
        return totalBefore - totalAfter;
    }

    public Map<RuleType, Integer> sortedByRuleType() {
        return new TreeMap<>(excludedByRuleType);
    }
}
