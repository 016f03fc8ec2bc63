package com.warewise.model;

import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * One finding produced by a rule. Output only; carries no identity across runs.
 */
public record AnomalyRecord(
    String unitId,
    String canonicalLocation,
    String anomalyType,
    Priority priority,
    long ruleId,
    RuleType ruleType,
    int precedenceLevel,
    String description,
    Map<String, String> evidence
) {

    /**
     * Stable report order: precedence, unit, anomaly type, then remaining fields as tie-breakers.
     */
    public static final Comparator<AnomalyRecord> REPORT_ORDER = Comparator
            .comparingInt(AnomalyRecord::precedenceLevel)
            .thenComparing(AnomalyRecord::unitId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AnomalyRecord::anomalyType)
            .thenComparingLong(AnomalyRecord::ruleId)
            .thenComparing(AnomalyRecord::canonicalLocation, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AnomalyRecord::description, Comparator.nullsFirst(Comparator.naturalOrder()));

    public AnomalyRecord {
        // sorted keys keep serialized output byte-identical between runs
        evidence = evidence == null ? Map.of() : java.util.Collections.unmodifiableMap(new TreeMap<>(evidence));
    }
}
