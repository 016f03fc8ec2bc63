package com.warewise.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one analysis run hands back to its caller: the findings plus enough
 * metadata to tell the user which rules failed and how sure the warehouse match was.
 */
public record AnalysisReport(
    String analysisId,
    List<AnomalyRecord> anomalies,
    WarehouseContextResult context,
    List<RuleExecutionResult> ruleResults,
    ExclusionStats exclusionStats,
    TimingBreakdown timing,
    boolean cancelled
) {

    public AnalysisReport {
        anomalies = List.copyOf(anomalies);
        ruleResults = List.copyOf(ruleResults);
    }

    public List<RuleExecutionResult> failedRules() {
        return ruleResults.stream().filter(r -> r.status() == RuleExecutionStatus.FAILED).toList();
    }

    public long anomalyCount(RuleType ruleType) {
        return anomalies.stream().filter(a -> a.ruleType() == ruleType).count();
    }

    /**
     * Time spent in each stage of the run.
     */
    public record TimingBreakdown(
            long contextMs,
            long normalizationMs,
            long rulesMs,
            long totalMs
    ) {
        public static final TimingBreakdown ZERO = new TimingBreakdown(0, 0, 0, 0);

        /**
         * Create breakdown with percentages.
         */
        public Map<String, Object> toDetailedMap() {
            long total = totalMs > 0 ? totalMs : 1;
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("contextMs", contextMs);
            map.put("contextPercent", String.format("%.1f%%", (contextMs * 100.0) / total));
            map.put("normalizationMs", normalizationMs);
            map.put("normalizationPercent", String.format("%.1f%%", (normalizationMs * 100.0) / total));
            map.put("rulesMs", rulesMs);
            map.put("rulesPercent", String.format("%.1f%%", (rulesMs * 100.0) / total));
            map.put("totalMs", totalMs);
            return map;
        }
    }
}
