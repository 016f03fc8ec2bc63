package com.warewise.model;

/**
 * Per-rule execution metadata returned alongside the anomalies.
 * {@code anomalyCount} is the evaluator's raw output, before exclusions.
 */
public record RuleExecutionResult(
    long ruleId,
    String ruleName,
    String ruleType,
    RuleExecutionStatus status,
    int anomalyCount,
    long durationMs,
    String errorMessage
) {

    public static RuleExecutionResult success(RuleDefinition rule, int anomalyCount, long durationMs) {
        return new RuleExecutionResult(rule.id(), rule.name(), rule.ruleType(), RuleExecutionStatus.SUCCESS,
                anomalyCount, durationMs, null);
    }

    public static RuleExecutionResult failed(RuleDefinition rule, long durationMs, String errorMessage) {
        return new RuleExecutionResult(rule.id(), rule.name(), rule.ruleType(), RuleExecutionStatus.FAILED,
                0, durationMs, errorMessage);
    }

    public static RuleExecutionResult skipped(RuleDefinition rule, String reason) {
        return new RuleExecutionResult(rule.id(), rule.name(), rule.ruleType(), RuleExecutionStatus.SKIPPED,
                0, 0, reason);
    }

    public static RuleExecutionResult cancelled(RuleDefinition rule) {
        return new RuleExecutionResult(rule.id(), rule.name(), rule.ruleType(), RuleExecutionStatus.CANCELLED,
                0, 0, "analysis cancelled before rule started");
    }

    public boolean success() {
        return status == RuleExecutionStatus.SUCCESS;
    }
}
