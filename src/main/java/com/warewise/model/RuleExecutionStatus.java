package com.warewise.model;

public enum RuleExecutionStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    CANCELLED
}
