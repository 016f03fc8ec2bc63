package com.warewise.model;

public enum ConfidenceTier {
    EXPLICIT,
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    public static ConfidenceTier fromScore(double matchScore, double minimumScore) {
        if (matchScore <= 0 || matchScore < minimumScore) {
            return NONE;
        }
        if (matchScore >= 0.9) {
            return VERY_HIGH;
        }
        if (matchScore >= 0.7) {
            return HIGH;
        }
        if (matchScore >= 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
