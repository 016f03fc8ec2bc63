package com.warewise.model;

import java.util.Set;

/**
 * Suppresses a rule's anomaly for a unit already flagged by one of the listed rule types.
 *
 * @param excludeIfFlaggedBy rule types whose findings take precedence
 * @param maxPrecedence      only findings from rules at this precedence level or higher
 *                           (numerically lower or equal) count; {@code null} means any level
 */
public record ExclusionRule(
    Set<RuleType> excludeIfFlaggedBy,
    Integer maxPrecedence,
    String reason
) {

    public ExclusionRule {
        excludeIfFlaggedBy = excludeIfFlaggedBy == null ? Set.of() : Set.copyOf(excludeIfFlaggedBy);
    }

    public static ExclusionRule of(Set<RuleType> excludeIfFlaggedBy, String reason) {
        return new ExclusionRule(excludeIfFlaggedBy, null, reason);
    }

    public boolean excludes(RuleType flaggedBy, int flaggedAtPrecedence) {
        if (!excludeIfFlaggedBy.contains(flaggedBy)) {
            return false;
        }
        return maxPrecedence == null || flaggedAtPrecedence <= maxPrecedence;
    }
}
