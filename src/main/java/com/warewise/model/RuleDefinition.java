package com.warewise.model;

import lombok.Builder;

import java.util.Optional;

/**
 * One configured rule. Owned by the rule configuration collaborator; immutable per evaluation.
 *
 * {@code ruleType} stays a string because rules arrive from external configuration and
 * may name a type this engine does not support; see {@link #resolvedType()}.
 * Precedence 1 is the highest level.
 */
@Builder(toBuilder = true)
public record RuleDefinition(
    long id,
    String name,
    String ruleType,
    RuleConditions conditions,
    Priority priority,
    Integer precedenceLevel,
    ExclusionRule exclusionRules,
    boolean active
) {

    public static final int LOWEST_PRECEDENCE = 4;

    public RuleDefinition {
        conditions = conditions == null ? RuleConditions.empty() : conditions;
        priority = priority == null ? Priority.MEDIUM : priority;
        if (precedenceLevel == null) {
            precedenceLevel = RuleType.fromName(ruleType)
                    .map(RuleType::defaultPrecedence)
                    .orElse(LOWEST_PRECEDENCE);
        }
        name = name == null || name.isBlank() ? String.valueOf(ruleType) : name;
    }

    public Optional<RuleType> resolvedType() {
        return RuleType.fromName(ruleType);
    }
}
