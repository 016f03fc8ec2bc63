package com.warewise.service.rules;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;

import java.util.List;

/**
 * One anomaly detector per {@link RuleType}.
 *
 * Implementations skip bad rows rather than throw. They may fail the whole rule with
 * {@link com.warewise.model.MissingConfigurationException} when a required input (warehouse
 * context, template) is absent, and raise {@link com.warewise.model.RuleContractViolationException}
 * for a misconfigured parameter.
 */
public interface RuleEvaluator {

    RuleType ruleType();

    List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context);
}
