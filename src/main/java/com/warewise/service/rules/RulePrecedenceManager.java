package com.warewise.service.rules;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.ExclusionRule;
import com.warewise.model.ExclusionStats;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Suppresses anomalies that restate a root cause already reported by a higher-precedence rule.
 *
 * Runs after every evaluator has finished. Rules are visited by precedence level (1 first), then
 * id; an anomaly is dropped when its unit was already flagged by a rule type its exclusion rule
 * names. Rules without {@code exclusion_rules} use the built-in defaults. Only kept anomalies
 * count as flags for later rules.
 */
@Component
@Slf4j
public class RulePrecedenceManager {

    static final Map<RuleType, ExclusionRule> DEFAULT_EXCLUSIONS = Map.of(
            RuleType.OVERCAPACITY, ExclusionRule.of(Set.of(RuleType.INVALID_LOCATION, RuleType.DATA_INTEGRITY),
                    "invalid or corrupt locations have no meaningful capacity"),
            RuleType.TEMPERATURE_ZONE_MISMATCH, ExclusionRule.of(Set.of(RuleType.INVALID_LOCATION),
                    "zone of an invalid location is unknown"),
            RuleType.LOCATION_TYPE_MISMATCH, ExclusionRule.of(Set.of(RuleType.INVALID_LOCATION),
                    "type of an invalid location is unknown"));

    public static final Comparator<RuleDefinition> PRECEDENCE_ORDER = Comparator
            .comparingInt(RuleDefinition::precedenceLevel)
            .thenComparingLong(RuleDefinition::id);

    private final boolean enabled;
    private final boolean strict;

    public RulePrecedenceManager(
            @Value("${app.engine.precedence.enabled:true}") boolean enabled,
            @Value("${app.engine.precedence.strict:false}") boolean strict) {
        this.enabled = enabled;
        this.strict = strict;
        log.info("RulePrecedenceManager initialized: enabled={}, strict={}", enabled, strict);
    }

    /**
     * @param anomaliesByRule raw evaluator output of every rule that ran successfully
     */
    public PrecedenceOutcome apply(Map<RuleDefinition, List<AnomalyRecord>> anomaliesByRule) {
        List<AnomalyRecord> all = new ArrayList<>();
        anomaliesByRule.values().forEach(all::addAll);
        if (!enabled) {
            return new PrecedenceOutcome(all, ExclusionStats.unchanged(all.size()));
        }

        List<RuleDefinition> ordered = anomaliesByRule.keySet().stream().sorted(PRECEDENCE_ORDER).toList();
        Map<String, List<Flag>> flagsByUnit = new HashMap<>();
        Map<RuleType, Integer> excludedByType = new EnumMap<>(RuleType.class);
        List<AnomalyRecord> kept = new ArrayList<>();

        for (RuleDefinition rule : ordered) {
            Optional<ExclusionRule> exclusion = exclusionFor(rule);
            List<AnomalyRecord> keptForRule = new ArrayList<>();
            for (AnomalyRecord anomaly : anomaliesByRule.get(rule)) {
                if (isExcluded(anomaly, rule, exclusion, flagsByUnit)) {
                    excludedByType.merge(anomaly.ruleType(), 1, Integer::sum);
                } else {
                    keptForRule.add(anomaly);
                }
            }
            for (AnomalyRecord anomaly : keptForRule) {
                if (anomaly.unitId() != null) {
                    flagsByUnit.computeIfAbsent(anomaly.unitId(), k -> new ArrayList<>())
                            .add(new Flag(anomaly.ruleType(), rule.precedenceLevel()));
                }
            }
            kept.addAll(keptForRule);
        }

        ExclusionStats stats = new ExclusionStats(all.size(), kept.size(), excludedByType);
        if (stats.totalExcluded() > 0) {
            log.info("Precedence pass excluded {} of {} anomalies: {}", stats.totalExcluded(), all.size(), stats.sortedByRuleType());
        }
        return new PrecedenceOutcome(kept, stats);
    }

    private static Optional<ExclusionRule> exclusionFor(RuleDefinition rule) {
        if (rule.exclusionRules() != null) {
            return Optional.of(rule.exclusionRules());
        }
        return rule.resolvedType().map(DEFAULT_EXCLUSIONS::get);
    }

    private boolean isExcluded(AnomalyRecord anomaly, RuleDefinition rule, Optional<ExclusionRule> exclusion,
                               Map<String, List<Flag>> flagsByUnit) {
        List<Flag> flags = anomaly.unitId() != null ? flagsByUnit.get(anomaly.unitId()) : null;
        if (flags == null) {
            return false;
        }
        for (Flag flag : flags) {
            if (exclusion.isPresent() && exclusion.get().excludes(flag.ruleType(), flag.precedenceLevel())) {
                return true;
            }
            if (strict && flag.precedenceLevel() < rule.precedenceLevel()) {
                return true;
            }
        }
        return false;
    }

    private record Flag(RuleType ruleType, int precedenceLevel) {}

    public record PrecedenceOutcome(List<AnomalyRecord> anomalies, ExclusionStats stats) {}
}
