package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.PatternSet;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Stagnation in transitional locations, which should clear faster than receiving.
 *
 * Transitional locations come from the warehouse's resolved patterns, unless the rule pins a
 * {@code location_pattern} wildcard such as {@code AISLE*}.
 */
@Component
@Slf4j
public class LocationSpecificStagnantEvaluator extends AbstractRuleEvaluator {

    static final double DEFAULT_THRESHOLD_HOURS = 4;

    @Override
    public RuleType ruleType() {
        return RuleType.LOCATION_SPECIFIC_STAGNANT;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        RuleConditions conditions = rule.conditions();
        double threshold = conditions.getNonNegativeDouble("time_threshold_hours", DEFAULT_THRESHOLD_HOURS);
        String wildcard = conditions.getString("location_pattern", null);

        Predicate<String> inScope;
        String source;
        if (wildcard != null && !wildcard.isBlank()) {
            Pattern pattern = wildcardPattern(wildcard);
            inScope = code -> pattern.matcher(code).matches();
            source = "rule_pattern";
        } else {
            PatternSet patterns = context.patternsFor(ruleType());
            inScope = patterns::isTransitional;
            source = patterns.source().label();
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (InventoryRecord record : context.getInventory()) {
            if (!record.hasLocation() || !inScope.test(record.canonicalLocation())) {
                continue;
            }
            double hours = hoursSince(record.createdAt(), context.getNow());
            if (hours > threshold) {
                anomalies.add(anomaly(rule, record,
                        "Pallet stuck in " + record.canonicalLocation() + " for " + formatHours(hours) + "h",
                        Map.of("hours_stagnant", formatHours(hours),
                                "threshold_hours", formatHours(threshold),
                                "pattern_source", source)));
            }
        }
        log.debug("Location-specific stagnant: {} units over {}h (patterns from {})", anomalies.size(), threshold, source);
        return anomalies;
    }

    /**
     * {@code *} matches any run of characters, {@code ?} exactly one; everything else is literal.
     */
    static Pattern wildcardPattern(String wildcard) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : wildcard.trim().toUpperCase(Locale.ROOT).toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
