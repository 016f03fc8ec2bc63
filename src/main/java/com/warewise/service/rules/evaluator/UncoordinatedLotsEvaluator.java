package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationType;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds lot stragglers: members still in a transient location although at least
 * {@code completion_threshold} of their lot already reached final storage.
 * Single-unit lots never qualify.
 */
@Component
@Slf4j
public class UncoordinatedLotsEvaluator extends AbstractRuleEvaluator {

    static final double DEFAULT_COMPLETION_THRESHOLD = 0.8;
    static final List<String> DEFAULT_TRANSIENT_TYPES = List.of("RECEIVING", "STAGING", "TRANSITIONAL");

    @Override
    public RuleType ruleType() {
        return RuleType.UNCOORDINATED_LOTS;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        RuleConditions conditions = rule.conditions();
        double threshold = conditions.getNonNegativeDouble("completion_threshold", DEFAULT_COMPLETION_THRESHOLD);
        Set<LocationType> transientTypes = parseLocationTypes("location_types",
                conditions.getStringList("location_types", DEFAULT_TRANSIENT_TYPES));

        Map<String, List<InventoryRecord>> lots = new LinkedHashMap<>();
        for (InventoryRecord record : context.getInventory()) {
            if (record.lotId() != null && !record.lotId().isBlank()) {
                lots.computeIfAbsent(record.lotId().trim(), k -> new ArrayList<>()).add(record);
            }
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        lots.forEach((lotId, members) -> {
            if (members.size() < 2) {
                return;
            }
            long stored = members.stream().filter(m -> m.locationType() != null && m.locationType().isFinalStorage()).count();
            double ratio = (double) stored / members.size();
            if (ratio < threshold) {
                return;
            }
            for (InventoryRecord member : members) {
                if (transientTypes.contains(member.locationType())) {
                    anomalies.add(anomaly(rule, member,
                            String.format(Locale.ROOT, "%.0f%% of lot '%s' stored, but this pallet still in %s",
                                    ratio * 100, lotId, member.locationType()),
                            Map.of("lot_id", lotId,
                                    "completion_ratio", String.format(Locale.ROOT, "%.2f", ratio),
                                    "lot_size", String.valueOf(members.size()),
                                    "location_type", member.locationType().name())));
                }
            }
        });
        log.debug("Uncoordinated lots: {} stragglers across {} lots", anomalies.size(), lots.size());
        return anomalies;
    }
}
