package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.CanonicalKind;
import com.warewise.model.InventoryRecord;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Basic data-quality defects, each with its own anomaly type:
 * duplicate unit ids (every occurrence), impossible location strings
 * (too long or containing corrupt characters), and location codes no parser understands.
 */
@Component
@Slf4j
public class DataIntegrityEvaluator extends AbstractRuleEvaluator {

    static final String DUPLICATE_SCAN = "Duplicate Scan";
    static final String IMPOSSIBLE_LOCATION = "Impossible Location";
    static final String UNPARSEABLE_LOCATION = "Unparseable Location";

    static final int DEFAULT_MAX_LOCATION_LENGTH = 20;
    private static final String CORRUPT_CHARACTERS = "@#!?";

    @Override
    public RuleType ruleType() {
        return RuleType.DATA_INTEGRITY;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        RuleConditions conditions = rule.conditions();
        boolean checkDuplicates = conditions.getBoolean("check_duplicate_scans", true);
        boolean checkImpossible = conditions.getBoolean("check_impossible_locations", true);
        boolean checkUnparseable = conditions.getBoolean("check_unparseable_locations", true);
        int maxLength = conditions.getInt("max_location_length", DEFAULT_MAX_LOCATION_LENGTH);

        List<InventoryRecord> inventory = context.getInventory();
        List<AnomalyRecord> anomalies = new ArrayList<>();

        if (checkDuplicates) {
            Map<String, Integer> occurrences = new HashMap<>();
            for (InventoryRecord record : inventory) {
                if (record.unitId() != null) {
                    occurrences.merge(record.unitId(), 1, Integer::sum);
                }
            }
            for (InventoryRecord record : inventory) {
                Integer count = record.unitId() != null ? occurrences.get(record.unitId()) : null;
                if (count != null && count > 1) {
                    anomalies.add(anomaly(rule, record, DUPLICATE_SCAN, rule.priority(),
                            "Pallet ID '" + record.unitId() + "' appears multiple times in data",
                            Map.of("reason", "duplicate_unit_id", "occurrences", String.valueOf(count))));
                }
            }
        }

        for (InventoryRecord record : inventory) {
            if (!record.hasLocation()) {
                continue;
            }
            String location = record.rawLocation().trim();
            if (checkImpossible && isImpossible(location, maxLength)) {
                anomalies.add(anomaly(rule, record, IMPOSSIBLE_LOCATION, rule.priority(),
                        "Location '" + location + "' appears to be invalid or corrupted",
                        Map.of("reason", location.length() > maxLength ? "too_long" : "invalid_characters",
                                "raw_location", location)));
            } else if (checkUnparseable && record.canonicalKind() == CanonicalKind.UNPARSEABLE
                    && !context.propertiesOf(record).exists()) {
                anomalies.add(anomaly(rule, record, UNPARSEABLE_LOCATION, rule.priority(),
                        "Location '" + location + "' does not match any known location format",
                        Map.of("reason", "unparseable", "raw_location", location)));
            }
        }
        log.debug("Data integrity: {} anomalies", anomalies.size());
        return anomalies;
    }

    private static boolean isImpossible(String location, int maxLength) {
        if (location.length() > maxLength) {
            return true;
        }
        for (char c : CORRUPT_CHARACTERS.toCharArray()) {
            if (location.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }
}
