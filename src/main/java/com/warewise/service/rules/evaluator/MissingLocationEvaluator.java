package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class MissingLocationEvaluator extends AbstractRuleEvaluator {

    @Override
    public RuleType ruleType() {
        return RuleType.MISSING_LOCATION;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (InventoryRecord record : context.getInventory()) {
            if (!record.hasLocation()) {
                anomalies.add(anomaly(rule, record, "Pallet has no location assigned",
                        Map.of("reason", "empty_location")));
            }
        }
        return anomalies;
    }
}
