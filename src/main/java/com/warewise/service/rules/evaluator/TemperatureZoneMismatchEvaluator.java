package com.warewise.service.rules.evaluator;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import com.warewise.model.TemperatureClass;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.preload.AnalysisContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infers a product's temperature class from keywords in its description and flags it when the
 * zone it sits in is declared (or named) for a different class. Ambient products are never flagged.
 */
@Component
@Slf4j
public class TemperatureZoneMismatchEvaluator extends AbstractRuleEvaluator {

    static final Map<String, List<String>> DEFAULT_KEYWORDS;

    static {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("FROZEN", List.of("FROZEN", "FREEZER", "ICE CREAM"));
        keywords.put("REFRIGERATED", List.of("REFRIGERATED", "CHILLED", "DAIRY", "FRESH"));
        DEFAULT_KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    @Override
    public RuleType ruleType() {
        return RuleType.TEMPERATURE_ZONE_MISMATCH;
    }

    @Override
    public List<AnomalyRecord> evaluate(RuleDefinition rule, AnalysisContext context) {
        WarehouseTemplate template = context.requireTemplate(ruleType());
        Map<TemperatureClass, List<String>> vocabulary =
                vocabulary(rule.conditions().getStringListMap("product_keywords", DEFAULT_KEYWORDS));

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (InventoryRecord record : context.getInventory()) {
            if (record.description() == null || record.description().isBlank()) {
                continue;
            }
            LocationProperties properties = context.propertiesOf(record);
            if (!properties.exists()) {
                continue;
            }
            TemperatureClass productClass = classify(record.description(), vocabulary);
            if (productClass == TemperatureClass.AMBIENT) {
                continue;
            }
            TemperatureClass zoneClass = template.temperatureClassOf(properties.zone());
            if (zoneClass != productClass) {
                anomalies.add(anomaly(rule, record,
                        "Temperature-sensitive product '" + record.description() + "' (" + productClass + ") in "
                                + properties.zone() + " zone (" + zoneClass + ")",
                        Map.of("product_class", productClass.name(),
                                "zone", properties.zone(),
                                "zone_class", zoneClass.name())));
            }
        }
        log.debug("Temperature zone mismatches: {}", anomalies.size());
        return anomalies;
    }

    /**
     * First class (in declaration order FROZEN, REFRIGERATED) whose keyword appears in the description.
     */
    static TemperatureClass classify(String description, Map<TemperatureClass, List<String>> vocabulary) {
        String text = description.toUpperCase(Locale.ROOT);
        for (Map.Entry<TemperatureClass, List<String>> entry : vocabulary.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (!keyword.isBlank() && text.contains(keyword.toUpperCase(Locale.ROOT))) {
                    return entry.getKey();
                }
            }
        }
        return TemperatureClass.AMBIENT;
    }

    private static Map<TemperatureClass, List<String>> vocabulary(Map<String, List<String>> raw) {
        Map<TemperatureClass, List<String>> vocabulary = new EnumMap<>(TemperatureClass.class);
        raw.forEach((name, keywords) -> {
            try {
                vocabulary.put(TemperatureClass.valueOf(name.trim().toUpperCase(Locale.ROOT)), keywords);
            } catch (IllegalArgumentException e) {
                throw new RuleContractViolationException("Rule parameter 'product_keywords' has unknown temperature class '" + name + "'", e);
            }
        });
        vocabulary.remove(TemperatureClass.AMBIENT);
        return vocabulary;
    }
}
