package com.warewise.repository;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warewise.model.ExclusionRule;
import com.warewise.model.Priority;
import com.warewise.model.RuleConditions;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads rule definitions from JSON.
 *
 * {@code conditions} may be a JSON object or a string holding JSON, as older rule exports store it.
 * Unknown {@code rule_type} values are kept; they fail as a single rule at evaluation time.
 */
@Component
@Slf4j
public class RuleDefinitionLoader {

    private static final TypeReference<List<RuleJson>> RULE_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> CONDITIONS = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String defaultRulesLocation;

    public RuleDefinitionLoader(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            @Value("${app.engine.rules.location:classpath:rules/default-rules.json}") String defaultRulesLocation) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.defaultRulesLocation = defaultRulesLocation;
    }

    public List<RuleDefinition> loadDefaults() {
        Resource resource = resourceLoader.getResource(defaultRulesLocation);
        try (InputStream in = resource.getInputStream()) {
            List<RuleDefinition> rules = objectMapper.readValue(in, RULE_LIST).stream().map(this::toRule).toList();
            log.info("Loaded {} rule definitions from {}", rules.size(), defaultRulesLocation);
            return rules;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load rule definitions: " + defaultRulesLocation, e);
        }
    }

    public List<RuleDefinition> parse(String json) {
        try {
            return objectMapper.readValue(json, RULE_LIST).stream().map(this::toRule).toList();
        } catch (JsonProcessingException e) {
            throw new RuleContractViolationException("Malformed rule definition JSON: " + e.getOriginalMessage(), e);
        }
    }

    private RuleDefinition toRule(RuleJson json) {
        if (json.id() == null) {
            throw new RuleContractViolationException("Rule definition without id: " + json.name());
        }
        return RuleDefinition.builder()
                .id(json.id())
                .name(json.name())
                .ruleType(json.ruleType())
                .conditions(toConditions(json))
                .priority(Priority.fromName(json.priority()))
                .precedenceLevel(json.precedenceLevel())
                .exclusionRules(toExclusion(json))
                .active(json.active() == null || json.active())
                .build();
    }

    private RuleConditions toConditions(RuleJson json) {
        JsonNode node = json.conditions();
        if (node == null || node.isNull()) {
            return RuleConditions.empty();
        }
        try {
            if (node.isTextual()) {
                String text = node.asText();
                return text.isBlank() ? RuleConditions.empty() : RuleConditions.of(objectMapper.readValue(text, CONDITIONS));
            }
            if (node.isObject()) {
                return RuleConditions.of(objectMapper.convertValue(node, CONDITIONS));
            }
        } catch (JsonProcessingException e) {
            throw new RuleContractViolationException("Rule " + json.id() + " has malformed conditions: " + e.getOriginalMessage(), e);
        }
        throw new RuleContractViolationException("Rule " + json.id() + " conditions must be an object");
    }

    private ExclusionRule toExclusion(RuleJson json) {
        ExclusionJson exclusion = json.exclusionRules();
        if (exclusion == null || exclusion.excludeIfFlaggedBy() == null || exclusion.excludeIfFlaggedBy().isEmpty()) {
            return null;
        }
        Set<RuleType> types = EnumSet.noneOf(RuleType.class);
        for (String name : exclusion.excludeIfFlaggedBy()) {
            Optional<RuleType> type = RuleType.fromName(name);
            if (type.isPresent()) {
                types.add(type.get());
            } else {
                log.warn("Rule {} excludes unknown rule type '{}', ignoring", json.id(), name);
            }
        }
        return new ExclusionRule(types, exclusion.maxPrecedence(), exclusion.reason());
    }

    record RuleJson(
            @JsonProperty("id") Long id,
            @JsonProperty("name") String name,
            @JsonProperty("rule_type") String ruleType,
            @JsonProperty("conditions") JsonNode conditions,
            @JsonProperty("priority") String priority,
            @JsonProperty("precedence_level") Integer precedenceLevel,
            @JsonProperty("exclusion_rules") ExclusionJson exclusionRules,
            @JsonProperty("is_active") Boolean active
    ) {}

    record ExclusionJson(
            @JsonProperty("exclude_if_flagged_by") List<String> excludeIfFlaggedBy,
            @JsonProperty("max_precedence") Integer maxPrecedence,
            @JsonProperty("reason") String reason
    ) {}
}
