package com.warewise.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warewise.model.Priority;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleDefinitionLoaderTest {

    private RuleDefinitionLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RuleDefinitionLoader(
                new DefaultResourceLoader(),
                new ObjectMapper().registerModule(new JavaTimeModule()),
                "classpath:rules/default-rules.json");
    }

    @Test
    @DisplayName("Should load one bundled rule per rule type")
    void shouldLoadBundledRules() {
        // When
        List<RuleDefinition> rules = loader.loadDefaults();

        // Then
        assertThat(rules).hasSize(9);
        assertThat(rules).extracting(RuleDefinition::resolvedType)
                .allSatisfy(type -> assertThat(type).isPresent());
        assertThat(rules.stream().map(r -> r.resolvedType().orElseThrow()).distinct())
                .containsExactlyInAnyOrder(RuleType.values());
        assertThat(rules).allMatch(RuleDefinition::active);
    }

    @Test
    @DisplayName("Should read conditions, priority, precedence and exclusions of a bundled rule")
    void shouldMapBundledRuleFields() {
        // When
        RuleDefinition overcapacity = loader.loadDefaults().stream()
                .filter(r -> r.id() == 3)
                .findFirst()
                .orElseThrow();

        // Then
        assertThat(overcapacity.ruleType()).isEqualTo("OVERCAPACITY");
        assertThat(overcapacity.priority()).isEqualTo(Priority.HIGH);
        assertThat(overcapacity.precedenceLevel()).isEqualTo(2);
        assertThat(overcapacity.conditions().getString("mode", null)).isEqualTo("differentiated");
        assertThat(overcapacity.exclusionRules()).isNotNull();
        assertThat(overcapacity.exclusionRules().excludeIfFlaggedBy())
                .containsExactlyInAnyOrder(RuleType.INVALID_LOCATION, RuleType.DATA_INTEGRITY);
    }

    @Test
    @DisplayName("Should accept conditions stored as a JSON string")
    void shouldParseConditionsGivenAsString() {
        // Given
        String json = """
                [{"id": 10, "rule_type": "STAGNANT_PALLETS",
                  "conditions": "{\\"time_threshold_hours\\": 12, \\"location_types\\": [\\"STAGING\\"]}"}]
                """;

        // When
        RuleDefinition rule = loader.parse(json).get(0);

        // Then
        assertThat(rule.conditions().getDouble("time_threshold_hours", 0)).isEqualTo(12.0);
        assertThat(rule.conditions().getStringList("location_types", List.of())).containsExactly("STAGING");
    }

    @Test
    @DisplayName("Should default missing fields from the rule type")
    void shouldApplyDefaults() {
        // When
        RuleDefinition rule = loader.parse("[{\"id\": 11, \"rule_type\": \"invalid-location\"}]").get(0);

        // Then
        assertThat(rule.resolvedType()).contains(RuleType.INVALID_LOCATION);
        assertThat(rule.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(rule.precedenceLevel()).isEqualTo(1);
        assertThat(rule.conditions().keys()).isEmpty();
        assertThat(rule.exclusionRules()).isNull();
        assertThat(rule.active()).isTrue();
    }

    @Test
    @DisplayName("Should keep rules of unknown type and inactive rules")
    void shouldKeepUnknownAndInactiveRules() {
        // When
        List<RuleDefinition> rules = loader.parse("""
                [{"id": 12, "rule_type": "FORKLIFT_SPEEDING"},
                 {"id": 13, "rule_type": "MISSING_LOCATION", "is_active": false}]
                """);

        // Then
        assertThat(rules).hasSize(2);
        assertThat(rules.get(0).resolvedType()).isEmpty();
        assertThat(rules.get(0).precedenceLevel()).isEqualTo(RuleDefinition.LOWEST_PRECEDENCE);
        assertThat(rules.get(1).active()).isFalse();
    }

    @Test
    @DisplayName("Should ignore unknown rule types named in exclusions")
    void shouldIgnoreUnknownExclusionTypes() {
        // When
        RuleDefinition rule = loader.parse("""
                [{"id": 14, "rule_type": "OVERCAPACITY",
                  "exclusion_rules": {"exclude_if_flagged_by": ["INVALID_LOCATION", "NOT_A_RULE"], "max_precedence": 1}}]
                """).get(0);

        // Then
        assertThat(rule.exclusionRules().excludeIfFlaggedBy()).containsExactly(RuleType.INVALID_LOCATION);
        assertThat(rule.exclusionRules().maxPrecedence()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a rule without id")
    void shouldRejectMissingId() {
        assertThatThrownBy(() -> loader.parse("[{\"name\": \"nameless\", \"rule_type\": \"OVERCAPACITY\"}]"))
                .isInstanceOf(RuleContractViolationException.class)
                .hasMessageContaining("without id");
    }

    @Test
    @DisplayName("Should reject malformed JSON and malformed conditions")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> loader.parse("[{\"id\": 1,"))
                .isInstanceOf(RuleContractViolationException.class)
                .hasMessageContaining("Malformed rule definition JSON");
        assertThatThrownBy(() -> loader.parse("[{\"id\": 2, \"rule_type\": \"OVERCAPACITY\", \"conditions\": \"{broken\"}]"))
                .isInstanceOf(RuleContractViolationException.class)
                .hasMessageContaining("Rule 2 has malformed conditions");
        assertThatThrownBy(() -> loader.parse("[{\"id\": 3, \"rule_type\": \"OVERCAPACITY\", \"conditions\": [1, 2]}]"))
                .isInstanceOf(RuleContractViolationException.class)
                .hasMessageContaining("must be an object");
    }

    @Test
    @DisplayName("Should fail loudly when the configured rules file is missing")
    void shouldFailOnMissingRulesFile() {
        // Given
        RuleDefinitionLoader missing = new RuleDefinitionLoader(
                new DefaultResourceLoader(), new ObjectMapper(), "classpath:rules/does-not-exist.json");

        // When / Then
        assertThatThrownBy(missing::loadDefaults)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("does-not-exist.json");
    }
}
