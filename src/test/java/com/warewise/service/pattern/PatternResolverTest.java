package com.warewise.service.pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.warewise.model.LocationFormatConfig;
import com.warewise.model.LocationType;
import com.warewise.model.PatternSet;
import com.warewise.model.PatternSource;
import com.warewise.model.RuleType;
import com.warewise.model.SpecialArea;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.VirtualLocationModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PatternResolver.
 */
class PatternResolverTest {

    private final Map<String, VirtualLocationModel> models = new HashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();
    private Cache<String, PatternSet> cache;
    private PatternResolver resolver;

    @BeforeEach
    void setUp() {
        models.put("WH01", VirtualLocationModel.of(WarehouseTemplate.builder()
                .warehouseId("WH01")
                .numAisles(3)
                .specialAreas(List.of(
                        new SpecialArea("RECV-01", LocationType.RECEIVING, 10, null),
                        new SpecialArea("STAGE-01", LocationType.STAGING, 5, null)))
                .build()));
        models.put("WH02", VirtualLocationModel.of(WarehouseTemplate.builder()
                .warehouseId("WH02")
                .autoCreateAisleAreas(false)
                .specialAreas(List.of(new SpecialArea("RECEIVING", LocationType.RECEIVING, 20, null)))
                .locationFormatConfig(LocationFormatConfig.zoneBased(List.of("PICK"), List.of("TRAN"), 0.75))
                .build()));
        cache = Caffeine.newBuilder().build();
        resolver = new PatternResolver(id -> {
            lookups.incrementAndGet();
            return Optional.ofNullable(models.get(id));
        }, cache);
    }

    @Test
    @DisplayName("Should derive canonical storage and special-area transitional patterns")
    void shouldResolveCanonicalTemplate() {
        // When
        PatternSet patterns = resolver.getPatterns("WH01", RuleType.LOCATION_SPECIFIC_STAGNANT);

        // Then
        assertThat(patterns.source()).isEqualTo(PatternSource.CANONICAL_TEMPLATE);
        assertThat(patterns.confidence()).isEqualTo(1.0);
        assertThat(patterns.isStorage("02-01-015B")).isTrue();
        assertThat(patterns.isTransitional("RECV-01")).isTrue();
        assertThat(patterns.isTransitional("AISLE-02")).isTrue();
        assertThat(patterns.isTransitional("02-01-015B")).isFalse();
        assertThat(patterns.isStorage("AISLE-02")).isFalse();
    }

    @Test
    @DisplayName("Should derive zone patterns with the configured confidence")
    void shouldResolveZoneBasedTemplate() {
        // When
        PatternSet patterns = resolver.getPatterns("WH02", RuleType.LOCATION_SPECIFIC_STAGNANT);

        // Then
        assertThat(patterns.source()).isEqualTo(PatternSource.ZONE_BASED_TEMPLATE);
        assertThat(patterns.confidence()).isEqualTo(0.75);
        assertThat(patterns.isStorage("PICK-A-001")).isTrue();
        assertThat(patterns.isTransitional("TRAN-A-001")).isTrue();
        assertThat(patterns.isTransitional("RECEIVING")).isTrue();
        assertThat(patterns.isTransitional("AISLE-01")).isFalse();
    }

    @Test
    @DisplayName("Should mark guessed patterns as default fallback when no template exists")
    void shouldFallBackWithoutTemplate() {
        // When
        PatternSet unknown = resolver.getPatterns("WH99", RuleType.STAGNANT_PALLETS);
        PatternSet none = resolver.getPatterns(null, RuleType.STAGNANT_PALLETS);

        // Then
        assertThat(unknown.isFallback()).isTrue();
        assertThat(unknown.source().label()).isEqualTo("default_fallback");
        assertThat(unknown.confidence()).isZero();
        assertThat(unknown.isTransitional("STAGE-04")).isTrue();
        assertThat(none.isFallback()).isTrue();
    }

    @Test
    @DisplayName("Should compute each (warehouse, rule type) pair once per run")
    void shouldCachePerWarehouseAndRuleType() {
        // When
        PatternSet first = resolver.getPatterns("WH01", RuleType.STAGNANT_PALLETS);
        PatternSet second = resolver.getPatterns("WH01", RuleType.STAGNANT_PALLETS);
        resolver.getPatterns("WH01", RuleType.UNCOORDINATED_LOTS);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(lookups.get()).isEqualTo(2);
        assertThat(cache.asMap()).containsOnlyKeys("WH01:STAGNANT_PALLETS", "WH01:UNCOORDINATED_LOTS");
    }

    @Test
    @DisplayName("Should drop only the cleared warehouse's entries")
    void shouldClearOneWarehouse() {
        // Given
        resolver.getPatterns("WH01", RuleType.STAGNANT_PALLETS);
        resolver.getPatterns("WH02", RuleType.STAGNANT_PALLETS);

        // When
        resolver.clear("WH01");

        // Then
        assertThat(cache.asMap()).containsOnlyKeys("WH02:STAGNANT_PALLETS");
    }
}
