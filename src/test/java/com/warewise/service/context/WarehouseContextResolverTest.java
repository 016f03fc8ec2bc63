package com.warewise.service.context;

import com.warewise.model.ConfidenceTier;
import com.warewise.model.LocationType;
import com.warewise.model.SpecialArea;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.VirtualLocationModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WarehouseContextResolver.
 */
class WarehouseContextResolverTest {

    private final WarehouseContextResolver resolver = new WarehouseContextResolver(0.1);

    private static VirtualLocationModel model(String id, int aisles, Instant updatedAt) {
        return VirtualLocationModel.of(WarehouseTemplate.builder()
                .warehouseId(id)
                .numAisles(aisles)
                .racksPerAisle(1)
                .positionsPerRack(10)
                .levelNames("AB")
                .autoCreateAisleAreas(false)
                .specialAreas(List.of(new SpecialArea("RECV-01", LocationType.RECEIVING, 10, null)))
                .updatedAt(updatedAt)
                .build());
    }

    /**
     * n locations that exist in any warehouse with at least one aisle, plus m that exist nowhere.
     */
    private static List<String> locations(int existing, int unknown) {
        List<String> locations = new ArrayList<>();
        IntStream.rangeClosed(1, existing).forEach(i -> locations.add(String.format("01-01-%03dA", i)));
        IntStream.rangeClosed(1, unknown).forEach(i -> locations.add("BOGUS-" + i));
        return locations;
    }

    @Test
    @DisplayName("Should pick the warehouse with the highest match score")
    void shouldPickBestMatch() {
        // Given
        VirtualLocationModel small = model("SMALL", 1, null);
        VirtualLocationModel large = model("LARGE", 3, null);
        List<String> inventory = List.of("01-01-001A", "02-01-001A", "03-01-001B", "RECV-01");

        // When
        WarehouseContextResult result = resolver.resolve(inventory, List.of(small, large));

        // Then
        assertThat(result.warehouseId()).isEqualTo("LARGE");
        assertThat(result.matchScore()).isEqualTo(1.0);
        assertThat(result.confidenceTier()).isEqualTo(ConfidenceTier.VERY_HIGH);
        assertThat(result.candidateScores()).containsEntry("SMALL", 0.5).containsEntry("LARGE", 1.0);
    }

    @Test
    @DisplayName("Should map match scores to confidence tiers")
    void shouldAssignTiers() {
        // Given
        List<VirtualLocationModel> candidates = List.of(model("WH01", 1, null));

        // Then
        assertThat(resolver.resolve(locations(9, 1), candidates).confidenceTier()).isEqualTo(ConfidenceTier.VERY_HIGH);
        assertThat(resolver.resolve(locations(7, 3), candidates).confidenceTier()).isEqualTo(ConfidenceTier.HIGH);
        assertThat(resolver.resolve(locations(4, 6), candidates).confidenceTier()).isEqualTo(ConfidenceTier.MEDIUM);
        assertThat(resolver.resolve(locations(2, 8), candidates).confidenceTier()).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    @DisplayName("Should return NONE when the best score is below the floor")
    void shouldReturnNoneBelowFloor() {
        // Given
        List<VirtualLocationModel> candidates = List.of(model("WH01", 1, null));

        // When
        WarehouseContextResult result = resolver.resolve(locations(1, 19), candidates);

        // Then
        assertThat(result.confidenceTier()).isEqualTo(ConfidenceTier.NONE);
        assertThat(result.warehouseId()).isNull();
        assertThat(result.isResolved()).isFalse();
        assertThat(result.candidateScores()).containsEntry("WH01", 0.05);
    }

    @Test
    @DisplayName("Should break ties by most recently updated template")
    void shouldBreakTiesByUpdatedAt() {
        // Given
        VirtualLocationModel older = model("AAA", 2, Instant.parse("2024-01-01T00:00:00Z"));
        VirtualLocationModel newer = model("ZZZ", 2, Instant.parse("2024-06-01T00:00:00Z"));

        // When
        WarehouseContextResult result = resolver.resolve(locations(5, 0), List.of(older, newer));

        // Then
        assertThat(result.warehouseId()).isEqualTo("ZZZ");
    }

    @Test
    @DisplayName("Should break remaining ties by warehouse id")
    void shouldBreakTiesById() {
        // When
        WarehouseContextResult result = resolver.resolve(locations(5, 0),
                List.of(model("WH09", 1, null), model("WH02", 1, null)));

        // Then
        assertThat(result.warehouseId()).isEqualTo("WH02");
    }

    @Test
    @DisplayName("Should not decrease the score when a matching location is added")
    void shouldBeMonotonicInMatches() {
        // Given
        List<VirtualLocationModel> candidates = List.of(model("WH01", 1, null));
        List<String> before = locations(3, 3);
        List<String> after = new ArrayList<>(before);
        after.add("01-01-010B");

        // When
        double scoreBefore = resolver.resolve(before, candidates).matchScore();
        double scoreAfter = resolver.resolve(after, candidates).matchScore();

        // Then
        assertThat(scoreAfter).isGreaterThanOrEqualTo(scoreBefore);
    }

    @Test
    @DisplayName("Should count each distinct location once")
    void shouldScoreDistinctLocations() {
        // Given
        List<String> inventory = List.of("01-01-001A", "01-01-001a", " 01-01-001A ", "BOGUS");

        // When
        WarehouseContextResult result = resolver.resolve(inventory, List.of(model("WH01", 1, null)));

        // Then
        assertThat(result.totalLocations()).isEqualTo(2);
        assertThat(result.matchedLocations()).isEqualTo(1);
        assertThat(result.matchScore()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should return NONE for an empty inventory")
    void shouldReturnNoneForEmptyInventory() {
        // When
        WarehouseContextResult result = resolver.resolve(List.of(), List.of(model("WH01", 1, null)));

        // Then
        assertThat(result.confidenceTier()).isEqualTo(ConfidenceTier.NONE);
        assertThat(result.totalLocations()).isZero();
    }

    @Test
    @DisplayName("Should bypass detection for an explicit warehouse id")
    void shouldHonorExplicitWarehouse() {
        // When
        WarehouseContextResult result = resolver.explicit("wh07");

        // Then
        assertThat(result.warehouseId()).isEqualTo("WH07");
        assertThat(result.confidenceTier()).isEqualTo(ConfidenceTier.EXPLICIT);
        assertThat(result.isExplicit()).isTrue();
        assertThat(result.matchScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should upper-case warehouse ids independently of the default locale")
    void shouldUpperCaseIdsUnderTurkishLocale() {
        // Given
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // When
            WarehouseContextResult result = resolver.explicit("wh-main");
            WarehouseTemplate template = WarehouseTemplate.builder().warehouseId("wh-main").numAisles(2).build();

            // Then
            assertThat(result.warehouseId()).isEqualTo("WH-MAIN");
            assertThat(template.warehouseId()).isEqualTo("WH-MAIN");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
