package com.warewise.service.context;

import com.warewise.model.ConfidenceTier;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.VirtualLocationModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Works out which warehouse an unlabeled inventory snapshot belongs to.
 *
 * Each candidate is scored by {@code matched / distinct}: the share of distinct inventory
 * locations that exist in that warehouse's virtual model. The best score wins; ties go to the
 * most recently updated template, then to the lower warehouse id.
 */
@Service
@Slf4j
public class WarehouseContextResolver {

    private static final Comparator<Candidate> BEST_FIRST = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparing(Candidate::updatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Candidate::warehouseId);

    private final double minimumMatchScore;

    public WarehouseContextResolver(@Value("${app.engine.context.min-match-score:0.1}") double minimumMatchScore) {
        this.minimumMatchScore = minimumMatchScore;
    }

    /**
     * Bypasses detection. The returned result is final for the run.
     */
    public WarehouseContextResult explicit(String warehouseId) {
        log.info("Warehouse context set explicitly: {}", warehouseId);
        return WarehouseContextResult.explicit(warehouseId);
    }

    public WarehouseContextResult resolve(Collection<String> rawLocations, Collection<VirtualLocationModel> candidates) {
        Set<String> distinct = distinctLocations(rawLocations);
        if (distinct.isEmpty() || candidates.isEmpty()) {
            log.warn("Warehouse detection skipped: {} distinct locations, {} candidate templates",
                    distinct.size(), candidates.size());
            return WarehouseContextResult.none(distinct.size(), Map.of());
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        Candidate best = null;
        for (VirtualLocationModel model : candidates) {
            int matched = countMatches(distinct, model);
            Candidate candidate = new Candidate(model.template(), matched, (double) matched / distinct.size());
            scores.put(candidate.warehouseId(), candidate.score());
            log.debug("Warehouse candidate {}: {}/{} locations matched (score {})",
                    candidate.warehouseId(), matched, distinct.size(), String.format("%.3f", candidate.score()));
            if (best == null || BEST_FIRST.compare(candidate, best) < 0) {
                best = candidate;
            }
        }

        ConfidenceTier tier = ConfidenceTier.fromScore(best.score(), minimumMatchScore);
        if (tier == ConfidenceTier.NONE) {
            log.warn("No warehouse matched above floor {}: best was {} at {}",
                    minimumMatchScore, best.warehouseId(), String.format("%.3f", best.score()));
            return WarehouseContextResult.none(distinct.size(), scores);
        }

        log.info("Warehouse detected: {} | confidence={} | score={} ({}/{} locations)",
                best.warehouseId(), tier, String.format("%.3f", best.score()), best.matched(), distinct.size());
        return new WarehouseContextResult(best.warehouseId(), tier, best.score(), best.matched(), distinct.size(), scores);
    }

    private static Set<String> distinctLocations(Collection<String> rawLocations) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String raw : rawLocations) {
            if (raw != null && !raw.isBlank()) {
                distinct.add(raw.trim().toUpperCase(Locale.ROOT));
            }
        }
        return distinct;
    }

    private static int countMatches(Set<String> locations, VirtualLocationModel model) {
        int matched = 0;
        for (String location : locations) {
            if (model.resolveRaw(location).exists()) {
                matched++;
            }
        }
        return matched;
    }

    private record Candidate(WarehouseTemplate template, int matched, double score) {

        String warehouseId() {
            return template.warehouseId();
        }

        Instant updatedAt() {
            return template.updatedAt();
        }
    }
}
