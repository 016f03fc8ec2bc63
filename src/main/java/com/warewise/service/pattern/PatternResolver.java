package com.warewise.service.pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.warewise.model.LocationFormatConfig;
import com.warewise.model.PatternSet;
import com.warewise.model.PatternSource;
import com.warewise.model.RuleType;
import com.warewise.model.SpecialArea;
import com.warewise.model.StandardLocationCode;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.VirtualLocationModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Derives, per warehouse, the patterns that separate storage from transitional codes.
 *
 * Owned by one analysis run. Results are cached per {@code (warehouseId, ruleType)} for the
 * run's lifetime; templates do not change mid-run so entries never expire.
 */
@Slf4j
public class PatternResolver {

    static final String NO_WAREHOUSE = "_NONE_";

    private static final List<Pattern> FALLBACK_TRANSITIONAL = List.of(
            Pattern.compile("^(RECV|STAGE|DOCK|AISLE)-\\d+$"),
            Pattern.compile("^(RECEIVING|STAGING|SHIPPING|DOCK)$"));
    private static final List<Pattern> FALLBACK_STORAGE = List.of(Pattern.compile("^.+$"));
    private static final Pattern AISLE_AREA = Pattern.compile("^AISLE-\\d+$");

    private final Function<String, Optional<VirtualLocationModel>> modelLookup;
    private final Cache<String, PatternSet> cache;

    public PatternResolver(Function<String, Optional<VirtualLocationModel>> modelLookup, Cache<String, PatternSet> cache) {
        this.modelLookup = modelLookup;
        this.cache = cache;
    }

    public PatternSet getPatterns(String warehouseId, RuleType ruleType) {
        String key = (warehouseId == null ? NO_WAREHOUSE : warehouseId) + ":" + ruleType;
        return cache.get(key, k -> resolve(warehouseId, ruleType));
    }

    /**
     * Drops cached pattern sets for one warehouse, e.g. after its template was replaced.
     */
    public void clear(String warehouseId) {
        String prefix = (warehouseId == null ? NO_WAREHOUSE : warehouseId) + ":";
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    private PatternSet resolve(String warehouseId, RuleType ruleType) {
        Optional<VirtualLocationModel> model = warehouseId == null ? Optional.empty() : modelLookup.apply(warehouseId);
        if (model.isEmpty()) {
            log.warn("No template for warehouse {} ({}): using default fallback patterns", warehouseId, ruleType);
            return new PatternSet(FALLBACK_STORAGE, FALLBACK_TRANSITIONAL, PatternSource.DEFAULT_FALLBACK, 0.0);
        }
        WarehouseTemplate template = model.get().template();
        List<Pattern> specials = specialAreaPatterns(model.get());
        LocationFormatConfig format = template.locationFormatConfig();

        PatternSet patterns;
        if (template.isZoneBased()) {
            List<Pattern> transitional = new ArrayList<>(specials);
            transitional.add(format.transitionalZonePattern());
            patterns = new PatternSet(List.of(format.businessZonePattern()), transitional,
                    PatternSource.ZONE_BASED_TEMPLATE, format.confidence());
        } else {
            double confidence = format != null && format.confidence() > 0 ? format.confidence() : 1.0;
            patterns = new PatternSet(List.of(StandardLocationCode.CANONICAL_PATTERN), specials,
                    PatternSource.CANONICAL_TEMPLATE, confidence);
        }
        log.debug("Patterns for {} ({}): source={}, {} storage, {} transitional",
                warehouseId, ruleType, patterns.source().label(),
                patterns.storagePatterns().size(), patterns.transitionalPatterns().size());
        return patterns;
    }

    private static List<Pattern> specialAreaPatterns(VirtualLocationModel model) {
        boolean aisleAreas = Boolean.TRUE.equals(model.template().autoCreateAisleAreas());
        List<Pattern> patterns = new ArrayList<>();
        for (SpecialArea area : model.specialAreas().values()) {
            // generated aisle areas are covered by one pattern below
            if (aisleAreas && AISLE_AREA.matcher(area.code()).matches()) {
                continue;
            }
            patterns.add(Pattern.compile("^" + Pattern.quote(area.code()) + "$"));
        }
        if (aisleAreas) {
            patterns.add(AISLE_AREA);
        }
        return patterns;
    }
}
