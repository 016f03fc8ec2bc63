package com.warewise.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.warewise.model.CanonicalResult;
import com.warewise.model.LocationProperties;
import com.warewise.service.location.VirtualLocationModel;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache-aside wrapper around {@link VirtualLocationModel#resolve(CanonicalResult)} for one run.
 *
 * Keyed by {@code (warehouseId, canonicalCode)}. Canonical codes are fixed points of the
 * canonicalizer, so the code alone determines its kind.
 */
@Slf4j
public class LocationPropertiesCache {

    private final Cache<String, LocationProperties> cache;

    LocationPropertiesCache(Cache<String, LocationProperties> cache) {
        this.cache = cache;
    }

    public LocationProperties resolve(VirtualLocationModel model, CanonicalResult canonical) {
        return cache.get(model.warehouseId() + ":" + canonical.value(), key -> model.resolve(canonical));
    }

    /**
     * Get cache statistics for monitoring.
     */
    public CacheStats getStats() {
        var stats = cache.stats();
        return new CacheStats(
                "locationProperties",
                cache.estimatedSize(),
                stats.hitCount(),
                stats.missCount(),
                stats.hitRate()
        );
    }

    public record CacheStats(
            String name,
            long size,
            long hits,
            long misses,
            double hitRate
    ) {}
}
