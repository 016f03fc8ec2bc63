package com.warewise.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.warewise.model.PatternSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates the caches owned by a single analysis run.
 *
 * Nothing built here is a singleton: every run gets fresh instances, so two concurrent runs
 * against different warehouses can never see each other's entries. No TTL; the cache dies with the run.
 */
@Component
@Slf4j
public class RunScopedCacheFactory {

    private final int locationCacheMaxSize;

    public RunScopedCacheFactory(@Value("${app.engine.location-cache.max-size:50000}") int locationCacheMaxSize) {
        this.locationCacheMaxSize = locationCacheMaxSize;
        log.info("RunScopedCacheFactory initialized with location cache maxSize={}", locationCacheMaxSize);
    }

    public LocationPropertiesCache newLocationPropertiesCache() {
        return new LocationPropertiesCache(Caffeine.newBuilder()
                .maximumSize(locationCacheMaxSize)
                .recordStats()
                .build());
    }

    public Cache<String, PatternSet> newPatternCache() {
        return Caffeine.newBuilder()
                .recordStats()
                .build();
    }
}
