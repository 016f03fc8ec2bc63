package com.warewise.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.warewise.service.location.VirtualLocationModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache configuration for the cross-run template catalog.
 *
 * Per-run caches (location properties, pattern sets) are not beans; see
 * {@link com.warewise.service.cache.RunScopedCacheFactory}.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.models.max-size:256}")
    private int modelMaxSize;

    /**
     * Virtual location model per warehouse id.
     * No TTL: entries are invalidated explicitly when a template is edited or replaced.
     */
    @Bean
    public Cache<String, VirtualLocationModel> virtualModelCache() {
        log.info("Creating virtual model cache: maxSize={}", modelMaxSize);
        return Caffeine.newBuilder()
                .maximumSize(modelMaxSize)
                .recordStats()
                .build();
    }
}
