package com.warewise.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.warewise.model.WarehouseTemplate;
import com.warewise.service.location.LocationCanonicalizer;
import com.warewise.service.location.VirtualLocationModel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known warehouse templates, shared across analysis runs.
 *
 * Holds one cached {@link VirtualLocationModel} per warehouse. Whoever edits or replaces a
 * template must go through {@link #register} or call {@link #invalidate} so the next run does
 * not see a stale model.
 */
@Component
@Slf4j
public class WarehouseTemplateCatalog {

    private final Map<String, WarehouseTemplate> templates = new ConcurrentHashMap<>();
    private final Cache<String, VirtualLocationModel> virtualModelCache;
    private final LocationCanonicalizer canonicalizer;
    private final WarehouseTemplateLoader templateLoader;

    @Value("${app.engine.templates.preload:true}")
    private boolean preloadTemplates;

    public WarehouseTemplateCatalog(
            Cache<String, VirtualLocationModel> virtualModelCache,
            LocationCanonicalizer canonicalizer,
            WarehouseTemplateLoader templateLoader) {
        this.virtualModelCache = virtualModelCache;
        this.canonicalizer = canonicalizer;
        this.templateLoader = templateLoader;
    }

    @PostConstruct
    void preload() {
        if (!preloadTemplates) {
            log.info("Template preload disabled");
            return;
        }
        templateLoader.loadAll().forEach(this::register);
        log.info("Template catalog ready with {} warehouses: {}", templates.size(), templates.keySet());
    }

    /**
     * Adds or replaces a template and drops any cached model for it.
     */
    public void register(WarehouseTemplate template) {
        WarehouseTemplate previous = templates.put(template.warehouseId(), template);
        virtualModelCache.invalidate(template.warehouseId());
        if (previous != null) {
            log.info("Template replaced for warehouse {}", template.warehouseId());
        }
    }

    public void remove(String warehouseId) {
        String id = normalize(warehouseId);
        templates.remove(id);
        virtualModelCache.invalidate(id);
    }

    /**
     * Drops the cached model for one warehouse; the next lookup rebuilds it from the current template.
     */
    public void invalidate(String warehouseId) {
        virtualModelCache.invalidate(normalize(warehouseId));
        log.debug("Virtual model invalidated for warehouse {}", warehouseId);
    }

    public Optional<WarehouseTemplate> find(String warehouseId) {
        if (warehouseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(normalize(warehouseId)));
    }

    /**
     * Cached model of the current template. The template is read inside the loader, so a
     * concurrent {@link #register} cannot leave a model of the replaced template in the cache.
     */
    public Optional<VirtualLocationModel> model(String warehouseId) {
        if (warehouseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(virtualModelCache.get(normalize(warehouseId), this::buildModel));
    }

    private VirtualLocationModel buildModel(String warehouseId) {
        WarehouseTemplate template = templates.get(warehouseId);
        return template != null ? VirtualLocationModel.of(template, canonicalizer) : null;
    }

    /**
     * All templates, ordered by warehouse id.
     */
    public List<WarehouseTemplate> all() {
        return templates.values().stream()
                .sorted(Comparator.comparing(WarehouseTemplate::warehouseId))
                .toList();
    }

    public int size() {
        return templates.size();
    }

    private static String normalize(String warehouseId) {
        return warehouseId.trim().toUpperCase(Locale.ROOT);
    }
}
