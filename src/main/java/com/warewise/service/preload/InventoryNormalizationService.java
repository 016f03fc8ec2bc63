package com.warewise.service.preload;

import com.warewise.model.CanonicalKind;
import com.warewise.model.CanonicalResult;
import com.warewise.model.InventoryRecord;
import com.warewise.model.LocationProperties;
import com.warewise.model.LocationType;
import com.warewise.service.cache.LocationPropertiesCache;
import com.warewise.service.location.LocationCanonicalizer;
import com.warewise.service.location.VirtualLocationModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Single normalization pass over an inventory snapshot.
 *
 * Each distinct raw location is canonicalized and resolved exactly once; distinct values are
 * split into chunks that run in parallel on the worker pool. Records are then enriched with
 * their canonical code, type and zone, keeping the input order.
 */
@Service
@Slf4j
public class InventoryNormalizationService {

    private final LocationCanonicalizer canonicalizer;
    private final int chunkSize;

    public InventoryNormalizationService(
            LocationCanonicalizer canonicalizer,
            @Value("${app.engine.normalization.chunk-size:500}") int chunkSize) {
        this.canonicalizer = canonicalizer;
        this.chunkSize = chunkSize;
        log.info("InventoryNormalizationService initialized with chunkSize={}", chunkSize);
    }

    /**
     * @param model    virtual model of the resolved warehouse, or {@code null} when none was resolved
     * @param cache    run-scoped location properties cache
     * @param executor executor for parallel chunk processing
     */
    public NormalizedInventory normalize(List<InventoryRecord> records,
                                         VirtualLocationModel model,
                                         LocationPropertiesCache cache,
                                         ExecutorService executor) {
        if (records == null || records.isEmpty()) {
            return new NormalizedInventory(List.of(), Map.of(), Map.of(), 0);
        }

        List<String> distinct = distinctLocations(records);
        int chunks = (distinct.size() + chunkSize - 1) / chunkSize;
        log.info("Normalizing {} records with {} distinct locations (chunkSize={}, chunks={}, warehouse={})",
                records.size(), distinct.size(), chunkSize, chunks, model != null ? model.warehouseId() : "NONE");
        long startTime = System.currentTimeMillis();

        Map<String, ResolvedLocation> resolved = resolveInChunks(distinct, model, cache, executor);

        List<InventoryRecord> normalized = new ArrayList<>(records.size());
        Map<String, LocationProperties> propertiesByLocation = new HashMap<>();
        Map<String, List<InventoryRecord>> unitsByLocation = new LinkedHashMap<>();
        int unparseable = 0;
        for (InventoryRecord record : records) {
            if (!record.hasLocation()) {
                normalized.add(record.withNormalization(CanonicalResult.unparseable(""), LocationProperties.missing()));
                continue;
            }
            ResolvedLocation location = resolved.get(record.rawLocation());
            InventoryRecord enriched = record.withNormalization(location.canonical(), location.properties());
            normalized.add(enriched);
            propertiesByLocation.put(location.canonical().value(), location.properties());
            unitsByLocation.computeIfAbsent(enriched.canonicalLocation(), k -> new ArrayList<>()).add(enriched);
            if (!location.canonical().isParsed()) {
                unparseable++;
            }
        }
        unitsByLocation.replaceAll((k, v) -> List.copyOf(v));

        long elapsedTime = System.currentTimeMillis() - startTime;
        log.info("Normalization completed in {}ms | {} locations, {} records with unparseable codes",
                elapsedTime, propertiesByLocation.size(), unparseable);
        if (cache != null) {
            log.debug("Location cache: {}", cache.getStats());
        }

        return new NormalizedInventory(
                List.copyOf(normalized),
                Collections.unmodifiableMap(propertiesByLocation),
                Collections.unmodifiableMap(unitsByLocation),
                unparseable);
    }

    private static List<String> distinctLocations(List<InventoryRecord> records) {
        Set<String> distinct = new LinkedHashSet<>();
        for (InventoryRecord record : records) {
            if (record.hasLocation()) {
                distinct.add(record.rawLocation());
            }
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Resolve distinct locations in chunks; chunks run in parallel.
     */
    private Map<String, ResolvedLocation> resolveInChunks(List<String> locations,
                                                         VirtualLocationModel model,
                                                         LocationPropertiesCache cache,
                                                         ExecutorService executor) {
        // If small enough, resolve on the calling thread
        if (locations.size() <= chunkSize) {
            return resolveChunk(locations, model, cache);
        }

        List<List<String>> chunks = partition(locations, chunkSize);
        log.debug("Resolving locations in {} chunks of up to {} each", chunks.size(), chunkSize);

        List<CompletableFuture<Map<String, ResolvedLocation>>> chunkFutures = chunks.stream()
                .map(chunk -> CompletableFuture.supplyAsync(() -> resolveChunk(chunk, model, cache), executor))
                .toList();

        CompletableFuture.allOf(chunkFutures.toArray(new CompletableFuture[0])).join();

        Map<String, ResolvedLocation> result = new HashMap<>();
        for (CompletableFuture<Map<String, ResolvedLocation>> future : chunkFutures) {
            result.putAll(future.join());
        }
        return result;
    }

    private Map<String, ResolvedLocation> resolveChunk(List<String> locations,
                                                      VirtualLocationModel model,
                                                      LocationPropertiesCache cache) {
        LocationCanonicalizer chunkCanonicalizer = model != null ? model.canonicalizer() : canonicalizer;
        Map<String, ResolvedLocation> result = new HashMap<>();
        for (String raw : locations) {
            CanonicalResult canonical = chunkCanonicalizer.canonicalize(raw);
            LocationProperties properties;
            if (model == null) {
                properties = LocationProperties.unresolved(canonical.value(), inferType(canonical));
            } else if (cache != null) {
                properties = cache.resolve(model, canonical);
            } else {
                properties = model.resolve(canonical);
            }
            result.put(raw, new ResolvedLocation(canonical, properties));
        }
        return result;
    }

    /**
     * Best-effort type from the code's shape, used when no warehouse template is available.
     */
    static LocationType inferType(CanonicalResult canonical) {
        if (canonical.kind() == CanonicalKind.STANDARD) {
            return LocationType.STORAGE;
        }
        if (canonical.kind() == CanonicalKind.UNPARSEABLE) {
            return LocationType.UNKNOWN;
        }
        String code = canonical.value();
        if (code.startsWith("RECV") || code.equals("RECEIVING")) {
            return LocationType.RECEIVING;
        }
        if (code.startsWith("STAGE") || code.equals("STAGING")) {
            return LocationType.STAGING;
        }
        if (code.startsWith("DOCK") || code.equals("SHIPPING")) {
            return LocationType.DOCK;
        }
        if (code.startsWith("AISLE")) {
            return LocationType.TRANSITIONAL;
        }
        return LocationType.UNKNOWN;
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }

    private record ResolvedLocation(CanonicalResult canonical, LocationProperties properties) {}

    /**
     * Output of the normalization pass.
     *
     * @param propertiesByLocation resolved properties keyed by canonical code
     * @param unitsByLocation      records grouped by canonical code, in input order
     */
    public record NormalizedInventory(
            List<InventoryRecord> records,
            Map<String, LocationProperties> propertiesByLocation,
            Map<String, List<InventoryRecord>> unitsByLocation,
            int unparseableRecords
    ) {}
}
