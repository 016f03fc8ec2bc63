package com.warewise.service;

import com.warewise.config.EngineMetrics;
import com.warewise.model.AnalysisReport;
import com.warewise.model.AnalysisReport.TimingBreakdown;
import com.warewise.model.AnalysisRequest;
import com.warewise.model.InventoryRecord;
import com.warewise.model.RuleDefinition;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.repository.RuleDefinitionLoader;
import com.warewise.repository.WarehouseTemplateCatalog;
import com.warewise.service.cache.LocationPropertiesCache;
import com.warewise.service.cache.RunScopedCacheFactory;
import com.warewise.service.context.WarehouseContextResolver;
import com.warewise.service.location.LocationCanonicalizer;
import com.warewise.service.location.VirtualLocationModel;
import com.warewise.service.pattern.PatternResolver;
import com.warewise.service.preload.AnalysisContext;
import com.warewise.service.preload.InventoryNormalizationService;
import com.warewise.service.preload.InventoryNormalizationService.NormalizedInventory;
import com.warewise.service.rules.RuleEvaluationService;
import com.warewise.service.rules.RuleEvaluationService.EvaluationOutput;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Runs one inventory analysis end to end.
 *
 * Thin orchestrator over the focused services:
 * 1. WarehouseContextResolver      - which warehouse the snapshot belongs to
 * 2. InventoryNormalizationService - canonical codes and location properties, once per distinct location
 * 3. RuleEvaluationService         - evaluators in parallel, then precedence and exclusions
 *
 * Caches used by stages 2 and 3 are created per run and dropped with it.
 */
@Service
@Slf4j
public class InventoryAnalysisOrchestrator {

    static final String MDC_ANALYSIS_ID = "analysisId";
    static final String MDC_WAREHOUSE_ID = "warehouseId";

    private final WarehouseContextResolver contextResolver;
    private final InventoryNormalizationService normalizationService;
    private final RuleEvaluationService ruleEvaluationService;
    private final RunScopedCacheFactory cacheFactory;
    private final WarehouseTemplateCatalog templateCatalog;
    private final RuleDefinitionLoader ruleDefinitionLoader;
    private final LocationCanonicalizer canonicalizer;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;

    public InventoryAnalysisOrchestrator(
            WarehouseContextResolver contextResolver,
            InventoryNormalizationService normalizationService,
            RuleEvaluationService ruleEvaluationService,
            RunScopedCacheFactory cacheFactory,
            WarehouseTemplateCatalog templateCatalog,
            RuleDefinitionLoader ruleDefinitionLoader,
            LocationCanonicalizer canonicalizer,
            EngineMetrics metrics,
            Clock clock,
            @Qualifier("analysisExecutor") ExecutorService executor) {
        this.contextResolver = contextResolver;
        this.normalizationService = normalizationService;
        this.ruleEvaluationService = ruleEvaluationService;
        this.cacheFactory = cacheFactory;
        this.templateCatalog = templateCatalog;
        this.ruleDefinitionLoader = ruleDefinitionLoader;
        this.canonicalizer = canonicalizer;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Analyze a snapshot against the catalog's templates and the bundled default rules.
     */
    public AnalysisReport analyzeWithDefaultRules(List<InventoryRecord> inventory, String explicitWarehouseId) {
        return analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .rules(ruleDefinitionLoader.loadDefaults())
                .explicitWarehouseId(explicitWarehouseId)
                .build());
    }

    /**
     * Main analysis pipeline - orchestrates all stages.
     *
     * @param request inventory, rules and optional templates; templates default to the catalog's
     * @return anomalies plus per-rule metadata, context and timing
     */
    public AnalysisReport analyze(AnalysisRequest request) {
        String analysisId = UUID.randomUUID().toString();
        MDC.put(MDC_ANALYSIS_ID, analysisId);
        try {
            return runPipeline(analysisId, request);
        } finally {
            MDC.remove(MDC_WAREHOUSE_ID);
            MDC.remove(MDC_ANALYSIS_ID);
        }
    }

    private AnalysisReport runPipeline(String analysisId, AnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        List<InventoryRecord> inventory = request.inventory();
        List<RuleDefinition> rules = request.rules();
        Map<String, VirtualLocationModel> models = candidateModels(request);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("ANALYSIS START: {} records | {} rules | {} candidate warehouses | explicit={}",
                inventory.size(), rules.size(), models.size(),
                request.explicitWarehouseId() != null ? request.explicitWarehouseId() : "NONE");
        log.info("═══════════════════════════════════════════════════════════════");

        // STAGE 1: Warehouse context
        log.info("STAGE 1: Warehouse Context");
        long contextStart = System.currentTimeMillis();

        WarehouseContextResult warehouseContext = request.explicitWarehouseId() != null
                ? contextResolver.explicit(request.explicitWarehouseId())
                : contextResolver.resolve(
                        inventory.stream().map(InventoryRecord::rawLocation).toList(),
                        models.values());
        if (warehouseContext.warehouseId() != null) {
            MDC.put(MDC_WAREHOUSE_ID, warehouseContext.warehouseId());
        }
        VirtualLocationModel model = warehouseContext.isResolved() ? models.get(warehouseContext.warehouseId()) : null;

        long contextTime = System.currentTimeMillis() - contextStart;

        // STAGE 2: Normalization
        log.info("STAGE 2: Location Normalization (template={})", model != null ? model.warehouseId() : "NONE");
        long normalizationStart = System.currentTimeMillis();

        LocationPropertiesCache locationCache = cacheFactory.newLocationPropertiesCache();
        NormalizedInventory normalized = normalizationService.normalize(inventory, model, locationCache, executor);

        long normalizationTime = System.currentTimeMillis() - normalizationStart;

        AnalysisContext context = AnalysisContext.builder()
                .analysisId(analysisId)
                .inventory(normalized.records())
                .propertiesByLocation(normalized.propertiesByLocation())
                .unitsByLocation(normalized.unitsByLocation())
                .warehouseContext(warehouseContext)
                .template(model != null ? model.template() : null)
                .locationModel(model)
                .patternResolver(new PatternResolver(
                        warehouseId -> Optional.ofNullable(models.get(warehouseId)),
                        cacheFactory.newPatternCache()))
                .now(LocalDateTime.now(clock))
                .cancellationToken(request.cancellationToken())
                .build();

        // STAGE 3: Rule evaluation
        log.info("STAGE 3: Rule Evaluation");
        long rulesStart = System.currentTimeMillis();

        EvaluationOutput output = ruleEvaluationService.evaluate(rules, context, executor);

        long rulesTime = System.currentTimeMillis() - rulesStart;

        // SUMMARY
        long totalTime = System.currentTimeMillis() - startTime;
        TimingBreakdown timing = new TimingBreakdown(contextTime, normalizationTime, rulesTime, totalTime);
        AnalysisReport report = new AnalysisReport(
                analysisId,
                output.anomalies(),
                warehouseContext,
                output.ruleResults(),
                output.exclusionStats(),
                timing,
                output.cancelled());

        metrics.recordStageTimes(contextTime, normalizationTime, rulesTime, totalTime);
        metrics.recordRun(report.anomalies().size(), report.failedRules().size(), report.cancelled());

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("ANALYSIS COMPLETE | Total: {}ms{}", totalTime, report.cancelled() ? " | CANCELLED" : "");
        log.info("  Context: {}ms | Normalize: {}ms | Rules: {}ms", contextTime, normalizationTime, rulesTime);
        log.info("  Warehouse: {} ({}, score={}) | Anomalies: {} | Excluded: {} | Failed rules: {}",
                warehouseContext.warehouseId() != null ? warehouseContext.warehouseId() : "NONE",
                warehouseContext.confidenceTier(),
                String.format("%.2f", warehouseContext.matchScore()),
                report.anomalies().size(),
                report.exclusionStats().totalExcluded(),
                report.failedRules().size());
        log.info("═══════════════════════════════════════════════════════════════");

        return report;
    }

    /**
     * Candidate models keyed by warehouse id: the request's own templates when given, otherwise the catalog's.
     */
    private Map<String, VirtualLocationModel> candidateModels(AnalysisRequest request) {
        Map<String, VirtualLocationModel> models = new LinkedHashMap<>();
        if (!request.templates().isEmpty()) {
            for (WarehouseTemplate template : request.templates()) {
                models.put(template.warehouseId(), VirtualLocationModel.of(template, canonicalizer));
            }
            return models;
        }
        for (WarehouseTemplate template : templateCatalog.all()) {
            templateCatalog.model(template.warehouseId()).ifPresent(m -> models.put(template.warehouseId(), m));
        }
        return models;
    }
}
