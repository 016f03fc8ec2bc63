package com.warewise.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.warewise.config.EngineMetrics;
import com.warewise.model.AnalysisReport;
import com.warewise.model.AnalysisRequest;
import com.warewise.model.AnomalyRecord;
import com.warewise.model.CancellationToken;
import com.warewise.model.ConfidenceTier;
import com.warewise.model.ExclusionStats;
import com.warewise.model.InventoryRecord;
import com.warewise.model.Priority;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleExecutionResult;
import com.warewise.model.RuleType;
import com.warewise.model.WarehouseContextResult;
import com.warewise.model.WarehouseTemplate;
import com.warewise.repository.RuleDefinitionLoader;
import com.warewise.repository.WarehouseTemplateCatalog;
import com.warewise.service.cache.LocationPropertiesCache;
import com.warewise.service.cache.RunScopedCacheFactory;
import com.warewise.service.context.WarehouseContextResolver;
import com.warewise.service.location.LocationCanonicalizer;
import com.warewise.service.location.VirtualLocationModel;
import com.warewise.service.preload.AnalysisContext;
import com.warewise.service.preload.InventoryNormalizationService;
import com.warewise.service.preload.InventoryNormalizationService.NormalizedInventory;
import com.warewise.service.rules.RuleEvaluationService;
import com.warewise.service.rules.RuleEvaluationService.EvaluationOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for InventoryAnalysisOrchestrator.
 *
 * Tests verify:
 * - Stages run in order: context, normalization, rules
 * - An explicit warehouse bypasses detection
 * - Results and metrics are assembled from the stage outputs
 * - MDC carries the run's ids during the run and is cleaned up afterwards
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InventoryAnalysisOrchestratorTest {

    private static final Instant FIXED_NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock private WarehouseContextResolver contextResolver;
    @Mock private InventoryNormalizationService normalizationService;
    @Mock private RuleEvaluationService ruleEvaluationService;
    @Mock private RunScopedCacheFactory cacheFactory;
    @Mock private WarehouseTemplateCatalog templateCatalog;
    @Mock private RuleDefinitionLoader ruleDefinitionLoader;
    @Mock private LocationPropertiesCache locationCache;
    @Mock private ExecutorService executorService;

    private SimpleMeterRegistry meterRegistry;
    private InventoryAnalysisOrchestrator orchestrator;

    private final WarehouseTemplate template = WarehouseTemplate.builder().warehouseId("WH01").build();
    private final RuleDefinition stagnantRule = RuleDefinition.builder()
            .id(1).ruleType(RuleType.STAGNANT_PALLETS.name()).active(true).build();
    private final List<InventoryRecord> inventory = List.of(
            InventoryRecord.builder().unitId("P1").rawLocation("RECV-01").build(),
            InventoryRecord.builder().unitId("P2").rawLocation("01-01-001A").build());

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new InventoryAnalysisOrchestrator(
                contextResolver, normalizationService, ruleEvaluationService, cacheFactory, templateCatalog,
                ruleDefinitionLoader, new LocationCanonicalizer(), new EngineMetrics(meterRegistry),
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC), executorService);

        when(cacheFactory.newLocationPropertiesCache()).thenReturn(locationCache);
        when(cacheFactory.newPatternCache()).thenReturn(Caffeine.newBuilder().build());
        when(normalizationService.normalize(anyList(), any(), any(), any()))
                .thenAnswer(invocation -> new NormalizedInventory(invocation.getArgument(0), Map.of(), Map.of(), 0));
        when(contextResolver.explicit("WH01")).thenReturn(WarehouseContextResult.explicit("WH01"));
    }

    private static AnomalyRecord anomaly(String unitId) {
        return new AnomalyRecord(unitId, "RECV-01", "Stagnant Pallet", Priority.HIGH, 1, RuleType.STAGNANT_PALLETS,
                3, "Pallet in RECEIVING for 9.0h (threshold: 6.0h)", Map.of());
    }

    private void stubRuleOutput(List<AnomalyRecord> anomalies, List<RuleExecutionResult> results, boolean cancelled) {
        when(ruleEvaluationService.evaluate(anyList(), any(AnalysisContext.class), eq(executorService)))
                .thenReturn(new EvaluationOutput(anomalies, results, ExclusionStats.unchanged(anomalies.size()), cancelled));
    }

    @Test
    @DisplayName("Should run context, normalization and rules in order for an explicit warehouse")
    void shouldRunStagesInOrderForExplicitWarehouse() {
        // Given
        stubRuleOutput(List.of(anomaly("P1")), List.of(RuleExecutionResult.success(stagnantRule, 1, 3)), false);
        AnalysisRequest request = AnalysisRequest.builder()
                .inventory(inventory)
                .templates(List.of(template))
                .rules(List.of(stagnantRule))
                .explicitWarehouseId("wh01")
                .build();

        // When
        AnalysisReport report = orchestrator.analyze(request);

        // Then
        InOrder inOrder = inOrder(contextResolver, normalizationService, ruleEvaluationService);
        inOrder.verify(contextResolver).explicit("WH01");
        inOrder.verify(normalizationService).normalize(eq(inventory), any(VirtualLocationModel.class), eq(locationCache), eq(executorService));
        inOrder.verify(ruleEvaluationService).evaluate(eq(List.of(stagnantRule)), any(AnalysisContext.class), eq(executorService));
        verify(contextResolver, never()).resolve(anyCollection(), anyCollection());

        assertThat(report.analysisId()).isNotBlank();
        assertThat(report.context().confidenceTier()).isEqualTo(ConfidenceTier.EXPLICIT);
        assertThat(report.anomalies()).hasSize(1);
        assertThat(report.ruleResults()).hasSize(1);
        assertThat(report.cancelled()).isFalse();
        assertThat(report.timing().totalMs()).isGreaterThanOrEqualTo(report.timing().rulesMs());
    }

    @Test
    @DisplayName("Should hand evaluators a context built from the resolved template and the clock")
    void shouldBuildAnalysisContext() {
        // Given
        stubRuleOutput(List.of(), List.of(), false);
        ArgumentCaptor<AnalysisContext> captor = ArgumentCaptor.forClass(AnalysisContext.class);

        // When
        orchestrator.analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .templates(List.of(template))
                .rules(List.of(stagnantRule))
                .explicitWarehouseId("WH01")
                .build());

        // Then
        verify(ruleEvaluationService).evaluate(anyList(), captor.capture(), eq(executorService));
        AnalysisContext context = captor.getValue();
        assertThat(context.getWarehouseId()).isEqualTo("WH01");
        assertThat(context.getTemplate()).isEqualTo(template);
        assertThat(context.getLocationModel().warehouseId()).isEqualTo("WH01");
        assertThat(context.getNow()).isEqualTo(LocalDateTime.of(2024, 3, 1, 12, 0));
        assertThat(context.getInventory()).isEqualTo(inventory);
        assertThat(context.patternsFor(RuleType.LOCATION_SPECIFIC_STAGNANT).isFallback()).isFalse();
    }

    @Test
    @DisplayName("Should detect the warehouse from catalog templates when none is given")
    void shouldDetectWarehouseFromCatalog() {
        // Given
        stubRuleOutput(List.of(), List.of(), false);
        VirtualLocationModel model = VirtualLocationModel.of(template);
        when(templateCatalog.all()).thenReturn(List.of(template));
        when(templateCatalog.model("WH01")).thenReturn(Optional.of(model));
        when(contextResolver.resolve(anyCollection(), anyCollection()))
                .thenReturn(new WarehouseContextResult("WH01", ConfidenceTier.VERY_HIGH, 1.0, 2, 2, Map.of("WH01", 1.0)));

        // When
        AnalysisReport report = orchestrator.analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .rules(List.of(stagnantRule))
                .build());

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> locations = ArgumentCaptor.forClass(Collection.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<VirtualLocationModel>> candidates = ArgumentCaptor.forClass(Collection.class);
        verify(contextResolver).resolve(locations.capture(), candidates.capture());
        assertThat(locations.getValue()).containsExactly("RECV-01", "01-01-001A");
        assertThat(candidates.getValue()).containsExactly(model);
        verify(normalizationService).normalize(eq(inventory), eq(model), eq(locationCache), eq(executorService));
        assertThat(report.context().warehouseId()).isEqualTo("WH01");
    }

    @Test
    @DisplayName("Should normalize without a model when no warehouse is resolved")
    void shouldContinueWithoutWarehouse() {
        // Given
        stubRuleOutput(List.of(), List.of(), false);
        when(templateCatalog.all()).thenReturn(List.of());
        when(contextResolver.resolve(anyCollection(), anyCollection())).thenReturn(WarehouseContextResult.none(2, Map.of()));

        // When
        AnalysisReport report = orchestrator.analyze(AnalysisRequest.builder().inventory(inventory).build());

        // Then
        verify(normalizationService).normalize(eq(inventory), isNull(), eq(locationCache), eq(executorService));
        assertThat(report.context().isResolved()).isFalse();
    }

    @Test
    @DisplayName("Should record run metrics from the report")
    void shouldRecordMetrics() {
        // Given
        RuleDefinition overcapacity = RuleDefinition.builder().id(2).ruleType("OVERCAPACITY").active(true).build();
        stubRuleOutput(List.of(anomaly("P1"), anomaly("P2")), List.of(
                RuleExecutionResult.success(stagnantRule, 2, 1),
                RuleExecutionResult.failed(overcapacity, 1, "OVERCAPACITY requires a template for warehouse WH01")), true);

        // When
        orchestrator.analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .templates(List.of(template))
                .rules(List.of(stagnantRule, overcapacity))
                .explicitWarehouseId("WH01")
                .build());

        // Then
        assertThat(meterRegistry.get("analysis.runs").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("analysis.anomalies").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("analysis.rules.failed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("analysis.cancelled").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("analysis.total.time").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should expose run ids in MDC during the run and clear them afterwards")
    void shouldManageMdc() {
        // Given
        AtomicReference<String> analysisIdDuringRun = new AtomicReference<>();
        AtomicReference<String> warehouseIdDuringRun = new AtomicReference<>();
        when(ruleEvaluationService.evaluate(anyList(), any(AnalysisContext.class), eq(executorService)))
                .thenAnswer(invocation -> {
                    analysisIdDuringRun.set(MDC.get("analysisId"));
                    warehouseIdDuringRun.set(MDC.get("warehouseId"));
                    return new EvaluationOutput(List.of(), List.of(), ExclusionStats.NONE, false);
                });

        // When
        AnalysisReport report = orchestrator.analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .templates(List.of(template))
                .explicitWarehouseId("WH01")
                .build());

        // Then
        assertThat(analysisIdDuringRun.get()).isEqualTo(report.analysisId());
        assertThat(warehouseIdDuringRun.get()).isEqualTo("WH01");
        assertThat(MDC.get("analysisId")).isNull();
        assertThat(MDC.get("warehouseId")).isNull();
    }

    @Test
    @DisplayName("Should analyze with the bundled default rules")
    void shouldUseDefaultRules() {
        // Given
        stubRuleOutput(List.of(), List.of(), false);
        when(ruleDefinitionLoader.loadDefaults()).thenReturn(List.of(stagnantRule));
        when(templateCatalog.all()).thenReturn(List.of(template));
        when(templateCatalog.model("WH01")).thenReturn(Optional.of(VirtualLocationModel.of(template)));

        // When
        orchestrator.analyzeWithDefaultRules(inventory, "WH01");

        // Then
        verify(ruleEvaluationService).evaluate(eq(List.of(stagnantRule)), any(AnalysisContext.class), eq(executorService));
        verify(contextResolver).explicit("WH01");
    }

    @Test
    @DisplayName("Should pass the request's cancellation token to evaluators")
    void shouldPassCancellationToken() {
        // Given
        stubRuleOutput(List.of(), List.of(), false);
        CancellationToken token = CancellationToken.create();
        ArgumentCaptor<AnalysisContext> captor = ArgumentCaptor.forClass(AnalysisContext.class);

        // When
        orchestrator.analyze(AnalysisRequest.builder()
                .inventory(inventory)
                .templates(List.of(template))
                .explicitWarehouseId("WH01")
                .cancellationToken(token)
                .build());

        // Then
        verify(ruleEvaluationService).evaluate(anyList(), captor.capture(), eq(executorService));
        assertThat(captor.getValue().getCancellationToken()).isSameAs(token);
        verify(normalizationService).normalize(anyList(), any(), any(), any());
        verify(cacheFactory).newPatternCache();
    }
}
