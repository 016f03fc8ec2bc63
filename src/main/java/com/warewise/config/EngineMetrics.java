package com.warewise.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Analysis metrics.
 *
 * Key metrics:
 * - analysis.total.time          → End-to-end run time
 * - analysis.context.time        → Warehouse detection
 * - analysis.normalization.time  → Location canonicalization + resolution
 * - analysis.rules.time          → Rule evaluation incl. precedence pass
 * - analysis.runs                → Completed runs
 * - analysis.anomalies           → Anomalies reported (after exclusions)
 * - analysis.rules.failed        → Rules that ended in FAILED
 * - analysis.cancelled           → Runs cancelled by the caller
 *
 * Evaluators never touch metrics; the orchestrator records them from structured results.
 */
@Component
@Getter
public class EngineMetrics {

    // Timers (track count, total time, max, mean)
    private final Timer totalTimer;
    private final Timer contextTimer;
    private final Timer normalizationTimer;
    private final Timer rulesTimer;

    // Counters
    private final Counter runsCounter;
    private final Counter anomaliesCounter;
    private final Counter failedRulesCounter;
    private final Counter cancelledCounter;

    public EngineMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS - Track latency (count, total, max, mean)
        // ═══════════════════════════════════════════════════════════════

        this.totalTimer = Timer.builder("analysis.total.time")
                .description("Total end-to-end analysis time")
                .register(registry);

        this.contextTimer = Timer.builder("analysis.context.time")
                .description("Warehouse context detection time")
                .register(registry);

        this.normalizationTimer = Timer.builder("analysis.normalization.time")
                .description("Location normalization time")
                .register(registry);

        this.rulesTimer = Timer.builder("analysis.rules.time")
                .description("Rule evaluation time")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS - Track counts
        // ═══════════════════════════════════════════════════════════════

        this.runsCounter = Counter.builder("analysis.runs")
                .description("Analysis runs completed")
                .register(registry);

        this.anomaliesCounter = Counter.builder("analysis.anomalies")
                .description("Anomalies reported after exclusions")
                .register(registry);

        this.failedRulesCounter = Counter.builder("analysis.rules.failed")
                .description("Rules that failed during evaluation")
                .register(registry);

        this.cancelledCounter = Counter.builder("analysis.cancelled")
                .description("Analysis runs cancelled before all rules ran")
                .register(registry);
    }

    public void recordStageTimes(long contextMs, long normalizationMs, long rulesMs, long totalMs) {
        contextTimer.record(contextMs, TimeUnit.MILLISECONDS);
        normalizationTimer.record(normalizationMs, TimeUnit.MILLISECONDS);
        rulesTimer.record(rulesMs, TimeUnit.MILLISECONDS);
        totalTimer.record(totalMs, TimeUnit.MILLISECONDS);
    }

    public void recordRun(int anomalies, int failedRules, boolean cancelled) {
        runsCounter.increment();
        anomaliesCounter.increment(anomalies);
        failedRulesCounter.increment(failedRules);
        if (cancelled) {
            cancelledCounter.increment();
        }
    }
}
