package com.warewise.service.rules;

import com.warewise.model.AnomalyRecord;
import com.warewise.model.ExclusionStats;
import com.warewise.model.MissingConfigurationException;
import com.warewise.model.RuleContractViolationException;
import com.warewise.model.RuleDefinition;
import com.warewise.model.RuleExecutionResult;
import com.warewise.model.RuleExecutionStatus;
import com.warewise.model.RuleType;
import com.warewise.service.preload.AnalysisContext;
import com.warewise.service.rules.RulePrecedenceManager.PrecedenceOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Runs every rule's evaluator over the normalized inventory and merges the results.
 *
 * Rules are independent until the merge, so they run in parallel under a semaphore. A rule
 * that fails (missing template, unsupported type, unexpected error) is reported in its
 * {@link RuleExecutionResult} and the others still run. Only
 * {@link RuleContractViolationException} escapes to the caller.
 *
 * Cancellation is checked before each rule starts; rules not yet started are reported CANCELLED.
 */
@Service
@Slf4j
public class RuleEvaluationService {

    private final RuleEvaluatorRegistry registry;
    private final RulePrecedenceManager precedenceManager;
    private final Semaphore evaluationSemaphore;
    private final boolean locationTypeMismatchEnabled;

    public RuleEvaluationService(
            RuleEvaluatorRegistry registry,
            RulePrecedenceManager precedenceManager,
            @Value("${app.engine.rule-concurrency:8}") int ruleConcurrency,
            @Value("${app.engine.rules.location-type-mismatch.enabled:false}") boolean locationTypeMismatchEnabled) {
        this.registry = registry;
        this.precedenceManager = precedenceManager;
        this.evaluationSemaphore = new Semaphore(ruleConcurrency);
        this.locationTypeMismatchEnabled = locationTypeMismatchEnabled;
        log.info("RuleEvaluationService initialized with concurrency limit: {}, locationTypeMismatch={}",
                ruleConcurrency, locationTypeMismatchEnabled ? "ENABLED" : "DISABLED");
    }

    /**
     * Evaluate all rules in parallel with concurrency limit.
     *
     * @param rules    rule definitions, in any order
     * @param context  normalized inventory and resolved warehouse
     * @param executor executor for parallel evaluation
     */
    public EvaluationOutput evaluate(List<RuleDefinition> rules, AnalysisContext context, ExecutorService executor) {
        if (rules.isEmpty()) {
            return new EvaluationOutput(List.of(), List.of(), ExclusionStats.NONE, false);
        }

        List<RuleDefinition> ordered = rules.stream().sorted(RulePrecedenceManager.PRECEDENCE_ORDER).toList();
        log.info("Evaluating {} rules in PARALLEL (max {} concurrent) over {} records...",
                ordered.size(), evaluationSemaphore.availablePermits(), context.getInventory().size());

        List<CompletableFuture<RuleRun>> futures = ordered.stream()
                .map(rule -> CompletableFuture.supplyAsync(() -> evaluateWithSemaphore(rule, context), executor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuleContractViolationException violation) {
                throw violation;
            }
            throw e;
        }

        Map<RuleDefinition, List<AnomalyRecord>> anomaliesByRule = new LinkedHashMap<>();
        List<RuleExecutionResult> results = new ArrayList<>();
        for (CompletableFuture<RuleRun> future : futures) {
            RuleRun run = future.join();
            results.add(run.result());
            if (run.result().success()) {
                anomaliesByRule.put(run.rule(), run.anomalies());
            }
        }

        PrecedenceOutcome outcome = precedenceManager.apply(anomaliesByRule);
        List<AnomalyRecord> sorted = outcome.anomalies().stream().sorted(AnomalyRecord.REPORT_ORDER).toList();
        results.sort(Comparator.comparingLong(RuleExecutionResult::ruleId));
        boolean cancelled = context.getCancellationToken().isCancelled();

        log.info("Rule evaluation complete: {} anomalies, {} rules succeeded, {} failed, {} skipped, {} cancelled",
                sorted.size(),
                count(results, RuleExecutionStatus.SUCCESS),
                count(results, RuleExecutionStatus.FAILED),
                count(results, RuleExecutionStatus.SKIPPED),
                count(results, RuleExecutionStatus.CANCELLED));
        return new EvaluationOutput(sorted, List.copyOf(results), outcome.stats(), cancelled);
    }

    /**
     * Evaluate a single rule with semaphore control.
     */
    private RuleRun evaluateWithSemaphore(RuleDefinition rule, AnalysisContext context) {
        try {
            evaluationSemaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Evaluation interrupted before rule {} started", rule.id());
            return new RuleRun(rule, List.of(), RuleExecutionResult.cancelled(rule));
        }
        try {
            return evaluateRule(rule, context);
        } finally {
            evaluationSemaphore.release();
        }
    }

    RuleRun evaluateRule(RuleDefinition rule, AnalysisContext context) {
        if (context.getCancellationToken().isCancelled()) {
            return new RuleRun(rule, List.of(), RuleExecutionResult.cancelled(rule));
        }
        if (!rule.active()) {
            return new RuleRun(rule, List.of(), RuleExecutionResult.skipped(rule, "rule is not active"));
        }
        Optional<RuleType> type = rule.resolvedType();
        if (type.isEmpty()) {
            String message = "No evaluator registered for rule type: " + rule.ruleType();
            log.warn("Rule {} failed: {}", rule.id(), message);
            return new RuleRun(rule, List.of(), RuleExecutionResult.failed(rule, 0, message));
        }
        if (type.get() == RuleType.LOCATION_TYPE_MISMATCH && !locationTypeMismatchEnabled) {
            return new RuleRun(rule, List.of(), RuleExecutionResult.skipped(rule, "location type mismatch rule is disabled"));
        }

        long startTime = System.currentTimeMillis();
        try {
            List<AnomalyRecord> anomalies = List.copyOf(registry.evaluatorFor(type.get()).evaluate(rule, context));
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Rule {} '{}' ({}): {} anomalies in {}ms", rule.id(), rule.name(), type.get(), anomalies.size(), elapsed);
            return new RuleRun(rule, anomalies, RuleExecutionResult.success(rule, anomalies.size(), elapsed));
        } catch (RuleContractViolationException e) {
            log.error("Rule {} '{}' is misconfigured: {}", rule.id(), rule.name(), e.getMessage());
            throw e;
        } catch (MissingConfigurationException e) {
            log.warn("Rule {} '{}' cannot run: {}", rule.id(), rule.name(), e.getMessage());
            return new RuleRun(rule, List.of(), RuleExecutionResult.failed(rule, System.currentTimeMillis() - startTime, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Rule {} '{}' failed unexpectedly", rule.id(), rule.name(), e);
            return new RuleRun(rule, List.of(), RuleExecutionResult.failed(rule, System.currentTimeMillis() - startTime,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private static long count(List<RuleExecutionResult> results, RuleExecutionStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    record RuleRun(RuleDefinition rule, List<AnomalyRecord> anomalies, RuleExecutionResult result) {}

    /**
     * Output record for rule evaluation.
     *
     * @param anomalies anomalies after exclusions, in report order
     * @param ruleResults one entry per rule, ordered by rule id
     */
    public record EvaluationOutput(
            List<AnomalyRecord> anomalies,
            List<RuleExecutionResult> ruleResults,
            ExclusionStats exclusionStats,
            boolean cancelled
    ) {}
}
