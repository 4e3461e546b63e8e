package com.jay.formulaengine.scheduler;

import com.jay.formulaengine.layer1_data.MarketDataService;
import com.jay.formulaengine.layer1_data.SubscriptionProvider;
import com.jay.formulaengine.layer2_formula.EvaluationError;
import com.jay.formulaengine.layer2_formula.EvaluationErrorType;
import com.jay.formulaengine.layer3_signal.PipelineOutcome;
import com.jay.formulaengine.layer3_signal.SignalPipeline;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.CycleReport;
import com.jay.formulaengine.model.ExecutionResult;
import com.jay.formulaengine.model.MarketSnapshot;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.enums.AuditEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs evaluation batches: snapshot of subscriptions, one shared market-data fetch, then one
 * pipeline per subscription on the evaluation pool. A failing pipeline never aborts the batch.
 *
 * Full cycles do not overlap; a cycle requested while one is running is skipped.
 * On-demand evaluations (one user, one formula) bypass that guard.
 */
@Slf4j
@Service
public class EvaluationEngine {

    private final SubscriptionProvider subscriptions;
    private final MarketDataService marketData;
    private final SignalPipeline pipeline;
    private final AuditLog audit;
    private final EngineStatistics stats;
    private final AsyncTaskExecutor workers;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);

    public EvaluationEngine(SubscriptionProvider subscriptions,
                            MarketDataService marketData,
                            SignalPipeline pipeline,
                            AuditLog audit,
                            EngineStatistics stats,
                            @Qualifier("evaluationExecutor") AsyncTaskExecutor workers) {
        this.subscriptions = subscriptions;
        this.marketData = marketData;
        this.pipeline = pipeline;
        this.audit = audit;
        this.stats = stats;
        this.workers = workers;
    }

    /** One full cycle across every active subscription. */
    public CycleReport evaluateAll() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.warn("Evaluation cycle already running — skipping this trigger");
            stats.cycleSkipped();
            return CycleReport.skipped(LocalDateTime.now());
        }
        try {
            List<Subscription> active = subscriptions.activeSubscriptions();
            CycleReport report = runBatch(active);
            stats.cycleCompleted(report.finishedAt());

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("evaluated", report.evaluated());
            summary.put("signals", report.signals().size());
            summary.put("executions", report.executions().size());
            summary.put("failures", report.failures().size());
            audit.event(AuditEventType.CYCLE_COMPLETED, "cycle", null, null, null, summary);
            log.info("Evaluation cycle done: {} evaluated, {} signals, {} routed, {} failures in {} ms",
                report.evaluated(), report.signals().size(), report.executions().size(), report.failures().size(),
                Duration.between(report.startedAt(), report.finishedAt()).toMillis());
            return report;
        } finally {
            cycleRunning.set(false);
        }
    }

    /** Evaluates every active subscription of one user. */
    public CycleReport evaluateUser(String userId) {
        List<Subscription> mine = subscriptions.subscriptionsForUser(userId).stream()
            .filter(Subscription::isEvaluable)
            .toList();
        log.info("On-demand evaluation for user {}: {} subscriptions", userId, mine.size());
        return runBatch(mine);
    }

    /**
     * Evaluates one (user, formula) pair through the same pipeline as a full cycle.
     *
     * @throws NoSuchElementException when the user has no active subscription to the formula
     */
    public CycleReport evaluateOne(String userId, String formulaId) {
        Subscription subscription = subscriptions.subscriptionsForUser(userId).stream()
            .filter(Subscription::isEvaluable)
            .filter(s -> formulaId.equals(s.getFormula().getId()))
            .findFirst()
            .orElseThrow(() -> new NoSuchElementException(
                "No active subscription of user " + userId + " to formula " + formulaId));
        return runBatch(List.of(subscription));
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    // ── Batch ─────────────────────────────────────────────────────────────────

    private CycleReport runBatch(List<Subscription> batch) {
        LocalDateTime startedAt = LocalDateTime.now();
        if (batch.isEmpty()) {
            return new CycleReport(startedAt, LocalDateTime.now(), 0, List.of(), List.of(), List.of());
        }

        Set<String> symbols = new LinkedHashSet<>();
        batch.forEach(s -> symbols.addAll(s.getFormula().getSymbols()));
        Map<String, MarketSnapshot> market = marketData.snapshot(symbols);
        log.debug("Batch of {} subscriptions over {} symbols ({} with data)", batch.size(), symbols.size(), market.size());

        List<Future<PipelineOutcome>> futures = new ArrayList<>();
        List<PipelineOutcome> outcomes = new ArrayList<>();
        for (Subscription subscription : batch) {
            try {
                futures.add(workers.submit(() -> runIsolated(subscription, market)));
            } catch (RejectedExecutionException e) {
                log.warn("Evaluation pool saturated — running {} on the caller thread", subscription.getId());
                outcomes.add(runIsolated(subscription, market));
            }
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Pipeline task failed unexpectedly: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                stats.pipelineError();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} pipelines — returning partial results", futures.size() - i);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            }
        }

        List<Signal> signals = new ArrayList<>();
        List<ExecutionResult> executions = new ArrayList<>();
        List<EvaluationError> failures = new ArrayList<>();
        for (PipelineOutcome outcome : outcomes) {
            if (outcome.signal() != null) signals.add(outcome.signal());
            if (outcome.execution() != null) executions.add(outcome.execution());
            if (outcome.error() != null) failures.add(outcome.error());
        }
        return new CycleReport(startedAt, LocalDateTime.now(), batch.size(),
            List.copyOf(signals), List.copyOf(executions), List.copyOf(failures));
    }

    // Error isolation boundary: nothing thrown by one pipeline reaches the batch.
    private PipelineOutcome runIsolated(Subscription subscription, Map<String, MarketSnapshot> market) {
        try {
            return pipeline.run(subscription, market);
        } catch (Exception e) {
            stats.pipelineError();
            String formulaId = subscription.getFormula().getId();
            log.error("Pipeline for subscription {} (formula {}) failed: {}",
                subscription.getId(), formulaId, e.getMessage(), e);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("subscription_id", subscription.getId());
            payload.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            audit.event(AuditEventType.PIPELINE_FAILED, formulaId, subscription.getUserId(), formulaId,
                subscription.getFormula().primarySymbol(), payload);
            return PipelineOutcome.failed(subscription.getId(), new EvaluationError(formulaId,
                subscription.getFormula().primarySymbol(), EvaluationErrorType.RUNTIME_ERROR,
                "Pipeline failed: " + e.getMessage()));
        }
    }
}
