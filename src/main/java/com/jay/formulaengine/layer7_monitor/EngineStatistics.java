package com.jay.formulaengine.layer7_monitor;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Layer 7 — Cycle-wide counters. The only mutable state shared by concurrent pipelines;
 * every field is atomic so increments from evaluation workers never need a lock.
 */
@Component
public class EngineStatistics {

    private final AtomicLong evaluationsAttempted = new AtomicLong();
    private final AtomicLong evaluationsSucceeded = new AtomicLong();
    private final AtomicLong evaluationsFailed = new AtomicLong();
    private final AtomicLong signalsGenerated = new AtomicLong();
    private final AtomicLong autoExecutions = new AtomicLong();
    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong pipelineErrors = new AtomicLong();
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong cyclesSkipped = new AtomicLong();
    private final AtomicReference<LocalDateTime> lastCycleAt = new AtomicReference<>();

    /** Point-in-time copy; individual counters are read one after another, not as a single transaction. */
    public record Snapshot(
        long evaluationsAttempted,
        long evaluationsSucceeded,
        long evaluationsFailed,
        long signalsGenerated,
        long autoExecutions,
        long notificationsSent,
        long pipelineErrors,
        long cyclesCompleted,
        long cyclesSkipped,
        LocalDateTime lastCycleAt
    ) {
        public double successRate() {
            return evaluationsAttempted == 0 ? 0 : (double) evaluationsSucceeded / evaluationsAttempted;
        }
    }

    public void evaluationAttempted()  { evaluationsAttempted.incrementAndGet(); }
    public void evaluationSucceeded()  { evaluationsSucceeded.incrementAndGet(); }
    public void evaluationFailed()     { evaluationsFailed.incrementAndGet(); }
    public void signalGenerated()      { signalsGenerated.incrementAndGet(); }
    public void autoExecuted()         { autoExecutions.incrementAndGet(); }
    public void notificationSent()     { notificationsSent.incrementAndGet(); }
    public void pipelineError()        { pipelineErrors.incrementAndGet(); }
    public void cycleSkipped()         { cyclesSkipped.incrementAndGet(); }

    public void cycleCompleted(LocalDateTime at) {
        cyclesCompleted.incrementAndGet();
        lastCycleAt.set(at);
    }

    public Snapshot snapshot() {
        return new Snapshot(
            evaluationsAttempted.get(),
            evaluationsSucceeded.get(),
            evaluationsFailed.get(),
            signalsGenerated.get(),
            autoExecutions.get(),
            notificationsSent.get(),
            pipelineErrors.get(),
            cyclesCompleted.get(),
            cyclesSkipped.get(),
            lastCycleAt.get());
    }

    public void reset() {
        evaluationsAttempted.set(0);
        evaluationsSucceeded.set(0);
        evaluationsFailed.set(0);
        signalsGenerated.set(0);
        autoExecutions.set(0);
        notificationsSent.set(0);
        pipelineErrors.set(0);
        cyclesCompleted.set(0);
        cyclesSkipped.set(0);
        lastCycleAt.set(null);
    }
}
