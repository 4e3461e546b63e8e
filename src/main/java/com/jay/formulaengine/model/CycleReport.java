package com.jay.formulaengine.model;

import com.jay.formulaengine.layer2_formula.EvaluationError;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of one evaluation cycle (or an on-demand evaluation).
 */
public record CycleReport(
    LocalDateTime startedAt,
    LocalDateTime finishedAt,
    int evaluated,
    List<Signal> signals,
    List<ExecutionResult> executions,
    List<EvaluationError> failures
) {
    public static CycleReport skipped(LocalDateTime at) {
        return new CycleReport(at, at, 0, List.of(), List.of(), List.of());
    }
}
