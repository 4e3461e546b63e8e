package com.jay.formulaengine.layer3_signal;

import com.jay.formulaengine.layer2_formula.EvaluationError;
import com.jay.formulaengine.model.ExecutionResult;
import com.jay.formulaengine.model.Signal;

/**
 * What one evaluate→validate→route pass produced for a subscription.
 * Exactly one of {@code signal} and {@code error} is set; {@code execution} is null for
 * failures and HOLD signals.
 */
public record PipelineOutcome(String subscriptionId, Signal signal, EvaluationError error, ExecutionResult execution) {

    public static PipelineOutcome failed(String subscriptionId, EvaluationError error) {
        return new PipelineOutcome(subscriptionId, null, error, null);
    }

    public static PipelineOutcome signalled(String subscriptionId, Signal signal, ExecutionResult execution) {
        return new PipelineOutcome(subscriptionId, signal, null, execution);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
