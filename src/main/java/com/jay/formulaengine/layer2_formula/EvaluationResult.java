package com.jay.formulaengine.layer2_formula;

import com.jay.formulaengine.model.Signal;

/**
 * Either a signal or a typed evaluation error, never both.
 */
public record EvaluationResult(Signal signal, EvaluationError error) {

    public static EvaluationResult success(Signal signal) {
        return new EvaluationResult(signal, null);
    }

    public static EvaluationResult failure(EvaluationError error) {
        return new EvaluationResult(null, error);
    }

    public boolean isSuccess() {
        return signal != null;
    }
}
