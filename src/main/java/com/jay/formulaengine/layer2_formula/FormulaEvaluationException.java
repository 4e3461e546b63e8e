package com.jay.formulaengine.layer2_formula;

/**
 * Raised inside the formula sandbox; converted to an {@link EvaluationError} at the evaluator boundary.
 */
public class FormulaEvaluationException extends RuntimeException {

    private final EvaluationErrorType type;

    public FormulaEvaluationException(EvaluationErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public FormulaEvaluationException(EvaluationErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public EvaluationErrorType getType() {
        return type;
    }
}
