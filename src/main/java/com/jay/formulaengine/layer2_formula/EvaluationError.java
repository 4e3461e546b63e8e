package com.jay.formulaengine.layer2_formula;

/**
 * Typed failure of one formula evaluation. The message is meant for the formula's owner.
 */
public record EvaluationError(String formulaId, String symbol, EvaluationErrorType type, String message) {

    public String describe() {
        return String.format("%s [%s/%s]: %s", type, formulaId, symbol, message);
    }
}
