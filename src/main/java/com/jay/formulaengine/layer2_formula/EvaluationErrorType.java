package com.jay.formulaengine.layer2_formula;

public enum EvaluationErrorType {
    MISSING_MARKET_DATA,
    EVALUATION_TIMEOUT,
    MISSING_SIGNAL,
    INVALID_SIGNAL_SHAPE,
    UNKNOWN_SIGNAL_KIND,
    FORMULA_SYNTAX,
    RUNTIME_ERROR
}
