package com.jay.formulaengine.layer2_formula;

public class FormulaSyntaxException extends FormulaEvaluationException {

    public FormulaSyntaxException(String message) {
        super(EvaluationErrorType.FORMULA_SYNTAX, message);
    }

    public FormulaSyntaxException(String message, Throwable cause) {
        super(EvaluationErrorType.FORMULA_SYNTAX, message, cause);
    }
}
