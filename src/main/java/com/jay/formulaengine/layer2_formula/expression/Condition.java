package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

public interface Condition {
    boolean test(FormulaContext ctx);
}
