package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

/** Inclusive range check: low <= value <= high. */
public record Between(NumericExpression value, NumericExpression low, NumericExpression high) implements Condition {

    @Override
    public boolean test(FormulaContext ctx) {
        ctx.step();
        double v = value.evaluate(ctx);
        return v >= low.evaluate(ctx) && v <= high.evaluate(ctx);
    }
}
