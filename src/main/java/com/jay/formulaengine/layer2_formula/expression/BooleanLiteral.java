package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

public record BooleanLiteral(boolean value) implements Condition {

    @Override
    public boolean test(FormulaContext ctx) {
        ctx.step();
        return value;
    }
}
