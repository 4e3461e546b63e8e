package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

public record NumberLiteral(double value) implements NumericExpression {

    @Override
    public double evaluate(FormulaContext ctx) {
        ctx.step();
        return value;
    }
}
