package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

/** A "SYMBOL.field" reference, e.g. AAPL.price or AAPL.rsi_14. */
public record MarketReference(String symbol, String field) implements NumericExpression {

    @Override
    public double evaluate(FormulaContext ctx) {
        ctx.step();
        return ctx.resolve(symbol, field);
    }
}
