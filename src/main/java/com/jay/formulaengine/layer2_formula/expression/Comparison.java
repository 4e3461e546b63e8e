package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

public record Comparison(ComparisonOperator operator, NumericExpression left, NumericExpression right)
        implements Condition {

    @Override
    public boolean test(FormulaContext ctx) {
        ctx.step();
        return operator.compare(left.evaluate(ctx), right.evaluate(ctx));
    }
}
