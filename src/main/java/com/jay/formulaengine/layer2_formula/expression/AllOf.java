package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.FormulaContext;

import java.util.List;

public record AllOf(List<Condition> conditions) implements Condition {

    public AllOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public boolean test(FormulaContext ctx) {
        ctx.step();
        for (Condition c : conditions) {
            if (!c.test(ctx)) return false;
        }
        return true;
    }
}
