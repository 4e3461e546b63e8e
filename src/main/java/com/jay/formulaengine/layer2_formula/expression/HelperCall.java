package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.EvaluationErrorType;
import com.jay.formulaengine.layer2_formula.FormulaContext;
import com.jay.formulaengine.layer2_formula.FormulaEvaluationException;

import java.util.List;

public record HelperCall(SafeFunction function, List<NumericExpression> args) implements NumericExpression {

    public HelperCall {
        args = List.copyOf(args);
    }

    @Override
    public double evaluate(FormulaContext ctx) {
        ctx.step();
        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = args.get(i).evaluate(ctx);
        }
        double result = function.apply(values);
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new FormulaEvaluationException(EvaluationErrorType.RUNTIME_ERROR,
                function.functionName() + " produced a non-finite value");
        }
        return result;
    }
}
