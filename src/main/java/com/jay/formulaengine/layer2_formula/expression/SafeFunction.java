package com.jay.formulaengine.layer2_formula.expression;

import com.jay.formulaengine.layer2_formula.EvaluationErrorType;
import com.jay.formulaengine.layer2_formula.FormulaEvaluationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The complete set of helpers a formula may call. Pure arithmetic only.
 */
public enum SafeFunction {
    ADD(2, Integer.MAX_VALUE) {
        @Override double apply(double[] a) { return Arrays.stream(a).sum(); }
    },
    SUB(2, 2) {
        @Override double apply(double[] a) { return a[0] - a[1]; }
    },
    MUL(2, Integer.MAX_VALUE) {
        @Override double apply(double[] a) {
            double r = 1;
            for (double v : a) r *= v;
            return r;
        }
    },
    DIV(2, 2) {
        @Override double apply(double[] a) {
            if (a[1] == 0) {
                throw new FormulaEvaluationException(EvaluationErrorType.RUNTIME_ERROR, "Division by zero");
            }
            return a[0] / a[1];
        }
    },
    NEG(1, 1) {
        @Override double apply(double[] a) { return -a[0]; }
    },
    ABS(1, 1) {
        @Override double apply(double[] a) { return Math.abs(a[0]); }
    },
    MIN(1, Integer.MAX_VALUE) {
        @Override double apply(double[] a) { return Arrays.stream(a).min().orElseThrow(); }
    },
    MAX(1, Integer.MAX_VALUE) {
        @Override double apply(double[] a) { return Arrays.stream(a).max().orElseThrow(); }
    },
    /** Percent change from the first argument to the second. */
    PCT_CHANGE(2, 2) {
        @Override double apply(double[] a) {
            if (a[0] == 0) {
                throw new FormulaEvaluationException(EvaluationErrorType.RUNTIME_ERROR,
                    "pct_change from zero base");
            }
            return (a[1] - a[0]) / a[0] * 100;
        }
    },
    CLAMP(3, 3) {
        @Override double apply(double[] a) { return Math.max(a[1], Math.min(a[2], a[0])); }
    },
    ROUND(2, 2) {
        @Override double apply(double[] a) {
            double scale = Math.pow(10, (int) a[1]);
            return Math.round(a[0] * scale) / scale;
        }
    };

    private final int minArgs;
    private final int maxArgs;

    SafeFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    abstract double apply(double[] args);

    public boolean acceptsArity(int n) {
        return n >= minArgs && n <= maxArgs;
    }

    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SafeFunction> byName(String name) {
        return Arrays.stream(values()).filter(f -> f.functionName().equals(name)).findFirst();
    }
}
