package com.jay.formulaengine.layer2_formula.expression;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ComparisonOperator {
    GT, GTE, LT, LTE, EQ, NEQ;

    private static final double EPSILON = 1e-9;

    boolean compare(double left, double right) {
        return switch (this) {
            case GT -> left > right;
            case GTE -> left >= right;
            case LT -> left < right;
            case LTE -> left <= right;
            case EQ -> Math.abs(left - right) < EPSILON;
            case NEQ -> Math.abs(left - right) >= EPSILON;
        };
    }

    public static Optional<ComparisonOperator> byName(String name) {
        return Arrays.stream(values())
            .filter(op -> op.name().toLowerCase(Locale.ROOT).equals(name))
            .findFirst();
    }
}
