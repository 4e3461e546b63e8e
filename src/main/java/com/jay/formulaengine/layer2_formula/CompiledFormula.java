package com.jay.formulaengine.layer2_formula;

import com.fasterxml.jackson.databind.JsonNode;
import com.jay.formulaengine.layer2_formula.expression.Condition;

import java.util.List;

/**
 * A parsed formula body. Signal bindings stay as raw JSON until one is selected,
 * so shape problems surface as evaluation errors of the binding actually produced.
 *
 * @param unconditional top-level "signal" binding, or null
 * @param rules         ordered rules, first match wins
 * @param otherwise     fallback binding when no rule matches, or null
 */
public record CompiledFormula(JsonNode unconditional, List<Rule> rules, JsonNode otherwise) {

    public record Rule(Condition when, JsonNode signal) {}

    public CompiledFormula {
        rules = List.copyOf(rules);
    }

    /** Returns the selected "signal" binding, or null when nothing binds it. */
    public JsonNode selectBinding(FormulaContext ctx) {
        if (unconditional != null) return unconditional;
        for (Rule rule : rules) {
            if (rule.when().test(ctx)) return rule.signal();
        }
        return otherwise;
    }
}
