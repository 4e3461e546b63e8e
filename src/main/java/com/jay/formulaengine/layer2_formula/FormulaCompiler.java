package com.jay.formulaengine.layer2_formula;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.formulaengine.layer2_formula.expression.AllOf;
import com.jay.formulaengine.layer2_formula.expression.AnyOf;
import com.jay.formulaengine.layer2_formula.expression.Between;
import com.jay.formulaengine.layer2_formula.expression.BooleanLiteral;
import com.jay.formulaengine.layer2_formula.expression.Comparison;
import com.jay.formulaengine.layer2_formula.expression.ComparisonOperator;
import com.jay.formulaengine.layer2_formula.expression.Condition;
import com.jay.formulaengine.layer2_formula.expression.HelperCall;
import com.jay.formulaengine.layer2_formula.expression.MarketReference;
import com.jay.formulaengine.layer2_formula.expression.Not;
import com.jay.formulaengine.layer2_formula.expression.NumberLiteral;
import com.jay.formulaengine.layer2_formula.expression.NumericExpression;
import com.jay.formulaengine.layer2_formula.expression.SafeFunction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses formula bodies (JSON rule documents) into condition and expression trees.
 *
 * <pre>
 * { "rules": [ { "when": {"lt": ["AAPL.rsi_14", 30]},
 *                "signal": {"signal_type": "entry_long", "confidence": 0.8,
 *                           "price": "AAPL.price", "symbol": "AAPL"} } ],
 *   "otherwise": { ... } }
 * </pre>
 *
 * A top-level "signal" is bound unconditionally.
 */
@Component
public class FormulaCompiler {

    static final int MAX_DEPTH = 32;

    private final ObjectMapper mapper = new ObjectMapper();

    public CompiledFormula compile(String body, Collection<String> declaredSymbols) {
        if (body == null || body.isBlank()) {
            throw new FormulaSyntaxException("Formula body is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FormulaSyntaxException("Formula body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FormulaSyntaxException("Formula body must be a JSON object");
        }

        JsonNode unconditional = root.has("signal") ? root.get("signal") : null;

        List<CompiledFormula.Rule> rules = new ArrayList<>();
        JsonNode rulesNode = root.path("rules");
        if (!rulesNode.isMissingNode()) {
            if (!rulesNode.isArray()) {
                throw new FormulaSyntaxException("'rules' must be an array");
            }
            int index = 0;
            for (JsonNode ruleNode : rulesNode) {
                if (!ruleNode.isObject() || !ruleNode.has("when")) {
                    throw new FormulaSyntaxException("Rule #" + index + " needs a 'when' condition");
                }
                Condition when = compileCondition(ruleNode.get("when"), declaredSymbols, 0);
                rules.add(new CompiledFormula.Rule(when, ruleNode.get("signal")));
                index++;
            }
        }

        JsonNode otherwise = root.has("otherwise") ? root.get("otherwise") : null;
        return new CompiledFormula(unconditional, rules, otherwise);
    }

    // ── Conditions ────────────────────────────────────────────────────────────

    public Condition compileCondition(JsonNode node, Collection<String> declaredSymbols, int depth) {
        checkDepth(depth);
        if (node == null || node.isNull()) {
            throw new FormulaSyntaxException("Missing condition");
        }
        if (node.isBoolean()) {
            return new BooleanLiteral(node.booleanValue());
        }
        Map.Entry<String, JsonNode> op = singleOperator(node, "condition");
        String name = op.getKey();
        JsonNode arg = op.getValue();

        switch (name) {
            case "all", "any" -> {
                List<Condition> parts = new ArrayList<>();
                for (JsonNode child : requireArray(arg, name, 1)) {
                    parts.add(compileCondition(child, declaredSymbols, depth + 1));
                }
                return "all".equals(name) ? new AllOf(parts) : new AnyOf(parts);
            }
            case "not" -> {
                return new Not(compileCondition(arg, declaredSymbols, depth + 1));
            }
            case "between" -> {
                List<JsonNode> args = requireArity(arg, name, 3);
                return new Between(
                    compileNumeric(args.get(0), declaredSymbols, depth + 1),
                    compileNumeric(args.get(1), declaredSymbols, depth + 1),
                    compileNumeric(args.get(2), declaredSymbols, depth + 1));
            }
            default -> {
                ComparisonOperator operator = ComparisonOperator.byName(name)
                    .orElseThrow(() -> new FormulaSyntaxException("Unknown condition '" + name + "'"));
                List<JsonNode> args = requireArity(arg, name, 2);
                return new Comparison(operator,
                    compileNumeric(args.get(0), declaredSymbols, depth + 1),
                    compileNumeric(args.get(1), declaredSymbols, depth + 1));
            }
        }
    }

    // ── Numeric expressions ───────────────────────────────────────────────────

    public NumericExpression compileNumeric(JsonNode node, Collection<String> declaredSymbols, int depth) {
        checkDepth(depth);
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new FormulaSyntaxException("Missing numeric operand");
        }
        if (node.isNumber()) {
            return new NumberLiteral(node.doubleValue());
        }
        if (node.isTextual()) {
            return parseReference(node.textValue(), declaredSymbols);
        }
        if (node.isObject()) {
            Map.Entry<String, JsonNode> op = singleOperator(node, "expression");
            SafeFunction function = SafeFunction.byName(op.getKey())
                .orElseThrow(() -> new FormulaSyntaxException("Unknown helper function '" + op.getKey() + "'"));
            List<JsonNode> rawArgs = requireArray(op.getValue(), op.getKey(), 1);
            if (!function.acceptsArity(rawArgs.size())) {
                throw new FormulaSyntaxException(String.format("%s does not accept %d argument(s)",
                    function.functionName(), rawArgs.size()));
            }
            List<NumericExpression> args = new ArrayList<>();
            for (JsonNode raw : rawArgs) {
                args.add(compileNumeric(raw, declaredSymbols, depth + 1));
            }
            return new HelperCall(function, args);
        }
        throw new FormulaSyntaxException("Unsupported operand: " + node);
    }

    private MarketReference parseReference(String text, Collection<String> declaredSymbols) {
        int dot = text.lastIndexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            throw new FormulaSyntaxException("Reference '" + text + "' must look like SYMBOL.field");
        }
        String symbol = text.substring(0, dot);
        String field = text.substring(dot + 1);
        if (!declaredSymbols.contains(symbol)) {
            throw new FormulaSyntaxException("Reference to undeclared symbol '" + symbol + "'");
        }
        return new MarketReference(symbol, field);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map.Entry<String, JsonNode> singleOperator(JsonNode node, String what) {
        if (!node.isObject() || node.size() != 1) {
            throw new FormulaSyntaxException("A " + what + " must be an object with exactly one operator: " + node);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        return fields.next();
    }

    private List<JsonNode> requireArray(JsonNode node, String op, int minSize) {
        if (node == null || !node.isArray() || node.size() < minSize) {
            throw new FormulaSyntaxException("'" + op + "' expects an array of at least " + minSize + " element(s)");
        }
        List<JsonNode> items = new ArrayList<>();
        node.forEach(items::add);
        return items;
    }

    private List<JsonNode> requireArity(JsonNode node, String op, int arity) {
        List<JsonNode> items = requireArray(node, op, arity);
        if (items.size() != arity) {
            throw new FormulaSyntaxException("'" + op + "' expects exactly " + arity + " arguments");
        }
        return items;
    }

    private void checkDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw new FormulaSyntaxException("Formula nesting deeper than " + MAX_DEPTH);
        }
    }
}
