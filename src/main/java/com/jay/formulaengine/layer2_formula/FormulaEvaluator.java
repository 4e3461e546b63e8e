package com.jay.formulaengine.layer2_formula;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.Formula;
import com.jay.formulaengine.model.MarketSnapshot;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.enums.SignalType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one formula against the cycle's market snapshots and produces a {@link Signal}
 * or a typed {@link EvaluationError}. Never throws: every failure, including the
 * wall-clock timeout, comes back as an error value.
 *
 * The formula only sees snapshots of the symbols it declares. Evaluation happens on the
 * sandbox executor so a stuck formula can be abandoned without holding up the caller.
 */
@Component
public class FormulaEvaluator {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final FormulaCompiler compiler;
    private final AsyncTaskExecutor sandbox;
    private final EngineConfig config;
    private final ObjectMapper mapper = new ObjectMapper();

    public FormulaEvaluator(FormulaCompiler compiler,
                            @Qualifier("formulaSandboxExecutor") AsyncTaskExecutor sandbox,
                            EngineConfig config) {
        this.compiler = compiler;
        this.sandbox = sandbox;
        this.config = config;
    }

    public EvaluationResult evaluate(Formula formula, Map<String, MarketSnapshot> marketSnapshots) {
        List<String> declared = formula.getSymbols() == null ? List.of() : formula.getSymbols();
        List<String> missing = declared.stream()
            .filter(s -> marketSnapshots == null || !marketSnapshots.containsKey(s))
            .toList();
        if (!missing.isEmpty()) {
            return fail(formula, missing.get(0), EvaluationErrorType.MISSING_MARKET_DATA,
                "No market data for " + String.join(", ", missing));
        }

        Map<String, MarketSnapshot> visible = new LinkedHashMap<>();
        declared.forEach(s -> visible.put(s, marketSnapshots.get(s)));

        long timeoutMs = config.evaluation().getTimeoutMs();
        Future<Signal> future;
        try {
            future = sandbox.submit(() -> interpret(formula, visible));
        } catch (RejectedExecutionException e) {
            return fail(formula, formula.primarySymbol(), EvaluationErrorType.RUNTIME_ERROR,
                "Formula sandbox is saturated");
        }

        try {
            return EvaluationResult.success(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return fail(formula, formula.primarySymbol(), EvaluationErrorType.EVALUATION_TIMEOUT,
                "Evaluation exceeded " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FormulaEvaluationException fe) {
                return fail(formula, formula.primarySymbol(), fe.getType(), fe.getMessage());
            }
            return fail(formula, formula.primarySymbol(), EvaluationErrorType.RUNTIME_ERROR,
                cause == null ? e.getMessage() : cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fail(formula, formula.primarySymbol(), EvaluationErrorType.RUNTIME_ERROR,
                "Evaluation interrupted");
        }
    }

    // ── Sandbox body ──────────────────────────────────────────────────────────

    Signal interpret(Formula formula, Map<String, MarketSnapshot> snapshots) {
        List<String> declared = formula.getSymbols();
        CompiledFormula compiled = compiler.compile(formula.getBody(), declared);
        FormulaContext ctx = new FormulaContext(formula.getId(), snapshots);

        JsonNode binding = compiled.selectBinding(ctx);
        if (binding == null || binding.isNull()) {
            throw new FormulaEvaluationException(EvaluationErrorType.MISSING_SIGNAL,
                "Formula must set the 'signal' binding");
        }
        if (!binding.isObject()) {
            throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                "Signal must be a mapping, got " + binding.getNodeType());
        }
        for (String field : List.of("signal_type", "confidence", "price", "symbol")) {
            if (!binding.hasNonNull(field)) {
                throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                    "Signal is missing '" + field + "'");
            }
        }

        JsonNode kindNode = binding.get("signal_type");
        SignalType kind = SignalType.parse(kindNode.isTextual() ? kindNode.textValue() : null)
            .orElseThrow(() -> new FormulaEvaluationException(EvaluationErrorType.UNKNOWN_SIGNAL_KIND,
                "Unknown signal type " + kindNode));

        JsonNode symbolNode = binding.get("symbol");
        if (!symbolNode.isTextual() || !declared.contains(symbolNode.textValue())) {
            throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                "Signal symbol " + symbolNode + " is not one of the formula's symbols " + declared);
        }

        double confidence = compiler.compileNumeric(binding.get("confidence"), declared, 0).evaluate(ctx);
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                String.format("Confidence %.4f outside [0, 1]", confidence));
        }
        double price = compiler.compileNumeric(binding.get("price"), declared, 0).evaluate(ctx);
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                "Signal price must be positive, got " + price);
        }

        return Signal.builder()
            .userId(formula.getUserId())
            .formulaId(formula.getId())
            .symbol(symbolNode.textValue())
            .signalType(kind)
            .confidence(confidence)
            .price(price)
            .timestamp(LocalDateTime.now())
            .metadata(readMetadata(binding.get("metadata")))
            .build();
    }

    private Map<String, Object> readMetadata(JsonNode node) {
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) {
            throw new FormulaEvaluationException(EvaluationErrorType.INVALID_SIGNAL_SHAPE,
                "Signal metadata must be a mapping");
        }
        return mapper.convertValue(node, METADATA_TYPE);
    }

    private EvaluationResult fail(Formula formula, String symbol, EvaluationErrorType type, String message) {
        return EvaluationResult.failure(new EvaluationError(formula.getId(), symbol, type, message));
    }
}
