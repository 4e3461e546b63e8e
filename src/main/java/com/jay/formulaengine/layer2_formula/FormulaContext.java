package com.jay.formulaengine.layer2_formula;

import com.jay.formulaengine.model.MarketSnapshot;

import java.util.Map;

/**
 * The only state a formula can see: the snapshots of its declared symbols.
 * Every node evaluation goes through {@link #step()}, which enforces the
 * step budget and honours interruption from the evaluation timeout.
 */
public class FormulaContext {

    static final int MAX_STEPS = 10_000;

    private final String formulaId;
    private final Map<String, MarketSnapshot> snapshots;
    private int steps;

    public FormulaContext(String formulaId, Map<String, MarketSnapshot> snapshots) {
        this.formulaId = formulaId;
        this.snapshots = Map.copyOf(snapshots);
    }

    public String formulaId() {
        return formulaId;
    }

    public void step() {
        if (Thread.currentThread().isInterrupted()) {
            throw new FormulaEvaluationException(EvaluationErrorType.EVALUATION_TIMEOUT,
                "Evaluation interrupted after exceeding its time budget");
        }
        if (++steps > MAX_STEPS) {
            throw new FormulaEvaluationException(EvaluationErrorType.RUNTIME_ERROR,
                "Formula exceeded " + MAX_STEPS + " evaluation steps");
        }
    }

    public double resolve(String symbol, String field) {
        MarketSnapshot snapshot = snapshots.get(symbol);
        if (snapshot == null) {
            throw new FormulaEvaluationException(EvaluationErrorType.MISSING_MARKET_DATA,
                "No market data for " + symbol);
        }
        switch (field) {
            case "price":  return snapshot.getPrice();
            case "volume": return snapshot.getVolume();
            case "open":   return snapshot.getOpen();
            case "high":   return snapshot.getHigh();
            case "low":    return snapshot.getLow();
            case "close":  return snapshot.getClose();
            default:
                Map<String, Double> indicators = snapshot.getIndicators();
                Double value = indicators == null ? null : indicators.get(field);
                if (value == null) {
                    throw new FormulaEvaluationException(EvaluationErrorType.RUNTIME_ERROR,
                        String.format("Indicator '%s' not available for %s", field, symbol));
                }
                return value;
        }
    }
}
