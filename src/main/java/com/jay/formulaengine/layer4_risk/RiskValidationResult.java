package com.jay.formulaengine.layer4_risk;

import com.jay.formulaengine.model.RiskMetrics;
import com.jay.formulaengine.model.SuggestedAdjustments;
import com.jay.formulaengine.model.enums.RiskStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of validating one trade. {@code suggestedAdjustments} is null when the
 * validator had nothing to recommend.
 */
public record RiskValidationResult(
    RiskStatus status,
    String message,
    RiskMetrics metrics,
    SuggestedAdjustments suggestedAdjustments
) {

    public boolean isRejected() {
        return status == RiskStatus.REJECTED;
    }

    /** Suggested numeric values keyed the way approval adjustments are keyed. */
    public Map<String, Double> adjustmentValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        if (suggestedAdjustments == null) return values;
        if (suggestedAdjustments.suggestedPositionSize() != null) {
            values.put("position_size", suggestedAdjustments.suggestedPositionSize());
        }
        if (suggestedAdjustments.suggestedTakeProfit() != null) {
            values.put("take_profit", suggestedAdjustments.suggestedTakeProfit());
        }
        return values;
    }
}
