package com.jay.formulaengine.model;

import java.util.List;

/**
 * Adjustments the risk validator proposes when a trade breaches or strains a policy.
 * Suggested values are null when not computable for the breach at hand.
 */
public record SuggestedAdjustments(
    List<String> recommendations,
    Double suggestedPositionSize,
    Double suggestedTakeProfit
) {
    public SuggestedAdjustments {
        recommendations = List.copyOf(recommendations);
    }
}
