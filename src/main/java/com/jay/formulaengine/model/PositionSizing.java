package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.PriceLevelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-subscription sizing rules used to turn a signal into a concrete trade.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSizing {

    @Builder.Default
    private double portfolioValue = 10000;

    /** Fixed number of units; when 0 the size is derived from {@link #allocationPct}. */
    private double quantity;

    @Builder.Default
    private double allocationPct = 0.05;

    @Builder.Default
    private double stopLoss = 2.0;

    @Builder.Default
    private PriceLevelType stopLossType = PriceLevelType.PERCENTAGE;

    @Builder.Default
    private double takeProfit = 4.0;

    @Builder.Default
    private PriceLevelType takeProfitType = PriceLevelType.PERCENTAGE;

    @Builder.Default
    private double leverage = 1.0;
}
