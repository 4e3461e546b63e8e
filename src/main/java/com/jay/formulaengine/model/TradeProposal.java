package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.OrderSide;
import com.jay.formulaengine.model.enums.PriceLevelType;
import lombok.Builder;
import lombok.Value;

/**
 * A concrete trade derived from a signal and the subscription's sizing rules.
 * Stop-loss and take-profit are raw values interpreted through their {@link PriceLevelType}.
 */
@Value
@Builder(toBuilder = true)
public class TradeProposal {
    String symbol;

    @Builder.Default
    OrderSide side = OrderSide.BUY;

    double entryPrice;
    double positionSize;
    double stopLoss;
    @Builder.Default
    PriceLevelType stopLossType = PriceLevelType.FIXED;
    double takeProfit;
    @Builder.Default
    PriceLevelType takeProfitType = PriceLevelType.FIXED;
    double currentPrice;
    double portfolioValue;

    @Builder.Default
    double leverage = 1.0;
}
