package com.jay.formulaengine.layer3_signal;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.PositionSizing;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.TradeProposal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns an actionable signal into a concrete trade using the subscription's sizing rules.
 * Quantity is the fixed quantity when set, otherwise portfolio value × allocation / price.
 */
@Component
@RequiredArgsConstructor
public class TradeProposalFactory {

    private final EngineConfig config;

    public TradeProposal create(Signal signal, PositionSizing sizing) {
        if (!signal.getSignalType().isActionable()) {
            throw new IllegalArgumentException("HOLD signals do not produce trades");
        }
        PositionSizing s = sizing != null ? sizing : config.defaultSizing();
        double price = signal.getPrice();
        double quantity = s.getQuantity() > 0
            ? s.getQuantity()
            : (price > 0 ? s.getPortfolioValue() * s.getAllocationPct() / price : 0);

        return TradeProposal.builder()
            .symbol(signal.getSymbol())
            .side(signal.getSignalType().orderSide())
            .entryPrice(price)
            .currentPrice(price)
            .positionSize(quantity)
            .stopLoss(s.getStopLoss())
            .stopLossType(s.getStopLossType())
            .takeProfit(s.getTakeProfit())
            .takeProfitType(s.getTakeProfitType())
            .portfolioValue(s.getPortfolioValue())
            .leverage(s.getLeverage())
            .build();
    }
}
