package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.layer4_risk.RiskValidationResult;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.RiskMetrics;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.TradeProposal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the payload maps shared by audit entries and notifications.
 */
final class TradePayloads {

    private TradePayloads() {}

    static Map<String, Object> signal(String tradeId, Signal signal) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("trade_id", tradeId);
        p.put("formula_id", signal.getFormulaId());
        p.put("symbol", signal.getSymbol());
        p.put("signal_type", signal.getSignalType() != null ? signal.getSignalType().name() : null);
        p.put("confidence", signal.getConfidence());
        p.put("price", signal.getPrice());
        if (signal.getMetadata() != null && !signal.getMetadata().isEmpty()) {
            p.put("metadata", signal.getMetadata());
        }
        return p;
    }

    static Map<String, Object> trade(String tradeId, Signal signal, TradeProposal proposal, RiskValidationResult risk) {
        Map<String, Object> p = signal(tradeId, signal);
        if (proposal != null) {
            p.put("side", proposal.getSide().name());
            p.put("quantity", proposal.getPositionSize());
            p.put("stop_loss", proposal.getStopLoss());
            p.put("stop_loss_type", proposal.getStopLossType().name());
            p.put("take_profit", proposal.getTakeProfit());
            p.put("take_profit_type", proposal.getTakeProfitType().name());
        }
        if (risk != null) {
            p.put("risk_status", risk.status().name());
            p.put("risk_message", risk.message());
            RiskMetrics m = risk.metrics();
            if (m != null) {
                p.put("risk_amount", m.riskAmount());
                p.put("reward_amount", m.rewardAmount());
                p.put("risk_reward_ratio", m.riskRewardRatio());
                p.put("portfolio_risk_pct", m.portfolioRiskPct());
                p.put("position_risk_pct", m.positionRiskPct());
                p.put("violations", m.violations());
                p.put("warnings", m.warnings());
                p.put("recommendations", m.recommendations());
            }
        }
        return p;
    }

    static Map<String, Object> fill(String tradeId, Signal signal, OrderFill fill) {
        Map<String, Object> p = signal(tradeId, signal);
        p.put("order_id", fill.orderId());
        p.put("order_status", fill.status().name());
        p.put("quantity", fill.filledQuantity());
        p.put("execution_price", fill.averagePrice());
        return p;
    }

    static Map<String, Object> failure(String tradeId, Signal signal, String error) {
        Map<String, Object> p = signal(tradeId, signal);
        p.put("error", error);
        return p;
    }
}
