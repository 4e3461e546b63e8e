package com.jay.formulaengine.layer4_risk;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.RiskMetrics;
import com.jay.formulaengine.model.RiskPolicy;
import com.jay.formulaengine.model.SuggestedAdjustments;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.PriceLevelType;
import com.jay.formulaengine.model.enums.RiskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 4 — Risk Validator.
 * Computes risk metrics for a proposed trade and checks them against a {@link RiskPolicy}.
 * Any violation rejects the trade; warnings alone let it through with status WARNING.
 *
 * Stateless: metrics are recomputed on every call and never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskValidator {

    private final EngineConfig config;

    /**
     * Validates the trade against the policy, or the configured default policy when null.
     */
    public RiskValidationResult validateTrade(TradeProposal trade, RiskPolicy policy) {
        RiskPolicy effective = policy != null ? policy : config.defaultRiskPolicy();
        RiskMetrics metrics = calculateRiskMetrics(trade, effective);

        RiskStatus status;
        String message;
        if (metrics.risky()) {
            status = RiskStatus.REJECTED;
            message = "Trade rejected due to risk violations: " + String.join("; ", metrics.violations());
        } else if (!metrics.warnings().isEmpty()) {
            status = RiskStatus.WARNING;
            message = "Trade approved with warnings: " + String.join("; ", metrics.warnings());
        } else {
            status = RiskStatus.APPROVED;
            message = "Trade approved - all risk parameters within limits";
        }

        SuggestedAdjustments adjustments = null;
        if (!metrics.recommendations().isEmpty()) {
            double stopPrice = stopLossPrice(trade.getEntryPrice(), trade.getStopLoss(), trade.getStopLossType());
            Double suggestedSize = null;
            Double suggestedTakeProfit = null;
            if (metrics.portfolioRiskPct() > effective.getMaxPortfolioRisk() * 100) {
                suggestedSize = effective.getMaxPortfolioRisk() * trade.getPortfolioValue()
                    / Math.abs(trade.getEntryPrice() - stopPrice);
            }
            if (metrics.riskRewardRatio() < effective.getMinRiskRewardRatio() && trade.getPositionSize() > 0) {
                suggestedTakeProfit = trade.getEntryPrice()
                    + (metrics.riskAmount() / trade.getPositionSize()) * effective.getMinRiskRewardRatio();
            }
            adjustments = new SuggestedAdjustments(metrics.recommendations(), suggestedSize, suggestedTakeProfit);
        }

        log.debug("Risk {} for {}: {}", status, trade.getSymbol(), message);
        return new RiskValidationResult(status, message, metrics, adjustments);
    }

    public RiskMetrics calculateRiskMetrics(TradeProposal trade, RiskPolicy policy) {
        double entry = trade.getEntryPrice();
        double size = trade.getPositionSize();
        double portfolio = trade.getPortfolioValue();

        double stopPrice = stopLossPrice(entry, trade.getStopLoss(), trade.getStopLossType());
        double targetPrice = takeProfitPrice(entry, trade.getTakeProfit(), trade.getTakeProfitType());

        double riskAmount = Math.abs(entry - stopPrice) * size;
        double rewardAmount = Math.abs(targetPrice - entry) * size;
        double riskReward = riskAmount > 0 ? rewardAmount / riskAmount : 0;
        double portfolioRiskPct = portfolio > 0 ? riskAmount / portfolio * 100 : 0;
        double positionRiskPct = portfolio > 0 ? size * entry / portfolio * 100 : 0;
        double leverageRisk = trade.getLeverage() * positionRiskPct;

        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        double maxPortfolioPct = policy.getMaxPortfolioRisk() * 100;
        double maxPositionPct = policy.getMaxPositionSize() * 100;
        double maxPerTradePct = policy.getMaxRiskPerTrade() * 100;

        // ── Violations ────────────────────────────────────────────────────────
        if (portfolio <= 0) {
            violations.add(String.format("Portfolio value (%.2f) must be positive", portfolio));
        }
        if (portfolioRiskPct > maxPortfolioPct) {
            violations.add(String.format("Portfolio risk (%.2f%%) exceeds maximum (%.2f%%)",
                portfolioRiskPct, maxPortfolioPct));
        }
        if (positionRiskPct > maxPositionPct) {
            violations.add(String.format("Position size (%.2f%%) exceeds maximum (%.2f%%)",
                positionRiskPct, maxPositionPct));
        }
        if (portfolioRiskPct > maxPerTradePct) {
            violations.add(String.format("Risk per trade (%.2f%%) exceeds maximum (%.2f%%)",
                portfolioRiskPct, maxPerTradePct));
        }
        if (trade.getLeverage() > policy.getMaxLeverage()) {
            violations.add(String.format("Leverage (%.2fx) exceeds maximum (%.2fx)",
                trade.getLeverage(), policy.getMaxLeverage()));
        }

        // ── Warnings ──────────────────────────────────────────────────────────
        if (riskReward < policy.getMinRiskRewardRatio()) {
            warnings.add(String.format("Risk:reward ratio (%.2f) is below minimum (%.2f)",
                riskReward, policy.getMinRiskRewardRatio()));
        }
        if (leverageRisk > maxPortfolioPct) {
            warnings.add(String.format("Leverage risk (%.2f%%) exceeds portfolio risk limit", leverageRisk));
        }

        // ── Recommendations ───────────────────────────────────────────────────
        if (!violations.isEmpty() || !warnings.isEmpty()) {
            if (portfolioRiskPct > maxPortfolioPct && entry != stopPrice) {
                double suggested = policy.getMaxPortfolioRisk() * portfolio / Math.abs(entry - stopPrice);
                recommendations.add(String.format("Reduce position size to %.4f", suggested));
            }
            if (positionRiskPct > maxPositionPct && entry > 0) {
                double suggested = policy.getMaxPositionSize() * portfolio / entry;
                recommendations.add(String.format("Reduce position size to %.4f", suggested));
            }
            if (riskReward < policy.getMinRiskRewardRatio() && size > 0) {
                double suggestedTp = entry + (riskAmount / size) * policy.getMinRiskRewardRatio();
                recommendations.add(String.format("Adjust take profit to %.2f for better R:R ratio", suggestedTp));
            }
        }

        return new RiskMetrics(riskAmount, rewardAmount, riskReward, portfolioRiskPct, positionRiskPct,
            leverageRisk, !violations.isEmpty(), violations, warnings, recommendations);
    }

    /** Flat view of the metrics for display and the operator API. */
    public Map<String, Object> riskSummary(TradeProposal trade, RiskPolicy policy) {
        RiskMetrics m = calculateRiskMetrics(trade, policy != null ? policy : config.defaultRiskPolicy());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("risk_amount", m.riskAmount());
        summary.put("reward_amount", m.rewardAmount());
        summary.put("risk_reward_ratio", m.riskRewardRatio());
        summary.put("portfolio_risk_percentage", m.portfolioRiskPct());
        summary.put("position_risk_percentage", m.positionRiskPct());
        summary.put("leverage_risk", m.leverageRisk());
        summary.put("is_risky", m.risky());
        summary.put("violations", m.violations());
        summary.put("warnings", m.warnings());
        summary.put("recommendations", m.recommendations());
        return summary;
    }

    /**
     * Largest position whose stop-out loses at most {@code maxRiskFraction} of the portfolio.
     * Returns 0 when the stop sits at the entry price.
     */
    public double maxPositionSize(double entryPrice, double stopLoss, PriceLevelType stopLossType,
                                  double portfolioValue, double maxRiskFraction) {
        double perUnitRisk = Math.abs(entryPrice - stopLossPrice(entryPrice, stopLoss, stopLossType));
        return perUnitRisk > 0 ? portfolioValue * maxRiskFraction / perUnitRisk : 0;
    }

    /** Take-profit price that reaches the given reward-to-risk ratio. */
    public double optimalTakeProfit(double entryPrice, double stopLoss, PriceLevelType stopLossType,
                                    double minRiskReward) {
        double perUnitRisk = Math.abs(entryPrice - stopLossPrice(entryPrice, stopLoss, stopLossType));
        return entryPrice + perUnitRisk * minRiskReward;
    }

    // ── Price levels ──────────────────────────────────────────────────────────

    // TRAILING levels are priced as a percentage distance from entry.
    static double stopLossPrice(double entry, double value, PriceLevelType type) {
        if (type == null || type == PriceLevelType.FIXED) return value;
        return entry * (1 - value / 100);
    }

    static double takeProfitPrice(double entry, double value, PriceLevelType type) {
        if (type == null || type == PriceLevelType.FIXED) return value;
        return entry * (1 + value / 100);
    }
}
