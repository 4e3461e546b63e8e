package com.jay.formulaengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Numeric limits a proposed trade is checked against. All fractions are decimals (0.02 = 2%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskPolicy {

    @Builder.Default
    private double maxPortfolioRisk = 0.02;

    @Builder.Default
    private double maxPositionSize = 0.1;

    @Builder.Default
    private double maxRiskPerTrade = 0.01;

    // Carried with the policy for reporting; no per-trade check uses it.
    @Builder.Default
    private double maxDrawdown = 0.05;

    @Builder.Default
    private double minRiskRewardRatio = 1.0;

    @Builder.Default
    private double maxLeverage = 1.0;
}
