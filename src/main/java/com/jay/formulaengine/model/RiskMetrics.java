package com.jay.formulaengine.model;

import java.util.List;

/**
 * Freshly computed risk figures for one trade. Percentages are expressed in percent (2.0 = 2%).
 */
public record RiskMetrics(
    double riskAmount,
    double rewardAmount,
    double riskRewardRatio,
    double portfolioRiskPct,
    double positionRiskPct,
    double leverageRisk,
    boolean risky,
    List<String> violations,
    List<String> warnings,
    List<String> recommendations
) {
    public RiskMetrics {
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }
}
