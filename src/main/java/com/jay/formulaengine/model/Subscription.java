package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.ExecutionMode;
import lombok.Builder;
import lombok.Data;

/**
 * A user's subscription to a formula, carrying how its signals are sized, risk-checked and routed.
 */
@Data
@Builder(toBuilder = true)
public class Subscription {

    private String id;
    private String userId;
    private Formula formula;

    /** Overrides the formula's own mode when set. */
    private ExecutionMode executionMode;

    @Builder.Default
    private RiskPolicy riskPolicy = new RiskPolicy();

    @Builder.Default
    private PositionSizing sizing = new PositionSizing();

    @Builder.Default
    private String brokerType = "paper";

    @Builder.Default
    private boolean notifyOnRiskRejection = true;

    @Builder.Default
    private boolean active = true;

    public ExecutionMode effectiveExecutionMode() {
        if (executionMode != null) return executionMode;
        return formula != null && formula.getExecutionMode() != null
            ? formula.getExecutionMode() : ExecutionMode.ALERT_ONLY;
    }

    public boolean isEvaluable() {
        return active && formula != null && formula.isActive();
    }
}
