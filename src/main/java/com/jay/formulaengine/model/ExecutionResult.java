package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.ExecutionErrorType;
import com.jay.formulaengine.model.enums.RiskStatus;
import com.jay.formulaengine.model.enums.RouteState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of routing one signal. Exactly one per routed signal.
 */
@Value
@Builder
public class ExecutionResult {
    boolean success;
    String tradeId;
    String orderId;
    double executionPrice;
    double executionQuantity;
    boolean requiresApproval;
    boolean notificationSent;
    String error;
    ExecutionErrorType errorType;
    RouteState finalState;
    RiskStatus riskStatus;

    @Builder.Default
    List<String> warnings = List.of();
}
