package com.jay.formulaengine.model;

import com.jay.formulaengine.layer4_risk.RiskValidationResult;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A trade waiting for a human decision. Mutated only by the approval gateway,
 * one writer per trade id.
 */
@Data
@Builder(toBuilder = true)
public class PendingApproval {

    private String tradeId;
    private String userId;
    private String subscriptionId;
    private String brokerType;
    private Signal signal;
    private TradeProposal proposal;
    private RiskValidationResult riskResult;

    /** Adjustments suggested by the risk validator or supplied with the approval. */
    @Builder.Default
    private Map<String, Double> adjustments = Map.of();

    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;

    private String rejectionReason;
    private String orderId;
    private String failureReason;

    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private LocalDateTime decidedAt;
    private LocalDateTime completedAt;
}
