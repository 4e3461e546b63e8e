package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer4_risk.RiskValidationResult;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.model.enums.PriceLevelType;
import com.jay.formulaengine.model.enums.RouteState;
import com.jay.formulaengine.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Layer 6 — Approval Gateway.
 * Holds MANUAL-mode trades until a human decides:
 *   1. The router submits a trade; it waits in PENDING
 *   2. approve(tradeId, adjustments) applies the adjustments and executes → EXECUTED or FAILED
 *   3. reject(tradeId, reason) ends it in REJECTED
 *   4. Unanswered trades expire after approval.expiry_minutes
 *
 * All mutations of one approval happen while holding that approval's monitor, so a decision,
 * its execution and the expiry sweep never interleave for the same trade id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGateway {

    static final Set<String> ADJUSTMENT_KEYS = Set.of("position_size", "take_profit", "stop_loss");

    private final TradeExecutor tradeExecutor;
    private final OrderFillWatcher fillWatcher;
    private final NotificationDispatcher notifier;
    private final AuditLog audit;
    private final EngineStatistics stats;
    private final EngineConfig config;

    private final Map<String, PendingApproval> approvals = new ConcurrentHashMap<>();

    // ── Submitting ────────────────────────────────────────────────────────────

    public PendingApproval submit(String tradeId, Subscription subscription, Signal signal,
                                  TradeProposal proposal, RiskValidationResult risk) {
        LocalDateTime now = LocalDateTime.now();
        PendingApproval approval = PendingApproval.builder()
            .tradeId(tradeId)
            .userId(subscription.getUserId())
            .subscriptionId(subscription.getId())
            .brokerType(subscription.getBrokerType())
            .signal(signal)
            .proposal(proposal)
            .riskResult(risk)
            .adjustments(risk != null ? Map.copyOf(risk.adjustmentValues()) : Map.of())
            .createdAt(now)
            .expiresAt(now.plusMinutes(config.approval().getExpiryMinutes()))
            .build();
        if (approvals.putIfAbsent(tradeId, approval) != null) {
            throw new IllegalStateException("Duplicate trade id " + tradeId);
        }
        log.info("Trade {} ({} {}) awaiting approval from {} until {}", tradeId, signal.getSignalType(),
            signal.getSymbol(), subscription.getUserId(), approval.getExpiresAt());
        return snapshot(approval);
    }

    // ── Decisions ─────────────────────────────────────────────────────────────

    /**
     * Approves a pending trade, applies the adjustments and executes it.
     * Adjustment keys: position_size, take_profit, stop_loss. Adjusted price levels are absolute prices.
     *
     * @throws ApprovalNotFoundException for an unknown trade id
     * @throws ApprovalStateException    when the approval is no longer PENDING
     * @throws IllegalArgumentException  for an unknown key or a non-positive value
     */
    public PendingApproval approve(String tradeId, Map<String, Double> adjustments) {
        PendingApproval approval = require(tradeId);
        Map<String, Double> requested = adjustments != null ? adjustments : Map.of();
        validateAdjustments(requested);

        synchronized (approval) {
            requirePending(approval, "approve");

            TradeProposal adjusted = applyAdjustments(approval.getProposal(), requested);
            approval.setProposal(adjusted);
            approval.setAdjustments(Map.copyOf(requested));
            approval.setStatus(ApprovalStatus.APPROVED);
            approval.setDecidedAt(LocalDateTime.now());
            Map<String, Object> decision = TradePayloads.trade(tradeId, approval.getSignal(), adjusted, null);
            decision.put("adjustments", requested);
            audit.transition(tradeId, approval.getSignal(), RouteState.PENDING_APPROVAL, RouteState.APPROVED,
                AuditActor.USER, decision);
            log.info("Trade {} APPROVED{}", tradeId, requested.isEmpty() ? "" : " with adjustments " + requested);

            execute(approval);
            return snapshot(approval);
        }
    }

    /**
     * @throws ApprovalNotFoundException for an unknown trade id
     * @throws ApprovalStateException    when the approval is no longer PENDING
     */
    public PendingApproval reject(String tradeId, String reason) {
        PendingApproval approval = require(tradeId);
        synchronized (approval) {
            requirePending(approval, "reject");
            String why = reason == null || reason.isBlank() ? "User rejected" : reason;
            approval.setStatus(ApprovalStatus.REJECTED);
            approval.setRejectionReason(why);
            approval.setDecidedAt(LocalDateTime.now());
            approval.setCompletedAt(approval.getDecidedAt());

            Map<String, Object> payload = TradePayloads.signal(tradeId, approval.getSignal());
            payload.put("reason", why);
            audit.transition(tradeId, approval.getSignal(), RouteState.PENDING_APPROVAL, RouteState.REJECTED,
                AuditActor.USER, payload);
            log.info("Trade {} REJECTED. Reason: {}", tradeId, why);
            return snapshot(approval);
        }
    }

    // ── Expiry ────────────────────────────────────────────────────────────────

    /** Expires every pending approval past its deadline. Returns how many expired. */
    public int expireTimedOut() {
        LocalDateTime now = LocalDateTime.now();
        int expired = 0;
        for (PendingApproval approval : approvals.values()) {
            synchronized (approval) {
                if (approval.getStatus() != ApprovalStatus.PENDING) continue;
                if (approval.getExpiresAt() == null || !approval.getExpiresAt().isBefore(now)) continue;
                expire(approval, now);
                expired++;
            }
        }
        if (expired > 0) log.info("Expired {} pending approvals", expired);
        return expired;
    }

    private void expire(PendingApproval approval, LocalDateTime now) {
        approval.setStatus(ApprovalStatus.EXPIRED);
        approval.setCompletedAt(now);
        Map<String, Object> payload = TradePayloads.signal(approval.getTradeId(), approval.getSignal());
        payload.put("message", "No response received — trade expired. No order placed.");
        audit.transition(approval.getTradeId(), approval.getSignal(), RouteState.PENDING_APPROVAL,
            RouteState.EXPIRED, AuditActor.SYSTEM, payload);
        log.info("Trade {} expired — no response received", approval.getTradeId());
        if (notifier.notify(approval.getUserId(), NotificationType.APPROVAL_EXPIRED, payload)) {
            stats.notificationSent();
        }
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    /** Returned approvals are copies; later decisions do not show through them. */
    public Optional<PendingApproval> find(String tradeId) {
        return Optional.ofNullable(tradeId == null ? null : approvals.get(tradeId)).map(ApprovalGateway::snapshot);
    }

    /** Approvals filtered by user and status; a null filter matches everything. Newest first. */
    public List<PendingApproval> query(String userId, ApprovalStatus status) {
        return approvals.values().stream()
            .map(ApprovalGateway::snapshot)
            .filter(a -> userId == null || userId.equals(a.getUserId()))
            .filter(a -> status == null || status == a.getStatus())
            .sorted(Comparator.comparing(PendingApproval::getCreatedAt).reversed())
            .toList();
    }

    private static PendingApproval snapshot(PendingApproval approval) {
        synchronized (approval) {
            return approval.toBuilder().build();
        }
    }

    public long pendingCount() {
        return approvals.values().stream().filter(a -> a.getStatus() == ApprovalStatus.PENDING).count();
    }

    // ── Execution of approved trades ──────────────────────────────────────────

    private void execute(PendingApproval approval) {
        String tradeId = approval.getTradeId();
        Signal signal = approval.getSignal();
        try {
            OrderFill fill = tradeExecutor.execute(signal, approval.getProposal(), approval.getBrokerType());
            approval.setOrderId(fill.orderId());
            approval.setStatus(ApprovalStatus.EXECUTED);
            approval.setCompletedAt(LocalDateTime.now());

            Map<String, Object> payload = TradePayloads.fill(tradeId, signal, fill);
            audit.transition(tradeId, signal, RouteState.APPROVED, RouteState.EXECUTED, AuditActor.BROKER, payload);
            if (notifier.notify(approval.getUserId(), NotificationType.EXECUTION, payload)) {
                stats.notificationSent();
            }
            fillWatcher.watch(tradeId, signal, fill);
        } catch (RuntimeException e) {
            log.error("Execution of approved trade {} failed: {}", tradeId, e.getMessage());
            approval.setStatus(ApprovalStatus.FAILED);
            approval.setFailureReason(e.getMessage());
            approval.setCompletedAt(LocalDateTime.now());

            Map<String, Object> payload = TradePayloads.failure(tradeId, signal, e.getMessage());
            payload.put("error_type", e instanceof ExecutorTimeoutException ? "EXECUTOR_TIMEOUT" : "EXECUTOR_ERROR");
            audit.transition(tradeId, signal, RouteState.APPROVED, RouteState.FAILED, AuditActor.BROKER, payload);
            if (notifier.notify(approval.getUserId(), NotificationType.EXECUTION_FAILED, payload)) {
                stats.notificationSent();
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private PendingApproval require(String tradeId) {
        return find(tradeId).orElseThrow(() -> new ApprovalNotFoundException(tradeId));
    }

    private void requirePending(PendingApproval approval, String action) {
        if (approval.getStatus() == ApprovalStatus.PENDING
                && approval.getExpiresAt() != null && approval.getExpiresAt().isBefore(LocalDateTime.now())) {
            expire(approval, LocalDateTime.now());
        }
        if (approval.getStatus() != ApprovalStatus.PENDING) {
            throw new ApprovalStateException(approval.getTradeId(), approval.getStatus(), action);
        }
    }

    private void validateAdjustments(Map<String, Double> adjustments) {
        adjustments.forEach((key, value) -> {
            if (!ADJUSTMENT_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown adjustment '" + key + "'; allowed: " + ADJUSTMENT_KEYS);
            }
            if (value == null || !(value > 0) || value.isInfinite()) {
                throw new IllegalArgumentException("Adjustment '" + key + "' must be a positive number");
            }
        });
    }

    private TradeProposal applyAdjustments(TradeProposal proposal, Map<String, Double> adjustments) {
        TradeProposal.TradeProposalBuilder b = proposal.toBuilder();
        if (adjustments.containsKey("position_size")) {
            b.positionSize(adjustments.get("position_size"));
        }
        if (adjustments.containsKey("take_profit")) {
            b.takeProfit(adjustments.get("take_profit")).takeProfitType(PriceLevelType.FIXED);
        }
        if (adjustments.containsKey("stop_loss")) {
            b.stopLoss(adjustments.get("stop_loss")).stopLossType(PriceLevelType.FIXED);
        }
        return b.build();
    }
}
