package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.layer4_risk.RiskValidationResult;
import com.jay.formulaengine.layer4_risk.RiskValidator;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.ExecutionResult;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.ExecutionErrorType;
import com.jay.formulaengine.model.enums.ExecutionMode;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.model.enums.RouteState;
import com.jay.formulaengine.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Layer 6 — Execution Router.
 * Moves one validated signal through the routing state machine:
 *
 *   RECEIVED → VALIDATED → AUTO_EXECUTING   → EXECUTED | FAILED      (AUTO)
 *                        → PENDING_APPROVAL → handed to ApprovalGateway (MANUAL)
 *                        → NOTIFIED_ONLY                              (ALERT_ONLY)
 *                        → REJECTED                                   (risk violations, any mode)
 *
 * A risk-rejected trade never reaches the executor. Every transition writes one audit entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionRouter {

    private final RiskValidator riskValidator;
    private final TradeExecutor tradeExecutor;
    private final ApprovalGateway approvalGateway;
    private final OrderFillWatcher fillWatcher;
    private final NotificationDispatcher notifier;
    private final AuditLog audit;
    private final EngineStatistics stats;

    public ExecutionResult route(Subscription subscription, Signal signal, TradeProposal proposal) {
        String tradeId = newTradeId();
        audit.transition(tradeId, signal, null, RouteState.RECEIVED, AuditActor.SYSTEM,
            TradePayloads.signal(tradeId, signal));

        RiskValidationResult risk = riskValidator.validateTrade(proposal, subscription.getRiskPolicy());
        Map<String, Object> tradePayload = TradePayloads.trade(tradeId, signal, proposal, risk);
        audit.transition(tradeId, signal, RouteState.RECEIVED, RouteState.VALIDATED, AuditActor.SYSTEM, tradePayload);

        if (risk.isRejected()) {
            return rejectOnRisk(tradeId, subscription, signal, risk, tradePayload);
        }

        ExecutionMode mode = subscription.effectiveExecutionMode();
        return switch (mode) {
            case AUTO -> autoExecute(tradeId, subscription, signal, proposal, risk, tradePayload);
            case MANUAL -> requestApproval(tradeId, subscription, signal, proposal, risk, tradePayload);
            case ALERT_ONLY -> alertOnly(tradeId, subscription, signal, risk, tradePayload);
        };
    }

    // ── Outcomes ──────────────────────────────────────────────────────────────

    private ExecutionResult rejectOnRisk(String tradeId, Subscription subscription, Signal signal,
                                         RiskValidationResult risk, Map<String, Object> payload) {
        audit.transition(tradeId, signal, RouteState.VALIDATED, RouteState.REJECTED, AuditActor.SYSTEM, payload);
        log.info("Trade {} for {} ({}) blocked by risk check: {}", tradeId, signal.getSymbol(),
            subscription.getUserId(), String.join("; ", risk.metrics().violations()));

        boolean sent = subscription.isNotifyOnRiskRejection()
            && send(subscription.getUserId(), NotificationType.RISK_WARNING, payload);
        return base(tradeId, risk, RouteState.REJECTED)
            .success(false)
            .error(risk.message())
            .errorType(ExecutionErrorType.RISK_REJECTED)
            .notificationSent(sent)
            .build();
    }

    private ExecutionResult autoExecute(String tradeId, Subscription subscription, Signal signal,
                                        TradeProposal proposal, RiskValidationResult risk,
                                        Map<String, Object> payload) {
        audit.transition(tradeId, signal, RouteState.VALIDATED, RouteState.AUTO_EXECUTING, AuditActor.SYSTEM, payload);

        OrderFill fill;
        try {
            fill = tradeExecutor.execute(signal, proposal, subscription.getBrokerType());
        } catch (ExecutorTimeoutException e) {
            return executionFailed(tradeId, subscription, signal, risk, e.getMessage(), ExecutionErrorType.EXECUTOR_TIMEOUT);
        } catch (RuntimeException e) {
            return executionFailed(tradeId, subscription, signal, risk, e.getMessage(), ExecutionErrorType.EXECUTOR_ERROR);
        }

        stats.autoExecuted();
        Map<String, Object> fillPayload = TradePayloads.fill(tradeId, signal, fill);
        audit.transition(tradeId, signal, RouteState.AUTO_EXECUTING, RouteState.EXECUTED, AuditActor.BROKER, fillPayload);
        log.info("Trade {} auto-executed: {} {} {} → order {}", tradeId, proposal.getSide(),
            fill.filledQuantity(), signal.getSymbol(), fill.orderId());

        boolean sent = send(subscription.getUserId(), NotificationType.EXECUTION, fillPayload);
        fillWatcher.watch(tradeId, signal, fill);

        return base(tradeId, risk, RouteState.EXECUTED)
            .success(true)
            .orderId(fill.orderId())
            .executionPrice(fill.averagePrice())
            .executionQuantity(fill.filledQuantity())
            .notificationSent(sent)
            .build();
    }

    private ExecutionResult executionFailed(String tradeId, Subscription subscription, Signal signal,
                                            RiskValidationResult risk, String error, ExecutionErrorType type) {
        log.error("Trade {} for {} failed ({}): {}", tradeId, signal.getSymbol(), type, error);
        Map<String, Object> payload = TradePayloads.failure(tradeId, signal, error);
        payload.put("error_type", type.name());
        audit.transition(tradeId, signal, RouteState.AUTO_EXECUTING, RouteState.FAILED, AuditActor.BROKER, payload);

        boolean sent = send(subscription.getUserId(), NotificationType.EXECUTION_FAILED, payload);
        return base(tradeId, risk, RouteState.FAILED)
            .success(false)
            .error(error)
            .errorType(type)
            .notificationSent(sent)
            .build();
    }

    private ExecutionResult requestApproval(String tradeId, Subscription subscription, Signal signal,
                                            TradeProposal proposal, RiskValidationResult risk,
                                            Map<String, Object> payload) {
        PendingApproval approval = approvalGateway.submit(tradeId, subscription, signal, proposal, risk);
        audit.transition(tradeId, signal, RouteState.VALIDATED, RouteState.PENDING_APPROVAL, AuditActor.SYSTEM, payload);

        payload.put("expires_at", approval.getExpiresAt().toString());
        boolean sent = send(subscription.getUserId(), NotificationType.APPROVAL_REQUEST, payload);
        return base(tradeId, risk, RouteState.PENDING_APPROVAL)
            .success(true)
            .requiresApproval(true)
            .notificationSent(sent)
            .build();
    }

    private ExecutionResult alertOnly(String tradeId, Subscription subscription, Signal signal,
                                      RiskValidationResult risk, Map<String, Object> payload) {
        audit.transition(tradeId, signal, RouteState.VALIDATED, RouteState.NOTIFIED_ONLY, AuditActor.SYSTEM, payload);
        boolean sent = send(subscription.getUserId(), NotificationType.SIGNAL, payload);
        return base(tradeId, risk, RouteState.NOTIFIED_ONLY)
            .success(true)
            .notificationSent(sent)
            .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ExecutionResult.ExecutionResultBuilder base(String tradeId, RiskValidationResult risk, RouteState state) {
        return ExecutionResult.builder()
            .tradeId(tradeId)
            .finalState(state)
            .riskStatus(risk.status())
            .warnings(risk.metrics().warnings());
    }

    private boolean send(String userId, NotificationType type, Map<String, Object> payload) {
        boolean sent = notifier.notify(userId, type, payload);
        if (sent) stats.notificationSent();
        return sent;
    }

    static String newTradeId() {
        return "TRD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
