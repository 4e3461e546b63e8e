package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer4_risk.RiskValidator;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.ExecutionMode;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.model.enums.OrderStatus;
import com.jay.formulaengine.model.enums.PriceLevelType;
import com.jay.formulaengine.model.enums.RouteState;
import com.jay.formulaengine.model.enums.SignalType;
import com.jay.formulaengine.notification.NotificationDispatcher;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalGatewayTest {

    @Mock
    private TradeExecutor tradeExecutor;

    @Mock
    private OrderFillWatcher fillWatcher;

    @Mock
    private NotificationDispatcher notifier;

    @Mock
    private AuditLog audit;

    private EngineConfig config;
    private ApprovalGateway gateway;
    private RiskValidator riskValidator;

    private final Signal signal = TestSignals.signal("AAPL", SignalType.ENTRY_LONG, 100);
    private final TradeProposal proposal = TestSignals.proposal("AAPL");
    private final Subscription subscription = TestSignals.subscription("SUB-1",
        TestSignals.formula("F-AAPL", "AAPL", "{}"), ExecutionMode.MANUAL);

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        riskValidator = new RiskValidator(config);
        gateway = new ApprovalGateway(tradeExecutor, fillWatcher, notifier, audit, new EngineStatistics(), config);
    }

    private PendingApproval submit(String tradeId) {
        return gateway.submit(tradeId, subscription, signal, proposal, riskValidator.validateTrade(proposal, null));
    }

    @Test
    void submittedTradeWaitsUntilExpiry() {
        PendingApproval approval = submit("TRD-00000001");

        assertThat(approval.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(approval.getUserId()).isEqualTo(TestSignals.USER);
        assertThat(approval.getExpiresAt()).isEqualTo(approval.getCreatedAt().plusMinutes(30));
        assertThat(gateway.pendingCount()).isEqualTo(1);
        assertThat(gateway.find("TRD-00000001")).contains(approval);
    }

    @Test
    void queriesReturnCopiesDetachedFromLaterDecisions() {
        submit("TRD-00000001");
        when(tradeExecutor.execute(eq(signal), any(TradeProposal.class), eq("paper")))
            .thenReturn(new OrderFill("PAPER-8", OrderStatus.FILLED, 5, 100));

        PendingApproval before = gateway.find("TRD-00000001").orElseThrow();
        PendingApproval listed = gateway.query(TestSignals.USER, null).get(0);
        listed.setStatus(ApprovalStatus.REJECTED);

        gateway.approve("TRD-00000001", Map.of());

        assertThat(before.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(before.getOrderId()).isNull();
        assertThat(gateway.find("TRD-00000001").orElseThrow().getStatus()).isEqualTo(ApprovalStatus.EXECUTED);
        assertThat(gateway.find("TRD-00000001").orElseThrow()).isNotSameAs(gateway.find("TRD-00000001").orElseThrow());
    }

    @Test
    void duplicateTradeIdIsRefused() {
        submit("TRD-00000001");

        assertThatThrownBy(() -> submit("TRD-00000001")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void approvalAppliesAdjustmentsAndExecutes() {
        submit("TRD-00000001");
        when(tradeExecutor.execute(eq(signal), any(TradeProposal.class), eq("paper")))
            .thenReturn(new OrderFill("PAPER-7", OrderStatus.FILLED, 3, 100));

        PendingApproval approved = gateway.approve("TRD-00000001", Map.of("position_size", 3.0, "stop_loss", 97.0));

        assertThat(approved.getStatus()).isEqualTo(ApprovalStatus.EXECUTED);
        assertThat(approved.getOrderId()).isEqualTo("PAPER-7");
        assertThat(approved.getAdjustments()).containsOnlyKeys("position_size", "stop_loss");

        ArgumentCaptor<TradeProposal> executed = ArgumentCaptor.forClass(TradeProposal.class);
        verify(tradeExecutor).execute(eq(signal), executed.capture(), eq("paper"));
        assertThat(executed.getValue().getPositionSize()).isEqualTo(3.0);
        assertThat(executed.getValue().getStopLoss()).isEqualTo(97.0);
        assertThat(executed.getValue().getStopLossType()).isEqualTo(PriceLevelType.FIXED);
        assertThat(executed.getValue().getTakeProfitType()).isEqualTo(PriceLevelType.PERCENTAGE);

        verify(audit).transition(eq("TRD-00000001"), eq(signal), eq(RouteState.PENDING_APPROVAL),
            eq(RouteState.APPROVED), eq(AuditActor.USER), any());
        verify(audit).transition(eq("TRD-00000001"), eq(signal), eq(RouteState.APPROVED),
            eq(RouteState.EXECUTED), eq(AuditActor.BROKER), any());
        verify(notifier).notify(eq(TestSignals.USER), eq(NotificationType.EXECUTION), any());
        verify(fillWatcher).watch(eq("TRD-00000001"), eq(signal), any(OrderFill.class));
    }

    @Test
    void secondDecisionConflicts() {
        submit("TRD-00000001");
        when(tradeExecutor.execute(any(), any(), any())).thenReturn(new OrderFill("PAPER-1", OrderStatus.FILLED, 5, 100));
        gateway.approve("TRD-00000001", Map.of());

        assertThatThrownBy(() -> gateway.reject("TRD-00000001", "too late"))
            .isInstanceOf(ApprovalStateException.class)
            .hasMessage("Cannot reject TRD-00000001: approval is EXECUTED");
        assertThatThrownBy(() -> gateway.approve("TRD-00000001", Map.of()))
            .isInstanceOf(ApprovalStateException.class);
        verify(tradeExecutor, times(1)).execute(any(), any(), any());
    }

    @Test
    void rejectionUsesDefaultReasonAndNeverExecutes() {
        submit("TRD-00000001");

        PendingApproval rejected = gateway.reject("TRD-00000001", " ");

        assertThat(rejected.getStatus()).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(rejected.getRejectionReason()).isEqualTo("User rejected");
        assertThat(rejected.getCompletedAt()).isNotNull();
        verifyNoInteractions(tradeExecutor);
        verify(audit).transition(eq("TRD-00000001"), eq(signal), eq(RouteState.PENDING_APPROVAL),
            eq(RouteState.REJECTED), eq(AuditActor.USER), any());
    }

    @Test
    void unknownTradeIdIsNotFound() {
        assertThatThrownBy(() -> gateway.approve("TRD-MISSING", Map.of()))
            .isInstanceOf(ApprovalNotFoundException.class)
            .hasMessage("Unknown trade ID: TRD-MISSING");
        assertThatThrownBy(() -> gateway.reject("TRD-MISSING", null))
            .isInstanceOf(ApprovalNotFoundException.class);
    }

    @Test
    void invalidAdjustmentsLeaveTradePending() {
        submit("TRD-00000001");

        assertThatThrownBy(() -> gateway.approve("TRD-00000001", Map.of("leverage", 5.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown adjustment 'leverage'");
        assertThatThrownBy(() -> gateway.approve("TRD-00000001", Map.of("take_profit", -1.0)))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(gateway.find("TRD-00000001").orElseThrow().getStatus()).isEqualTo(ApprovalStatus.PENDING);
        verifyNoInteractions(tradeExecutor);
    }

    @Test
    void executionFailureMarksApprovalFailed() {
        submit("TRD-00000001");
        when(tradeExecutor.execute(any(), any(), any())).thenThrow(new ExecutorException("broker down"));

        PendingApproval failed = gateway.approve("TRD-00000001", Map.of());

        assertThat(failed.getStatus()).isEqualTo(ApprovalStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo("broker down");
        verify(audit).transition(eq("TRD-00000001"), eq(signal), eq(RouteState.APPROVED),
            eq(RouteState.FAILED), eq(AuditActor.BROKER), any());
        verify(notifier).notify(eq(TestSignals.USER), eq(NotificationType.EXECUTION_FAILED), any());
        verify(fillWatcher, never()).watch(any(), any(), any());
    }

    @Test
    void sweepExpiresOverdueApprovals() {
        config.approval().setExpiryMinutes(-1);
        submit("TRD-00000001");

        assertThat(gateway.expireTimedOut()).isEqualTo(1);
        assertThat(gateway.expireTimedOut()).isZero();

        assertThat(gateway.find("TRD-00000001").orElseThrow().getStatus()).isEqualTo(ApprovalStatus.EXPIRED);
        verify(audit).transition(eq("TRD-00000001"), eq(signal), eq(RouteState.PENDING_APPROVAL),
            eq(RouteState.EXPIRED), eq(AuditActor.SYSTEM), any());
        verify(notifier).notify(eq(TestSignals.USER), eq(NotificationType.APPROVAL_EXPIRED), any());
        assertThatThrownBy(() -> gateway.approve("TRD-00000001", Map.of()))
            .isInstanceOf(ApprovalStateException.class)
            .hasMessageContaining("EXPIRED");
        verifyNoInteractions(tradeExecutor);
    }

    @Test
    void lateDecisionExpiresTradeBeforeTheSweepRuns() {
        config.approval().setExpiryMinutes(-1);
        submit("TRD-00000001");

        assertThatThrownBy(() -> gateway.approve("TRD-00000001", Map.of()))
            .isInstanceOf(ApprovalStateException.class)
            .satisfies(e -> assertThat(((ApprovalStateException) e).getCurrentStatus()).isEqualTo(ApprovalStatus.EXPIRED));
        verifyNoInteractions(tradeExecutor);
    }

    @Test
    void concurrentApprovalsExecuteOnce() throws Exception {
        submit("TRD-00000001");
        when(tradeExecutor.execute(any(), any(), any())).thenReturn(new OrderFill("PAPER-1", OrderStatus.FILLED, 5, 100));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    gateway.approve("TRD-00000001", Map.of());
                } catch (ApprovalStateException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(conflicts.get()).isEqualTo(threads - 1);
        verify(tradeExecutor, times(1)).execute(any(), any(), any());
    }

    @Test
    void queryFiltersByUserAndStatus() {
        submit("TRD-00000001");
        submit("TRD-00000002");
        gateway.reject("TRD-00000002", "no");

        assertThat(gateway.query(TestSignals.USER, null)).hasSize(2);
        assertThat(gateway.query(null, ApprovalStatus.PENDING)).extracting(PendingApproval::getTradeId)
            .containsExactly("TRD-00000001");
        assertThat(gateway.query("someone-else", null)).isEmpty();
    }
}
