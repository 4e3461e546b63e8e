package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.enums.AuditEventType;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.model.enums.OrderStatus;
import com.jay.formulaengine.model.enums.SignalType;
import com.jay.formulaengine.notification.NotificationDispatcher;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderFillWatcherTest {

    @Mock
    private TradeExecutor tradeExecutor;

    @Mock
    private NotificationDispatcher notifier;

    @Mock
    private AuditLog audit;

    private EngineConfig config;
    private OrderFillWatcher watcher;
    private final Signal signal = TestSignals.signal("AAPL", SignalType.ENTRY_LONG, 100);

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        watcher = new OrderFillWatcher(tradeExecutor, notifier, audit, new EngineStatistics(), config);
    }

    @AfterEach
    void tearDown() {
        watcher.shutdown();
    }

    @Test
    void filledOrdersAreNotWatched() {
        watcher.watch("TRD-1", signal, new OrderFill("PAPER-1", OrderStatus.FILLED, 5, 100));

        verifyNoInteractions(tradeExecutor);
    }

    @Test
    void unfilledOrderIsCancelledAndReported() {
        when(tradeExecutor.status("ORD-1")).thenReturn(Optional.of(new OrderFill("ORD-1", OrderStatus.OPEN, 0, 0)));
        when(tradeExecutor.cancel("ORD-1")).thenReturn(true);

        watcher.checkAndCancelUnfilled("TRD-1", signal, "ORD-1");

        verify(audit).event(eq(AuditEventType.ORDER_CANCELLED), eq("TRD-1"), eq(TestSignals.USER),
            eq(signal.getFormulaId()), eq("AAPL"), argThat(p -> ((Map<?, ?>) p).get("cancelled").equals(true)));
        verify(notifier).notify(eq(TestSignals.USER), eq(NotificationType.EXECUTION_FAILED), any());
    }

    @Test
    void orderFilledInTheMeantimeIsLeftAlone() {
        when(tradeExecutor.status("ORD-1")).thenReturn(Optional.of(new OrderFill("ORD-1", OrderStatus.FILLED, 5, 100)));

        watcher.checkAndCancelUnfilled("TRD-1", signal, "ORD-1");

        verify(tradeExecutor, never()).cancel(anyString());
        verifyNoInteractions(audit, notifier);
    }

    @Test
    void scheduledCheckRunsAfterTimeout() {
        config.execution().setOrderFillTimeoutSeconds(0);
        when(tradeExecutor.status("ORD-2")).thenReturn(Optional.empty());
        when(tradeExecutor.cancel("ORD-2")).thenReturn(false);

        watcher.watch("TRD-2", signal, new OrderFill("ORD-2", OrderStatus.OPEN, 0, 0));

        verify(tradeExecutor, timeout(2_000)).cancel("ORD-2");
        verify(notifier, timeout(2_000)).notify(eq(TestSignals.USER), eq(NotificationType.EXECUTION_FAILED), any());
    }
}
