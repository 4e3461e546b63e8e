package com.jay.formulaengine.scheduler;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.ApprovalGateway;
import com.jay.formulaengine.model.CycleReport;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.notification.NotificationDispatcher;
import com.jay.formulaengine.notification.TelegramService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Map;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationSchedulerTest {

    @Mock
    private EvaluationEngine engine;

    @Mock
    private ApprovalGateway approvalGateway;

    @Mock
    private TelegramService telegramService;

    @Mock
    private NotificationDispatcher notifier;

    private EngineConfig config;
    private EvaluationScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        scheduler = new EvaluationScheduler(engine, approvalGateway, telegramService, notifier, config);
    }

    @Test
    void disabledSchedulerIgnoresEveryTrigger() {
        config.scheduler().setEnabled(false);

        scheduler.intervalCycle();
        scheduler.marketOpenCycle();
        scheduler.expireApprovals();
        scheduler.pollTelegram();

        verifyNoInteractions(engine, approvalGateway, telegramService, notifier);
    }

    @Test
    void intervalTriggerRunsFullCycle() {
        when(engine.evaluateAll()).thenReturn(CycleReport.skipped(LocalDateTime.now()));

        scheduler.intervalCycle();

        verify(engine).evaluateAll();
        verifyNoInteractions(notifier);
    }

    @Test
    void failedCycleRaisesSystemAlert() {
        when(engine.evaluateAll()).thenThrow(new IllegalStateException("pool shut down"));

        scheduler.marketCloseCycle();

        verify(notifier).notify(isNull(), eq(NotificationType.SYSTEM_ALERT),
            eq(Map.of("message", "MARKET CLOSE evaluation cycle failed: pool shut down")));
    }

    @Test
    void expirySweepAndPollingRunWhenEnabled() {
        scheduler.expireApprovals();
        scheduler.pollTelegram();

        verify(approvalGateway).expireTimedOut();
        verify(telegramService).pollForMessages();
    }
}
