package com.jay.formulaengine.scheduler;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.ApprovalGateway;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.notification.NotificationDispatcher;
import com.jay.formulaengine.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Evaluation Scheduler — drives the engine.
 *
 *   Interval     : every scheduler.interval_ms (default 5 min) — full evaluation cycle
 *   Market open  : scheduler.market_open_cron (09:30) — full evaluation cycle
 *   Market close : scheduler.market_close_cron (16:00) — full evaluation cycle
 *   Every minute : expire unanswered approvals
 *   Telegram     : every engine.telegram-poll-ms — poll for APPROVE/REJECT commands
 *
 * Every trigger is a no-op while scheduler.enabled is false.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluationScheduler {

    private final EvaluationEngine engine;
    private final ApprovalGateway approvalGateway;
    private final TelegramService telegramService;
    private final NotificationDispatcher notifier;
    private final EngineConfig config;

    // ── Evaluation cycles ─────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "#{@engineConfig.scheduler().intervalMs}",
               initialDelayString = "${engine.scheduler.initial-delay-ms:30000}")
    public void intervalCycle() {
        runCycle("INTERVAL");
    }

    @Scheduled(cron = "#{@engineConfig.scheduler().marketOpenCron}", zone = "#{@engineConfig.scheduler().zone}")
    public void marketOpenCycle() {
        runCycle("MARKET OPEN");
    }

    @Scheduled(cron = "#{@engineConfig.scheduler().marketCloseCron}", zone = "#{@engineConfig.scheduler().zone}")
    public void marketCloseCycle() {
        runCycle("MARKET CLOSE");
    }

    void runCycle(String trigger) {
        if (!config.scheduler().isEnabled()) {
            log.debug("Scheduler disabled — {} trigger ignored", trigger);
            return;
        }
        log.info("=== {} — evaluation cycle ===", trigger);
        try {
            engine.evaluateAll();
        } catch (Exception e) {
            log.error("{} evaluation cycle failed: {}", trigger, e.getMessage(), e);
            notifier.notify(null, NotificationType.SYSTEM_ALERT,
                Map.of("message", trigger + " evaluation cycle failed: " + e.getMessage()));
        }
    }

    // ── Approval expiry (every minute) ───────────────────────────────────────

    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    public void expireApprovals() {
        if (!config.scheduler().isEnabled()) return;
        try {
            approvalGateway.expireTimedOut();
        } catch (Exception e) {
            log.error("Approval expiry sweep failed: {}", e.getMessage());
        }
    }

    // ── Telegram polling ─────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${engine.telegram-poll-ms:2000}")
    public void pollTelegram() {
        if (!config.scheduler().isEnabled()) return;
        try {
            telegramService.pollForMessages();
        } catch (Exception e) {
            log.debug("Telegram poll error: {}", e.getMessage());
        }
    }
}
