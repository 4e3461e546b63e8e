package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.enums.AuditEventType;
import com.jay.formulaengine.model.enums.NotificationType;
import com.jay.formulaengine.notification.NotificationDispatcher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cancels orders that are still unfilled execution.order_fill_timeout_seconds after placement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderFillWatcher {

    private final TradeExecutor tradeExecutor;
    private final NotificationDispatcher notifier;
    private final AuditLog audit;
    private final EngineStatistics stats;
    private final EngineConfig config;

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    /** Schedules a fill check unless the order is already filled. */
    public void watch(String tradeId, Signal signal, OrderFill fill) {
        if (fill == null || fill.status().isFilled()) return;
        int timeout = config.execution().getOrderFillTimeoutSeconds();
        log.info("Order {} for {} is {} — fill check in {}s", fill.orderId(), tradeId, fill.status(), timeout);
        scheduler.schedule(() -> checkAndCancelUnfilled(tradeId, signal, fill.orderId()), timeout, TimeUnit.SECONDS);
    }

    void checkAndCancelUnfilled(String tradeId, Signal signal, String orderId) {
        try {
            Optional<OrderFill> current = tradeExecutor.status(orderId);
            if (current.isPresent() && current.get().status().isFilled()) {
                log.info("Order {} for {} filled", orderId, tradeId);
                return;
            }

            boolean cancelled = tradeExecutor.cancel(orderId);
            String reason = String.format("Order %s not filled within %ds — %s", orderId,
                config.execution().getOrderFillTimeoutSeconds(), cancelled ? "cancelled" : "cancel failed, verify manually");
            log.warn("{} ({})", reason, tradeId);

            Map<String, Object> payload = TradePayloads.failure(tradeId, signal, reason);
            payload.put("order_id", orderId);
            payload.put("cancelled", cancelled);
            current.ifPresent(f -> payload.put("last_status", f.status().name()));
            audit.event(AuditEventType.ORDER_CANCELLED, tradeId, signal.getUserId(), signal.getFormulaId(),
                signal.getSymbol(), payload);

            if (notifier.notify(signal.getUserId(), NotificationType.EXECUTION_FAILED, payload)) {
                stats.notificationSent();
            }
        } catch (Exception e) {
            log.error("Fill check for order {} ({}) failed: {}", orderId, tradeId, e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
