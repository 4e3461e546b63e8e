package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.broker.BrokerClient;
import com.jay.formulaengine.layer6_execution.broker.BrokerRegistry;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Layer 6 — Trade executor backed by the broker registry.
 * Resolves the subscription's broker, places a LIMIT order at the signal's entry price and
 * remembers which broker owns each order id so later cancel/status calls reach the same broker.
 * Every broker call runs on the broker pool and is abandoned after execution.broker_timeout_ms.
 */
@Slf4j
@Component
public class BrokerTradeExecutor implements TradeExecutor {

    private final BrokerRegistry registry;
    private final AsyncTaskExecutor brokerCalls;
    private final EngineConfig config;

    private final Map<String, String> orderBrokers = new ConcurrentHashMap<>();

    public BrokerTradeExecutor(BrokerRegistry registry,
                               @Qualifier("brokerExecutor") AsyncTaskExecutor brokerCalls,
                               EngineConfig config) {
        this.registry = registry;
        this.brokerCalls = brokerCalls;
        this.config = config;
    }

    @Override
    public OrderFill execute(Signal signal, TradeProposal proposal, String brokerType) {
        String tag = brokerType != null && !brokerType.isBlank() ? brokerType : config.execution().getDefaultBroker();
        BrokerClient broker = registry.resolve(tag);

        if (!(proposal.getPositionSize() > 0)) {
            throw new ExecutorException("Computed position size is 0 for " + proposal.getSymbol() + " — cannot place order");
        }

        log.info("Placing {} {} {} @ {} via {} (formula {})", proposal.getSide(), proposal.getPositionSize(),
            proposal.getSymbol(), proposal.getEntryPrice(), tag, signal.getFormulaId());

        OrderFill fill = call(tag, "placeOrder", () -> {
            if (!broker.isConnected() && !broker.connect()) {
                throw new ExecutorException("Could not connect to broker '" + tag + "'");
            }
            return broker.placeOrder(proposal.getSymbol(), proposal.getSide(),
                proposal.getPositionSize(), proposal.getEntryPrice());
        });

        if (fill == null || fill.orderId() == null || fill.orderId().isBlank()) {
            throw new ExecutorException("Broker '" + tag + "' returned no order id");
        }
        if (fill.status() == OrderStatus.REJECTED) {
            throw new ExecutorException("Order " + fill.orderId() + " rejected by broker '" + tag + "'");
        }
        orderBrokers.put(fill.orderId(), broker.brokerType());
        return fill;
    }

    @Override
    public boolean cancel(String orderId) {
        String tag = orderBrokers.get(orderId);
        if (tag == null) {
            log.warn("Cancel requested for unknown order {}", orderId);
            return false;
        }
        BrokerClient broker = registry.resolve(tag);
        try {
            boolean cancelled = call(tag, "cancelOrder", () -> broker.cancelOrder(orderId));
            log.info("Cancel of order {} via {}: {}", orderId, tag, cancelled ? "done" : "refused");
            return cancelled;
        } catch (ExecutorException e) {
            log.error("Cancel of order {} via {} failed: {}", orderId, tag, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<OrderFill> status(String orderId) {
        String tag = orderBrokers.get(orderId);
        if (tag == null) return Optional.empty();
        BrokerClient broker = registry.resolve(tag);
        try {
            return Optional.ofNullable(call(tag, "getOrderStatus", () -> broker.getOrderStatus(orderId)));
        } catch (ExecutorException e) {
            log.warn("Status of order {} via {} unavailable: {}", orderId, tag, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Bounded broker call ───────────────────────────────────────────────────

    private <T> T call(String brokerType, String operation, Callable<T> action) {
        long timeoutMs = config.execution().getBrokerTimeoutMs();
        Future<T> future;
        try {
            future = brokerCalls.submit(action);
        } catch (RejectedExecutionException e) {
            throw new ExecutorException("Broker pool saturated — " + operation + " not attempted", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExecutorTimeoutException(String.format("%s on broker '%s' timed out after %d ms",
                operation, brokerType, timeoutMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ExecutorException ee) throw ee;
            throw new ExecutorException(String.format("%s on broker '%s' failed: %s",
                operation, brokerType, cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutorException(operation + " on broker '" + brokerType + "' interrupted", e);
        }
    }
}
