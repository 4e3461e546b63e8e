package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.TradeProposal;

import java.util.Optional;

/**
 * Places and manages orders for routed signals.
 * Failures are thrown as {@link ExecutorException}; a broker that does not answer in time
 * as {@link ExecutorTimeoutException}. No automatic retries.
 */
public interface TradeExecutor {

    OrderFill execute(Signal signal, TradeProposal proposal, String brokerType);

    boolean cancel(String orderId);

    Optional<OrderFill> status(String orderId);
}
