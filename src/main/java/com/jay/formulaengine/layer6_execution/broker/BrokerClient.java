package com.jay.formulaengine.layer6_execution.broker;

import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.enums.OrderSide;

import java.util.List;
import java.util.Map;

/**
 * Capability interface every broker integration implements.
 * Implementations are Spring beans; {@link BrokerRegistry} indexes them by {@link #brokerType()} once at start-up.
 * Failures surface as {@link com.jay.formulaengine.layer6_execution.ExecutorException}.
 */
public interface BrokerClient {

    /** Tag subscriptions use to select this broker, e.g. "paper". Matched case-insensitively. */
    String brokerType();

    boolean connect();

    boolean isConnected();

    /** Places a LIMIT order. */
    OrderFill placeOrder(String symbol, OrderSide side, double quantity, double limitPrice);

    boolean cancelOrder(String orderId);

    OrderFill getOrderStatus(String orderId);

    List<BrokerPosition> getPositions();

    Map<String, Object> getProfile();
}
