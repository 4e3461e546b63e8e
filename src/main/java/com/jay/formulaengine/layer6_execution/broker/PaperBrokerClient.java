package com.jay.formulaengine.layer6_execution.broker;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.ExecutorException;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.enums.OrderSide;
import com.jay.formulaengine.model.enums.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated broker. Every LIMIT order fills immediately at the limit price, moved against
 * the trader by execution.paper_slippage_pct. No real order is placed anywhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaperBrokerClient implements BrokerClient {

    private final EngineConfig config;

    private final AtomicLong orderSeq = new AtomicLong();
    private final Map<String, OrderFill> orders = new ConcurrentHashMap<>();
    private final Map<String, BrokerPosition> positions = new ConcurrentHashMap<>();
    private volatile boolean connected;

    @Override
    public String brokerType() {
        return "paper";
    }

    @Override
    public boolean connect() {
        connected = true;
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public OrderFill placeOrder(String symbol, OrderSide side, double quantity, double limitPrice) {
        if (quantity <= 0 || limitPrice <= 0) {
            throw new ExecutorException(String.format("Invalid paper order %s %.4f @ %.2f", symbol, quantity, limitPrice));
        }
        double slippage = config.execution().getPaperSlippagePct() / 100;
        double fillPrice = side == OrderSide.BUY ? limitPrice * (1 + slippage) : limitPrice * (1 - slippage);

        String orderId = "PAPER-" + orderSeq.incrementAndGet();
        OrderFill fill = new OrderFill(orderId, OrderStatus.FILLED, quantity, fillPrice);
        orders.put(orderId, fill);

        double signedQty = side == OrderSide.BUY ? quantity : -quantity;
        positions.merge(symbol, new BrokerPosition(symbol, signedQty, fillPrice), (held, add) -> {
            double qty = held.quantity() + add.quantity();
            double avg = qty == 0 ? 0
                : (held.quantity() * held.averagePrice() + add.quantity() * add.averagePrice()) / qty;
            return new BrokerPosition(symbol, qty, avg);
        });

        log.info("[PAPER] {} {} {} @ {} → {}", side, quantity, symbol, String.format("%.2f", fillPrice), orderId);
        return fill;
    }

    @Override
    public boolean cancelOrder(String orderId) {
        OrderFill order = orders.get(orderId);
        if (order == null || order.status().isFilled() || order.status() == OrderStatus.CANCELLED) return false;
        orders.put(orderId, new OrderFill(orderId, OrderStatus.CANCELLED, order.filledQuantity(), order.averagePrice()));
        return true;
    }

    @Override
    public OrderFill getOrderStatus(String orderId) {
        OrderFill order = orders.get(orderId);
        if (order == null) throw new ExecutorException("Unknown paper order " + orderId);
        return order;
    }

    @Override
    public List<BrokerPosition> getPositions() {
        return positions.values().stream().filter(p -> p.quantity() != 0).toList();
    }

    @Override
    public Map<String, Object> getProfile() {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("broker", brokerType());
        profile.put("connected", connected);
        profile.put("orders", orders.size());
        profile.put("open_positions", getPositions().size());
        return profile;
    }
}
