package com.jay.formulaengine.layer6_execution.broker;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.ExecutorException;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.enums.OrderSide;
import com.jay.formulaengine.model.enums.OrderStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PaperBrokerClientTest {

    @Test
    void fillsImmediatelyAtLimitPrice() {
        PaperBrokerClient broker = new PaperBrokerClient(new EngineConfig());

        OrderFill fill = broker.placeOrder("AAPL", OrderSide.BUY, 10, 150.0);

        assertThat(fill.orderId()).isEqualTo("PAPER-1");
        assertThat(fill.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(fill.filledQuantity()).isEqualTo(10);
        assertThat(fill.averagePrice()).isEqualTo(150.0);
        assertThat(broker.getOrderStatus("PAPER-1")).isEqualTo(fill);
    }

    @Test
    void slippageMovesAgainstTheTrader() {
        EngineConfig config = new EngineConfig();
        config.execution().setPaperSlippagePct(1.0);
        PaperBrokerClient broker = new PaperBrokerClient(config);

        assertThat(broker.placeOrder("AAPL", OrderSide.BUY, 1, 100).averagePrice()).isCloseTo(101.0, within(1e-9));
        assertThat(broker.placeOrder("AAPL", OrderSide.SELL, 1, 100).averagePrice()).isCloseTo(99.0, within(1e-9));
    }

    @Test
    void tracksNetPositions() {
        PaperBrokerClient broker = new PaperBrokerClient(new EngineConfig());
        broker.placeOrder("AAPL", OrderSide.BUY, 10, 100);
        broker.placeOrder("AAPL", OrderSide.BUY, 10, 110);
        broker.placeOrder("MSFT", OrderSide.BUY, 5, 300);
        broker.placeOrder("MSFT", OrderSide.SELL, 5, 310);

        assertThat(broker.getPositions()).singleElement().satisfies(p -> {
            assertThat(p.symbol()).isEqualTo("AAPL");
            assertThat(p.quantity()).isEqualTo(20);
            assertThat(p.averagePrice()).isCloseTo(105.0, within(1e-9));
        });
        assertThat(broker.getProfile()).containsEntry("orders", 4).containsEntry("open_positions", 1);
    }

    @Test
    void filledOrdersCannotBeCancelled() {
        PaperBrokerClient broker = new PaperBrokerClient(new EngineConfig());
        OrderFill fill = broker.placeOrder("AAPL", OrderSide.BUY, 1, 100);

        assertThat(broker.cancelOrder(fill.orderId())).isFalse();
        assertThat(broker.cancelOrder("PAPER-404")).isFalse();
    }

    @Test
    void rejectsInvalidOrdersAndUnknownIds() {
        PaperBrokerClient broker = new PaperBrokerClient(new EngineConfig());

        assertThatThrownBy(() -> broker.placeOrder("AAPL", OrderSide.BUY, 0, 100)).isInstanceOf(ExecutorException.class);
        assertThatThrownBy(() -> broker.getOrderStatus("PAPER-404")).isInstanceOf(ExecutorException.class);
    }
}
