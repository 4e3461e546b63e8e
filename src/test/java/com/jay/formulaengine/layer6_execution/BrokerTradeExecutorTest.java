package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.layer6_execution.broker.BrokerClient;
import com.jay.formulaengine.layer6_execution.broker.BrokerRegistry;
import com.jay.formulaengine.layer6_execution.broker.PaperBrokerClient;
import com.jay.formulaengine.model.OrderFill;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.enums.OrderSide;
import com.jay.formulaengine.model.enums.OrderStatus;
import com.jay.formulaengine.model.enums.SignalType;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BrokerTradeExecutorTest {

    private ThreadPoolTaskExecutor brokerPool;
    private EngineConfig config;
    private final Signal signal = TestSignals.signal("AAPL", SignalType.ENTRY_LONG, 100);

    @BeforeEach
    void setUp() {
        brokerPool = new ThreadPoolTaskExecutor();
        brokerPool.setCorePoolSize(2);
        brokerPool.setThreadNamePrefix("broker-test-");
        brokerPool.initialize();
        config = new EngineConfig();
    }

    @AfterEach
    void tearDown() {
        brokerPool.shutdown();
    }

    private BrokerTradeExecutor executor(BrokerClient... clients) {
        return new BrokerTradeExecutor(new BrokerRegistry(List.of(clients)), brokerPool, config);
    }

    @Test
    void placesOrderOnDefaultBrokerWhenTagIsBlank() {
        BrokerTradeExecutor executor = executor(new PaperBrokerClient(config));

        OrderFill fill = executor.execute(signal, TestSignals.proposal("AAPL"), " ");

        assertThat(fill.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(fill.filledQuantity()).isEqualTo(5);
        assertThat(executor.status(fill.orderId())).contains(fill);
        assertThat(executor.cancel(fill.orderId())).isFalse();
    }

    @Test
    void unknownOrdersHaveNoStatus() {
        BrokerTradeExecutor executor = executor(new PaperBrokerClient(config));

        assertThat(executor.status("PAPER-99")).isEmpty();
        assertThat(executor.cancel("PAPER-99")).isFalse();
    }

    @Test
    void zeroSizedProposalIsRefused() {
        BrokerTradeExecutor executor = executor(new PaperBrokerClient(config));

        assertThatThrownBy(() -> executor.execute(signal, TestSignals.proposal("AAPL").toBuilder().positionSize(0).build(), "paper"))
            .isInstanceOf(ExecutorException.class)
            .hasMessageContaining("position size is 0");
    }

    @Test
    void unknownBrokerIsRefused() {
        BrokerTradeExecutor executor = executor(new PaperBrokerClient(config));

        assertThatThrownBy(() -> executor.execute(signal, TestSignals.proposal("AAPL"), "zerodha"))
            .isInstanceOf(UnknownBrokerException.class);
    }

    @Test
    void slowBrokerTimesOut() {
        config.execution().setBrokerTimeoutMs(200);
        BrokerClient slow = mock(BrokerClient.class);
        when(slow.brokerType()).thenReturn("slow");
        when(slow.isConnected()).thenReturn(true);
        when(slow.placeOrder(eq("AAPL"), eq(OrderSide.BUY), anyDouble(), anyDouble())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return new OrderFill("SLOW-1", OrderStatus.FILLED, 5, 100);
        });
        BrokerTradeExecutor executor = executor(slow);

        long start = System.currentTimeMillis();
        assertThatThrownBy(() -> executor.execute(signal, TestSignals.proposal("AAPL"), "slow"))
            .isInstanceOf(ExecutorTimeoutException.class)
            .hasMessage("placeOrder on broker 'slow' timed out after 200 ms");
        assertThat(System.currentTimeMillis() - start).isLessThan(2_000);
    }

    @Test
    void brokerRejectionIsAnError() {
        BrokerClient picky = mock(BrokerClient.class);
        when(picky.brokerType()).thenReturn("picky");
        when(picky.isConnected()).thenReturn(true);
        when(picky.placeOrder(eq("AAPL"), eq(OrderSide.BUY), anyDouble(), anyDouble()))
            .thenReturn(new OrderFill("P-1", OrderStatus.REJECTED, 0, 0));
        BrokerTradeExecutor executor = executor(picky);

        assertThatThrownBy(() -> executor.execute(signal, TestSignals.proposal("AAPL"), "picky"))
            .isInstanceOf(ExecutorException.class)
            .hasMessageContaining("rejected by broker 'picky'");
    }

    @Test
    void brokerExceptionsAreWrapped() {
        BrokerClient flaky = mock(BrokerClient.class);
        when(flaky.brokerType()).thenReturn("flaky");
        when(flaky.isConnected()).thenReturn(true);
        when(flaky.placeOrder(eq("AAPL"), eq(OrderSide.BUY), anyDouble(), anyDouble()))
            .thenThrow(new IllegalStateException("socket closed"));
        BrokerTradeExecutor executor = executor(flaky);

        assertThatThrownBy(() -> executor.execute(signal, TestSignals.proposal("AAPL"), "flaky"))
            .isInstanceOf(ExecutorException.class)
            .hasMessage("placeOrder on broker 'flaky' failed: socket closed");
    }
}
