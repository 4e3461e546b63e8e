package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.MarketSnapshot;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketDataServiceTest {

    @Mock
    private MarketDataSupplier supplier;

    private ThreadPoolTaskExecutor executor;
    private EngineConfig config;
    private MarketDataService service;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
        config = new EngineConfig();
        service = new MarketDataService(supplier, executor, config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchesEachSymbolOnce() {
        when(supplier.fetch(anyCollection())).thenReturn(Map.of(
            "AAPL", TestSignals.snapshot("AAPL", 100), "MSFT", TestSignals.snapshot("MSFT", 300)));

        Map<String, MarketSnapshot> market = service.snapshot(Arrays.asList("AAPL", " MSFT", "AAPL", null, ""));

        ArgumentCaptor<Collection<String>> requested = ArgumentCaptor.forClass(Collection.class);
        verify(supplier).fetch(requested.capture());
        assertThat(requested.getValue()).containsExactly("AAPL", "MSFT");
        assertThat(market).containsOnlyKeys("AAPL", "MSFT");
    }

    @Test
    void publishedMapIsReadOnlyAndLimitedToRequestedSymbols() {
        when(supplier.fetch(anyCollection())).thenReturn(Map.of(
            "AAPL", TestSignals.snapshot("AAPL", 100), "TSLA", TestSignals.snapshot("TSLA", 200)));

        Map<String, MarketSnapshot> market = service.snapshot(List.of("AAPL", "MSFT"));

        assertThat(market).containsOnlyKeys("AAPL");
        assertThatThrownBy(() -> market.put("MSFT", TestSignals.snapshot("MSFT", 1)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void slowSupplierYieldsEmptyMarket() {
        config.evaluation().setMarketDataTimeoutMs(100);
        when(supplier.fetch(anyCollection())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return Map.of();
        });

        assertThat(service.snapshot(List.of("AAPL"))).isEmpty();
    }

    @Test
    void failingSupplierYieldsEmptyMarket() {
        when(supplier.fetch(anyCollection())).thenThrow(new IllegalStateException("feed down"));

        assertThat(service.snapshot(List.of("AAPL"))).isEmpty();
    }

    @Test
    void noSymbolsNoFetch() {
        assertThat(service.snapshot(List.of())).isEmpty();
        assertThat(service.snapshot(null)).isEmpty();
        verifyNoInteractions(supplier);
    }
}
