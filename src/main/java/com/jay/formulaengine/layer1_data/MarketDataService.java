package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Layer 1 — Market data for one evaluation cycle.
 * Fetches every requested symbol exactly once, bounded by a timeout, and publishes the
 * result as an unmodifiable map that all of the cycle's evaluations share.
 * Symbols the supplier could not deliver are absent; formulas needing them fail with
 * MISSING_MARKET_DATA instead of seeing stale values.
 */
@Slf4j
@Service
public class MarketDataService {

    private final MarketDataSupplier supplier;
    private final AsyncTaskExecutor executor;
    private final EngineConfig config;

    public MarketDataService(MarketDataSupplier supplier,
                             @Qualifier("evaluationExecutor") AsyncTaskExecutor executor,
                             EngineConfig config) {
        this.supplier = supplier;
        this.executor = executor;
        this.config = config;
    }

    public Map<String, MarketSnapshot> snapshot(Collection<String> symbols) {
        Set<String> distinct = new LinkedHashSet<>();
        if (symbols != null) {
            symbols.stream().filter(Objects::nonNull).map(String::trim)
                .filter(s -> !s.isEmpty()).forEach(distinct::add);
        }
        if (distinct.isEmpty()) return Map.of();

        long timeoutMs = config.evaluation().getMarketDataTimeoutMs();
        Map<String, MarketSnapshot> fetched;
        Future<Map<String, MarketSnapshot>> future = null;
        try {
            future = executor.submit(() -> supplier.fetch(Collections.unmodifiableSet(distinct)));
            fetched = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Market data fetch for {} symbols timed out after {} ms", distinct.size(), timeoutMs);
            return Map.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Market data fetch failed: {}", cause.getMessage(), cause);
            return Map.of();
        } catch (RejectedExecutionException e) {
            log.error("Market data fetch rejected — worker pool saturated");
            return Map.of();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Map.of();
        }

        Map<String, MarketSnapshot> published = new LinkedHashMap<>();
        if (fetched != null) {
            for (String symbol : distinct) {
                MarketSnapshot snap = fetched.get(symbol);
                if (snap != null) published.put(symbol, snap);
            }
        }
        if (published.size() < distinct.size()) {
            Set<String> missing = new LinkedHashSet<>(distinct);
            missing.removeAll(published.keySet());
            log.warn("Market data missing for {} of {} symbols: {}", missing.size(), distinct.size(), missing);
        }
        return Collections.unmodifiableMap(published);
    }
}
