package com.jay.formulaengine.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.MarketSnapshot;
import com.jay.formulaengine.model.OHLCVBar;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1 — REST market data client.
 * Pulls latest quotes in one batch call and candle history per symbol, then attaches
 * ta4j-derived indicators to each snapshot.
 *
 * Endpoints (relative to market_data.base_url):
 *   GET /quotes?symbols=A,B        → {"data":[{symbol, ltp, open, high, low, close, volume, timestamp}]}
 *   GET /candles?symbol=X&limit=N  → {"data":[[timestamp, open, high, low, close, volume], ...]}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestMarketDataClient implements MarketDataSupplier {

    private final EngineConfig config;
    private final IndicatorCalculator indicatorCalculator;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpClient http;

    @PostConstruct
    public void init() {
        EngineConfig.MarketData md = config.marketData();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(md.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(md.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
    }

    @Override
    public Map<String, MarketSnapshot> fetch(Collection<String> symbols) {
        Map<String, MarketSnapshot> out = new LinkedHashMap<>();
        if (symbols == null || symbols.isEmpty()) return out;

        String baseUrl = config.marketData().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("market_data.base_url not configured — no market data for {} symbols", symbols.size());
            return out;
        }

        JsonNode quotes;
        try {
            quotes = get(url("quotes").addQueryParameter("symbols", String.join(",", symbols)).build());
        } catch (Exception e) {
            log.error("Quote fetch failed for {}: {}", symbols, e.getMessage());
            return out;
        }

        for (JsonNode q : quotes.path("data")) {
            String symbol = q.path("symbol").asText(null);
            if (symbol == null || !symbols.contains(symbol)) continue;
            try {
                double ltp = q.path("ltp").asDouble(Double.NaN);
                if (!(ltp > 0)) {
                    log.warn("Skipping {} — quote has no usable last price", symbol);
                    continue;
                }
                List<OHLCVBar> history = getCandles(symbol);
                out.put(symbol, MarketSnapshot.builder()
                    .symbol(symbol)
                    .price(ltp)
                    .open(q.path("open").asDouble(ltp))
                    .high(q.path("high").asDouble(ltp))
                    .low(q.path("low").asDouble(ltp))
                    .close(q.path("close").asDouble(ltp))
                    .volume(q.path("volume").asLong(0))
                    .timestamp(parseTimestamp(q.get("timestamp")))
                    .indicators(Map.copyOf(indicatorCalculator.compute(symbol, history)))
                    .build());
            } catch (Exception e) {
                log.warn("Skipping {} — {}", symbol, e.getMessage());
            }
        }

        log.debug("Market data fetched for {}/{} symbols", out.size(), symbols.size());
        return out;
    }

    /** Candle history for one symbol, oldest first. Empty when the call fails. */
    public List<OHLCVBar> getCandles(String symbol) {
        List<OHLCVBar> bars = new ArrayList<>();
        try {
            JsonNode root = get(url("candles")
                .addQueryParameter("symbol", symbol)
                .addQueryParameter("limit", String.valueOf(config.marketData().getHistoryBars()))
                .build());
            for (JsonNode candle : root.path("data")) {
                // Each candle: [timestamp, open, high, low, close, volume]
                if (!candle.isArray() || candle.size() < 6) continue;
                bars.add(OHLCVBar.builder()
                    .timestamp(parseTimestamp(candle.get(0)))
                    .open(candle.get(1).asDouble())
                    .high(candle.get(2).asDouble())
                    .low(candle.get(3).asDouble())
                    .close(candle.get(4).asDouble())
                    .volume(candle.get(5).asLong())
                    .build());
            }
        } catch (Exception e) {
            log.warn("Candle fetch failed for {}: {}", symbol, e.getMessage());
        }
        return bars;
    }

    // ── HTTP Helpers ───────────────────────────────────────────────────────────

    private HttpUrl.Builder url(String path) {
        HttpUrl base = HttpUrl.get(config.marketData().getBaseUrl());
        return base.newBuilder().addPathSegment(path);
    }

    private JsonNode get(HttpUrl url) throws IOException {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .get()
            .addHeader("Accept", "application/json");
        String apiKey = config.marketData().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.addHeader("X-API-Key", apiKey);
        }

        try (Response response = http.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url.encodedPath());
            }
            String body = response.body() != null ? response.body().string() : "{}";
            return objectMapper.readTree(body);
        }
    }

    // Accepts ISO local/offset date-times and epoch seconds or millis.
    static LocalDateTime parseTimestamp(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return LocalDateTime.now();
        if (node.isNumber()) {
            long raw = node.asLong();
            Instant instant = raw > 100_000_000_000L ? Instant.ofEpochMilli(raw) : Instant.ofEpochSecond(raw);
            return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
        }
        String text = node.asText();
        try {
            return OffsetDateTime.parse(text).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            return LocalDateTime.parse(text);
        }
    }
}
