package com.jay.formulaengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Point-in-time market view of one symbol. Immutable once published to a cycle.
 */
@Value
@Builder
public class MarketSnapshot {
    String symbol;
    double price;                 // last traded price
    long volume;
    double open;
    double high;
    double low;
    double close;
    LocalDateTime timestamp;

    @Builder.Default
    Map<String, Double> indicators = Map.of();   // derived values keyed by name, e.g. rsi_14

    public boolean hasIndicator(String name) {
        return indicators != null && indicators.containsKey(name);
    }
}
