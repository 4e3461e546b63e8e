package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.SignalType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Output of one successful formula evaluation.
 */
@Value
@Builder(toBuilder = true)
public class Signal {
    String userId;
    String formulaId;
    String symbol;
    SignalType signalType;
    double confidence;            // 0..1
    double price;                 // reference price
    LocalDateTime timestamp;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
