package com.jay.formulaengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** One candle of price history, oldest first when held in a list. */
@Value
@Builder
public class OHLCVBar {
    LocalDateTime timestamp;
    double open;
    double high;
    double low;
    double close;
    long volume;
}
