package com.jay.formulaengine.model.enums;

import java.util.Locale;
import java.util.Optional;

public enum SignalType {
    ENTRY_LONG,
    ENTRY_SHORT,
    EXIT_LONG,
    EXIT_SHORT,
    HOLD;

    /** Case-insensitive lookup; formulas usually write kinds in lower case ("entry_long"). */
    public static Optional<SignalType> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean isActionable() {
        return this != HOLD;
    }

    /** Direction of the order a signal of this kind results in. */
    public OrderSide orderSide() {
        return switch (this) {
            case ENTRY_LONG, EXIT_SHORT -> OrderSide.BUY;
            case ENTRY_SHORT, EXIT_LONG -> OrderSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD signals do not produce orders");
        };
    }
}
