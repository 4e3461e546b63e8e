package com.jay.formulaengine.model.enums;

public enum OrderStatus {
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isFilled() {
        return this == FILLED;
    }
}
