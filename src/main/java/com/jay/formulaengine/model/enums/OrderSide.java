package com.jay.formulaengine.model.enums;

public enum OrderSide {
    BUY,
    SELL
}
