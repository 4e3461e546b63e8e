package com.jay.formulaengine.model.enums;

/**
 * How a stop-loss or take-profit value is expressed.
 * TRAILING is priced like PERCENTAGE when computing risk metrics.
 */
public enum PriceLevelType {
    FIXED,
    PERCENTAGE,
    TRAILING
}
