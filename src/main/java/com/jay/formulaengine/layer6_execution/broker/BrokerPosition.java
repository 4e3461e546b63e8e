package com.jay.formulaengine.layer6_execution.broker;

/** Net open quantity for one symbol at a broker. Negative quantity means short. */
public record BrokerPosition(String symbol, double quantity, double averagePrice) {}
