package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.OrderStatus;

/** Broker acknowledgement of an order placement. */
public record OrderFill(String orderId, OrderStatus status, double filledQuantity, double averagePrice) {}
