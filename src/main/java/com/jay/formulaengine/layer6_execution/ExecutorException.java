package com.jay.formulaengine.layer6_execution;

/** Broker-side failure while placing, cancelling or inspecting an order. */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
