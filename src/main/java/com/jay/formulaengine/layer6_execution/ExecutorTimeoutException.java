package com.jay.formulaengine.layer6_execution;

/** A broker call did not answer within execution.broker_timeout_ms. */
public class ExecutorTimeoutException extends ExecutorException {

    public ExecutorTimeoutException(String message) {
        super(message);
    }
}
