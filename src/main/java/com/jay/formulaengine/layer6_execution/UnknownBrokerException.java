package com.jay.formulaengine.layer6_execution;

public class UnknownBrokerException extends ExecutorException {

    public UnknownBrokerException(String brokerType) {
        super("No broker registered for type '" + brokerType + "'");
    }
}
