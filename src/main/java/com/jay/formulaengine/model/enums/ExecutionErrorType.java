package com.jay.formulaengine.model.enums;

public enum ExecutionErrorType {
    RISK_REJECTED,
    EXECUTOR_ERROR,
    EXECUTOR_TIMEOUT,
    NOT_ROUTED
}
