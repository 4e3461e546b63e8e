package com.jay.formulaengine.model.enums;

public enum NotificationType {
    SIGNAL,
    APPROVAL_REQUEST,
    EXECUTION,
    EXECUTION_FAILED,
    RISK_WARNING,
    APPROVAL_EXPIRED,
    SYSTEM_ALERT
}
