package com.jay.formulaengine.model.enums;

/** States a signal passes through on its way from evaluation to the broker or the user. */
public enum RouteState {
    RECEIVED,
    VALIDATED,
    AUTO_EXECUTING,
    PENDING_APPROVAL,
    NOTIFIED_ONLY,
    APPROVED,
    EXECUTED,
    FAILED,
    REJECTED,
    EXPIRED
}
