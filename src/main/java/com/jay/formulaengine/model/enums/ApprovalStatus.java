package com.jay.formulaengine.model.enums;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXECUTED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == REJECTED || this == EXECUTED || this == FAILED || this == EXPIRED;
    }
}
