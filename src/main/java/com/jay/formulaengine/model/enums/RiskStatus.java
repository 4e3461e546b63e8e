package com.jay.formulaengine.model.enums;

public enum RiskStatus {
    APPROVED,
    WARNING,
    REJECTED
}
