package com.jay.formulaengine.model.enums;

public enum AuditActor {
    SYSTEM,
    USER,
    BROKER
}
