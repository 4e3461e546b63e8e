package com.jay.formulaengine.model.enums;

public enum AuditEventType {
    SIGNAL_GENERATED,
    EVALUATION_FAILED,
    PIPELINE_FAILED,
    ROUTE_TRANSITION,
    ORDER_CANCELLED,
    CYCLE_COMPLETED
}
