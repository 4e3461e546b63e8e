package com.jay.formulaengine.model.enums;

/**
 * How signals of a subscription are acted on.
 * AUTO places orders straight away, MANUAL queues them for a human decision,
 * ALERT_ONLY never touches the broker.
 */
public enum ExecutionMode {
    AUTO,
    MANUAL,
    ALERT_ONLY
}
