package com.jay.formulaengine.layer6_execution;

public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String tradeId) {
        super("Unknown trade ID: " + tradeId);
    }
}
