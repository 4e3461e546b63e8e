package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.model.enums.ApprovalStatus;
import lombok.Getter;

/**
 * An approval decision arrived for a trade that is no longer PENDING.
 */
@Getter
public class ApprovalStateException extends RuntimeException {

    private final String tradeId;
    private final ApprovalStatus currentStatus;

    public ApprovalStateException(String tradeId, ApprovalStatus currentStatus, String action) {
        super(String.format("Cannot %s %s: approval is %s", action, tradeId, currentStatus));
        this.tradeId = tradeId;
        this.currentStatus = currentStatus;
    }
}
