package com.jay.formulaengine.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.jay.formulaengine.model.PositionSizing;
import com.jay.formulaengine.model.RiskPolicy;
import com.jay.formulaengine.model.enums.ExecutionMode;

import java.util.List;

/**
 * Request body of {@code POST /api/subscriptions}. The formula body may be sent as a JSON
 * document or as a string holding one.
 */
public record SubscriptionRequest(
    String id,
    String userId,
    FormulaRequest formula,
    ExecutionMode executionMode,
    RiskPolicy riskPolicy,
    PositionSizing sizing,
    String brokerType,
    Boolean notifyOnRiskRejection,
    Boolean active,
    String telegramChatId
) {
    public record FormulaRequest(
        String id,
        String name,
        String userId,
        JsonNode body,
        List<String> symbols,
        ExecutionMode executionMode,
        Boolean active
    ) {
        public String bodyText() {
            if (body == null || body.isNull()) return null;
            return body.isTextual() ? body.asText() : body.toString();
        }
    }
}
