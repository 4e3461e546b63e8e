package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import com.jay.formulaengine.notification.TelegramService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Operator commands over Telegram.
 * Format: "APPROVE TRD-XXXXXXXX", "REJECT TRD-XXXXXXXX [reason]" or "PENDING".
 * Only messages from the configured operator chat are acted on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramCommandHandler {

    private final TelegramService telegramService;
    private final ApprovalGateway approvalGateway;
    private final EngineConfig config;

    @PostConstruct
    public void init() {
        telegramService.addMessageHandler(this::handle);
        log.info("TelegramCommandHandler initialized — listening for APPROVE/REJECT commands");
    }

    void handle(TelegramService.TelegramMessage msg) {
        String operatorChat = config.telegram().getChatId();
        if (operatorChat == null || !operatorChat.equals(String.valueOf(msg.chatId()))) {
            log.warn("Ignoring Telegram message from non-operator chat {}", msg.chatId());
            return;
        }

        String[] parts = msg.text().trim().split("\\s+", 3);
        String command = parts[0].toUpperCase();
        String tradeId = parts.length >= 2 ? parts[1].toUpperCase() : null;

        switch (command) {
            case "APPROVE" -> {
                if (tradeId == null) { reply(msg, "Usage: APPROVE TRD-XXXXXXXX"); return; }
                decide(msg, tradeId, () -> approvalGateway.approve(tradeId, Map.of()));
            }
            case "REJECT" -> {
                if (tradeId == null) { reply(msg, "Usage: REJECT TRD-XXXXXXXX [reason]"); return; }
                String reason = parts.length >= 3 ? parts[2] : "User rejected";
                decide(msg, tradeId, () -> approvalGateway.reject(tradeId, reason));
            }
            case "PENDING" -> reply(msg, buildPendingMessage());
            default -> log.debug("Unrecognised Telegram command: {}", command);
        }
    }

    private void decide(TelegramService.TelegramMessage msg, String tradeId,
                        Supplier<PendingApproval> decision) {
        try {
            PendingApproval result = decision.get();
            String detail = switch (result.getStatus()) {
                case EXECUTED -> "Order ID: " + result.getOrderId();
                case FAILED -> "Execution failed: " + result.getFailureReason();
                case REJECTED -> "Reason: " + result.getRejectionReason();
                default -> "";
            };
            reply(msg, String.format("%s → %s%n%s", tradeId, result.getStatus(), detail));
        } catch (ApprovalNotFoundException e) {
            reply(msg, "❓ Unknown trade ID: " + tradeId);
        } catch (ApprovalStateException e) {
            reply(msg, "❓ Already processed: " + tradeId + " is " + e.getCurrentStatus());
        }
    }

    private String buildPendingMessage() {
        List<PendingApproval> pending = approvalGateway.query(null, ApprovalStatus.PENDING);
        if (pending.isEmpty()) return "No trades awaiting approval.";
        StringBuilder sb = new StringBuilder("<b>Pending approvals</b>\n");
        pending.forEach(a -> sb.append(String.format("• %s — %s %s (%s), expires %s%n",
            a.getTradeId(), a.getSignal().getSignalType(), a.getSignal().getSymbol(),
            a.getUserId(), a.getExpiresAt())));
        return sb.toString();
    }

    private void reply(TelegramService.TelegramMessage msg, String text) {
        telegramService.sendMessageTo(String.valueOf(msg.chatId()), text);
    }
}
