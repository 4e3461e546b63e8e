package com.jay.formulaengine.layer6_execution;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import com.jay.formulaengine.model.enums.SignalType;
import com.jay.formulaengine.notification.TelegramService;
import com.jay.formulaengine.notification.TelegramService.TelegramMessage;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramCommandHandlerTest {

    private static final long OPERATOR = 42L;

    @Mock
    private TelegramService telegramService;

    @Mock
    private ApprovalGateway approvalGateway;

    private TelegramCommandHandler handler;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        config.telegram().setChatId(String.valueOf(OPERATOR));
        handler = new TelegramCommandHandler(telegramService, approvalGateway, config);
    }

    @Test
    void approveExecutesTradeAndRepliesWithOrderId() {
        when(approvalGateway.approve("TRD-1A2B3C4D", Map.of()))
            .thenReturn(approval("TRD-1A2B3C4D", ApprovalStatus.EXECUTED, "PAPER-7"));

        handler.handle(message(OPERATOR, "approve trd-1a2b3c4d"));

        verify(telegramService).sendMessageTo(eq("42"), contains("TRD-1A2B3C4D → EXECUTED"));
        verify(telegramService).sendMessageTo(eq("42"), contains("Order ID: PAPER-7"));
    }

    @Test
    void rejectPassesFreeTextReason() {
        PendingApproval rejected = approval("TRD-00000001", ApprovalStatus.REJECTED, null);
        rejected.setRejectionReason("earnings tomorrow");
        when(approvalGateway.reject("TRD-00000001", "earnings tomorrow")).thenReturn(rejected);

        handler.handle(message(OPERATOR, "REJECT TRD-00000001 earnings tomorrow"));

        verify(telegramService).sendMessageTo(eq("42"), contains("Reason: earnings tomorrow"));
    }

    @Test
    void rejectWithoutReasonUsesDefault() {
        when(approvalGateway.reject("TRD-00000001", "User rejected"))
            .thenReturn(approval("TRD-00000001", ApprovalStatus.REJECTED, null));

        handler.handle(message(OPERATOR, "REJECT TRD-00000001"));

        verify(approvalGateway).reject("TRD-00000001", "User rejected");
    }

    @Test
    void unknownTradeIsReported() {
        when(approvalGateway.approve("TRD-DEADBEEF", Map.of()))
            .thenThrow(new ApprovalNotFoundException("TRD-DEADBEEF"));

        handler.handle(message(OPERATOR, "APPROVE TRD-DEADBEEF"));

        verify(telegramService).sendMessageTo("42", "❓ Unknown trade ID: TRD-DEADBEEF");
    }

    @Test
    void decidedTradeIsReported() {
        when(approvalGateway.approve("TRD-00000001", Map.of()))
            .thenThrow(new ApprovalStateException("TRD-00000001", ApprovalStatus.EXPIRED, "approve"));

        handler.handle(message(OPERATOR, "APPROVE TRD-00000001"));

        verify(telegramService).sendMessageTo("42", "❓ Already processed: TRD-00000001 is EXPIRED");
    }

    @Test
    void approveWithoutIdShowsUsage() {
        handler.handle(message(OPERATOR, "APPROVE"));

        verify(telegramService).sendMessageTo("42", "Usage: APPROVE TRD-XXXXXXXX");
        verifyNoInteractions(approvalGateway);
    }

    @Test
    void pendingListsOpenApprovals() {
        when(approvalGateway.query(null, ApprovalStatus.PENDING))
            .thenReturn(List.of(approval("TRD-00000002", ApprovalStatus.PENDING, null)));

        handler.handle(message(OPERATOR, "PENDING"));

        verify(telegramService).sendMessageTo(eq("42"), contains("TRD-00000002 — ENTRY_LONG AAPL (user-1)"));
    }

    @Test
    void pendingWithNothingOpen() {
        when(approvalGateway.query(null, ApprovalStatus.PENDING)).thenReturn(List.of());

        handler.handle(message(OPERATOR, "pending"));

        verify(telegramService).sendMessageTo("42", "No trades awaiting approval.");
    }

    @Test
    void messagesFromOtherChatsAreIgnored() {
        handler.handle(message(7L, "APPROVE TRD-00000001"));

        verifyNoInteractions(approvalGateway);
        verify(telegramService, never()).sendMessageTo(any(), any());
    }

    @Test
    void unknownCommandIsIgnored() {
        handler.handle(message(OPERATOR, "hello there"));

        verifyNoInteractions(approvalGateway, telegramService);
    }

    private static TelegramMessage message(long chatId, String text) {
        return new TelegramMessage(chatId, 1L, text, "operator");
    }

    private static PendingApproval approval(String tradeId, ApprovalStatus status, String orderId) {
        return PendingApproval.builder()
            .tradeId(tradeId)
            .userId(TestSignals.USER)
            .signal(TestSignals.signal("AAPL", SignalType.ENTRY_LONG, 100))
            .status(status)
            .orderId(orderId)
            .createdAt(LocalDateTime.now())
            .expiresAt(LocalDateTime.now().plusMinutes(15))
            .build();
    }
}
