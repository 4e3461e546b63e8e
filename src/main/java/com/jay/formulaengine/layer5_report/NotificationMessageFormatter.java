package com.jay.formulaengine.layer5_report;

import com.jay.formulaengine.model.enums.NotificationType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Layer 5 — Notification text.
 * Turns a notification payload into the HTML message sent over Telegram and the other channels.
 * Payload keys are the snake_case names the router and gateway put in; unknown keys are ignored.
 */
@Component
public class NotificationMessageFormatter {

    private static final String DIVIDER = "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    public String format(NotificationType type, Map<String, Object> payload) {
        Map<String, Object> p = payload != null ? payload : Map.of();
        StringBuilder sb = new StringBuilder();
        sb.append("<b>").append(title(type)).append("</b>\n");
        sb.append(DIVIDER).append("\n");

        line(sb, "Trade ID  ", p.get("trade_id"));
        line(sb, "Formula   ", p.get("formula_id"));
        line(sb, "Symbol    ", p.get("symbol"));
        line(sb, "Signal    ", p.get("signal_type"));
        if (p.get("confidence") instanceof Number c) {
            sb.append(String.format("Confidence: %.0f%%%n", c.doubleValue() * 100));
        }
        price(sb, "Price     ", p.get("price"));
        line(sb, "Side      ", p.get("side"));
        number(sb, "Quantity  ", p.get("quantity"));
        price(sb, "Stop-loss ", p.get("stop_loss"));
        price(sb, "Target    ", p.get("take_profit"));
        if (p.get("risk_reward_ratio") instanceof Number rr) {
            sb.append(String.format("R:R       : 1 : %.2f%n", rr.doubleValue()));
        }
        line(sb, "Risk      ", p.get("risk_status"));
        line(sb, "Order ID  ", p.get("order_id"));
        price(sb, "Fill price", p.get("execution_price"));

        list(sb, "❌ Violations", p.get("violations"));
        list(sb, "⚠️ Warnings", p.get("warnings"));
        list(sb, "💡 Suggestions", p.get("recommendations"));

        line(sb, "Reason    ", p.get("error"));
        line(sb, "Reason    ", p.get("reason"));
        if (p.get("message") != null) {
            sb.append(p.get("message")).append("\n");
        }

        if (type == NotificationType.APPROVAL_REQUEST && p.get("trade_id") != null) {
            sb.append(DIVIDER).append("\n");
            sb.append(String.format("📲 Reply:  APPROVE %s  or  REJECT %s [reason]%n",
                p.get("trade_id"), p.get("trade_id")));
            line(sb, "⏰ Expires ", p.get("expires_at"));
        }
        return sb.toString();
    }

    private String title(NotificationType type) {
        return switch (type) {
            case SIGNAL -> "📊 SIGNAL";
            case APPROVAL_REQUEST -> "🔔 APPROVAL REQUIRED";
            case EXECUTION -> "✅ ORDER PLACED";
            case EXECUTION_FAILED -> "❌ EXECUTION FAILED";
            case RISK_WARNING -> "⚠️ SIGNAL BLOCKED BY RISK CHECK";
            case APPROVAL_EXPIRED -> "⏰ APPROVAL EXPIRED";
            case SYSTEM_ALERT -> "🤖 SYSTEM ALERT";
        };
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void line(StringBuilder sb, String label, Object value) {
        if (value == null) return;
        String text = String.valueOf(value);
        if (text.isBlank()) return;
        sb.append(label).append(": ").append(escape(text)).append("\n");
    }

    private void price(StringBuilder sb, String label, Object value) {
        if (value instanceof Number n) {
            sb.append(String.format("%s: %.2f%n", label, n.doubleValue()));
        }
    }

    private void number(StringBuilder sb, String label, Object value) {
        if (value instanceof Number n) {
            sb.append(String.format("%s: %.4f%n", label, n.doubleValue()));
        }
    }

    private void list(StringBuilder sb, String heading, Object value) {
        if (!(value instanceof Collection<?> items) || items.isEmpty()) return;
        sb.append(heading).append(":\n");
        items.forEach(i -> sb.append("   • ").append(escape(String.valueOf(i))).append("\n"));
    }

    // Telegram HTML mode rejects unescaped angle brackets and ampersands.
    private String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
