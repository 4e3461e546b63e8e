package com.jay.formulaengine.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.formulaengine.config.EngineConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Telegram Bot API client.
 * Sends messages via sendMessage and polls for operator replies via getUpdates.
 * All interaction uses OkHttp; there is no Telegram SDK dependency.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DEFAULT_OFFSET_FILE = ".formula-engine-telegram-offset";

    private final EngineConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient httpClient;
    private volatile long lastUpdateId = 0;
    // Persisted update offset so a restart does not replay APPROVE/REJECT commands.
    private Path offsetFile;

    private final List<Consumer<TelegramMessage>> messageHandlers = new CopyOnWriteArrayList<>();

    public record TelegramMessage(long chatId, long messageId, String text, String username) {}

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .build();
        String configured = config.telegram().getOffsetFile();
        offsetFile = configured == null || configured.isBlank()
            ? Path.of(System.getProperty("user.home"), DEFAULT_OFFSET_FILE)
            : Path.of(configured);
        try {
            if (Files.exists(offsetFile)) {
                lastUpdateId = Long.parseLong(Files.readString(offsetFile).trim());
                log.info("TelegramService: restored update offset {} from disk", lastUpdateId);
            }
        } catch (Exception e) {
            log.warn("TelegramService: could not read offset file ({}), starting from 0", e.getMessage());
        }
        log.info("TelegramService initialized. Bot configured: {}", isConfigured());
    }

    public boolean isConfigured() {
        String token = config.telegram().getBotToken();
        return token != null && !token.isBlank() && !token.equals("YOUR_BOT_TOKEN");
    }

    // ── Sending Messages ───────────────────────────────────────────────────────

    /** Sends to the operator chat. */
    public boolean sendMessage(String text) {
        return sendMessageTo(config.telegram().getChatId(), text);
    }

    public boolean sendMessageTo(String chatId, String text) {
        if (chatId == null || chatId.isBlank() || chatId.equals("YOUR_CHAT_ID")) {
            log.debug("Telegram chat ID not configured — message not sent");
            return false;
        }
        if (!isConfigured()) {
            log.debug("Telegram bot token not configured — message not sent");
            return false;
        }

        try {
            String payload = mapper.createObjectNode()
                .put("chat_id", chatId)
                .put("text", text)
                .put("parse_mode", "HTML")
                .toString();

            Request request = new Request.Builder()
                .url(botUrl("sendMessage"))
                .post(RequestBody.create(payload, JSON))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Telegram message sent to {}", chatId);
                    return true;
                }
                log.error("Telegram sendMessage failed: {} — {}",
                    response.code(), response.body() != null ? response.body().string() : "");
                return false;
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("Telegram sendMessage exception: {}", e.getMessage());
            return false;
        }
    }

    // ── Receiving Messages (Polling) ───────────────────────────────────────────

    public void addMessageHandler(Consumer<TelegramMessage> handler) {
        messageHandlers.add(handler);
    }

    /**
     * Fetches pending updates and hands each text message to the registered handlers.
     * Called by the scheduler on a fixed delay.
     */
    public void pollForMessages() {
        if (!isConfigured()) return;

        try {
            Request request = new Request.Builder()
                .url(botUrl("getUpdates") + "?offset=" + (lastUpdateId + 1) + "&timeout=2")
                .get()
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) return;

                JsonNode root = mapper.readTree(response.body().string());
                if (!root.path("ok").asBoolean()) return;

                long highestId = lastUpdateId;
                for (JsonNode update : root.path("result")) {
                    long updateId = update.path("update_id").asLong();
                    if (updateId > highestId) highestId = updateId;

                    JsonNode msg = update.path("message");
                    if (msg.isMissingNode()) continue;

                    String text = msg.path("text").asText("").trim();
                    if (text.isBlank()) continue;

                    TelegramMessage telegramMsg = new TelegramMessage(
                        msg.path("chat").path("id").asLong(),
                        msg.path("message_id").asLong(),
                        text,
                        msg.path("from").path("username").asText(""));
                    messageHandlers.forEach(h -> {
                        try { h.accept(telegramMsg); }
                        catch (Exception e) { log.error("Message handler error: {}", e.getMessage()); }
                    });
                }
                if (highestId > lastUpdateId) {
                    lastUpdateId = highestId;
                    try {
                        Files.writeString(offsetFile, String.valueOf(lastUpdateId));
                    } catch (Exception e) {
                        log.warn("TelegramService: could not persist offset: {}", e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Telegram poll error (may be normal): {}", e.getMessage());
        }
    }

    private String botUrl(String method) {
        return config.telegram().getApiBase() + "/bot" + config.telegram().getBotToken() + "/" + method;
    }
}
