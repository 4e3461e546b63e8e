package com.jay.formulaengine.notification;

/**
 * Delivers to a user's own Telegram chat through the shared bot.
 */
public record TelegramChatChannel(TelegramService telegram, String chatId) implements NotificationChannel {

    @Override
    public String name() {
        return "telegram:" + chatId;
    }

    @Override
    public boolean send(String message) {
        return telegram.sendMessageTo(chatId, message);
    }
}
