package dev.univer.expensebot.bot;

import java.util.List;

/**
 * Outgoing message content. Delivery is done by {@link dev.univer.expensebot.service.TelegramSender}.
 * An EDIT reply replaces the text and buttons of {@code messageId} in place.
 */
public record BotReply(Kind kind, Long chatId, Integer messageId, String text, List<List<ReplyButton>> buttons) {

    public enum Kind { SEND, EDIT }

    public BotReply {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static BotReply send(Long chatId, String text) {
        return new BotReply(Kind.SEND, chatId, null, text, List.of());
    }

    public static BotReply send(Long chatId, String text, List<List<ReplyButton>> buttons) {
        return new BotReply(Kind.SEND, chatId, null, text, buttons);
    }

    public static BotReply edit(Long chatId, Integer messageId, String text) {
        return new BotReply(Kind.EDIT, chatId, messageId, text, List.of());
    }

    public static BotReply edit(Long chatId, Integer messageId, String text, List<List<ReplyButton>> buttons) {
        return new BotReply(Kind.EDIT, chatId, messageId, text, buttons);
    }

    public boolean hasButtons() {
        return !buttons.isEmpty();
    }
}
