package dev.univer.expensebot.service;

import dev.univer.expensebot.bot.BotReply;
import dev.univer.expensebot.bot.ReplyButton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramSender {
    private final AbsSender sender;

    /** Delivers replies in order; a failed one is logged and the rest still go out. */
    public void deliver(List<BotReply> replies) {
        for (BotReply reply : replies) {
            try {
                deliver(reply);
            } catch (TelegramApiException e) {
                log.error("Failed to deliver {} to chat {}: {}", reply.kind(), reply.chatId(), e.getMessage());
            }
        }
    }

    public void deliver(BotReply reply) throws TelegramApiException {
        switch (reply.kind()) {
            case SEND -> {
                SendMessage sm = SendMessage.builder()
                        .chatId(reply.chatId().toString())
                        .text(reply.text())
                        .build();
                if (reply.hasButtons()) sm.setReplyMarkup(keyboard(reply.buttons()));
                sender.execute(sm);
            }
            case EDIT -> {
                EditMessageText em = EditMessageText.builder()
                        .chatId(reply.chatId().toString())
                        .messageId(reply.messageId())
                        .text(reply.text())
                        .build();
                if (reply.hasButtons()) em.setReplyMarkup(keyboard(reply.buttons()));
                sender.execute(em);
            }
        }
    }

    public void answerCallback(String callbackQueryId) {
        try {
            sender.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException e) {
            log.warn("Failed to answer callback {}: {}", callbackQueryId, e.getMessage());
        }
    }

    static InlineKeyboardMarkup keyboard(List<List<ReplyButton>> rows) {
        List<List<InlineKeyboardButton>> keyboard = rows.stream()
                .map(row -> row.stream()
                        .map(b -> InlineKeyboardButton.builder().text(b.text()).callbackData(b.action()).build())
                        .toList())
                .toList();
        return InlineKeyboardMarkup.builder().keyboard(keyboard).build();
    }
}
