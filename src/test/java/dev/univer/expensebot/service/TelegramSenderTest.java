package dev.univer.expensebot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.univer.expensebot.bot.BotReply;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@ExtendWith(MockitoExtension.class)
class TelegramSenderTest {

    @Mock
    AbsSender absSender;
    @Captor
    ArgumentCaptor<SendMessage> sendCaptor;
    @Captor
    ArgumentCaptor<EditMessageText> editCaptor;

    TelegramSender sender;

    @BeforeEach
    void setUp() {
        sender = new TelegramSender(absSender);
    }

    @Test
    void sendCarriesInlineButtons() throws Exception {
        sender.deliver(BotReply.send(100L, "hello", ExpenseCards.expenseButtons(42L)));

        verify(absSender).execute(sendCaptor.capture());
        SendMessage sent = sendCaptor.getValue();
        assertThat(sent.getChatId()).isEqualTo("100");
        assertThat(sent.getText()).isEqualTo("hello");
        InlineKeyboardMarkup markup = (InlineKeyboardMarkup) sent.getReplyMarkup();
        assertThat(markup.getKeyboard().get(0).get(0).getCallbackData()).isEqualTo("edit_expense_42");
        assertThat(markup.getKeyboard().get(0).get(1).getCallbackData()).isEqualTo("delete_expense_42");
    }

    @Test
    void editReplacesTheGivenMessage() throws Exception {
        sender.deliver(BotReply.edit(100L, 555, "updated"));

        verify(absSender).execute(editCaptor.capture());
        EditMessageText edit = editCaptor.getValue();
        assertThat(edit.getMessageId()).isEqualTo(555);
        assertThat(edit.getText()).isEqualTo("updated");
        assertThat(edit.getReplyMarkup()).isNull();
    }

    @Test
    void failedDeliveryDoesNotStopTheRest() throws Exception {
        when(absSender.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("blocked"));

        sender.deliver(List.of(BotReply.send(100L, "first"), BotReply.edit(100L, 555, "second")));

        verify(absSender).execute(editCaptor.capture());
        assertThat(editCaptor.getValue().getText()).isEqualTo("second");
    }
}
