package dev.univer.expensebot.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.univer.expensebot.edit.EditFlowController;
import dev.univer.expensebot.service.CategoryCommandService;
import dev.univer.expensebot.service.ExpenseCaptureService;
import dev.univer.expensebot.service.ExpenseCards;
import dev.univer.expensebot.service.ExpenseCommandService;
import dev.univer.expensebot.service.TagCommandService;
import dev.univer.expensebot.service.TelegramSender;
import dev.univer.expensebot.service.UserSettingsService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

@ExtendWith(MockitoExtension.class)
class ExpenseBotTest {

    private static final long CHAT = 100L;
    private static final long USER = 7L;

    @Mock
    EditFlowController editFlow;
    @Mock
    ExpenseCaptureService capture;
    @Mock
    ExpenseCommandService commands;
    @Mock
    TagCommandService tags;
    @Mock
    CategoryCommandService categories;
    @Mock
    UserSettingsService userSettingsService;
    @Mock
    TelegramSender sender;
    @Captor
    ArgumentCaptor<List<BotReply>> replies;

    ExpenseBot bot;

    @BeforeEach
    void setUp() {
        bot = new ExpenseBot(editFlow, capture, commands, tags, categories, userSettingsService, sender);
    }

    @Test
    void pendingEditTakesPrecedenceOverExpenseParsing() {
        BotReply updated = BotReply.edit(CHAT, 555, "✅ Amount Updated");
        when(editFlow.handleMessage(CHAT, USER, "5.50 Coffee")).thenReturn(Optional.of(List.of(updated)));

        bot.handle(textUpdate("5.50 Coffee"));

        verify(sender).deliver(List.of(updated));
        verifyNoInteractions(capture);
    }

    @Test
    void pendingEditTakesCommandLookingTextToo() {
        when(editFlow.handleMessage(CHAT, USER, "/help")).thenReturn(Optional.of(List.of()));

        bot.handle(textUpdate("/help"));

        verify(sender).deliver(List.of());
    }

    @Test
    void freeTextWithoutPendingEditBecomesExpense() {
        BotReply added = BotReply.send(CHAT, "✅ Expense Added");
        when(editFlow.handleMessage(CHAT, USER, "5.50 Coffee")).thenReturn(Optional.empty());
        when(capture.captureFreeText(CHAT, USER, "5.50 Coffee")).thenReturn(Optional.of(List.of(added)));

        bot.handle(textUpdate("5.50 Coffee"));

        verify(sender).deliver(List.of(added));
    }

    @Test
    void unrecognisedTextGetsHint() {
        when(editFlow.handleMessage(CHAT, USER, "hi")).thenReturn(Optional.empty());
        when(capture.captureFreeText(CHAT, USER, "hi")).thenReturn(Optional.empty());

        bot.handle(textUpdate("hi"));

        verify(sender).deliver(replies.capture());
        assertThat(replies.getValue()).extracting(BotReply::text).containsExactly(ExpenseCards.FREE_TEXT_HINT);
    }

    @Test
    void helpCommand() {
        when(editFlow.handleMessage(CHAT, USER, "/help@ExpenseBot")).thenReturn(Optional.empty());

        bot.handle(textUpdate("/help@ExpenseBot"));

        verify(sender).deliver(replies.capture());
        assertThat(replies.getValue()).extracting(BotReply::text).containsExactly(ExpenseBot.HELP_TEXT);
        verifyNoInteractions(capture);
    }

    @Test
    void helpListsEveryCommand() {
        assertThat(ExpenseBot.HELP_TEXT).contains(
                "/add", "/list", "/today", "/week", "/edit", "/delete", "/categories", "/category",
                "/addcategory", "/renamecategory", "/deletecategory", "/tag", "/untag", "/tags", "/currency");
    }

    @Test
    void addCommandGoesToCapture() {
        when(editFlow.handleMessage(CHAT, USER, "/add 3 Tea")).thenReturn(Optional.empty());
        when(capture.captureCommand(CHAT, USER, "/add 3 Tea")).thenReturn(List.of());

        bot.handle(textUpdate("/add 3 Tea"));

        verify(capture).captureCommand(CHAT, USER, "/add 3 Tea");
    }

    @Test
    void addCategoryPassesTheName() {
        when(editFlow.handleMessage(CHAT, USER, "/addcategory Pets")).thenReturn(Optional.empty());
        when(categories.add("Pets")).thenReturn("✅ Category created: Pets");

        bot.handle(textUpdate("/addcategory Pets"));

        verify(sender).deliver(replies.capture());
        assertThat(replies.getValue()).extracting(BotReply::text).containsExactly("✅ Category created: Pets");
    }

    @Test
    void categoriesIsNotMistakenForCategory() {
        when(editFlow.handleMessage(CHAT, USER, "/categories")).thenReturn(Optional.empty());
        when(categories.list()).thenReturn("📁 Categories");

        bot.handle(textUpdate("/categories"));

        verify(categories).list();
        verifyNoInteractions(commands);
    }

    @Test
    void categoryCommandPassesTheWholeName() {
        when(editFlow.handleMessage(CHAT, USER, "/category Food - Dining Out")).thenReturn(Optional.empty());
        when(commands.byCategory(USER, "Food - Dining Out")).thenReturn("📁 Food - Dining Out Expenses");

        bot.handle(textUpdate("/category Food - Dining Out"));

        verify(sender).deliver(replies.capture());
        assertThat(replies.getValue()).extracting(BotReply::text).containsExactly("📁 Food - Dining Out Expenses");
    }

    @Test
    void periodCommands() {
        when(editFlow.handleMessage(eq(CHAT), eq(USER), any())).thenReturn(Optional.empty());
        when(commands.today(USER)).thenReturn("📅 Today's Expenses");
        when(commands.week(USER)).thenReturn("📆 This Week's Expenses");

        bot.handle(textUpdate("/today"));
        bot.handle(textUpdate("/week@ExpenseBot"));

        verify(commands).today(USER);
        verify(commands).week(USER);
    }

    @Test
    void editAndDeleteByIdGoToCommands() {
        when(editFlow.handleMessage(eq(CHAT), eq(USER), any())).thenReturn(Optional.empty());
        when(commands.edit(USER, "42 12.50 Lunch")).thenReturn("✅ Expense Updated");
        when(commands.delete(USER, null)).thenReturn("❌ Usage: /delete <id>");

        bot.handle(textUpdate("/edit 42 12.50 Lunch"));
        bot.handle(textUpdate("/delete"));

        verify(commands).edit(USER, "42 12.50 Lunch");
        verify(commands).delete(USER, null);
    }

    @Test
    void tagCommandsAreToldApart() {
        when(editFlow.handleMessage(eq(CHAT), eq(USER), any())).thenReturn(Optional.empty());
        when(tags.tag(USER, "42 #work")).thenReturn("✅ Added #work to expense #42.");
        when(tags.untag(USER, "42 #work")).thenReturn("✅ Removed #work from expense #42.");
        when(tags.tags(USER, null)).thenReturn("🏷️ Tags");

        bot.handle(textUpdate("/tag 42 #work"));
        bot.handle(textUpdate("/untag 42 #work"));
        bot.handle(textUpdate("/tags"));

        verify(tags).tag(USER, "42 #work");
        verify(tags).untag(USER, "42 #work");
        verify(tags).tags(USER, null);
    }

    @Test
    void categoryAdministration() {
        when(editFlow.handleMessage(eq(CHAT), eq(USER), any())).thenReturn(Optional.empty());
        when(categories.rename("Food -> Meals")).thenReturn("✅ Category 'Food' renamed to 'Meals'.");
        when(categories.delete("Meals")).thenReturn("✅ Category 'Meals' deleted.");

        bot.handle(textUpdate("/renamecategory Food -> Meals"));
        bot.handle(textUpdate("/deletecategory Meals"));

        verify(categories).rename("Food -> Meals");
        verify(categories).delete("Meals");
        verifyNoInteractions(commands);
    }

    @Test
    void currencyCommandSetsUppercaseCode() {
        when(editFlow.handleMessage(CHAT, USER, "/currency usd")).thenReturn(Optional.empty());

        bot.handle(textUpdate("/currency usd"));

        verify(userSettingsService).updateDefaultCurrency(USER, "USD");
        verify(sender).deliver(replies.capture());
        assertThat(replies.getValue().get(0).text()).isEqualTo("✅ Default currency set to USD");
    }

    @Test
    void editButtonsGoToEditFlow() {
        when(editFlow.supports(any(ActionToken.class))).thenReturn(true);
        when(editFlow.handleAction(eq(CHAT), eq(USER), eq(555), any(ActionToken.class))).thenReturn(List.of());

        bot.handle(callbackUpdate("edit_amount_42"));

        verify(sender).answerCallback("cb-1");
        verify(editFlow).handleAction(eq(CHAT), eq(USER), eq(555), any(ActionToken.class));
        verifyNoInteractions(capture);
    }

    @Test
    void deleteButtonsGoToCapture() {
        when(editFlow.supports(any(ActionToken.class))).thenReturn(false);
        when(capture.handleAction(eq(CHAT), eq(USER), eq(555), any(ActionToken.class))).thenReturn(List.of());

        bot.handle(callbackUpdate("delete_expense_42"));

        verify(capture).handleAction(eq(CHAT), eq(USER), eq(555), any(ActionToken.class));
    }

    @Test
    void malformedButtonDataIsIgnored() {
        bot.handle(callbackUpdate("garbage"));

        verify(sender).answerCallback("cb-1");
        verify(editFlow, never()).handleAction(anyLong(), anyLong(), anyInt(), any(ActionToken.class));
        verifyNoInteractions(capture);
    }

    private static Update textUpdate(String text) {
        Message message = message();
        message.setText(text);
        Update update = new Update();
        update.setMessage(message);
        return update;
    }

    private static Update callbackUpdate(String data) {
        CallbackQuery query = new CallbackQuery();
        query.setId("cb-1");
        query.setFrom(user());
        query.setMessage(message());
        query.setData(data);
        Update update = new Update();
        update.setCallbackQuery(query);
        return update;
    }

    private static Message message() {
        Chat chat = new Chat();
        chat.setId(CHAT);
        chat.setType("private");
        Message message = new Message();
        message.setMessageId(555);
        message.setChat(chat);
        message.setFrom(user());
        return message;
    }

    private static User user() {
        User user = new User();
        user.setId(USER);
        user.setFirstName("Alex");
        user.setIsBot(false);
        return user;
    }
}
