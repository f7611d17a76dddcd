package dev.univer.expensebot.bot;

import dev.univer.expensebot.config.AsyncConfig;
import dev.univer.expensebot.edit.EditFlowController;
import dev.univer.expensebot.service.CategoryCommandService;
import dev.univer.expensebot.service.ExpenseCaptureService;
import dev.univer.expensebot.service.ExpenseCards;
import dev.univer.expensebot.service.ExpenseCommandService;
import dev.univer.expensebot.service.TagCommandService;
import dev.univer.expensebot.service.TelegramSender;
import dev.univer.expensebot.service.UserSettingsService;
import dev.univer.expensebot.util.Currencies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class ExpenseBot {

    private final EditFlowController editFlow;
    private final ExpenseCaptureService capture;
    private final ExpenseCommandService commands;
    private final TagCommandService tags;
    private final CategoryCommandService categories;
    private final UserSettingsService userSettingsService;
    private final TelegramSender sender;

    private static final String MENTION_OPT = "(?:@\\w+)?";

    private static final Pattern HELP           = Pattern.compile("^/(start|help)" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADD            = Pattern.compile("^/add" + MENTION_OPT + "(?:\\s+.*)?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LIST           = bare("list");
    private static final Pattern TODAY          = bare("today");
    private static final Pattern WEEK           = bare("week");
    private static final Pattern CATEGORY       = withArgs("category");
    private static final Pattern EDIT           = withArgs("edit");
    private static final Pattern DELETE         = withArgs("delete");
    private static final Pattern TAG            = withArgs("tag");
    private static final Pattern UNTAG          = withArgs("untag");
    private static final Pattern TAGS           = withArgs("tags");
    private static final Pattern CATEGORIES     = bare("categories");
    private static final Pattern ADDCATEGORY    = withArgs("addcategory");
    private static final Pattern RENAMECATEGORY = withArgs("renamecategory");
    private static final Pattern DELETECATEGORY = withArgs("deletecategory");
    private static final Pattern CURRENCY       = Pattern.compile("^/currency" + MENTION_OPT + "(?:\\s+(\\S+))?\\s*$", Pattern.CASE_INSENSITIVE);

    static final String HELP_TEXT = """
            💸 Expense Capture Bot

            Send an expense as plain text:
              5.50 Coffee
              $10 Lunch #work
              SGD 25.50 Groceries [Food - Grocery]

            Expenses:
              /add <amount> <description> [Category] #tag - add an expense
              /list - recent expenses
              /today - today's expenses
              /week - this week's expenses
              /edit <id> <amount> <description> [category] - change an expense
              /delete <id> - delete an expense

            Categories:
              /categories - list categories
              /category <name> - expenses in a category
              /addcategory <name> - create a category
              /renamecategory Old -> New - rename a category
              /deletecategory <name> - delete a category

            Tags:
              /tag <id> #tag1 [#tag2] - tag an expense
              /untag <id> #tag - remove a tag
              /tags [tag] - your tags, or expenses with a tag

            Settings:
              /currency [CODE] - show or set your default currency

            Every saved expense has Edit and Delete buttons.""";

    @Async(AsyncConfig.UPDATE_EXECUTOR)
    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    void handle(Update update) {
        if (update.hasCallbackQuery()) {
            onCallback(update.getCallbackQuery());
            return;
        }
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText() || msg.getFrom() == null) return;
        onText(msg.getChatId(), msg.getFrom().getId(), msg.getText());
    }

    private void onCallback(CallbackQuery query) {
        sender.answerCallback(query.getId());
        Message msg = query.getMessage();
        if (msg == null || query.getFrom() == null) return;

        Optional<ActionToken> parsed = ActionToken.parse(query.getData());
        if (parsed.isEmpty()) {
            log.debug("Ignoring malformed action: {}", query.getData());
            return;
        }
        ActionToken token = parsed.get();
        long chatId = msg.getChatId();
        long userId = query.getFrom().getId();
        log.debug("Action {} on expense {} in chat {}", token.action(), token.expenseId(), chatId);

        List<BotReply> replies = editFlow.supports(token)
                                 ? editFlow.handleAction(chatId, userId, msg.getMessageId(), token)
                                 : capture.handleAction(chatId, userId, msg.getMessageId(), token);
        sender.deliver(replies);
    }

    private void onText(long chatId, long userId, String raw) {
        // a pending edit takes the message whatever it looks like
        Optional<List<BotReply>> edited = editFlow.handleMessage(chatId, userId, raw);
        if (edited.isPresent()) {
            log.debug("Message in chat {} consumed by pending edit", chatId);
            sender.deliver(edited.get());
            return;
        }

        String text = raw.trim();
        if (text.startsWith("/")) {
            sender.deliver(command(chatId, userId, text));
            return;
        }
        List<BotReply> replies = capture.captureFreeText(chatId, userId, text)
                .orElseGet(() -> List.of(BotReply.send(chatId, ExpenseCards.FREE_TEXT_HINT)));
        sender.deliver(replies);
    }

    private List<BotReply> command(long chatId, long userId, String text) {
        Matcher m;
        if (HELP.matcher(text).matches()) {
            return List.of(BotReply.send(chatId, HELP_TEXT));
        }
        if (ADD.matcher(text).matches()) {
            return capture.captureCommand(chatId, userId, text);
        }
        if (LIST.matcher(text).matches()) {
            return List.of(capture.recent(chatId, userId));
        }
        String reply;
        if (TODAY.matcher(text).matches()) {
            reply = commands.today(userId);
        } else if (WEEK.matcher(text).matches()) {
            reply = commands.week(userId);
        } else if ((m = CATEGORY.matcher(text)).matches()) {
            reply = commands.byCategory(userId, m.group(1));
        } else if ((m = EDIT.matcher(text)).matches()) {
            reply = commands.edit(userId, m.group(1));
        } else if ((m = DELETE.matcher(text)).matches()) {
            reply = commands.delete(userId, m.group(1));
        } else if ((m = TAG.matcher(text)).matches()) {
            reply = tags.tag(userId, m.group(1));
        } else if ((m = UNTAG.matcher(text)).matches()) {
            reply = tags.untag(userId, m.group(1));
        } else if ((m = TAGS.matcher(text)).matches()) {
            reply = tags.tags(userId, m.group(1));
        } else if (CATEGORIES.matcher(text).matches()) {
            reply = categories.list();
        } else if ((m = ADDCATEGORY.matcher(text)).matches()) {
            reply = categories.add(m.group(1));
        } else if ((m = RENAMECATEGORY.matcher(text)).matches()) {
            reply = categories.rename(m.group(1));
        } else if ((m = DELETECATEGORY.matcher(text)).matches()) {
            reply = categories.delete(m.group(1));
        } else if ((m = CURRENCY.matcher(text)).matches()) {
            reply = currency(userId, m.group(1));
        } else {
            log.debug("Unknown command in chat {}", chatId);
            reply = ExpenseCards.FREE_TEXT_HINT;
        }
        return List.of(BotReply.send(chatId, reply));
    }

    // "/list", "/list@Bot"
    private static Pattern bare(String name) {
        return Pattern.compile("^/" + name + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    }

    // "/tag 42 #work": group 1 is everything after the command, or null
    private static Pattern withArgs(String name) {
        return Pattern.compile("^/" + name + MENTION_OPT + "(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    private String currency(long userId, String code) {
        if (code == null) {
            String current;
            try {
                current = userSettingsService.defaultCurrency(userId);
            } catch (DataAccessException e) {
                log.error("Failed to read default currency", e);
                return "❌ Failed to fetch settings. Please try again.";
            }
            return "💱 Default currency: " + current
                   + "\nSupported: " + String.join(", ", Currencies.supportedCodes())
                   + "\nChange it with /currency <CODE>";
        }
        String upper = code.toUpperCase(Locale.ROOT);
        try {
            userSettingsService.updateDefaultCurrency(userId, upper);
        } catch (IllegalArgumentException e) {
            return "❌ " + e.getMessage() + "\nSupported: " + String.join(", ", Currencies.supportedCodes());
        } catch (DataAccessException e) {
            log.error("Failed to update default currency", e);
            return "❌ Failed to update currency. Please try again.";
        }
        return "✅ Default currency set to " + upper;
    }
}
