package dev.univer.expensebot.service;

import dev.univer.expensebot.bot.ActionToken;
import dev.univer.expensebot.bot.BotReply;
import dev.univer.expensebot.model.Category;
import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.util.CategoryMatcher;
import dev.univer.expensebot.util.ExpenseParser;
import dev.univer.expensebot.util.ParsedExpense;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseCaptureService {
    static final int LIST_LIMIT = 10;

    private static final Set<String> ACTIONS = Set.of(
            ActionToken.DELETE_EXPENSE, ActionToken.DELETE_CONFIRM, ActionToken.BACK_EXPENSE);

    private final CategoryService categoryService;
    private final ExpenseService expenseService;
    private final UserSettingsService userSettingsService;

    /** "5.50 Coffee #work" → new expense. Empty when the text is a command or has no amount. */
    public Optional<List<BotReply>> captureFreeText(Long chatId, Long userId, String text) {
        if (text == null || text.isBlank() || text.trim().startsWith("/")) return Optional.empty();
        List<Category> categories = knownCategories();
        return ExpenseParser.parseExpenseInput(text, CategoryService.names(categories))
                .map(parsed -> save(chatId, userId, parsed, categories));
    }

    /** "/add 5.50 Coffee [Food]" → new expense, or the usage text. */
    public List<BotReply> captureCommand(Long chatId, Long userId, String text) {
        List<Category> categories = knownCategories();
        Optional<ParsedExpense> parsed = ExpenseParser.parseCommandExpense(text, CategoryService.names(categories));
        if (parsed.isEmpty()) return List.of(BotReply.send(chatId, ExpenseCards.ADD_USAGE));
        return save(chatId, userId, parsed.get(), categories);
    }

    /** Delete / confirm delete / back to the expense card. */
    public List<BotReply> handleAction(Long chatId, Long userId, Integer messageId, ActionToken token) {
        if (!ACTIONS.contains(token.action())) {
            log.debug("Unknown expense action {}", token.action());
            return List.of();
        }
        Optional<Expense> found;
        try {
            found = expenseService.findById(token.expenseId());
        } catch (DataAccessException e) {
            log.error("Failed to load expense {}", token.expenseId(), e);
            return List.of(BotReply.send(chatId, ExpenseCards.LOAD_FAILED));
        }
        if (found.isEmpty()) {
            log.warn("Expense {} not found", token.expenseId());
            return List.of(BotReply.edit(chatId, messageId, ExpenseCards.NOT_FOUND));
        }
        Expense expense = found.get();
        if (!Objects.equals(expense.getUserId(), userId)) {
            log.warn("User mismatch on expense {}", token.expenseId());
            return List.of();
        }

        switch (token.action()) {
            case ActionToken.DELETE_EXPENSE -> {
                return List.of(BotReply.edit(chatId, messageId, ExpenseCards.deletePrompt(expense),
                                             ExpenseCards.deleteButtons(expense.getId())));
            }
            case ActionToken.DELETE_CONFIRM -> {
                try {
                    expenseService.delete(expense);
                } catch (DataAccessException e) {
                    log.error("Failed to delete expense {}", expense.getId(), e);
                    return List.of(BotReply.edit(chatId, messageId, "❌ Failed to delete expense. Please try again."));
                }
                log.info("Expense {} deleted", expense.getId());
                return List.of(BotReply.edit(chatId, messageId, "✅ Expense #" + expense.getId() + " deleted."));
            }
            case ActionToken.BACK_EXPENSE -> {
                return List.of(BotReply.edit(chatId, messageId, ExpenseCards.expenseAdded(expense),
                                             ExpenseCards.expenseButtons(expense.getId())));
            }
            default -> {
                return List.of();
            }
        }
    }

    public BotReply recent(Long chatId, Long userId) {
        List<Expense> expenses;
        try {
            expenses = expenseService.recent(userId, LIST_LIMIT);
        } catch (DataAccessException e) {
            log.error("Failed to fetch recent expenses", e);
            return BotReply.send(chatId, "❌ Failed to fetch expenses. Please try again.");
        }
        if (expenses.isEmpty()) return BotReply.send(chatId, "No expenses yet. Send one like 5.50 Coffee");
        String body = expenses.stream().map(ExpenseCards::listLine).collect(Collectors.joining("\n"));
        return BotReply.send(chatId, "📋 Recent Expenses\n\n" + body);
    }

    private List<BotReply> save(Long chatId, Long userId, ParsedExpense parsed, List<Category> categories) {
        String currency = parsed.hasCurrency() ? parsed.currency() : defaultCurrency(userId);
        Category category = parsed.hasCategoryName()
                            ? CategoryMatcher.match(parsed.categoryName(), categories).orElse(null)
                            : null;

        Expense expense = Expense.builder()
                .userId(userId)
                .amount(parsed.amount())
                .currency(currency)
                .description(parsed.description())
                .merchant(parsed.description())
                .category(category)
                .tags(new ArrayList<>(parsed.tags()))
                .build();
        try {
            expense = expenseService.create(expense);
        } catch (DataAccessException e) {
            log.error("Failed to create expense", e);
            return List.of(BotReply.send(chatId, "❌ Failed to save expense. Please try again."));
        }

        log.info("Expense {} created: amount={} {}, category={}, tags={}",
                 expense.getId(), expense.getAmount(), currency, ExpenseCards.categoryName(expense), parsed.tags().size());
        return List.of(BotReply.send(chatId, ExpenseCards.expenseAdded(expense), ExpenseCards.expenseButtons(expense.getId())));
    }

    private List<Category> knownCategories() {
        try {
            return categoryService.getAll();
        } catch (DataAccessException e) {
            log.warn("Failed to fetch categories, parsing without them: {}", e.getMessage());
            return List.of();
        }
    }

    private String defaultCurrency(Long userId) {
        try {
            return userSettingsService.defaultCurrency(userId);
        } catch (DataAccessException e) {
            log.debug("Failed to read default currency for user, using fallback: {}", e.getMessage());
            return userSettingsService.fallbackCurrency();
        }
    }
}
