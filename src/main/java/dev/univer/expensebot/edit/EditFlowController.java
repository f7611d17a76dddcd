package dev.univer.expensebot.edit;

import dev.univer.expensebot.bot.ActionToken;
import dev.univer.expensebot.bot.BotReply;
import dev.univer.expensebot.model.Category;
import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.service.CategoryService;
import dev.univer.expensebot.service.ExpenseCards;
import dev.univer.expensebot.service.ExpenseService;
import dev.univer.expensebot.util.ExpenseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dialogue for revising one field of an expense.
 * <p>
 * Pressing "Edit amount", "Edit merchant" or "Create New" category stores a {@link PendingEdit} for the chat;
 * the next text message in that chat is the new value, whatever it looks like. Expenses of other users are
 * never touched and never mentioned: such requests end without any reply.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EditFlowController {

    private static final Set<String> ACTIONS = Set.of(
            ActionToken.EDIT_EXPENSE, ActionToken.EDIT_AMOUNT, ActionToken.EDIT_MERCHANT,
            ActionToken.EDIT_CATEGORY, ActionToken.CREATE_CATEGORY, ActionToken.SET_CATEGORY,
            ActionToken.CANCEL_EDIT);

    private final PendingEditStore pendingEdits;
    private final ExpenseService expenseService;
    private final CategoryService categoryService;

    public boolean supports(ActionToken token) {
        return ACTIONS.contains(token.action());
    }

    /**
     * Consumes {@code text} as the value of the chat's pending edit.
     *
     * @return empty when nothing is pending (the message is not ours); otherwise the replies, possibly none
     */
    public Optional<List<BotReply>> handleMessage(long chatId, long userId, String text) {
        Optional<PendingEdit> pending = pendingEdits.remove(chatId);
        if (pending.isEmpty()) return Optional.empty();
        PendingEdit edit = pending.get();
        log.debug("Consuming pending {} edit: chat={}, expense={}", edit.field(), chatId, edit.expenseId());

        Lookup lookup = lookup(edit.expenseId(), userId);
        if (lookup.access() == Access.FOREIGN) return Optional.of(List.of());
        if (lookup.access() == Access.MISSING) return Optional.of(List.of(BotReply.send(chatId, ExpenseCards.NOT_FOUND)));
        if (lookup.access() == Access.ERROR) return Optional.of(List.of(BotReply.send(chatId, ExpenseCards.LOAD_FAILED)));

        Expense expense = lookup.expense();
        String input = text == null ? "" : text;
        List<BotReply> replies = switch (edit.field()) {
            case AMOUNT -> applyAmount(chatId, edit, expense, input);
            case MERCHANT -> applyMerchant(chatId, edit, expense, input);
            case CATEGORY -> applyNewCategory(chatId, edit, expense, input);
        };
        return Optional.of(replies);
    }

    /** Same as {@link #handleAction(long, long, int, ActionToken)}; malformed data is ignored. */
    public List<BotReply> handleAction(long chatId, long userId, int messageId, String data) {
        return ActionToken.parse(data)
                .filter(this::supports)
                .map(token -> handleAction(chatId, userId, messageId, token))
                .orElseGet(List::of);
    }

    public List<BotReply> handleAction(long chatId, long userId, int messageId, ActionToken token) {
        if (ActionToken.CANCEL_EDIT.equals(token.action())) {
            pendingEdits.remove(chatId);
        }

        Lookup lookup = lookup(token.expenseId(), userId);
        if (lookup.access() == Access.FOREIGN) return List.of();
        if (lookup.access() == Access.MISSING) return List.of(BotReply.edit(chatId, messageId, ExpenseCards.NOT_FOUND));
        if (lookup.access() == Access.ERROR) return List.of(BotReply.send(chatId, ExpenseCards.LOAD_FAILED));
        Expense expense = lookup.expense();
        long id = expense.getId();

        return switch (token.action()) {
            case ActionToken.EDIT_EXPENSE, ActionToken.CANCEL_EDIT ->
                    List.of(BotReply.edit(chatId, messageId, ExpenseCards.editMenu(expense), ExpenseCards.editMenuButtons(id)));
            case ActionToken.EDIT_AMOUNT -> {
                pendingEdits.put(chatId, new PendingEdit(id, EditField.AMOUNT, messageId));
                yield List.of(BotReply.edit(chatId, messageId, ExpenseCards.amountPrompt(expense), ExpenseCards.cancelButton(id)));
            }
            case ActionToken.EDIT_MERCHANT -> {
                pendingEdits.put(chatId, new PendingEdit(id, EditField.MERCHANT, messageId));
                yield List.of(BotReply.edit(chatId, messageId, ExpenseCards.merchantPrompt(expense), ExpenseCards.cancelButton(id)));
            }
            case ActionToken.CREATE_CATEGORY -> {
                pendingEdits.put(chatId, new PendingEdit(id, EditField.CATEGORY, messageId));
                yield List.of(BotReply.edit(chatId, messageId, ExpenseCards.newCategoryPrompt(), ExpenseCards.cancelButton(id)));
            }
            case ActionToken.EDIT_CATEGORY -> showCategories(chatId, messageId, expense);
            case ActionToken.SET_CATEGORY -> token.extraId(0)
                    .map(categoryId -> assignCategory(chatId, messageId, expense, categoryId))
                    .orElseGet(List::of);
            default -> List.of();
        };
    }

    // ===================== field handlers =====================

    private List<BotReply> applyAmount(long chatId, PendingEdit edit, Expense expense, String input) {
        Optional<BigDecimal> amount = ExpenseParser.parseAmount(input);
        if (amount.isEmpty()) {
            return List.of(BotReply.send(chatId, "❌ Invalid amount. Please enter a positive number (e.g. 25.50)."));
        }
        expense.setAmount(amount.get());
        return persist(chatId, edit.promptMessageId(), expense, "Amount Updated",
                       "❌ Failed to update amount. Please try again.");
    }

    private List<BotReply> applyMerchant(long chatId, PendingEdit edit, Expense expense, String input) {
        String merchant = input.trim();
        if (merchant.isEmpty()) {
            return List.of(BotReply.send(chatId, "❌ Merchant cannot be empty."));
        }
        expense.setMerchant(merchant);
        expense.setDescription(merchant);
        return persist(chatId, edit.promptMessageId(), expense, "Merchant Updated",
                       "❌ Failed to update merchant. Please try again.");
    }

    private List<BotReply> applyNewCategory(long chatId, PendingEdit edit, Expense expense, String input) {
        String name;
        try {
            name = CategoryService.validateName(input);
        } catch (IllegalArgumentException ex) {
            return List.of(BotReply.send(chatId, "❌ " + ex.getMessage()));
        }

        Category category;
        try {
            category = categoryService.findOrCreate(name);
        } catch (DataAccessException e) {
            log.error("Failed to create category: expense={}", expense.getId(), e);
            return List.of(BotReply.send(chatId, "❌ Failed to create category. Please try again."));
        }
        expense.setCategory(category);
        return persist(chatId, edit.promptMessageId(), expense, "Category Updated",
                       "❌ Category created but failed to assign it. Please select it from the list.");
    }

    private List<BotReply> showCategories(long chatId, int messageId, Expense expense) {
        List<Category> categories;
        try {
            categories = categoryService.getAll();
        } catch (DataAccessException e) {
            log.error("Failed to fetch categories", e);
            return List.of(BotReply.send(chatId, "❌ Failed to fetch categories. Please try again."));
        }
        return List.of(BotReply.edit(chatId, messageId, ExpenseCards.categoryPicker(expense),
                                     ExpenseCards.categoryButtons(expense.getId(), categories)));
    }

    private List<BotReply> assignCategory(long chatId, int messageId, Expense expense, long categoryId) {
        Optional<Category> category;
        try {
            category = categoryService.findById(categoryId);
        } catch (DataAccessException e) {
            log.error("Failed to load category {}", categoryId, e);
            return List.of(BotReply.send(chatId, "❌ Failed to update category. Please try again."));
        }
        if (category.isEmpty()) {
            log.warn("Category {} not found for expense {}", categoryId, expense.getId());
            return List.of(BotReply.edit(chatId, messageId, "❌ Category not found."));
        }
        expense.setCategory(category.get());
        return persist(chatId, messageId, expense, "Category Updated",
                       "❌ Failed to update category. Please try again.");
    }

    // ===================== helpers =====================

    private List<BotReply> persist(long chatId, int messageId, Expense expense, String headline, String failure) {
        try {
            expenseService.update(expense);
        } catch (DataAccessException e) {
            log.error("Failed to update expense {}", expense.getId(), e);
            return List.of(BotReply.send(chatId, failure));
        }
        log.info("Expense {} updated: {}", expense.getId(), headline);
        return List.of(BotReply.edit(chatId, messageId, ExpenseCards.updated(expense, headline),
                                     ExpenseCards.expenseButtons(expense.getId())));
    }

    private enum Access { OWNED, MISSING, FOREIGN, ERROR }

    private record Lookup(Access access, Expense expense) {}

    private Lookup lookup(long expenseId, long userId) {
        Optional<Expense> found;
        try {
            found = expenseService.findById(expenseId);
        } catch (DataAccessException e) {
            log.error("Failed to load expense {}", expenseId, e);
            return new Lookup(Access.ERROR, null);
        }
        if (found.isEmpty()) {
            log.warn("Expense {} not found", expenseId);
            return new Lookup(Access.MISSING, null);
        }
        if (!Objects.equals(found.get().getUserId(), userId)) {
            log.warn("User mismatch on expense {}", expenseId);
            return new Lookup(Access.FOREIGN, null);
        }
        return new Lookup(Access.OWNED, found.get());
    }
}
