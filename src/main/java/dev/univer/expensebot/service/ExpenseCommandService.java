package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Category;
import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.util.ExpenseParser;
import dev.univer.expensebot.util.ParsedExpense;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Commands that look up or change expenses by id or by period: {@code /today}, {@code /week},
 * {@code /category}, {@code /edit} and {@code /delete}.
 * <p>
 * Every method returns the text of a single reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseCommandService {
    static final int CATEGORY_LIST_LIMIT = 20;
    static final String EDIT_USAGE = "/edit <id> <amount> <description> [category]";
    static final String DELETE_USAGE = "/delete <id>";

    private static final String FETCH_FAILED = "❌ Failed to fetch expenses. Please try again.";
    private static final String CATEGORIES_FAILED = "❌ Failed to fetch categories. Please try again.";

    private final ExpenseService expenseService;
    private final CategoryService categoryService;
    private final Clock clock;

    public String today(long userId) {
        ZonedDateTime start = LocalDate.now(clock).atStartOfDay(clock.getZone());
        return period(userId, start, start.plusDays(1), "📅 Today's Expenses");
    }

    /** Weeks start on Monday. */
    public String week(long userId) {
        LocalDate monday = LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        ZonedDateTime start = monday.atStartOfDay(clock.getZone());
        return period(userId, start, start.plusWeeks(1), "📆 This Week's Expenses");
    }

    /** Latest expenses of the user in the category named exactly (ignoring case), with the category total. */
    public String byCategory(long userId, String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return "❌ Please provide a category name.\n\nUsage: /category Food - Dining Out";
        }
        String name = rawName.trim();
        Optional<Category> found;
        try {
            found = categoryService.findByName(name);
        } catch (DataAccessException e) {
            log.error("Failed to fetch categories", e);
            return CATEGORIES_FAILED;
        }
        if (found.isEmpty()) {
            return "❌ Category '" + name + "' not found.\n\nUse /categories to see all available categories.";
        }

        Category category = found.get();
        List<Expense> expenses;
        Map<String, BigDecimal> totals;
        try {
            expenses = expenseService.inCategory(userId, category.getId(), CATEGORY_LIST_LIMIT);
            totals = expenseService.categoryTotals(userId, category.getId());
        } catch (DataAccessException e) {
            log.error("Failed to fetch expenses of category {}", category.getId(), e);
            return FETCH_FAILED;
        }
        log.info("Category filter applied: category={}, count={}", category.getId(), expenses.size());
        return ExpenseCards.list("📁 " + category.getName() + " Expenses (Total: " + ExpenseCards.totals(totals) + ")",
                                 expenses);
    }

    /**
     * "/edit 42 12.50 Lunch Food": the amount is always replaced; currency, description and category only
     * when the new text names them. Tags in the text are added.
     */
    public String edit(long userId, String args) {
        if (args == null || args.isBlank()) return "❌ Usage: " + EDIT_USAGE;
        String[] parts = args.trim().split("\\s+", 2);

        CommandTargets.Target target = CommandTargets.resolve(expenseService, parts[0], userId, "edit", EDIT_USAGE);
        if (!target.found()) return target.error();
        if (parts.length < 2) return "❌ Please provide new values: " + EDIT_USAGE;

        List<Category> categories;
        try {
            categories = categoryService.getAll();
        } catch (DataAccessException e) {
            log.error("Failed to fetch categories for edit", e);
            return CATEGORIES_FAILED;
        }
        Optional<ParsedExpense> parsed = ExpenseParser.parseExpenseInput(parts[1], CategoryService.names(categories));
        if (parsed.isEmpty()) return "❌ Invalid format. Use: " + EDIT_USAGE;

        Expense expense = target.expense();
        apply(expense, parsed.get(), categories);
        try {
            expenseService.update(expense);
        } catch (DataAccessException e) {
            log.error("Failed to update expense {}", expense.getId(), e);
            return "❌ Failed to update expense. Please try again.";
        }
        log.info("Expense {} edited by command", expense.getId());
        return ExpenseCards.commandUpdated(expense);
    }

    public String delete(long userId, String args) {
        if (args == null || args.isBlank()) return "❌ Usage: " + DELETE_USAGE;

        CommandTargets.Target target = CommandTargets.resolve(expenseService, args.trim(), userId, "delete", DELETE_USAGE);
        if (!target.found()) return target.error();

        Expense expense = target.expense();
        try {
            expenseService.delete(expense);
        } catch (DataAccessException e) {
            log.error("Failed to delete expense {}", expense.getId(), e);
            return "❌ Failed to delete expense. Please try again.";
        }
        log.info("Expense {} deleted by command", expense.getId());
        return "✅ Expense #" + expense.getId() + " deleted.";
    }

    // ===================== internals =====================

    private String period(long userId, ZonedDateTime from, ZonedDateTime to, String title) {
        List<Expense> expenses;
        try {
            expenses = expenseService.between(userId, from.toInstant(), to.toInstant());
        } catch (DataAccessException e) {
            log.error("Failed to fetch expenses from {} to {}", from, to, e);
            return FETCH_FAILED;
        }
        String total = ExpenseCards.totals(ExpenseCards.totalsOf(expenses));
        return ExpenseCards.list(title + " (Total: " + total + ")", expenses);
    }

    private static void apply(Expense expense, ParsedExpense parsed, List<Category> categories) {
        expense.setAmount(parsed.amount());
        if (parsed.hasCurrency()) {
            expense.setCurrency(parsed.currency());
        }
        if (!parsed.description().isEmpty()) {
            expense.setDescription(parsed.description());
            expense.setMerchant(parsed.description());
        }
        if (parsed.hasCategoryName()) {
            categories.stream()
                    .filter(c -> c.getName().equalsIgnoreCase(parsed.categoryName()))
                    .findFirst()
                    .ifPresent(expense::setCategory);
        }
        if (!parsed.tags().isEmpty()) {
            List<String> tags = expense.getTags() == null ? new ArrayList<>() : new ArrayList<>(expense.getTags());
            parsed.tags().stream().filter(t -> !tags.contains(t)).forEach(tags::add);
            expense.setTags(tags);
        }
    }
}
