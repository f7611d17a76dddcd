package dev.univer.expensebot.service;

import dev.univer.expensebot.bot.ActionToken;
import dev.univer.expensebot.bot.ReplyButton;
import dev.univer.expensebot.model.Category;
import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.util.Currencies;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Texts and buttons of the messages that show an expense. */
public final class ExpenseCards {

    public static final String UNCATEGORIZED = "Uncategorized";
    public static final String NOT_FOUND = "❌ Expense not found.";
    public static final String LOAD_FAILED = "❌ Failed to load expense. Please try again.";
    public static final String ADD_USAGE = "❌ Invalid format. Use: /add 5.50 Coffee [Category] #tag";
    public static final String FREE_TEXT_HINT =
            "I didn't understand that. Use /help to see available commands, or send an expense like 5.50 Coffee";

    private ExpenseCards() {
    }

    public static String fmtMoney(BigDecimal amount, String currency) {
        return Currencies.displaySymbol(currency) + amount.setScale(2, RoundingMode.HALF_UP).toPlainString()
               + " " + currency;
    }

    public static String categoryName(Expense e) {
        return e.getCategory() == null ? UNCATEGORIZED : e.getCategory().getName();
    }

    public static String expenseAdded(Expense e) {
        StringBuilder sb = new StringBuilder("✅ Expense Added\n\n");
        sb.append("💰 ").append(fmtMoney(e.getAmount(), e.getCurrency()));
        if (e.getDescription() != null && !e.getDescription().isBlank()) {
            sb.append("\n📝 ").append(e.getDescription());
        }
        sb.append("\n📁 ").append(categoryName(e));
        sb.append("\n🆔 #").append(e.getId());
        appendTags(sb, e);
        return sb.toString();
    }

    /** Card shown in place of the prompt once a field was changed. */
    public static String updated(Expense e, String headline) {
        StringBuilder sb = new StringBuilder("✅ ").append(headline).append("\n\n");
        sb.append("💰 Amount: ").append(fmtMoney(e.getAmount(), e.getCurrency()));
        sb.append("\n🏪 Merchant: ").append(merchant(e));
        sb.append("\n📁 Category: ").append(categoryName(e));
        sb.append("\n🆔 #").append(e.getId());
        appendTags(sb, e);
        return sb.toString();
    }

    public static List<List<ReplyButton>> expenseButtons(long expenseId) {
        return List.of(List.of(
                new ReplyButton("✏️ Edit", ActionToken.of(ActionToken.EDIT_EXPENSE, expenseId)),
                new ReplyButton("🗑️ Delete", ActionToken.of(ActionToken.DELETE_EXPENSE, expenseId))));
    }

    public static String editMenu(Expense e) {
        return "✏️ Edit Expense #" + e.getId() + "\n\n"
               + "💰 Amount: " + fmtMoney(e.getAmount(), e.getCurrency()) + "\n"
               + "🏪 Merchant: " + merchant(e) + "\n"
               + "📁 Category: " + categoryName(e) + "\n\n"
               + "What would you like to edit?";
    }

    public static List<List<ReplyButton>> editMenuButtons(long expenseId) {
        return List.of(
                List.of(new ReplyButton("💰 Amount", ActionToken.of(ActionToken.EDIT_AMOUNT, expenseId)),
                        new ReplyButton("🏪 Merchant", ActionToken.of(ActionToken.EDIT_MERCHANT, expenseId))),
                List.of(new ReplyButton("📁 Category", ActionToken.of(ActionToken.EDIT_CATEGORY, expenseId))),
                List.of(new ReplyButton("⬅️ Back", ActionToken.of(ActionToken.BACK_EXPENSE, expenseId))));
    }

    public static String amountPrompt(Expense e) {
        return "💰 Edit Amount\n\nCurrent amount: " + fmtMoney(e.getAmount(), e.getCurrency())
               + "\n\nPlease type the new amount (e.g. 25.50):";
    }

    public static String merchantPrompt(Expense e) {
        return "🏪 Edit Merchant\n\nCurrent merchant: " + merchant(e)
               + "\n\nPlease type the new merchant name:";
    }

    public static String newCategoryPrompt() {
        return "📁 Create New Category\n\nPlease type the name for the new category (e.g. Subscriptions):";
    }

    public static List<List<ReplyButton>> cancelButton(long expenseId) {
        return List.of(List.of(new ReplyButton("⬅️ Cancel", ActionToken.of(ActionToken.CANCEL_EDIT, expenseId))));
    }

    public static String categoryPicker(Expense e) {
        return "📁 Select Category\n\nCurrent: " + categoryName(e) + "\n\nChoose a new category:";
    }

    /** Two categories per row, then "Create New" and "Back". */
    public static List<List<ReplyButton>> categoryButtons(long expenseId, List<Category> categories) {
        List<List<ReplyButton>> rows = new ArrayList<>();
        List<ReplyButton> row = new ArrayList<>();
        for (Category c : categories) {
            row.add(new ReplyButton(c.getName(), ActionToken.of(ActionToken.SET_CATEGORY, expenseId, c.getId())));
            if (row.size() == 2) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) rows.add(row);
        rows.add(List.of(
                new ReplyButton("➕ Create New", ActionToken.of(ActionToken.CREATE_CATEGORY, expenseId)),
                new ReplyButton("⬅️ Back", ActionToken.of(ActionToken.EDIT_EXPENSE, expenseId))));
        return rows;
    }

    public static String deletePrompt(Expense e) {
        return "🗑️ Delete Expense?\n\n"
               + "💰 " + fmtMoney(e.getAmount(), e.getCurrency()) + "\n"
               + "📝 " + merchant(e) + "\n"
               + "🆔 #" + e.getId() + "\n\n"
               + "This action cannot be undone.";
    }

    public static List<List<ReplyButton>> deleteButtons(long expenseId) {
        return List.of(
                List.of(new ReplyButton("✅ Yes, Delete", ActionToken.of(ActionToken.DELETE_CONFIRM, expenseId))),
                List.of(new ReplyButton("❌ No, Keep It", ActionToken.of(ActionToken.BACK_EXPENSE, expenseId))));
    }

    /** Reply to a successful "/edit". */
    public static String commandUpdated(Expense e) {
        return "✅ Expense Updated\n\n"
               + "🆔 #" + e.getId() + "\n"
               + "💰 " + fmtMoney(e.getAmount(), e.getCurrency()) + "\n"
               + "📝 " + merchant(e) + "\n"
               + "📁 " + categoryName(e);
    }

    public static String listLine(Expense e) {
        String d = (e.getDescription() == null || e.getDescription().isBlank()) ? "(no description)" : e.getDescription();
        StringBuilder sb = new StringBuilder("#").append(e.getId()).append(' ')
                .append(fmtMoney(e.getAmount(), e.getCurrency()))
                .append(" — ").append(d).append(" [").append(categoryName(e)).append(']');
        if (e.getTags() != null) {
            e.getTags().forEach(t -> sb.append(" #").append(t));
        }
        return sb.toString();
    }

    /** Header, blank line, one line per expense; "No expenses found." when there are none. */
    public static String list(String header, List<Expense> expenses) {
        if (expenses.isEmpty()) return header + "\n\nNo expenses found.";
        return header + "\n\n" + expenses.stream().map(ExpenseCards::listLine).collect(Collectors.joining("\n"));
    }

    /** Amounts are never added across currencies. */
    public static Map<String, BigDecimal> totalsOf(List<Expense> expenses) {
        return expenses.stream().collect(Collectors.groupingBy(
                Expense::getCurrency, TreeMap::new,
                Collectors.reducing(BigDecimal.ZERO, Expense::getAmount, BigDecimal::add)));
    }

    /** "S$12.50 SGD, $3.00 USD"; "0.00" when empty. */
    public static String totals(Map<String, BigDecimal> byCurrency) {
        if (byCurrency.isEmpty()) return "0.00";
        return byCurrency.entrySet().stream()
                .map(e -> fmtMoney(e.getValue(), e.getKey()))
                .collect(Collectors.joining(", "));
    }

    private static String merchant(Expense e) {
        if (e.getMerchant() != null && !e.getMerchant().isBlank()) return e.getMerchant();
        if (e.getDescription() != null && !e.getDescription().isBlank()) return e.getDescription();
        return "-";
    }

    private static void appendTags(StringBuilder sb, Expense e) {
        if (e.getTags() != null && !e.getTags().isEmpty()) {
            sb.append("\n🏷️ ").append(String.join(", ", e.getTags()));
        }
    }
}
