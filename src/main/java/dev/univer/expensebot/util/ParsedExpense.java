package dev.univer.expensebot.util;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expense candidate read from a chat message.
 *
 * @param amount       always positive, at most four decimal places, as typed
 * @param currency     detected code, or "" when the user's default applies
 * @param description  text left after amount, currency, category and tags were removed
 * @param categoryName known category name found in the text, or ""
 * @param tags         lowercase, distinct, in order of first appearance
 */
public record ParsedExpense(BigDecimal amount,
                            String currency,
                            String description,
                            String categoryName,
                            List<String> tags) {

    public ParsedExpense {
        currency = currency == null ? "" : currency;
        description = description == null ? "" : description;
        categoryName = categoryName == null ? "" : categoryName;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean hasCurrency() {
        return !currency.isEmpty();
    }

    public boolean hasCategoryName() {
        return !categoryName.isEmpty();
    }
}
