package dev.univer.expensebot.bot;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Callback data of an inline button: {@code <verb>_<field>_<expenseId>[_<extra>...]},
 * e.g. "edit_amount_42", "cancel_edit_42", "set_category_42_7".
 */
public record ActionToken(String verb, String field, long expenseId, List<String> extras) {

    public static final String EDIT_EXPENSE = "edit_expense";
    public static final String EDIT_AMOUNT = "edit_amount";
    public static final String EDIT_MERCHANT = "edit_merchant";
    public static final String EDIT_CATEGORY = "edit_category";
    public static final String CREATE_CATEGORY = "create_category";
    public static final String SET_CATEGORY = "set_category";
    public static final String CANCEL_EDIT = "cancel_edit";
    public static final String BACK_EXPENSE = "back_expense";
    public static final String DELETE_EXPENSE = "delete_expense";
    public static final String DELETE_CONFIRM = "delete_confirm";

    private static final String DELIMITER = "_";

    public ActionToken {
        extras = extras == null ? List.of() : List.copyOf(extras);
    }

    /** Empty for anything malformed: fewer than three parts or a non-numeric expense id. */
    public static Optional<ActionToken> parse(String data) {
        if (data == null) return Optional.empty();
        String[] parts = data.split(DELIMITER, -1);
        if (parts.length < 3 || parts[0].isEmpty()) return Optional.empty();
        try {
            long expenseId = Long.parseLong(parts[2]);
            List<String> extras = Arrays.asList(parts).subList(3, parts.length);
            return Optional.of(new ActionToken(parts[0], parts[1], expenseId, extras));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Encodes {@code action} ("verb_field") for an expense, e.g. {@code of(SET_CATEGORY, 42, 7)}. */
    public static String of(String action, long expenseId, Object... extras) {
        StringBuilder sb = new StringBuilder(action).append(DELIMITER).append(expenseId);
        for (Object extra : extras) sb.append(DELIMITER).append(extra);
        return sb.toString();
    }

    public String action() {
        return verb + DELIMITER + field;
    }

    /** Numeric extra at {@code index}, empty if missing or not a number. */
    public Optional<Long> extraId(int index) {
        if (index >= extras.size()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(extras.get(index)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
