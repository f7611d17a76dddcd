package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Expense;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.Objects;
import java.util.Optional;

/** Expense named by its id in "/edit 42 ...", "/tag 42 ..." and the like. */
@Slf4j
final class CommandTargets {

    /** Either the user's expense or the reply explaining why there is none. */
    record Target(Expense expense, String error) {
        boolean found() {
            return expense != null;
        }
    }

    private CommandTargets() {
    }

    /**
     * @param verb  what the user tried, as in "You can only {verb} your own expenses."
     * @param usage shown after an id that is not a number
     */
    static Target resolve(ExpenseService expenses, String idText, long userId, String verb, String usage) {
        long id;
        try {
            id = Long.parseLong(idText);
        } catch (NumberFormatException e) {
            return new Target(null, "❌ Invalid expense ID. Use: " + usage);
        }

        Optional<Expense> found;
        try {
            found = expenses.findById(id);
        } catch (DataAccessException e) {
            log.error("Failed to load expense {}", id, e);
            return new Target(null, ExpenseCards.LOAD_FAILED);
        }
        if (found.isEmpty()) {
            return new Target(null, "❌ Expense #" + id + " not found.");
        }
        if (!Objects.equals(found.get().getUserId(), userId)) {
            log.warn("User mismatch on expense {} ({})", id, verb);
            return new Target(null, "❌ You can only " + verb + " your own expenses.");
        }
        return new Target(found.get(), null);
    }
}
