package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Expense;
import dev.univer.expensebot.util.ExpenseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** {@code /tag}, {@code /untag} and {@code /tags}. Tags are stored lowercase without the "#". */
@Service
@RequiredArgsConstructor
@Slf4j
public class TagCommandService {
    static final int MAX_TAGS_PER_COMMAND = 10;
    static final int TAGGED_LIST_LIMIT = 20;

    private static final String TAG_USAGE = "/tag <id> #tag1 [#tag2] ...";
    private static final String UNTAG_USAGE = "/untag <id> #tag";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ExpenseService expenseService;

    /** "/tag 42 #work #client" */
    public String tag(long userId, String args) {
        String[] parts = split(args);
        if (parts.length < 2) return "❌ Usage: " + TAG_USAGE;
        if (parts.length - 1 > MAX_TAGS_PER_COMMAND) {
            return "❌ Too many tags. Maximum " + MAX_TAGS_PER_COMMAND + " tags per command.";
        }

        CommandTargets.Target target = CommandTargets.resolve(expenseService, parts[0], userId, "tag", TAG_USAGE);
        if (!target.found()) return target.error();

        Set<String> added = new LinkedHashSet<>();
        for (int i = 1; i < parts.length; i++) {
            String name = normalize(parts[i]);
            if (name.isEmpty()) continue;
            if (!ExpenseParser.isValidTagName(name)) return invalidName(name);
            added.add(name);
        }
        if (added.isEmpty()) return "❌ No valid tags provided.";

        Expense expense = target.expense();
        List<String> tags = current(expense);
        added.stream().filter(t -> !tags.contains(t)).forEach(tags::add);
        expense.setTags(tags);
        try {
            expenseService.update(expense);
        } catch (DataAccessException e) {
            log.error("Failed to add tags to expense {}", expense.getId(), e);
            return "❌ Failed to add tags. Please try again.";
        }
        log.info("Expense {} tagged: {}", expense.getId(), added);
        return "✅ Added " + hashed(added, ", ") + " to expense #" + expense.getId() + ".\n🏷️ Tags: " + hashed(tags, " ");
    }

    /** "/untag 42 #work" */
    public String untag(long userId, String args) {
        String[] parts = split(args);
        if (parts.length < 2) return "❌ Usage: " + UNTAG_USAGE;

        CommandTargets.Target target = CommandTargets.resolve(expenseService, parts[0], userId, "untag", UNTAG_USAGE);
        if (!target.found()) return target.error();

        String name = normalize(parts[1]);
        if (!ExpenseParser.isValidTagName(name)) return invalidName(name);

        Expense expense = target.expense();
        List<String> tags = current(expense);
        if (!tags.remove(name)) return "❌ Tag '" + name + "' not found.";
        expense.setTags(tags);
        try {
            expenseService.update(expense);
        } catch (DataAccessException e) {
            log.error("Failed to remove tag from expense {}", expense.getId(), e);
            return "❌ Failed to remove tag. Please try again.";
        }
        log.info("Expense {} untagged: {}", expense.getId(), name);
        return "✅ Removed #" + name + " from expense #" + expense.getId() + ".";
    }

    /** Without an argument the user's tags; with one, the user's latest expenses carrying it. */
    public String tags(long userId, String args) {
        if (args == null || args.isBlank()) return allTags(userId);

        String name = normalize(args.trim());
        if (!ExpenseParser.isValidTagName(name)) return invalidName(name);
        List<Expense> tagged;
        try {
            tagged = expenseService.tagged(userId, name, TAGGED_LIST_LIMIT);
        } catch (DataAccessException e) {
            log.error("Failed to fetch expenses tagged {}", name, e);
            return "❌ Failed to fetch expenses. Please try again.";
        }
        if (tagged.isEmpty()) return "❌ Tag '" + name + "' not found.\n\nUse /tags to see all tags.";
        return ExpenseCards.list("🏷️ Expenses tagged #" + name, tagged);
    }

    private String allTags(long userId) {
        List<String> tags;
        try {
            tags = expenseService.tagsOf(userId);
        } catch (DataAccessException e) {
            log.error("Failed to fetch tags", e);
            return "❌ Failed to fetch tags. Please try again.";
        }
        if (tags.isEmpty()) {
            return "🏷️ No tags found.\n\nAdd tags inline: 5.50 Coffee #work\nOr use: /tag <id> <tag>";
        }
        StringBuilder sb = new StringBuilder("🏷️ Tags\n");
        for (int i = 0; i < tags.size(); i++) {
            sb.append('\n').append(i + 1).append(". #").append(tags.get(i));
        }
        return sb.toString();
    }

    // ===================== internals =====================

    private static String[] split(String args) {
        if (args == null || args.isBlank()) return new String[0];
        return WHITESPACE.split(args.trim());
    }

    private static String normalize(String raw) {
        String name = raw.startsWith("#") ? raw.substring(1) : raw;
        return name.toLowerCase(Locale.ROOT);
    }

    private static List<String> current(Expense expense) {
        return expense.getTags() == null ? new ArrayList<>() : new ArrayList<>(expense.getTags());
    }

    private static String hashed(Iterable<String> tags, String separator) {
        List<String> out = new ArrayList<>();
        tags.forEach(t -> out.add("#" + t));
        return String.join(separator, out);
    }

    private static String invalidName(String name) {
        return "❌ Invalid tag name '" + name + "'. Tags must start with a letter, contain only "
               + "letters/numbers/underscores, and be at most " + ExpenseParser.MAX_TAG_LENGTH + " characters";
    }
}
