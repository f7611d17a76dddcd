package dev.univer.expensebot.util;

import dev.univer.expensebot.model.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a free-text category hint onto one of the known categories.
 * <p>
 * Rules are tried in order and the first one that finds something wins:
 * <ol>
 *     <li>exact, case-insensitive name;</li>
 *     <li>the shortest name that contains the hint ("dining" -> "Food - Dining Out");</li>
 *     <li>the longest name contained in the hint ("Restaurant Food - Dining Out expenses");</li>
 *     <li>the first category sharing a significant word with the hint.</li>
 * </ol>
 * Ties go to the earlier category in the given list.
 */
public final class CategoryMatcher {

    private static final Set<String> STOP_WORDS = Set.of("and", "the", "for");
    private static final int MIN_WORD_LENGTH = 3;

    private CategoryMatcher() {
    }

    public static Optional<Category> match(String suggested, List<Category> categories) {
        if (suggested == null || categories == null || categories.isEmpty()) return Optional.empty();
        String hint = suggested.trim();
        if (hint.isEmpty()) return Optional.empty();
        String hintLower = hint.toLowerCase(Locale.ROOT);

        for (Category c : categories) {
            if (c.getName().equalsIgnoreCase(hint)) return Optional.of(c);
        }

        Category best = null;
        for (Category c : categories) {
            if (c.getName().toLowerCase(Locale.ROOT).contains(hintLower)
                    && (best == null || c.getName().length() < best.getName().length())) {
                best = c;
            }
        }
        if (best != null) return Optional.of(best);

        for (Category c : categories) {
            if (hintLower.contains(c.getName().toLowerCase(Locale.ROOT))
                    && (best == null || c.getName().length() > best.getName().length())) {
                best = c;
            }
        }
        if (best != null) return Optional.of(best);

        List<String> hintWords = significantWords(hint);
        if (hintWords.isEmpty()) return Optional.empty();
        for (Category c : categories) {
            for (String word : significantWords(c.getName())) {
                if (hintWords.contains(word)) return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    static List<String> significantWords(String s) {
        List<String> words = new ArrayList<>();
        for (String w : s.toLowerCase(Locale.ROOT).split("[-/&\\s]+")) {
            if (w.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(w)) words.add(w);
        }
        return words;
    }
}
