package dev.univer.expensebot.util;

import dev.univer.expensebot.model.Expense;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ExpenseParser {
    // "5", "5.50", "5,50", optionally followed by a symbol: "10€"
    private static final Pattern AMOUNT_TOKEN = Pattern.compile("^(?<amount>\\d+(?:[.,]\\d+)?)(?<symbol>\\D*)$");
    private static final Pattern MONEY = Pattern.compile("^\\d+(?:[.,]\\d+)?$");
    private static final Pattern CODE_PREFIX = Pattern.compile("^(?<code>[A-Z]{3})(?<rest>\\d.*)?$");
    private static final Pattern TAG_TOKEN = Pattern.compile("^#(?<name>[a-zA-Z][a-zA-Z0-9_]{0,29})$");
    private static final Pattern TAG_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{0,29}$");
    private static final Pattern BRACKET_CATEGORY = Pattern.compile("\\s*\\[(?<name>[^\\]]+)\\]\\s*$");
    private static final Pattern COMMAND = Pattern.compile("^/\\w+(?:@\\w+)?(?=\\s|$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final int MAX_TAG_LENGTH = 30;

    /** Tags pulled out of a text together with the text that is left. */
    public record TagExtraction(List<String> tags, String cleaned) {}

    private ExpenseParser() {
    }

    public static Optional<ParsedExpense> parseExpenseInput(String text) {
        return parseExpenseInput(text, List.of());
    }

    /**
     * Parses free text such as "5.50 Coffee", "$10 Lunch #work" or "SGD 25.50 Groceries".
     * Empty when no positive amount is found, or when the amount has more than four decimal places.
     */
    public static Optional<ParsedExpense> parseExpenseInput(String text, List<String> knownCategoryNames) {
        if (text == null || text.isBlank()) return Optional.empty();
        List<String> tokens = new ArrayList<>(Arrays.asList(WHITESPACE.split(text.trim())));

        String currency = leadingCurrency(tokens);

        int amountIdx = -1;
        BigDecimal amount = null;
        String gluedCode = null;
        for (int i = 0; i < tokens.size(); i++) {
            Matcher m = AMOUNT_TOKEN.matcher(tokens.get(i));
            if (!m.matches()) continue;
            String glued = m.group("symbol");
            if (!glued.isEmpty() && Currencies.codeForSymbol(glued) == null) {
                // "10USD", "25sgd,", "300baht"
                gluedCode = Currencies.codeForToken(glued).orElse(null);
                if (gluedCode == null) continue;
            }
            amount = new BigDecimal(m.group("amount").replace(',', '.'));
            amountIdx = i;
            // a trailing "$" is ambiguous, so the user's default currency still applies
            if (gluedCode == null && currency.isEmpty() && !glued.isEmpty() && !glued.equals("$")) {
                currency = Currencies.codeForSymbol(glued);
            }
            break;
        }
        if (amount == null || !isStorable(amount)) return Optional.empty();
        tokens.remove(amountIdx);

        if (gluedCode != null) {
            currency = gluedCurrency(tokens, amountIdx, currency, gluedCode);
        }
        currency = currencyAfterAmount(tokens, amountIdx, currency);

        TagExtraction extracted = extractTags(String.join(" ", tokens));
        String rest = extracted.cleaned();

        String categoryName = "";
        if (knownCategoryNames != null && !knownCategoryNames.isEmpty() && !rest.isBlank()) {
            CategoryHint hint = extractCategory(rest, knownCategoryNames);
            categoryName = hint.name();
            rest = hint.remaining();
        }

        return Optional.of(new ParsedExpense(amount, currency, collapse(rest), categoryName, extracted.tags()));
    }

    public static Optional<ParsedExpense> parseCommandExpense(String text) {
        return parseCommandExpense(text, List.of());
    }

    /** Same as {@link #parseExpenseInput(String, List)} after dropping a leading "/add" or "/add@Bot". */
    public static Optional<ParsedExpense> parseCommandExpense(String text, List<String> knownCategoryNames) {
        if (text == null) return Optional.empty();
        String args = COMMAND.matcher(text.trim()).replaceFirst("");
        return parseExpenseInput(args, knownCategoryNames);
    }

    /** Removes "#tag" tokens; returns the text unchanged when there are none. */
    public static TagExtraction extractTags(String text) {
        if (text == null) return new TagExtraction(List.of(), "");
        if (!text.contains("#")) return new TagExtraction(List.of(), text);

        Set<String> tags = new LinkedHashSet<>();
        List<String> remaining = new ArrayList<>();
        for (String word : WHITESPACE.split(text.trim())) {
            Matcher m = TAG_TOKEN.matcher(word);
            if (m.matches()) {
                tags.add(m.group("name").toLowerCase(Locale.ROOT));
            } else {
                remaining.add(word);
            }
        }
        if (tags.isEmpty()) return new TagExtraction(List.of(), text);
        return new TagExtraction(List.copyOf(tags), String.join(" ", remaining));
    }

    public static boolean isValidTagName(String name) {
        return name != null && name.length() <= MAX_TAG_LENGTH && TAG_NAME.matcher(name).matches();
    }

    /**
     * Reads a user-typed amount: an optional leading currency symbol, then a positive number.
     * Anything after the first number is ignored, so "5.50 Coffee" reads as 5.50.
     * More than four decimal places is rejected rather than rounded.
     */
    public static Optional<BigDecimal> parseAmount(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim();
        Optional<String> symbol = Currencies.leadingSymbol(s);
        if (symbol.isPresent()) s = s.substring(symbol.get().length()).trim();
        if (s.isEmpty()) return Optional.empty();

        String first = WHITESPACE.split(s)[0];
        if (!MONEY.matcher(first).matches()) return Optional.empty();
        BigDecimal amount = new BigDecimal(first.replace(',', '.'));
        return isStorable(amount) ? Optional.of(amount) : Optional.empty();
    }

    // ===================== internals =====================

    private static String leadingCurrency(List<String> tokens) {
        String first = tokens.get(0);
        Optional<String> symbol = Currencies.leadingSymbol(first);
        if (symbol.isPresent()) {
            String rest = first.substring(symbol.get().length());
            if (rest.isEmpty() || Character.isDigit(rest.charAt(0))) {
                replaceOrDrop(tokens, 0, rest);
                return Currencies.codeForSymbol(symbol.get());
            }
        }
        Matcher m = CODE_PREFIX.matcher(first);
        if (!m.matches() || !Currencies.isSupported(m.group("code"))) return "";
        String rest = m.group("rest");
        // a lone "USD" is not a currency prefix
        if (rest == null && tokens.size() == 1) return "";
        replaceOrDrop(tokens, 0, rest == null ? "" : rest);
        return m.group("code");
    }

    /** The first currency named wins; a different glued code stays in the text as a word. */
    private static String gluedCurrency(List<String> tokens, int amountIdx, String currency, String code) {
        if (!currency.isEmpty() && !currency.equals(code)) {
            tokens.add(amountIdx, code);
            return currency;
        }
        if (amountIdx < tokens.size() && tokens.get(amountIdx).equals("-")) tokens.remove(amountIdx);
        return code;
    }

    private static String currencyAfterAmount(List<String> tokens, int amountIdx, String currency) {
        if (amountIdx < tokens.size()) {
            Optional<String> code = Currencies.codeForToken(tokens.get(amountIdx));
            if (code.isPresent() && (currency.isEmpty() || currency.equals(code.get()))) {
                tokens.remove(amountIdx);
                if (amountIdx < tokens.size() && tokens.get(amountIdx).equals("-")) tokens.remove(amountIdx);
                return code.get();
            }
            if (code.isPresent()) return currency;
        }
        if (currency.isEmpty() && !tokens.isEmpty()) {
            int last = tokens.size() - 1;
            Optional<String> code = Currencies.codeForToken(tokens.get(last))
                    .filter(Currencies::isSupported);
            if (code.isPresent()) {
                tokens.remove(last);
                return code.get();
            }
        }
        return currency;
    }

    private record CategoryHint(String name, String remaining) {}

    private static CategoryHint extractCategory(String text, List<String> knownNames) {
        Matcher bracket = BRACKET_CATEGORY.matcher(text);
        if (bracket.find()) {
            String inside = bracket.group("name").trim();
            for (String name : knownNames) {
                if (name != null && name.equalsIgnoreCase(inside)) {
                    return new CategoryHint(name, text.substring(0, bracket.start()));
                }
            }
        }

        String best = null;
        int bestIdx = -1;
        for (String name : knownNames) {
            if (name == null || name.isBlank()) continue;
            int idx = indexOfWord(text, name);
            if (idx < 0) continue;
            if (best == null || idx < bestIdx || (idx == bestIdx && name.length() > best.length())) {
                best = name;
                bestIdx = idx;
            }
        }
        if (best == null) return new CategoryHint("", text);
        String remaining = text.substring(0, bestIdx) + " " + text.substring(bestIdx + best.length());
        return new CategoryHint(best, remaining);
    }

    /** Leftmost case-insensitive occurrence of {@code word} not glued to letters or digits. */
    private static int indexOfWord(String text, String word) {
        int len = word.length();
        for (int i = 0; i + len <= text.length(); i++) {
            if (!text.regionMatches(true, i, word, 0, len)) continue;
            boolean startOk = i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1));
            boolean endOk = i + len == text.length() || !Character.isLetterOrDigit(text.charAt(i + len));
            if (startOk && endOk) return i;
        }
        return -1;
    }

    // positive, and no more fractional digits than the amount column keeps
    private static boolean isStorable(BigDecimal amount) {
        return amount.signum() > 0 && amount.stripTrailingZeros().scale() <= Expense.AMOUNT_SCALE;
    }

    private static void replaceOrDrop(List<String> tokens, int idx, String value) {
        if (value.isEmpty()) tokens.remove(idx);
        else tokens.set(idx, value);
    }

    private static String collapse(String s) {
        return s == null ? "" : WHITESPACE.matcher(s.trim()).replaceAll(" ");
    }
}
