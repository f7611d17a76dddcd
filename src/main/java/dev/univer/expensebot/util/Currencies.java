package dev.univer.expensebot.util;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class Currencies {

    public static final String DEFAULT_CURRENCY = "SGD";

    // code -> display symbol
    private static final Map<String, String> SUPPORTED = new LinkedHashMap<>();
    // symbol -> code
    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();
    // currencies that people spell out
    private static final Map<String, String> WORDS = Map.of("BAHT", "THB");

    static {
        SUPPORTED.put("SGD", "S$");
        SUPPORTED.put("USD", "$");
        SUPPORTED.put("EUR", "€");
        SUPPORTED.put("GBP", "£");
        SUPPORTED.put("JPY", "¥");
        SUPPORTED.put("CNY", "¥");
        SUPPORTED.put("MYR", "RM");
        SUPPORTED.put("THB", "฿");
        SUPPORTED.put("IDR", "Rp");
        SUPPORTED.put("PHP", "₱");
        SUPPORTED.put("VND", "₫");
        SUPPORTED.put("KRW", "₩");
        SUPPORTED.put("INR", "₹");
        SUPPORTED.put("AUD", "A$");
        SUPPORTED.put("NZD", "NZ$");
        SUPPORTED.put("HKD", "HK$");
        SUPPORTED.put("TWD", "NT$");

        SYMBOLS.put("$", "USD");
        SYMBOLS.put("€", "EUR");
        SYMBOLS.put("£", "GBP");
        SYMBOLS.put("¥", "JPY");
        SYMBOLS.put("฿", "THB");
        SYMBOLS.put("₱", "PHP");
        SYMBOLS.put("₫", "VND");
        SYMBOLS.put("₩", "KRW");
        SYMBOLS.put("₹", "INR");
        SYMBOLS.put("S$", "SGD");
        SYMBOLS.put("A$", "AUD");
        SYMBOLS.put("HK$", "HKD");
        SYMBOLS.put("NZ$", "NZD");
        SYMBOLS.put("NT$", "TWD");
        SYMBOLS.put("RM", "MYR");
        SYMBOLS.put("Rp", "IDR");
    }

    /** Symbols sorted so that "S$" is tried before "$". */
    static final List<String> SYMBOLS_LONGEST_FIRST = SYMBOLS.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    private Currencies() {
    }

    public static boolean isSupported(String code) {
        return code != null && SUPPORTED.containsKey(code.toUpperCase(Locale.ROOT));
    }

    public static List<String> supportedCodes() {
        return List.copyOf(SUPPORTED.keySet());
    }

    public static String codeForSymbol(String symbol) {
        return SYMBOLS.get(symbol);
    }

    /** Resolves a bare token such as "usd", "SGD." or "baht" to a supported code. */
    public static Optional<String> codeForToken(String token) {
        if (token == null || token.isEmpty()) return Optional.empty();
        String upper = stripPunctuation(token).toUpperCase(Locale.ROOT);
        if (SUPPORTED.containsKey(upper)) return Optional.of(upper);
        return Optional.ofNullable(WORDS.get(upper));
    }

    /** Leading symbol of {@code text}, longest match first, or empty. */
    public static Optional<String> leadingSymbol(String text) {
        for (String symbol : SYMBOLS_LONGEST_FIRST) {
            if (text.startsWith(symbol)) return Optional.of(symbol);
        }
        return Optional.empty();
    }

    public static String displaySymbol(String code) {
        String symbol = code == null ? null : SUPPORTED.get(code);
        return symbol == null ? "" : symbol;
    }

    private static String stripPunctuation(String token) {
        int end = token.length();
        while (end > 0 && ".,;:".indexOf(token.charAt(end - 1)) >= 0) end--;
        return token.substring(0, end);
    }
}
