package dev.univer.expensebot.repo;

import java.math.BigDecimal;

/** Sum of amounts in one currency. */
public interface CurrencyTotal {
    String getCurrency();
    BigDecimal getTotal();
}
