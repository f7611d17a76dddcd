package dev.univer.expensebot.edit;

/** Field of an expense that can be revised through a typed reply. */
public enum EditField {
    AMOUNT,
    MERCHANT,
    /** A new category name; picking an existing one needs no typed reply. */
    CATEGORY
}
