package dev.univer.expensebot.edit;

/**
 * The edit a chat is waiting on.
 *
 * @param promptMessageId message showing the prompt; the confirmation replaces it
 */
public record PendingEdit(long expenseId, EditField field, int promptMessageId) {}
