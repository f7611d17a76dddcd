package dev.univer.expensebot.bot;

/** Inline button: caption plus the action token sent back when it is pressed. */
public record ReplyButton(String text, String action) {}
