package dev.univer.expensebot.edit;

import java.util.Optional;

/** Holds at most one {@link PendingEdit} per chat. */
public interface PendingEditStore {

    Optional<PendingEdit> get(long chatId);

    /** Replaces whatever the chat was waiting on. */
    void put(long chatId, PendingEdit edit);

    /** Removes and returns the chat's pending edit. */
    Optional<PendingEdit> remove(long chatId);
}
