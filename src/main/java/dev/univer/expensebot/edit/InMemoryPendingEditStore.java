package dev.univer.expensebot.edit;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Component
public class InMemoryPendingEditStore implements PendingEditStore {

    private final Map<Long, PendingEdit> pendingByChat = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<PendingEdit> get(long chatId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(pendingByChat.get(chatId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(long chatId, PendingEdit edit) {
        lock.writeLock().lock();
        try {
            pendingByChat.put(chatId, edit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<PendingEdit> remove(long chatId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(pendingByChat.remove(chatId));
        } finally {
            lock.writeLock().unlock();
        }
    }
}
