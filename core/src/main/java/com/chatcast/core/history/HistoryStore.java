package com.chatcast.core.history;

import com.chatcast.protocol.Frames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only chat log with lock-consistent snapshot reads.
 *
 * Appends take the write lock, snapshots the read lock: snapshots may run
 * concurrently with each other but never observe a half-written record.
 * Store failures never escape: appends report false, snapshots come back empty.
 */
public final class HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private final MessageStore store;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public HistoryStore(MessageStore store) {
        this.store = store;
    }

    /**
     * Persists one message.
     *
     * @return false if the store rejected it; the caller still delivers the message
     */
    public boolean append(String username, String message) {
        lock.writeLock().lock();
        try {
            store.append(username, message);
            return true;
        } catch (StoreWriteException e) {
            log.warn("Failed to persist message from {}: {}", username, e.getMessage());
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Up to {@code limit} most recent records, oldest first. */
    public List<HistoryRecord> snapshotRecords(int limit) {
        if (limit <= 0) return List.of();
        List<HistoryRecord> newestFirst;
        lock.readLock().lock();
        try {
            newestFirst = store.queryRecent(limit);
        } catch (StoreReadException e) {
            log.warn("Failed to read history: {}", e.getMessage());
            return List.of();
        } finally {
            lock.readLock().unlock();
        }
        List<HistoryRecord> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    /**
     * History block of up to {@code limit} lines, oldest first.
     * Empty string when there is no history or the store is unavailable.
     */
    public String snapshot(int limit) {
        List<HistoryRecord> records = snapshotRecords(limit);
        List<String> lines = new ArrayList<>(records.size());
        for (HistoryRecord r : records) lines.add(r.toLine());
        return Frames.historyBlock(lines);
    }
}
