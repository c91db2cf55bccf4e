package com.chatcast.core.history;

import java.util.List;

/**
 * Persistent message log consumed by {@link HistoryStore}.
 *
 * Implementations do their own connection handling but no locking beyond what
 * they need for memory safety: {@link HistoryStore} serializes writers against readers.
 */
public interface MessageStore extends AutoCloseable {

    /**
     * Opens the store and empties it. History only lives for one process run.
     */
    void initialize() throws StoreInitException;

    /** @return the sequence id of the new record */
    long append(String username, String message) throws StoreWriteException;

    /**
     * Up to {@code limit} most recent records, newest first.
     */
    List<HistoryRecord> queryRecent(int limit) throws StoreReadException;

    @Override
    void close();
}
