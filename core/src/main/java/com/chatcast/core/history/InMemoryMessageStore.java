package com.chatcast.core.history;

import java.util.ArrayList;
import java.util.List;

/**
 * Heap-backed {@link MessageStore}. Nothing survives the process, which is also
 * what the SQLite store gives after its truncate-on-start.
 */
public final class InMemoryMessageStore implements MessageStore {

    private final List<HistoryRecord> records = new ArrayList<>();
    private long nextId = 1;
    private boolean open;

    @Override
    public synchronized void initialize() {
        records.clear();
        nextId = 1;
        open = true;
    }

    @Override
    public synchronized long append(String username, String message) throws StoreWriteException {
        if (!open) throw new StoreWriteException("store is not open");
        long id = nextId++;
        records.add(new HistoryRecord(id, username, message));
        return id;
    }

    @Override
    public synchronized List<HistoryRecord> queryRecent(int limit) throws StoreReadException {
        if (!open) throw new StoreReadException("store is not open");
        int n = Math.min(Math.max(limit, 0), records.size());
        List<HistoryRecord> out = new ArrayList<>(n);
        for (int i = records.size() - 1; i >= records.size() - n; i--) {
            out.add(records.get(i));
        }
        return out;
    }

    @Override
    public synchronized void close() {
        open = false;
    }
}
