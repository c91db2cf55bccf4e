package com.chatcast.core.history;

import com.chatcast.protocol.Frames;

/**
 * One persisted chat line. Sequence ids increase in persistence order.
 */
public record HistoryRecord(long id, String username, String message) {

    public String toLine() {
        return Frames.chatLine(username, message);
    }
}
