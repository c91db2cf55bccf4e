package com.chatcast.core.session;

/**
 * Transport-side handle for one live connection.
 *
 * The core only keeps a reference; opening and closing the underlying
 * connection is the transport's business.
 */
public interface ChatConnection {

    /** Unique among live connections. Assigned by the transport. */
    int id();

    /**
     * Queues one text frame for delivery. Must not block on the network.
     *
     * @return false if the connection is no longer writable
     */
    boolean send(String text);
}
