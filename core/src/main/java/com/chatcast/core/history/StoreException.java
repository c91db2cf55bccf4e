package com.chatcast.core.history;

/** Base type for failures reported by a {@link MessageStore}. */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
