package com.chatcast.core.history;

/** A message could not be persisted. Chat delivery is unaffected. */
public class StoreWriteException extends StoreException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
