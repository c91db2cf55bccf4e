package com.chatcast.core.history;

/** History could not be read. Snapshots degrade to empty. */
public class StoreReadException extends StoreException {

    public StoreReadException(String message) {
        super(message);
    }

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
