package com.chatcast.core.history;

/** The store could not be opened or prepared. Fatal at startup. */
public class StoreInitException extends StoreException {

    public StoreInitException(String message) {
        super(message);
    }

    public StoreInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
