package com.collabrouter.server.store;

/**
 * A message or document store could not complete an operation.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
