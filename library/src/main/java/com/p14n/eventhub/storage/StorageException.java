package com.p14n.eventhub.storage;

/**
 * A storage operation failed. The hub treats these as transient and retries.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
