package com.adlanda.dailytoon.exception;

/**
 * Raised when the episode store is unreachable or an update left the stored
 * state inconsistent with what the caller expected.
 */
public class StoreException extends DailyToonException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
