package com.adlanda.dailytoon.exception;

/**
 * Raised when a story could not be decomposed into a valid storyboard,
 * either because the text-generation call failed or because its payload
 * did not validate.
 */
public class DecompositionException extends DailyToonException {

    public DecompositionException(String message) {
        super(message);
    }

    public DecompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
