package com.adlanda.dailytoon.exception;

/**
 * Base type for all failures raised by the comic pipeline.
 *
 * Messages on subclasses are meant for operators (logs); the HTTP layer
 * replaces them with generic end-user text.
 */
public abstract class DailyToonException extends RuntimeException {

    protected DailyToonException(String message) {
        super(message);
    }

    protected DailyToonException(String message, Throwable cause) {
        super(message, cause);
    }
}
