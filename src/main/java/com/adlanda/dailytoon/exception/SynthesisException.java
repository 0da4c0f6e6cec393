package com.adlanda.dailytoon.exception;

/**
 * Raised when a panel image could not be produced.
 *
 * {@code permanent} distinguishes a rejected request (upstream 4xx, never
 * retried) from exhausted transient failures. {@code lastStatus} is the last
 * upstream HTTP status observed, 0 for network errors and timeouts.
 */
public class SynthesisException extends DailyToonException {

    private final int lastStatus;
    private final boolean permanent;
    private final boolean cancelled;

    private SynthesisException(String message, int lastStatus, boolean permanent, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.lastStatus = lastStatus;
        this.permanent = permanent;
        this.cancelled = cancelled;
    }

    public static SynthesisException permanent(int status, Throwable cause) {
        return new SynthesisException(
                "Image generation rejected by upstream (status " + status + ")", status, true, false, cause);
    }

    public static SynthesisException exhausted(int attempts, int lastStatus, Throwable cause) {
        return new SynthesisException(
                "Image generation failed after " + attempts + " attempts (last status " + lastStatus + ")",
                lastStatus, false, false, cause);
    }

    public static SynthesisException cancelled(int lastStatus, Throwable cause) {
        return new SynthesisException("Image generation cancelled", lastStatus, false, true, cause);
    }

    public int getLastStatus() {
        return lastStatus;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
