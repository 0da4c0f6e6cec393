package com.adlanda.dailytoon.client;

/**
 * Failure of a single image-generation attempt.
 *
 * {@code status} is the upstream HTTP status, or {@link #NETWORK_ERROR} when no
 * response arrived (connection failure or timeout).
 */
public class ImageGenerationException extends RuntimeException {

    public static final int NETWORK_ERROR = 0;

    private final int status;

    public ImageGenerationException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ImageGenerationException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Client errors (4xx) mean the request itself is bad and will fail again.
     * Everything else (5xx, network errors, unusable 2xx payloads) may succeed
     * on another attempt.
     */
    public boolean isTransient() {
        return status < 400 || status >= 500;
    }
}
