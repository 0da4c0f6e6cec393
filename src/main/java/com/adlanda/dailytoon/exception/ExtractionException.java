package com.adlanda.dailytoon.exception;

/**
 * Raised when a text-model response cannot be turned into a JSON object.
 *
 * Keeps the full offending response for diagnostics; the message only carries
 * a truncated preview.
 */
public class ExtractionException extends DailyToonException {

    private static final int PREVIEW_LENGTH = 200;

    private final String rawText;

    public ExtractionException(String rawText) {
        super("Could not extract a JSON object from response: " + preview(rawText));
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }

    private static String preview(String text) {
        if (text == null) {
            return "<null>";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
