package com.adlanda.dailytoon.exception;

/**
 * Raised when a referenced episode or panel does not exist.
 */
public class NotFoundException extends DailyToonException {

    private final String resource;

    private NotFoundException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public static NotFoundException episode(String episodeId) {
        return new NotFoundException("Episode", "Episode not found: " + episodeId);
    }

    public static NotFoundException panel(String episodeId, String panelId) {
        return new NotFoundException("Panel", "Panel not found: " + panelId + " in episode " + episodeId);
    }

    /**
     * Kind of the missing resource, "Episode" or "Panel".
     */
    public String getResource() {
        return resource;
    }
}
