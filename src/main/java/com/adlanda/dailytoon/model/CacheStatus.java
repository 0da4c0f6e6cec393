package com.adlanda.dailytoon.model;

/**
 * Whether a panel image was served from the store or produced for this request.
 */
public enum CacheStatus {
    HIT("cached"),
    MISS("generated");

    private final String label;

    CacheStatus(String label) {
        this.label = label;
    }

    /**
     * Label used in API responses.
     */
    public String label() {
        return label;
    }
}
