package com.adlanda.dailytoon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for panel image synthesis.
 *
 * Maps to properties prefixed with 'dailytoon.image' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "dailytoon.image")
public class ImageProperties {

    /**
     * Base URL of the image service. Prompts are appended as /prompt/{text}.
     */
    private String baseUrl = "https://image.pollinations.ai";

    private int width = 1024;

    private int height = 1024;

    /**
     * Total attempts per panel, including the first one.
     */
    private int maxRetries = 3;

    /**
     * Delay before the first retry; doubled for each further retry.
     */
    private Duration baseDelay = Duration.ofSeconds(2);

    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Per-attempt read timeout; rendering can take tens of seconds.
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    /**
     * Fixed art-direction text placed in front of every panel prompt.
     */
    private String stylePreamble = "monochrome panel-style illustration with halftone shading";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public String getStylePreamble() {
        return stylePreamble;
    }

    public void setStylePreamble(String stylePreamble) {
        this.stylePreamble = stylePreamble;
    }
}
