package com.adlanda.dailytoon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for story decomposition.
 *
 * Maps to properties prefixed with 'dailytoon.storyboard' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "dailytoon.storyboard")
public class StoryboardProperties {

    /**
     * Behavior when the text model call fails or its output does not validate.
     */
    private FailurePolicy failurePolicy = FailurePolicy.PROPAGATE;

    /**
     * Upper bound for a single text-generation call.
     */
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Fewest panels accepted from the model.
     */
    private int minPanels = 4;

    /**
     * Most panels kept; extra panels are dropped.
     */
    private int maxPanels = 6;

    private String defaultCharacterName = "the main character";

    private String defaultCharacterAppearance = "a young person with expressive eyes, dark hair, casual modern clothing";

    /**
     * Title used when the model does not provide one.
     */
    private String defaultTitle = "My Daily Story";

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMinPanels() {
        return minPanels;
    }

    public void setMinPanels(int minPanels) {
        this.minPanels = minPanels;
    }

    public int getMaxPanels() {
        return maxPanels;
    }

    public void setMaxPanels(int maxPanels) {
        this.maxPanels = maxPanels;
    }

    public String getDefaultCharacterName() {
        return defaultCharacterName;
    }

    public void setDefaultCharacterName(String defaultCharacterName) {
        this.defaultCharacterName = defaultCharacterName;
    }

    public String getDefaultCharacterAppearance() {
        return defaultCharacterAppearance;
    }

    public void setDefaultCharacterAppearance(String defaultCharacterAppearance) {
        this.defaultCharacterAppearance = defaultCharacterAppearance;
    }

    public String getDefaultTitle() {
        return defaultTitle;
    }

    public void setDefaultTitle(String defaultTitle) {
        this.defaultTitle = defaultTitle;
    }
}
