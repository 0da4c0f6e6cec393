package com.adlanda.dailytoon.config;

/**
 * What the storyboard step does when the text model fails or returns
 * something unusable. Exactly one policy is active per deployment.
 */
public enum FailurePolicy {

    /** Surface the failure to the caller. */
    PROPAGATE,

    /** Replace the storyboard with a single idle panel. */
    DEGRADE
}
