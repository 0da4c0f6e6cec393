package com.adlanda.dailytoon.client;

/**
 * Renders a prompt into raw image bytes.
 */
public interface ImageGenerationClient {

    /**
     * Performs a single rendering attempt; no retries happen here.
     *
     * @return the complete, non-empty image payload
     * @throws ImageGenerationException with the upstream status for any failure
     */
    byte[] generate(ImageRequest request);
}
