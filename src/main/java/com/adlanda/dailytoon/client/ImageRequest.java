package com.adlanda.dailytoon.client;

/**
 * One rendering request.
 *
 * @param prompt full rendering instruction
 * @param width  image width in pixels
 * @param height image height in pixels
 * @param seed   random seed; a fresh one per call keeps upstream caches from answering
 */
public record ImageRequest(
        String prompt,
        int width,
        int height,
        int seed
) {}
