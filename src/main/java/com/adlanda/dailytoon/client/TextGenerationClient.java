package com.adlanda.dailytoon.client;

/**
 * Free-text in, free-text out access to a text-completion model.
 *
 * Output is not guaranteed to be pure JSON even when the instruction asks
 * for it; callers are expected to extract the payload themselves.
 */
public interface TextGenerationClient {

    /**
     * Sends one instruction and waits for the completion.
     *
     * @param instruction the full prompt
     * @return the raw model output
     * @throws TextGenerationException if the call fails or exceeds its time budget
     */
    String generate(String instruction);
}
