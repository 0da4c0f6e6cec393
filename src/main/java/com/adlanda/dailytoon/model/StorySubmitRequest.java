package com.adlanda.dailytoon.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for the story submission endpoint.
 *
 * Character name and appearance are optional; configured defaults apply when absent.
 */
public record StorySubmitRequest(
        @NotBlank(message = "Story text is required")
        @Size(max = 20000, message = "Story text must be at most 20000 characters")
        String storyText,

        @Size(max = 200)
        String characterName,

        @Size(max = 1000)
        String characterAppearance
) {}
