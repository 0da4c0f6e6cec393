package com.adlanda.dailytoon.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the panel image endpoint.
 */
public record PanelImageRequest(
        @NotBlank(message = "Episode id is required")
        String episodeId,

        @NotBlank(message = "Panel id is required")
        String panelId
) {}
