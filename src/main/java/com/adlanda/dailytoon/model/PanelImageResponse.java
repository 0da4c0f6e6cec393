package com.adlanda.dailytoon.model;

import java.util.Base64;

/**
 * Response from the panel image endpoint.
 *
 * @param status "cached" when the stored image was returned, "generated" otherwise
 */
public record PanelImageResponse(
        String episodeId,
        String panelId,
        String imageBase64,
        String status
) {
    public static PanelImageResponse of(String episodeId, String panelId, PanelImage image) {
        return new PanelImageResponse(
                episodeId,
                panelId,
                Base64.getEncoder().encodeToString(image.bytes()),
                image.status().label()
        );
    }
}
