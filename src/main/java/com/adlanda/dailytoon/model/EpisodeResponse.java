package com.adlanda.dailytoon.model;

import com.adlanda.dailytoon.entity.Episode;

import java.time.Instant;
import java.util.List;

/**
 * API view of an episode.
 *
 * @param id               Episode id
 * @param title            Episode title
 * @param storyText        The story as submitted
 * @param characterProfile Character profile shared by all panels
 * @param createdAt        Creation time
 * @param panels           Panels in reading order
 */
public record EpisodeResponse(
        String id,
        String title,
        String storyText,
        String characterProfile,
        Instant createdAt,
        List<PanelResponse> panels
) {
    public static EpisodeResponse from(Episode episode) {
        return new EpisodeResponse(
                episode.getId(),
                episode.getTitle(),
                episode.getSourceStoryText(),
                episode.getCharacterProfile(),
                episode.getCreatedAt(),
                episode.getPanels().stream().map(PanelResponse::from).toList()
        );
    }
}
