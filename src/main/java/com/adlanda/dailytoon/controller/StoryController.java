package com.adlanda.dailytoon.controller;

import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.model.EpisodeResponse;
import com.adlanda.dailytoon.model.StorySubmitRequest;
import com.adlanda.dailytoon.service.EpisodeService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for story submission.
 */
@RestController
@RequestMapping("/api/story")
public class StoryController {

    private final EpisodeService episodeService;

    public StoryController(EpisodeService episodeService) {
        this.episodeService = episodeService;
    }

    /**
     * Decompose a story into a new episode. Panel images are generated separately.
     *
     * @param request The story and optional character details
     * @return The created episode
     */
    @PostMapping("/submit")
    public ResponseEntity<EpisodeResponse> submit(@Valid @RequestBody StorySubmitRequest request) {
        Episode episode = episodeService.submitStory(
                request.storyText(), request.characterName(), request.characterAppearance());
        return ResponseEntity.ok(EpisodeResponse.from(episode));
    }
}
