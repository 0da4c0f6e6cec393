package com.adlanda.dailytoon.controller;

import com.adlanda.dailytoon.model.EpisodeResponse;
import com.adlanda.dailytoon.service.EpisodeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for browsing and deleting episodes.
 */
@RestController
@RequestMapping("/api/episodes")
public class EpisodeController {

    private final EpisodeService episodeService;

    public EpisodeController(EpisodeService episodeService) {
        this.episodeService = episodeService;
    }

    /**
     * Most recent episodes, newest first.
     */
    @GetMapping
    public ResponseEntity<List<EpisodeResponse>> list() {
        return ResponseEntity.ok(episodeService.listRecent().stream()
                .map(EpisodeResponse::from)
                .toList());
    }

    @GetMapping("/{episodeId}")
    public ResponseEntity<EpisodeResponse> get(@PathVariable String episodeId) {
        return ResponseEntity.ok(EpisodeResponse.from(episodeService.get(episodeId)));
    }

    @DeleteMapping("/{episodeId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String episodeId) {
        episodeService.delete(episodeId);
        return ResponseEntity.ok(Map.of(
                "message", "Episode deleted successfully",
                "episodeId", episodeId
        ));
    }
}
