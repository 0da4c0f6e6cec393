package com.adlanda.dailytoon.controller;

import com.adlanda.dailytoon.model.PanelImage;
import com.adlanda.dailytoon.model.PanelImageRequest;
import com.adlanda.dailytoon.model.PanelImageResponse;
import com.adlanda.dailytoon.service.PanelCacheGate;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for panel images.
 */
@RestController
@RequestMapping("/api/panels")
public class PanelController {

    private final PanelCacheGate cacheGate;

    public PanelController(PanelCacheGate cacheGate) {
        this.cacheGate = cacheGate;
    }

    @PostMapping("/generate")
    public ResponseEntity<PanelImageResponse> generate(@Valid @RequestBody PanelImageRequest request) {
        PanelImage image = cacheGate.ensureImage(request.episodeId(), request.panelId());
        return ResponseEntity.ok(PanelImageResponse.of(request.episodeId(), request.panelId(), image));
    }
}
