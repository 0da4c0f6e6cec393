package com.adlanda.dailytoon.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "DailyToon",
                "version", appVersion,
                "endpoints", Map.of(
                        "submit", "POST /api/story/submit - Turn a story into an episode",
                        "generate", "POST /api/panels/generate - Get or generate a panel image",
                        "episodes", "GET /api/episodes - List recent episodes",
                        "episode", "GET /api/episodes/{id} - Get one episode",
                        "delete", "DELETE /api/episodes/{id} - Delete an episode",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
