package com.adlanda.dailytoon.controller;

import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.entity.Panel;
import com.adlanda.dailytoon.exception.NotFoundException;
import com.adlanda.dailytoon.service.EpisodeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EpisodeController.class)
class EpisodeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EpisodeService episodeService;

    @Test
    void list_returnsEpisodesInServiceOrder() throws Exception {
        when(episodeService.listRecent()).thenReturn(List.of(
                episode("ep-2", "Newer"),
                episode("ep-1", "Older")));

        mockMvc.perform(get("/api/episodes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("ep-2"))
                .andExpect(jsonPath("$[1].title").value("Older"));
    }

    @Test
    void get_existingEpisode_returnsIt() throws Exception {
        when(episodeService.get("ep-1")).thenReturn(episode("ep-1", "Rainy Monday"));

        mockMvc.perform(get("/api/episodes/ep-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Rainy Monday"))
                .andExpect(jsonPath("$.createdAt").value("2026-01-10T10:00:00Z"))
                .andExpect(jsonPath("$.panels[0].sceneDescription").value("scene"));
    }

    @Test
    void get_unknownEpisode_returnsNotFound() throws Exception {
        when(episodeService.get("nope")).thenThrow(NotFoundException.episode("nope"));

        mockMvc.perform(get("/api/episodes/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"));
    }

    @Test
    void delete_existingEpisode_returnsConfirmation() throws Exception {
        mockMvc.perform(delete("/api/episodes/ep-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Episode deleted successfully"))
                .andExpect(jsonPath("$.episodeId").value("ep-1"));

        verify(episodeService).delete("ep-1");
    }

    @Test
    void delete_unknownEpisode_returnsNotFound() throws Exception {
        doThrow(NotFoundException.episode("nope")).when(episodeService).delete("nope");

        mockMvc.perform(delete("/api/episodes/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unexpectedFailure_returnsGenericServerError() throws Exception {
        when(episodeService.listRecent()).thenThrow(new IllegalStateException("boom at line 42"));

        mockMvc.perform(get("/api/episodes"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("An unexpected error occurred. Please try again later."));
    }

    @Test
    void preflight_fromAnyOrigin_isAllowed() throws Exception {
        mockMvc.perform(options("/api/episodes")
                        .header("Origin", "http://localhost:19006")
                        .header("Access-Control-Request-Method", "DELETE"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:19006"));
    }

    private static Episode episode(String id, String title) {
        Episode episode = new Episode(id, title, "story", Instant.parse("2026-01-10T10:00:00Z"), "Aki: red hair");
        episode.addPanel(new Panel(id + "-p0", 0, "scene", "line", "Aki: red hair", "place"));
        return episode;
    }
}
