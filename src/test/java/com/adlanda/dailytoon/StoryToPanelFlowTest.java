package com.adlanda.dailytoon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Submits a story and renders a panel through the whole stack: mocked text
 * model, WireMock image service, in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "spring.ai.openai.api-key=test-key",
    "spring.datasource.url=jdbc:h2:mem:dailytoon-flow;DB_CLOSE_DELAY=-1",
    "spring.datasource.username=sa",
    "spring.datasource.password=",
    "dailytoon.image.base-delay=10ms"
})
class StoryToPanelFlowTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A};

    private static final String STORYBOARD = """
            Here is the storyboard:
            ```json
            {
              "title": "The Lost Umbrella",
              "panels": [
                {"scene_description": "Aki leaves the cafe", "dialogue": "What a nice day", "background": "cafe door"},
                {"scene_description": "Rain starts", "dialogue": "Oh no", "background": "street"},
                {"scene_description": "Aki runs back", "dialogue": "My umbrella!", "background": "street"},
                {"scene_description": "The umbrella is gone", "dialogue": "...", "background": "cafe"}
              ]
            }
            ```
            """;

    @RegisterExtension
    static WireMockExtension imageService = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @DynamicPropertySource
    static void imageServiceUrl(DynamicPropertyRegistry registry) {
        registry.add("dailytoon.image.base-url", imageService::baseUrl);
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        public ChatModel chatModel() {
            ChatModel model = mock(ChatModel.class);
            when(model.call(anyString())).thenReturn(STORYBOARD);
            return model;
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void stubImageService() {
        imageService.stubFor(WireMock.get(urlPathMatching("/prompt/.+"))
                .inScenario("flaky")
                .whenScenarioStateIs("Started")
                .willReturn(serviceUnavailable())
                .willSetStateTo("recovered"));
        imageService.stubFor(WireMock.get(urlPathMatching("/prompt/.+"))
                .inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(ok().withHeader("Content-Type", "image/png").withBody(PNG)));
    }

    @Test
    void submitStory_thenGeneratePanelTwice_generatesOnceAndCaches() throws Exception {
        String submitted = mockMvc.perform(post("/api/story/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"storyText": "I forgot my umbrella at the cafe.", "characterName": "Aki", "characterAppearance": "red hair"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("The Lost Umbrella"))
                .andExpect(jsonPath("$.panels.length()").value(4))
                .andReturn().getResponse().getContentAsString();

        JsonNode episode = objectMapper.readTree(submitted);
        String episodeId = episode.get("id").asText();
        String panelId = episode.get("panels").get(2).get("id").asText();
        String request = "{\"episodeId\": \"" + episodeId + "\", \"panelId\": \"" + panelId + "\"}";
        String expectedImage = Base64.getEncoder().encodeToString(PNG);

        mockMvc.perform(post("/api/panels/generate").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("generated"))
                .andExpect(jsonPath("$.imageBase64").value(expectedImage));

        mockMvc.perform(post("/api/panels/generate").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cached"))
                .andExpect(jsonPath("$.imageBase64").value(expectedImage));

        // One 503, one success, nothing for the cached request
        assertThat(imageService.getAllServeEvents()).hasSize(2);

        mockMvc.perform(get("/api/episodes/" + episodeId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.panels[2].hasImage").value(true))
                .andExpect(jsonPath("$.panels[2].characterDescription").value("Aki: red hair"));
    }

    @Test
    void generatePanel_unknownEpisode_returnsNotFoundWithoutCallingImageService() throws Exception {
        mockMvc.perform(post("/api/panels/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"episodeId": "does-not-exist", "panelId": "nope"}
                            """))
                .andExpect(status().isNotFound());

        assertThat(imageService.getAllServeEvents()).isEmpty();
    }
}
