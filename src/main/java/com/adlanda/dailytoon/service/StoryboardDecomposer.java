package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.client.TextGenerationClient;
import com.adlanda.dailytoon.client.TextGenerationException;
import com.adlanda.dailytoon.config.FailurePolicy;
import com.adlanda.dailytoon.config.StoryboardProperties;
import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.exception.DecompositionException;
import com.adlanda.dailytoon.exception.ExtractionException;
import com.adlanda.dailytoon.model.PanelDraft;
import com.adlanda.dailytoon.model.Storyboard;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns story text into a validated storyboard by asking the text model for
 * panel descriptions.
 *
 * What happens when the model call fails or returns something unusable is
 * decided once per deployment by {@link FailurePolicy}.
 */
@Service
public class StoryboardDecomposer {

    private static final Logger log = LoggerFactory.getLogger(StoryboardDecomposer.class);

    static final String FIELD_SCENE = "scene_description";
    static final String FIELD_DIALOGUE = "dialogue";
    static final String FIELD_BACKGROUND = "background";

    private final TextGenerationClient textClient;
    private final ResponseExtractor extractor;
    private final StoryboardProperties properties;

    public StoryboardDecomposer(TextGenerationClient textClient,
                                ResponseExtractor extractor,
                                StoryboardProperties properties) {
        this.textClient = textClient;
        this.extractor = extractor;
        this.properties = properties;
    }

    /**
     * Decomposes a story into panels.
     *
     * @param storyText            The story as submitted
     * @param characterName        Main character name, or null for the default
     * @param characterAppearance  Main character appearance, or null for the default
     * @return The storyboard; a degraded single-panel one under {@link FailurePolicy#DEGRADE}
     * @throws DecompositionException on failure under {@link FailurePolicy#PROPAGATE}
     */
    public Storyboard decompose(String storyText, String characterName, String characterAppearance) {
        String name = isBlank(characterName) ? properties.getDefaultCharacterName() : characterName.trim();
        String appearance = isBlank(characterAppearance)
                ? properties.getDefaultCharacterAppearance()
                : characterAppearance.trim();
        String characterProfile = name + ": " + appearance;

        try {
            String response = textClient.generate(buildInstruction(storyText, characterProfile));
            ObjectNode payload = extractor.extract(response);
            Storyboard storyboard = validate(payload, characterProfile);
            log.info("Decomposed story into {} panels: '{}'", storyboard.panels().size(), storyboard.title());
            return storyboard;
        } catch (TextGenerationException e) {
            return onFailure(new DecompositionException("Text generation failed: " + e.getMessage(), e), name, characterProfile);
        } catch (ExtractionException e) {
            return onFailure(new DecompositionException("Model response contained no JSON object", e), name, characterProfile);
        } catch (DecompositionException e) {
            return onFailure(e, name, characterProfile);
        }
    }

    String buildInstruction(String storyText, String characterProfile) {
        int min = properties.getMinPanels();
        int max = properties.getMaxPanels();
        return """
                You are a manga storyboard expert. Analyze the story and break it into %d-%d dramatic manga-style scenes.

                Story: %s
                Main Character: %s

                Create %d-%d manga panels. For each panel provide:
                1. scene_description (visual)
                2. dialogue (speech/thought)
                3. background (setting)

                Respond with a single JSON object only, in this format:
                {
                  "title": "Episode Title",
                  "panels": [
                    {
                      "scene_description": "...",
                      "dialogue": "...",
                      "background": "..."
                    }
                  ]
                }
                """.formatted(min, max, storyText, characterProfile, min, max);
    }

    private Storyboard validate(ObjectNode payload, String characterProfile) {
        JsonNode panelsNode = payload.get("panels");
        if (panelsNode == null || !panelsNode.isArray()) {
            throw new DecompositionException("Model response has no 'panels' array");
        }

        int count = panelsNode.size();
        if (count < properties.getMinPanels()) {
            throw new DecompositionException(
                    "Model returned %d panels, at least %d required".formatted(count, properties.getMinPanels()));
        }
        if (count > properties.getMaxPanels()) {
            log.warn("Model returned {} panels, keeping the first {}", count, properties.getMaxPanels());
        }

        int kept = Math.min(count, properties.getMaxPanels());
        List<PanelDraft> panels = new ArrayList<>(kept);
        for (int i = 0; i < kept; i++) {
            JsonNode panel = panelsNode.get(i);
            if (!panel.isObject()) {
                throw new DecompositionException("Panel " + i + " is not an object");
            }
            panels.add(new PanelDraft(
                    requiredText(panel, FIELD_SCENE, i),
                    requiredText(panel, FIELD_DIALOGUE, i),
                    requiredText(panel, FIELD_BACKGROUND, i)
            ));
        }

        JsonNode titleNode = payload.get("title");
        String title = titleNode != null && titleNode.isTextual() && !titleNode.asText().isBlank()
                ? titleNode.asText().trim()
                : properties.getDefaultTitle();
        if (title.length() > Episode.MAX_TITLE_LENGTH) {
            log.warn("Model title has {} chars, truncating to {}", title.length(), Episode.MAX_TITLE_LENGTH);
            title = title.substring(0, Episode.MAX_TITLE_LENGTH);
        }

        return new Storyboard(title, characterProfile, panels, false);
    }

    private static String requiredText(JsonNode panel, String field, int index) {
        JsonNode value = panel.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new DecompositionException("Panel " + index + " is missing '" + field + "'");
        }
        return value.asText().trim();
    }

    private Storyboard onFailure(DecompositionException failure, String characterName, String characterProfile) {
        if (properties.getFailurePolicy() == FailurePolicy.PROPAGATE) {
            throw failure;
        }
        log.warn("Story decomposition failed, using single-panel fallback: {}", failure.getMessage());
        PanelDraft placeholder = new PanelDraft(
                characterName + " is standing there, waiting.",
                "...",
                "A simple background"
        );
        return new Storyboard(properties.getDefaultTitle(), characterProfile, List.of(placeholder), true);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
