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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoryboardDecomposerTest {

    @Mock
    private TextGenerationClient textClient;

    private StoryboardProperties properties;

    private StoryboardDecomposer decomposer;

    @BeforeEach
    void setUp() {
        properties = new StoryboardProperties();
        decomposer = new StoryboardDecomposer(textClient, new ResponseExtractor(new ObjectMapper()), properties);
    }

    @Test
    void decompose_wellFormedResponse_returnsPanelsInOrder() {
        when(textClient.generate(anyString())).thenReturn(response("Morning Rush", 4));

        Storyboard storyboard = decomposer.decompose("I missed the bus and ran to work.", "Aki", "short red hair");

        assertThat(storyboard.title()).isEqualTo("Morning Rush");
        assertThat(storyboard.characterProfile()).isEqualTo("Aki: short red hair");
        assertThat(storyboard.degraded()).isFalse();
        assertThat(storyboard.panels()).hasSize(4);
        assertThat(storyboard.panels()).extracting(PanelDraft::sceneDescription)
                .containsExactly("scene 0", "scene 1", "scene 2", "scene 3");
        assertThat(storyboard.panels()).allSatisfy(panel -> {
            assertThat(panel.sceneDescription()).isNotBlank();
            assertThat(panel.dialogue()).isNotBlank();
            assertThat(panel.background()).isNotBlank();
        });
    }

    @Test
    void decompose_fencedResponse_isExtracted() {
        when(textClient.generate(anyString()))
                .thenReturn("Here is your storyboard:\n```json\n" + response("Fenced", 5) + "\n```\nHave fun!");

        Storyboard storyboard = decomposer.decompose("A long day.", null, null);

        assertThat(storyboard.panels()).hasSize(5);
    }

    @Test
    void decompose_missingCharacter_usesDefaults() {
        when(textClient.generate(anyString())).thenReturn(response("Defaults", 4));

        Storyboard storyboard = decomposer.decompose("A quiet walk.", "  ", null);

        assertThat(storyboard.characterProfile()).isEqualTo(
                "the main character: a young person with expressive eyes, dark hair, casual modern clothing");
    }

    @Test
    void decompose_instructionMentionsStoryCharacterAndPanelRange() {
        when(textClient.generate(anyString())).thenReturn(response("T", 4));
        ArgumentCaptor<String> instruction = ArgumentCaptor.forClass(String.class);

        decomposer.decompose("I adopted a cat.", "Mina", "round glasses");

        verify(textClient).generate(instruction.capture());
        assertThat(instruction.getValue())
                .contains("I adopted a cat.")
                .contains("Mina: round glasses")
                .contains("4-6")
                .contains("scene_description")
                .contains("single JSON object");
    }

    @Test
    void decompose_missingTitle_usesDefaultTitle() {
        when(textClient.generate(anyString())).thenReturn("{\"panels\": " + panelArray(4) + "}");

        Storyboard storyboard = decomposer.decompose("Untitled day.", null, null);

        assertThat(storyboard.title()).isEqualTo("My Daily Story");
    }

    @Test
    void decompose_overlongTitle_truncatedToColumnLength() {
        String title = "x".repeat(600);
        when(textClient.generate(anyString())).thenReturn(response(title, 4));

        Storyboard storyboard = decomposer.decompose("A very long day.", null, null);

        assertThat(storyboard.title()).hasSize(Episode.MAX_TITLE_LENGTH);
        assertThat(title).startsWith(storyboard.title());
    }

    @Test
    void decompose_tooManyPanels_truncatesToMax() {
        when(textClient.generate(anyString())).thenReturn(response("Long", 9));

        Storyboard storyboard = decomposer.decompose("Everything happened.", null, null);

        assertThat(storyboard.panels()).hasSize(6);
        assertThat(storyboard.panels().get(5).sceneDescription()).isEqualTo("scene 5");
    }

    @Test
    void decompose_tooFewPanels_propagatesFailure() {
        when(textClient.generate(anyString())).thenReturn(response("Short", 2));

        assertThatThrownBy(() -> decomposer.decompose("Short day.", null, null))
                .isInstanceOf(DecompositionException.class)
                .hasMessageContaining("at least 4");
    }

    @Test
    void decompose_blankPanelField_propagatesFailure() {
        String panels = "[" + IntStream.range(0, 4)
                .mapToObj(i -> "{\"scene_description\":\"s\",\"dialogue\":\"" + (i == 2 ? " " : "d")
                        + "\",\"background\":\"b\"}")
                .collect(Collectors.joining(",")) + "]";
        when(textClient.generate(anyString())).thenReturn("{\"title\":\"t\",\"panels\":" + panels + "}");

        assertThatThrownBy(() -> decomposer.decompose("Story.", null, null))
                .isInstanceOf(DecompositionException.class)
                .hasMessageContaining("Panel 2")
                .hasMessageContaining("dialogue");
    }

    @Test
    void decompose_panelsNotAnArray_propagatesFailure() {
        when(textClient.generate(anyString())).thenReturn("{\"title\":\"t\",\"panels\":\"four of them\"}");

        assertThatThrownBy(() -> decomposer.decompose("Story.", null, null))
                .isInstanceOf(DecompositionException.class);
    }

    @Test
    void decompose_unparseableResponse_wrapsExtractionFailure() {
        when(textClient.generate(anyString())).thenReturn("Sorry, I cannot help with that.");

        assertThatThrownBy(() -> decomposer.decompose("Story.", null, null))
                .isInstanceOf(DecompositionException.class)
                .hasCauseInstanceOf(ExtractionException.class);
    }

    @Test
    void decompose_textClientFails_propagatesFailure() {
        when(textClient.generate(anyString())).thenThrow(new TextGenerationException("timed out"));

        assertThatThrownBy(() -> decomposer.decompose("Story.", null, null))
                .isInstanceOf(DecompositionException.class)
                .hasCauseInstanceOf(TextGenerationException.class);
    }

    @Test
    void decompose_degradePolicy_returnsSinglePlaceholderPanel() {
        properties.setFailurePolicy(FailurePolicy.DEGRADE);
        when(textClient.generate(anyString())).thenThrow(new TextGenerationException("upstream down"));

        Storyboard storyboard = decomposer.decompose("Story.", "Ren", "tall");

        assertThat(storyboard.degraded()).isTrue();
        assertThat(storyboard.title()).isEqualTo("My Daily Story");
        assertThat(storyboard.characterProfile()).isEqualTo("Ren: tall");
        assertThat(storyboard.panels()).containsExactly(
                new PanelDraft("Ren is standing there, waiting.", "...", "A simple background"));
    }

    @Test
    void decompose_degradePolicy_coversValidationFailures() {
        properties.setFailurePolicy(FailurePolicy.DEGRADE);
        when(textClient.generate(anyString())).thenReturn(response("Short", 1));

        Storyboard storyboard = decomposer.decompose("Story.", null, null);

        assertThat(storyboard.degraded()).isTrue();
        assertThat(storyboard.panels()).hasSize(1);
        assertThat(storyboard.panels().get(0).sceneDescription())
                .isEqualTo("the main character is standing there, waiting.");
    }

    private static String response(String title, int panels) {
        return "{\"title\":\"" + title + "\",\"panels\":" + panelArray(panels) + "}";
    }

    private static String panelArray(int count) {
        return "[" + IntStream.range(0, count)
                .mapToObj(i -> "{\"scene_description\":\"scene " + i + "\",\"dialogue\":\"line " + i
                        + "\",\"background\":\"place " + i + "\"}")
                .collect(Collectors.joining(",")) + "]";
    }
}
