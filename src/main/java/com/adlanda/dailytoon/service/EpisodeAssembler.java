package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.entity.Panel;
import com.adlanda.dailytoon.model.PanelDraft;
import com.adlanda.dailytoon.model.Storyboard;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Builds a new, not yet persisted episode from a storyboard.
 */
@Component
public class EpisodeAssembler {

    private final Clock clock;

    public EpisodeAssembler(Clock clock) {
        this.clock = clock;
    }

    public Episode assemble(Storyboard storyboard, String storyText) {
        Episode episode = new Episode(
                UUID.randomUUID().toString(),
                storyboard.title(),
                storyText,
                clock.instant(),
                storyboard.characterProfile()
        );

        List<PanelDraft> drafts = storyboard.panels();
        for (int order = 0; order < drafts.size(); order++) {
            PanelDraft draft = drafts.get(order);
            episode.addPanel(new Panel(
                    UUID.randomUUID().toString(),
                    order,
                    draft.sceneDescription(),
                    draft.dialogue(),
                    storyboard.characterProfile(),
                    draft.background()
            ));
        }
        return episode;
    }
}
