package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.exception.NotFoundException;
import com.adlanda.dailytoon.model.Storyboard;
import com.adlanda.dailytoon.repository.EpisodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for story submission and episode management.
 *
 * Orchestrates: decompose story, assemble episode, persist.
 */
@Service
public class EpisodeService {

    private static final Logger log = LoggerFactory.getLogger(EpisodeService.class);

    static final int RECENT_LIMIT = 100;
    private static final int LOG_PREVIEW = 80;

    private final StoryboardDecomposer decomposer;
    private final EpisodeAssembler assembler;
    private final EpisodeStore store;

    public EpisodeService(StoryboardDecomposer decomposer, EpisodeAssembler assembler, EpisodeStore store) {
        this.decomposer = decomposer;
        this.assembler = assembler;
        this.store = store;
    }

    /**
     * Turns a story into a stored episode whose panels have no images yet.
     *
     * @param storyText            The story text
     * @param characterName        Optional character name
     * @param characterAppearance  Optional character appearance
     * @return The persisted episode
     */
    public Episode submitStory(String storyText, String characterName, String characterAppearance) {
        log.info("Story received: \"{}\"", preview(storyText));
        long start = System.currentTimeMillis();

        Storyboard storyboard = decomposer.decompose(storyText, characterName, characterAppearance);
        Episode episode = store.save(assembler.assemble(storyboard, storyText));

        log.info("Created episode {} '{}' with {} panels{} in {}ms",
                episode.getId(), episode.getTitle(), episode.getPanels().size(),
                storyboard.degraded() ? " (degraded)" : "",
                System.currentTimeMillis() - start);
        return episode;
    }

    public List<Episode> listRecent() {
        return store.findRecentEpisodes(RECENT_LIMIT);
    }

    public Episode get(String episodeId) {
        return store.findEpisode(episodeId).orElseThrow(() -> NotFoundException.episode(episodeId));
    }

    public void delete(String episodeId) {
        if (!store.deleteEpisode(episodeId)) {
            throw NotFoundException.episode(episodeId);
        }
        log.info("Deleted episode {}", episodeId);
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= LOG_PREVIEW ? flat : flat.substring(0, LOG_PREVIEW) + "...";
    }
}
