package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.entity.Panel;
import com.adlanda.dailytoon.exception.NotFoundException;
import com.adlanda.dailytoon.exception.StoreException;
import com.adlanda.dailytoon.model.CacheStatus;
import com.adlanda.dailytoon.model.PanelImage;
import com.adlanda.dailytoon.repository.EpisodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Serves a panel's image, generating and storing it on first request.
 *
 * The stored image never changes once set. When two requests race on the
 * same empty panel both may generate, but only the first write is kept and
 * both callers receive the stored bytes.
 */
@Service
public class PanelCacheGate {

    private static final Logger log = LoggerFactory.getLogger(PanelCacheGate.class);

    private final EpisodeStore store;
    private final PanelImageSynthesizer synthesizer;

    public PanelCacheGate(EpisodeStore store, PanelImageSynthesizer synthesizer) {
        this.store = store;
        this.synthesizer = synthesizer;
    }

    /**
     * Returns the panel image, generating it if the panel has none yet.
     *
     * @param episodeId The episode id
     * @param panelId   The panel id, which must belong to the episode
     * @return The image with HIT if it was already stored, MISS otherwise
     * @throws NotFoundException if the episode or panel does not exist
     */
    public PanelImage ensureImage(String episodeId, String panelId) {
        Panel panel = lookup(episodeId, panelId);

        Optional<byte[]> cached = panel.getImage();
        if (cached.isPresent()) {
            log.debug("Panel {} image served from store", panelId);
            return new PanelImage(cached.get(), CacheStatus.HIT);
        }

        log.info("Generating image for panel {} of episode {}", panelId, episodeId);
        byte[] image = synthesizer.synthesize(
                panel.getSceneDescription(),
                panel.getDialogue(),
                panel.getCharacterDescription(),
                panel.getBackground()
        );

        if (store.attachImage(episodeId, panelId, image)) {
            log.info("Stored image for panel {} ({} bytes)", panelId, image.length);
            return new PanelImage(image, CacheStatus.MISS);
        }

        // Lost the race or the panel disappeared meanwhile
        Panel current = lookup(episodeId, panelId);
        byte[] winner = current.getImage().orElseThrow(() -> new StoreException(
                "Image update for panel " + panelId + " matched no row but the panel has no image"));
        log.info("Panel {} was imaged concurrently, returning the stored image", panelId);
        return new PanelImage(winner, CacheStatus.MISS);
    }

    private Panel lookup(String episodeId, String panelId) {
        return store.findPanel(episodeId, panelId).orElseThrow(() -> store.episodeExists(episodeId)
                ? NotFoundException.panel(episodeId, panelId)
                : NotFoundException.episode(episodeId));
    }
}
