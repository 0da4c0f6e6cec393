package com.adlanda.dailytoon.repository;

import com.adlanda.dailytoon.entity.Episode;
import com.adlanda.dailytoon.entity.Panel;
import com.adlanda.dailytoon.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Episode persistence used by the pipeline.
 *
 * This is a wrapper around the Spring Data repositories that gives the
 * pipeline a narrow contract and translates every data-access failure,
 * including failures to open or commit a transaction, into {@link StoreException}.
 * Each method runs in its own short transaction; no transaction is held while
 * images are being generated.
 */
@Repository
public class EpisodeStore {

    private static final Logger log = LoggerFactory.getLogger(EpisodeStore.class);

    private final EpisodeRepository episodeRepository;
    private final PanelRepository panelRepository;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public EpisodeStore(EpisodeRepository episodeRepository,
                        PanelRepository panelRepository,
                        PlatformTransactionManager transactionManager) {
        this.episodeRepository = episodeRepository;
        this.panelRepository = panelRepository;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    /**
     * Persists a new episode together with its panels.
     *
     * @param episode The assembled episode
     * @return The persisted episode
     */
    public Episode save(Episode episode) {
        Episode saved = execute("save episode " + episode.getId(), writeTx,
                status -> episodeRepository.saveAndFlush(episode));
        log.debug("Saved episode {} with {} panels", saved.getId(), saved.getPanels().size());
        return saved;
    }

    /**
     * Loads an episode with its panels.
     */
    public Optional<Episode> findEpisode(String episodeId) {
        return execute("load episode " + episodeId, readTx,
                status -> episodeRepository.findWithPanelsById(episodeId));
    }

    /**
     * Loads a panel scoped to its episode; a panel id from another episode is not found.
     */
    public Optional<Panel> findPanel(String episodeId, String panelId) {
        return execute("load panel " + panelId, readTx,
                status -> panelRepository.findByIdAndEpisodeId(panelId, episodeId));
    }

    public boolean episodeExists(String episodeId) {
        return execute("check episode " + episodeId, readTx,
                status -> episodeRepository.existsById(episodeId));
    }

    /**
     * Deletes an episode and its panels.
     *
     * @return false if there was no such episode
     */
    public boolean deleteEpisode(String episodeId) {
        Boolean deleted = execute("delete episode " + episodeId, writeTx, status -> {
            Optional<Episode> episode = episodeRepository.findById(episodeId);
            if (episode.isEmpty()) {
                return false;
            }
            episodeRepository.delete(episode.get());
            episodeRepository.flush();
            return true;
        });
        return Boolean.TRUE.equals(deleted);
    }

    /**
     * Conditionally stores a panel image.
     *
     * @return true if this call stored the image; false if the panel is missing
     *         or already has an image
     */
    public boolean attachImage(String episodeId, String panelId, byte[] image) {
        Integer updated = execute("attach image to panel " + panelId, writeTx,
                status -> panelRepository.attachImage(episodeId, panelId, image));
        return updated != null && updated > 0;
    }

    /**
     * Most recently created episodes with their panels, newest first.
     *
     * @param limit Maximum number of episodes
     */
    public List<Episode> findRecentEpisodes(int limit) {
        return execute("list recent episodes", readTx, status -> {
            List<String> ids = episodeRepository.findRecentIds(PageRequest.of(0, limit));
            if (ids.isEmpty()) {
                return List.<Episode>of();
            }
            return episodeRepository.findWithPanelsByIdIn(ids).stream()
                    .sorted(Comparator.comparing(Episode::getCreatedAt).reversed())
                    .toList();
        });
    }

    public long countEpisodes() {
        Long count = execute("count episodes", readTx, status -> episodeRepository.count());
        return count != null ? count : 0L;
    }

    private <T> T execute(String action, TransactionTemplate template, TransactionCallback<T> work) {
        try {
            return template.execute(work);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Failed to " + action, e);
        }
    }
}
