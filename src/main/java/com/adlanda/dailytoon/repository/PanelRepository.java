package com.adlanda.dailytoon.repository;

import com.adlanda.dailytoon.entity.Panel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for panels, always addressed through their episode.
 */
@Repository
public interface PanelRepository extends JpaRepository<Panel, String> {

    /**
     * Find a panel only if it belongs to the given episode.
     *
     * @param id        The panel id
     * @param episodeId The owning episode id
     * @return The panel if it exists in that episode
     */
    Optional<Panel> findByIdAndEpisodeId(String id, String episodeId);

    /**
     * Store an image on a panel that does not have one yet.
     *
     * The IS NULL guard makes this a compare-and-swap: of several concurrent
     * writers only the first matches the row, later ones see 0.
     *
     * @return Number of rows updated, 0 or 1
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Panel p SET p.image = :image " +
            "WHERE p.id = :panelId AND p.episode.id = :episodeId AND p.image IS NULL")
    int attachImage(@Param("episodeId") String episodeId,
                    @Param("panelId") String panelId,
                    @Param("image") byte[] image);
}
