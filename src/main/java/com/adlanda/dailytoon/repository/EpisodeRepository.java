package com.adlanda.dailytoon.repository;

import com.adlanda.dailytoon.entity.Episode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for episodes and, through cascading, their panels.
 */
@Repository
public interface EpisodeRepository extends JpaRepository<Episode, String> {

    /**
     * Find an episode with its panels loaded in one query.
     */
    @EntityGraph(attributePaths = "panels")
    Optional<Episode> findWithPanelsById(String id);

    /**
     * Ids of the most recently created episodes, newest first.
     * Paged on ids only so the database applies the limit, not Hibernate.
     */
    @Query("SELECT e.id FROM Episode e ORDER BY e.createdAt DESC")
    List<String> findRecentIds(Pageable pageable);

    @EntityGraph(attributePaths = "panels")
    List<Episode> findWithPanelsByIdIn(Collection<String> ids);
}
