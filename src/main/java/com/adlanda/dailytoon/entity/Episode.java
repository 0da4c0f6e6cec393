package com.adlanda.dailytoon.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA aggregate root for one submitted story and its panels.
 *
 * Panels are owned by the episode (cascade + orphan removal) and always
 * read back in panel order.
 */
@Entity
@Table(name = "episodes", indexes = {
        @Index(name = "idx_episode_created", columnList = "created_at")
})
public class Episode {

    public static final int MAX_TITLE_LENGTH = 500;

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "title", nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "source_story_text", nullable = false, columnDefinition = "text")
    private String sourceStoryText;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "character_profile", nullable = false, length = 2000)
    private String characterProfile;

    @OneToMany(mappedBy = "episode", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("panelOrder ASC")
    private List<Panel> panels = new ArrayList<>();

    // Default constructor for JPA
    protected Episode() {
    }

    public Episode(String id, String title, String sourceStoryText, Instant createdAt, String characterProfile) {
        this.id = id;
        this.title = title;
        this.sourceStoryText = sourceStoryText;
        this.createdAt = createdAt;
        this.characterProfile = characterProfile;
    }

    /**
     * Appends a panel; its order must equal the current panel count.
     */
    public void addPanel(Panel panel) {
        if (panel.getPanelOrder() != panels.size()) {
            throw new IllegalArgumentException(
                    "Panel order %d breaks sequence, expected %d".formatted(panel.getPanelOrder(), panels.size()));
        }
        panels.add(panel);
        panel.setEpisode(this);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getSourceStoryText() {
        return sourceStoryText;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCharacterProfile() {
        return characterProfile;
    }

    public List<Panel> getPanels() {
        return List.copyOf(panels);
    }

    @Override
    public String toString() {
        return "Episode{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", panels=" + panels.size() +
                ", createdAt=" + createdAt +
                '}';
    }
}
