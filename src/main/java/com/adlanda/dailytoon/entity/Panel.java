package com.adlanda.dailytoon.entity;

import jakarta.persistence.*;

import java.util.Optional;

/**
 * One illustrated beat of an episode.
 *
 * The image column starts empty and is filled exactly once by the store's
 * conditional update; there is no image setter.
 */
@Entity
@Table(name = "panels", uniqueConstraints = {
        @UniqueConstraint(name = "uk_panel_episode_order", columnNames = {"episode_id", "panel_order"})
})
public class Panel {

    /** Upper bound for a stored image; maps to bytea on PostgreSQL. */
    public static final int MAX_IMAGE_BYTES = 16 * 1024 * 1024;

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "episode_id", nullable = false)
    private Episode episode;

    @Column(name = "panel_order", nullable = false)
    private int panelOrder;

    @Column(name = "scene_description", nullable = false, columnDefinition = "text")
    private String sceneDescription;

    @Column(name = "dialogue", nullable = false, columnDefinition = "text")
    private String dialogue;

    @Column(name = "character_description", nullable = false, length = 2000)
    private String characterDescription;

    @Column(name = "background", nullable = false, columnDefinition = "text")
    private String background;

    @Column(name = "image", length = MAX_IMAGE_BYTES)
    private byte[] image;

    // Default constructor for JPA
    protected Panel() {
    }

    public Panel(String id, int panelOrder, String sceneDescription, String dialogue,
                 String characterDescription, String background) {
        this.id = id;
        this.panelOrder = panelOrder;
        this.sceneDescription = sceneDescription;
        this.dialogue = dialogue;
        this.characterDescription = characterDescription;
        this.background = background;
    }

    void setEpisode(Episode episode) {
        this.episode = episode;
    }

    public String getId() {
        return id;
    }

    public Episode getEpisode() {
        return episode;
    }

    public int getPanelOrder() {
        return panelOrder;
    }

    public String getSceneDescription() {
        return sceneDescription;
    }

    public String getDialogue() {
        return dialogue;
    }

    public String getCharacterDescription() {
        return characterDescription;
    }

    public String getBackground() {
        return background;
    }

    /**
     * A copy of the stored image, so callers cannot alter the entity's bytes.
     */
    public Optional<byte[]> getImage() {
        return image == null ? Optional.empty() : Optional.of(image.clone());
    }

    public boolean hasImage() {
        return image != null;
    }

    @Override
    public String toString() {
        return "Panel{" +
                "id='" + id + '\'' +
                ", panelOrder=" + panelOrder +
                ", hasImage=" + hasImage() +
                '}';
    }
}
