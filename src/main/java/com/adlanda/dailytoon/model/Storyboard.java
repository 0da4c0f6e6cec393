package com.adlanda.dailytoon.model;

import java.util.List;

/**
 * Validated result of decomposing a story.
 *
 * @param title            Episode title
 * @param characterProfile "name: appearance" description shared by all panels
 * @param panels           Panel drafts in reading order
 * @param degraded         True when this is the single-panel fallback produced after a failure
 */
public record Storyboard(
        String title,
        String characterProfile,
        List<PanelDraft> panels,
        boolean degraded
) {
    public Storyboard {
        panels = List.copyOf(panels);
    }
}
