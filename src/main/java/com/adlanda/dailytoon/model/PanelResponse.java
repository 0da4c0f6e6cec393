package com.adlanda.dailytoon.model;

import com.adlanda.dailytoon.entity.Panel;

/**
 * API view of a panel. Image bytes are never inlined here; clients fetch them
 * through the panel image endpoint.
 */
public record PanelResponse(
        String id,
        int order,
        String sceneDescription,
        String dialogue,
        String characterDescription,
        String background,
        boolean hasImage
) {
    public static PanelResponse from(Panel panel) {
        return new PanelResponse(
                panel.getId(),
                panel.getPanelOrder(),
                panel.getSceneDescription(),
                panel.getDialogue(),
                panel.getCharacterDescription(),
                panel.getBackground(),
                panel.hasImage()
        );
    }
}
