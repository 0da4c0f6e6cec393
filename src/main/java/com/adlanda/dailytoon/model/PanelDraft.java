package com.adlanda.dailytoon.model;

/**
 * One panel as proposed by the text model, before it is assigned an id or order.
 */
public record PanelDraft(
        String sceneDescription,
        String dialogue,
        String background
) {}
