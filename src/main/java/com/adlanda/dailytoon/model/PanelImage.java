package com.adlanda.dailytoon.model;

/**
 * Image bytes for a panel together with how they were obtained.
 */
public record PanelImage(
        byte[] bytes,
        CacheStatus status
) {}
