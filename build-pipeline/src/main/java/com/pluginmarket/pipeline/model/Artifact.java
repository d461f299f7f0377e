package com.pluginmarket.pipeline.model;

/**
 * Downloadable package of a published version.
 */
public record Artifact(String url, String version, String checksum) {

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
