package com.pluginmarket.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One attempt to build one plugin version, created when a release is published.
 * Stored in the plugin_builds table.
 */
@Data
@Builder(toBuilder = true)
public class BuildRecord {

    private String id;                  // UUID
    private String pluginId;
    private String version;             // parsed from the release tag
    private BuildStatus status;

    // ── Release that produced this build ────────────────────────────────────
    private Long sourceEventId;         // release id
    private String sourceTag;
    private String sourceReleaseName;
    private String sourceArchiveUrl;    // tarball
    private boolean prerelease;
    private String changelog;

    /** Subdirectory holding the plugin in a monorepo, null for the repo root */
    private String pluginSubpath;

    private String errorMessage;        // null unless failed
    private String versionId;           // published version, set on success

    private Instant createdAt;
    private Instant updatedAt;
}
