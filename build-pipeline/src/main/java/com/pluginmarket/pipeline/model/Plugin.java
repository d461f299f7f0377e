package com.pluginmarket.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry entry for a plugin and the repository its releases come from.
 */
@Data
@Builder
public class Plugin {

    private String id;
    private String name;
    private String authorId;

    // ── Source repository link ──────────────────────────────────────────────
    private Long repositoryId;
    private String repositoryFullName;
    private String pluginSubpath;       // monorepo subdirectory, may be null

    private String currentVersion;
    private long downloads;
    private Instant createdAt;

    /** Published versions, newest first */
    @Builder.Default
    private List<PluginVersion> versions = new ArrayList<>();
}
