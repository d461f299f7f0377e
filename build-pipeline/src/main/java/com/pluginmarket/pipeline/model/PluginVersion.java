package com.pluginmarket.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class PluginVersion {

    private String id;                  // UUID
    private String pluginId;
    private String version;
    private String downloadUrl;
    private String checksum;            // sha256 hex
    private Long fileSize;
    private boolean latest;
    private boolean prerelease;
    private String changelog;
    private long downloads;
    private Instant publishedAt;
}
