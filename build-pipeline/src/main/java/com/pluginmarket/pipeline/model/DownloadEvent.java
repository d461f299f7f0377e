package com.pluginmarket.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Append-only usage record written for every served download.
 * The client IP is never stored, only a truncated sha256 of it.
 */
@Data
@Builder
public class DownloadEvent {

    private String id;
    private String pluginId;
    private String versionId;           // null when the served version is unknown
    private String version;
    private String requesterId;
    private String ipHash;
    private String userAgent;
    private Instant timestamp;
}
