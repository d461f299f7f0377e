package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.model.ClientInfo;
import com.pluginmarket.pipeline.model.DownloadEvent;
import com.pluginmarket.pipeline.model.Plugin;
import com.pluginmarket.pipeline.model.PluginVersion;
import com.pluginmarket.pipeline.output.TelemetryRouter;
import com.pluginmarket.pipeline.store.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Records served downloads in the background. Failures are logged by the
 * task runner and never reach the client.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DownloadTracker {

    private static final int IP_HASH_LENGTH = 16;

    private final TelemetryRouter telemetryRouter;
    private final PluginRegistry pluginRegistry;
    private final BackgroundTaskRunner backgroundTasks;
    private final Clock clock;

    public CompletableFuture<Void> track(Plugin plugin, String servedVersion, ClientInfo client) {
        DownloadEvent event = DownloadEvent.builder()
                .id(UUID.randomUUID().toString())
                .pluginId(plugin.getId())
                .versionId(resolveVersionId(plugin, servedVersion))
                .version(servedVersion)
                .requesterId(client.requesterId())
                .ipHash(hashIp(client.ip()))
                .userAgent(client.userAgent())
                .timestamp(clock.instant())
                .build();

        return backgroundTasks.submit("download-track-" + plugin.getId(), () -> record(event));
    }

    void record(DownloadEvent event) {
        boolean counted = telemetryRouter.write(event);
        if (counted) {
            pluginRegistry.incrementDownloads(event.getPluginId(), event.getVersionId());
        }
    }

    static String resolveVersionId(Plugin plugin, String servedVersion) {
        return plugin.getVersions().stream()
                .filter(v -> v.getVersion().equals(servedVersion))
                .map(PluginVersion::getId)
                .findFirst()
                .orElse(null);
    }

    static String hashIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return null;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(ip.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, IP_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
