package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.model.Artifact;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.ClientInfo;
import com.pluginmarket.pipeline.model.Plugin;
import com.pluginmarket.pipeline.service.DownloadResolution.Outcome;
import com.pluginmarket.pipeline.store.ArtifactStore;
import com.pluginmarket.pipeline.store.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Answers "give me plugin X (version Y)". When nothing is published yet the
 * latest build record explains why, so the client can tell "come back later"
 * from "this release is broken".
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DownloadResolver {

    private final PluginRegistry pluginRegistry;
    private final ArtifactStore artifactStore;
    private final BuildRecordManager buildRecordManager;
    private final DownloadTracker downloadTracker;

    /**
     * @param version exact version, or null for the latest stable one
     */
    public DownloadResolution resolve(String pluginId, String version, ClientInfo client) {
        Optional<Plugin> plugin = pluginRegistry.findById(pluginId);
        if (plugin.isEmpty()) {
            return DownloadResolution.of(Outcome.PLUGIN_NOT_FOUND);
        }

        Optional<Artifact> artifact = artifactStore.findArtifact(pluginId, version);
        if (artifact.isEmpty()) {
            return explainMissingArtifact(pluginId);
        }

        if (!artifact.get().hasUrl()) {
            log.error("Version {} of {} is published without a download URL", artifact.get().version(), pluginId);
            return DownloadResolution.of(Outcome.DOWNLOAD_UNAVAILABLE);
        }

        downloadTracker.track(plugin.get(), artifact.get().version(), client);
        return DownloadResolution.found(artifact.get());
    }

    private DownloadResolution explainMissingArtifact(String pluginId) {
        Optional<BuildRecord> latest = buildRecordManager.getLatest(pluginId);
        if (latest.isEmpty()) {
            return DownloadResolution.of(Outcome.NO_VERSION);
        }

        BuildRecord build = latest.get();
        return switch (build.getStatus()) {
            case PENDING, BUILDING -> DownloadResolution.of(Outcome.BUILDING, build);
            case FAILED -> DownloadResolution.of(Outcome.BUILD_FAILED, build);
            // latest build succeeded but the requested version was never published
            case SUCCESS -> DownloadResolution.of(Outcome.NO_VERSION);
        };
    }
}
