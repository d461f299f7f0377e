package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.model.BuildJob;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.Plugin;
import com.pluginmarket.pipeline.model.ReleaseEvent;
import com.pluginmarket.pipeline.store.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a published release into a pending build and schedules its dispatch.
 * Returns as soon as the record exists; the builder is never awaited.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReleaseWebhookService {

    private final PluginRegistry pluginRegistry;
    private final BuildRecordManager buildRecordManager;
    private final BuildTrigger buildTrigger;

    /**
     * @return the created build, or empty when no plugin is linked to the repository
     */
    public Optional<BuildRecord> handlePublishedRelease(ReleaseEvent event, String deliveryId) {
        ReleaseEvent.Release release = event.getRelease();
        ReleaseEvent.Repository repository = event.getRepository();

        log.info("Processing release {} for {} (delivery {})",
                release.getTagName(), repository.getFullName(), deliveryId);

        Optional<Plugin> plugin = pluginRegistry.findByRepositoryId(repository.getId());
        if (plugin.isEmpty()) {
            log.info("No plugin found for repository {} (id {})", repository.getFullName(), repository.getId());
            return Optional.empty();
        }

        String pluginId = plugin.get().getId();
        String version = VersionParser.parseVersion(release.getTagName());

        BuildRecord build = buildRecordManager.createPending(
                pluginId, version, release, plugin.get().getPluginSubpath());

        try {
            buildTrigger.trigger(build.getId(), BuildJob.from(build));
        } catch (RuntimeException e) {
            log.error("Could not schedule dispatch of build {} (delivery {}): {}",
                    build.getId(), deliveryId, e.getMessage(), e);
        }
        return Optional.of(build);
    }
}
