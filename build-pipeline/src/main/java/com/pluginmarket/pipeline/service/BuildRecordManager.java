package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.exception.BuildNotFoundException;
import com.pluginmarket.pipeline.exception.IllegalBuildTransitionException;
import com.pluginmarket.pipeline.exception.MalformedPayloadException;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.BuildStatus;
import com.pluginmarket.pipeline.model.BuildStatusUpdate;
import com.pluginmarket.pipeline.model.PluginVersion;
import com.pluginmarket.pipeline.model.ReleaseEvent;
import com.pluginmarket.pipeline.store.BuildRecordRepository;
import com.pluginmarket.pipeline.store.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns build records and their lifecycle.
 *
 * Records are created pending here; every later status change comes from the
 * builder's status callback through {@link #applyUpdate}, or from the reaper.
 * Both are compare-and-set on the stored status, so a record never moves
 * backwards or out of a terminal state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuildRecordManager {

    static final String TIMED_OUT_MESSAGE = "Build timed out after %d minutes without a result";

    // pending → building → terminal: at most three statuses to chase
    private static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final BuildRecordRepository repository;
    private final PluginRegistry pluginRegistry;
    private final Clock clock;

    /**
     * Repeated deliveries of the same release are not deduplicated: each one
     * creates its own pending record.
     */
    public BuildRecord createPending(String pluginId, String version,
                                     ReleaseEvent.Release release, String pluginSubpath) {
        Instant now = clock.instant();
        BuildRecord build = BuildRecord.builder()
                .id(UUID.randomUUID().toString())
                .pluginId(pluginId)
                .version(version)
                .status(BuildStatus.PENDING)
                .sourceEventId(release.getId())
                .sourceTag(release.getTagName())
                .sourceReleaseName(release.getName())
                .sourceArchiveUrl(release.getTarballUrl())
                .prerelease(release.isPrerelease())
                .changelog(release.getBody())
                .pluginSubpath(pluginSubpath)
                .createdAt(now)
                .updatedAt(now)
                .build();

        repository.insert(build);
        log.info("Created build record {} for {}@{}", build.getId(), pluginId, version);
        return build;
    }

    public Optional<BuildRecord> get(String buildId) {
        return repository.findById(buildId);
    }

    public Optional<BuildRecord> getLatest(String pluginId) {
        return repository.findLatestByPlugin(pluginId);
    }

    public List<BuildRecord> listRecent(String pluginId, int limit) {
        return repository.findRecentByPlugin(pluginId, limit);
    }

    /**
     * Applies a builder status report. A success carrying an artifact also
     * publishes the version, in the same transaction as the status change.
     *
     * @throws BuildNotFoundException          unknown build id
     * @throws MalformedPayloadException       missing status or wrong plugin
     * @throws IllegalBuildTransitionException backwards move or terminal record
     */
    @Transactional
    public BuildRecord applyUpdate(String buildId, BuildStatusUpdate update) {
        if (update.getStatus() == null) {
            throw new MalformedPayloadException("Missing required field: status");
        }
        BuildRecord current = repository.findById(buildId)
                .orElseThrow(() -> new BuildNotFoundException(buildId));

        if (update.getPluginId() != null && !update.getPluginId().equals(current.getPluginId())) {
            throw new MalformedPayloadException("Build " + buildId + " does not belong to plugin " + update.getPluginId());
        }

        BuildStatus target = update.getStatus();
        String errorMessage = target == BuildStatus.FAILED ? update.getErrorMessage() : null;
        transition(current, target, errorMessage);

        if (target == BuildStatus.SUCCESS && update.getArtifact() != null) {
            PluginVersion published = pluginRegistry.publishVersion(PluginVersion.builder()
                    .pluginId(current.getPluginId())
                    .version(current.getVersion())
                    .downloadUrl(update.getArtifact().getDownloadUrl())
                    .checksum(update.getArtifact().getChecksum())
                    .fileSize(update.getArtifact().getFileSize())
                    .latest(!current.isPrerelease())
                    .prerelease(current.isPrerelease())
                    .changelog(current.getChangelog())
                    .build(), clock.instant());
            repository.linkVersion(buildId, published.getId());
        } else if (target == BuildStatus.SUCCESS) {
            log.warn("Build {} reported success without an artifact; nothing published", buildId);
        }

        return repository.findById(buildId).orElseThrow(() -> new BuildNotFoundException(buildId));
    }

    /**
     * Fails every pending or building record that has not changed status for
     * longer than {@code timeout}. A record that moves while being reaped has
     * made progress and is left alone.
     *
     * @return number of records failed
     */
    public int failStuckBuilds(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        String message = String.format(TIMED_OUT_MESSAGE, timeout.toMinutes());
        int failed = 0;

        for (BuildRecord stuck : repository.findUnfinishedNotUpdatedSince(cutoff)) {
            boolean applied = repository.transition(
                    stuck.getId(), stuck.getStatus(), BuildStatus.FAILED, message, clock.instant());
            if (applied) {
                failed++;
                log.warn("Build {} for {}@{} was {} since {}; marked failed",
                        stuck.getId(), stuck.getPluginId(), stuck.getVersion(),
                        stuck.getStatus().value(), stuck.getUpdatedAt());
            } else {
                log.debug("Build {} changed status before it could be reaped", stuck.getId());
            }
        }
        return failed;
    }

    /**
     * Compare-and-set from the last status seen. When another writer got there
     * first, the move is retried from the fresh status as long as it is still
     * legal; forward-only moves bound the number of retries.
     */
    private void transition(BuildRecord current, BuildStatus target, String errorMessage) {
        String buildId = current.getId();
        BuildStatus from = current.getStatus();

        for (int attempt = 0; attempt < MAX_TRANSITION_ATTEMPTS; attempt++) {
            if (from == null || !from.canTransitionTo(target)) {
                throw new IllegalBuildTransitionException(buildId, from, target);
            }
            if (repository.transition(buildId, from, target, errorMessage, clock.instant())) {
                log.info("Build {} moved {} → {}", buildId, from.value(), target.value());
                return;
            }
            BuildStatus seen = from;
            from = repository.findById(buildId)
                    .map(BuildRecord::getStatus)
                    .orElseThrow(() -> new BuildNotFoundException(buildId));
            log.debug("Build {} moved from {} to {} concurrently; retrying {}",
                    buildId, seen.value(), from.value(), target.value());
        }
        throw new IllegalBuildTransitionException(buildId, from, target);
    }
}
