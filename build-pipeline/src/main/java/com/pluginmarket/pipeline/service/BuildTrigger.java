package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.model.BuildJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Hands a freshly created build to the builder without blocking the webhook
 * response. A failed dispatch leaves the record pending; the stuck-build
 * reaper eventually fails it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuildTrigger {

    private final BuilderClient builderClient;
    private final BackgroundTaskRunner backgroundTasks;

    public CompletableFuture<Void> trigger(String buildId, BuildJob job) {
        log.info("Scheduling dispatch of build {} ({}@{})", buildId, job.pluginId(), job.version());
        return backgroundTasks.submit("build-dispatch-" + buildId, () -> builderClient.dispatch(job));
    }
}
