package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs fire-and-forget work on the pipeline worker pool.
 *
 * Callers get a future but the request path never joins it. Every outcome is
 * logged here under the task name and counted, so background failures are
 * visible even though nobody waits for them.
 */
@Component
@Slf4j
public class BackgroundTaskRunner {

    private final Executor executor;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public BackgroundTaskRunner(@Qualifier(PipelineConfig.TASK_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public record TaskStats(long submitted, long succeeded, long failed, long inFlight) {
    }

    public CompletableFuture<Void> submit(String taskName, Runnable task) {
        submitted.incrementAndGet();

        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            log.error("Background task {} rejected: worker pool is saturated", taskName);
            return CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((ignored, error) -> {
            if (error == null) {
                succeeded.incrementAndGet();
                log.debug("Background task {} completed", taskName);
            } else {
                failed.incrementAndGet();
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.error("Background task {} failed: {}", taskName, cause.getMessage(), cause);
            }
        });
    }

    public TaskStats stats() {
        long done = succeeded.get() + failed.get();
        return new TaskStats(submitted.get(), succeeded.get(), failed.get(), Math.max(0, submitted.get() - done));
    }
}
