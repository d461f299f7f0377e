package com.pluginmarket.pipeline.scheduler;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.ingress.RateLimiter;
import com.pluginmarket.pipeline.output.JdbcTelemetryWriter;
import com.pluginmarket.pipeline.output.TelemetryRouter;
import com.pluginmarket.pipeline.service.BuildRecordManager;
import com.pluginmarket.pipeline.store.BuildRecordRepository;
import com.pluginmarket.pipeline.store.PluginRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Startup schema setup and the periodic housekeeping jobs.
 *
 * Rate-limit sweep: every {@code plugin-builds.rate-limit.sweep-interval} (60s).
 * Stuck-build reaper: every {@code plugin-builds.reaper.interval} (5 min), fails
 * records left pending or building for longer than the stuck timeout.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final BuildRecordRepository buildRecordRepository;
    private final PluginRegistry pluginRegistry;
    private final JdbcTelemetryWriter jdbcTelemetryWriter;
    private final TelemetryRouter telemetryRouter;
    private final BuildRecordManager buildRecordManager;
    private final List<RateLimiter> rateLimiters;
    private final PluginBuildsProperties properties;

    @PostConstruct
    public void onStartup() {
        pluginRegistry.ensureSchema();
        buildRecordRepository.ensureSchema();

        if (telemetryRouter.usesJdbc()) {
            jdbcTelemetryWriter.ensureSchema();
        } else {
            log.info("Telemetry mode {}: skipping download_events table", properties.getTelemetry().getMode());
        }

        log.info("Build pipeline ready. Stuck builds reaped after {} (reaper {})",
                properties.getReaper().getStuckTimeout(),
                properties.getReaper().isEnabled() ? "enabled" : "disabled");
    }

    @Scheduled(fixedDelayString = "#{@pluginBuildsProperties.rateLimit.sweepInterval.toMillis()}")
    public void sweepRateLimits() {
        for (RateLimiter limiter : rateLimiters) {
            try {
                limiter.sweep();
            } catch (Exception e) {
                log.error("Rate limit sweep failed for '{}': {}", limiter.getName(), e.getMessage(), e);
            }
        }
    }

    @Scheduled(
            initialDelayString = "#{@pluginBuildsProperties.reaper.interval.toMillis()}",
            fixedDelayString = "#{@pluginBuildsProperties.reaper.interval.toMillis()}")
    public void reapStuckBuilds() {
        if (!properties.getReaper().isEnabled()) {
            return;
        }
        try {
            int failed = buildRecordManager.failStuckBuilds(properties.getReaper().getStuckTimeout());
            if (failed > 0) {
                log.warn("Reaper failed {} stuck builds", failed);
            }
        } catch (Exception e) {
            log.error("Stuck build reaper failed: {}", e.getMessage(), e);
        }
    }
}
