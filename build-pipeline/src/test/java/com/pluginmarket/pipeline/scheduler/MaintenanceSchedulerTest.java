package com.pluginmarket.pipeline.scheduler;

import com.pluginmarket.pipeline.MutableClock;
import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.ingress.RateLimiter;
import com.pluginmarket.pipeline.output.JdbcTelemetryWriter;
import com.pluginmarket.pipeline.output.TelemetryRouter;
import com.pluginmarket.pipeline.service.BuildRecordManager;
import com.pluginmarket.pipeline.store.BuildRecordRepository;
import com.pluginmarket.pipeline.store.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock
    private BuildRecordRepository buildRecordRepository;
    @Mock
    private PluginRegistry pluginRegistry;
    @Mock
    private JdbcTelemetryWriter jdbcTelemetryWriter;
    @Mock
    private TelemetryRouter telemetryRouter;
    @Mock
    private BuildRecordManager buildRecordManager;

    private MutableClock clock;
    private RateLimiter limiter;
    private PluginBuildsProperties properties;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        limiter = new RateLimiter("public", 10, Duration.ofSeconds(60), clock);
        properties = new PluginBuildsProperties();
        scheduler = new MaintenanceScheduler(buildRecordRepository, pluginRegistry, jdbcTelemetryWriter,
                telemetryRouter, buildRecordManager, List.of(limiter), properties);
    }

    @Test
    void startupCreatesSchemas() {
        when(telemetryRouter.usesJdbc()).thenReturn(true);

        scheduler.onStartup();

        verify(pluginRegistry).ensureSchema();
        verify(buildRecordRepository).ensureSchema();
        verify(jdbcTelemetryWriter).ensureSchema();
    }

    @Test
    void csvOnlyTelemetrySkipsEventTable() {
        when(telemetryRouter.usesJdbc()).thenReturn(false);

        scheduler.onStartup();

        verify(jdbcTelemetryWriter, never()).ensureSchema();
    }

    @Test
    void sweepDropsExpiredWindows() {
        limiter.tryAcquire("198.51.100.1");
        clock.advance(Duration.ofSeconds(61));

        scheduler.sweepRateLimits();

        assertThat(limiter.trackedKeys()).isZero();
    }

    @Test
    void reaperUsesConfiguredTimeout() {
        properties.getReaper().setStuckTimeout(Duration.ofMinutes(45));

        scheduler.reapStuckBuilds();

        verify(buildRecordManager).failStuckBuilds(Duration.ofMinutes(45));
    }

    @Test
    void disabledReaperDoesNothing() {
        properties.getReaper().setEnabled(false);

        scheduler.reapStuckBuilds();

        verify(buildRecordManager, never()).failStuckBuilds(any());
    }

    @Test
    void reaperErrorsDoNotEscape() {
        when(buildRecordManager.failStuckBuilds(any())).thenThrow(new IllegalStateException("db down"));

        scheduler.reapStuckBuilds();
    }
}
