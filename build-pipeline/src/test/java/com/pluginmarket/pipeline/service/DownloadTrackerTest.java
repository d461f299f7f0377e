package com.pluginmarket.pipeline.service;

import com.pluginmarket.pipeline.MutableClock;
import com.pluginmarket.pipeline.model.ClientInfo;
import com.pluginmarket.pipeline.model.DownloadEvent;
import com.pluginmarket.pipeline.model.Plugin;
import com.pluginmarket.pipeline.model.PluginVersion;
import com.pluginmarket.pipeline.output.TelemetryRouter;
import com.pluginmarket.pipeline.store.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DownloadTracker")
class DownloadTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private TelemetryRouter telemetryRouter;
    @Mock
    private PluginRegistry pluginRegistry;

    private BackgroundTaskRunner backgroundTasks;
    private DownloadTracker tracker;
    private Plugin plugin;

    @BeforeEach
    void setUp() {
        backgroundTasks = new BackgroundTaskRunner(Runnable::run);
        tracker = new DownloadTracker(telemetryRouter, pluginRegistry, backgroundTasks, new MutableClock(NOW));
        plugin = Plugin.builder()
                .id("demo-plugin")
                .versions(List.of(
                        PluginVersion.builder().id("v-210").version("2.1.0").build(),
                        PluginVersion.builder().id("v-200").version("2.0.0").build()))
                .build();
    }

    @Test
    @DisplayName("Should write an anonymised event and bump the counters")
    void recordsDownload() {
        // given
        when(telemetryRouter.write(any())).thenReturn(true);

        // when
        CompletableFuture<Void> future = tracker.track(plugin, "2.0.0",
                new ClientInfo("user-1", "203.0.113.7", "desktop/1.4"));

        // then
        assertThat(future).isCompleted();
        ArgumentCaptor<DownloadEvent> captor = ArgumentCaptor.forClass(DownloadEvent.class);
        verify(telemetryRouter).write(captor.capture());
        DownloadEvent event = captor.getValue();
        assertThat(event.getPluginId()).isEqualTo("demo-plugin");
        assertThat(event.getVersionId()).isEqualTo("v-200");
        assertThat(event.getVersion()).isEqualTo("2.0.0");
        assertThat(event.getRequesterId()).isEqualTo("user-1");
        assertThat(event.getIpHash()).isEqualTo("fec52565aa0cf18f");
        assertThat(event.getUserAgent()).isEqualTo("desktop/1.4");
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        verify(pluginRegistry).incrementDownloads("demo-plugin", "v-200");
    }

    @Test
    @DisplayName("Should not count a repeat download")
    void repeatNotCounted() {
        when(telemetryRouter.write(any())).thenReturn(false);

        tracker.track(plugin, "2.1.0", new ClientInfo(null, "203.0.113.7", null));

        verify(pluginRegistry, never()).incrementDownloads(anyString(), any());
    }

    @Test
    @DisplayName("Should keep tracking failures away from the caller")
    void failureIsContained() {
        when(telemetryRouter.write(any())).thenThrow(new IllegalStateException("disk full"));

        CompletableFuture<Void> future = tracker.track(plugin, "2.1.0", new ClientInfo(null, "203.0.113.7", null));

        assertThat(future).isCompletedExceptionally();
        assertThat(backgroundTasks.stats().failed()).isEqualTo(1);
    }

    @Test
    void hashesIpToSixteenHexChars() {
        assertThat(DownloadTracker.hashIp("203.0.113.7")).isEqualTo("fec52565aa0cf18f").hasSize(16);
        assertThat(DownloadTracker.hashIp(null)).isNull();
        assertThat(DownloadTracker.hashIp("")).isNull();
    }

    @Test
    void versionIdIsNullForUnknownVersion() {
        assertThat(DownloadTracker.resolveVersionId(plugin, "2.1.0")).isEqualTo("v-210");
        assertThat(DownloadTracker.resolveVersionId(plugin, "0.1.0")).isNull();
    }
}
