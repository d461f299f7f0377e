package com.pluginmarket.pipeline.output;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.config.PluginBuildsProperties.Telemetry.TelemetryMode;
import com.pluginmarket.pipeline.model.DownloadEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelemetryRouterTest {

    private static final DownloadEvent EVENT = DownloadEvent.builder()
            .id("e1")
            .pluginId("demo-plugin")
            .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
            .build();

    @Mock
    private JdbcTelemetryWriter jdbcWriter;
    @Mock
    private CsvTelemetryWriter csvWriter;

    private PluginBuildsProperties properties;
    private TelemetryRouter router;

    @BeforeEach
    void setUp() {
        properties = new PluginBuildsProperties();
        router = new TelemetryRouter(jdbcWriter, csvWriter, properties);
    }

    @Test
    void jdbcModeUsesDatabaseVerdict() {
        when(jdbcWriter.write(EVENT)).thenReturn(false);

        assertThat(router.write(EVENT)).isFalse();
        verifyNoInteractions(csvWriter);
        assertThat(router.usesJdbc()).isTrue();
    }

    @Test
    void csvModeCountsEverything() {
        properties.getTelemetry().setMode(TelemetryMode.CSV);

        assertThat(router.write(EVENT)).isTrue();
        verify(csvWriter).write(EVENT);
        verifyNoInteractions(jdbcWriter);
        assertThat(router.usesJdbc()).isFalse();
    }

    @Test
    void bothModeWritesBoth() {
        properties.getTelemetry().setMode(TelemetryMode.BOTH);
        when(jdbcWriter.write(EVENT)).thenReturn(true);

        assertThat(router.write(EVENT)).isTrue();
        verify(csvWriter).write(EVENT);
    }
}
