package com.pluginmarket.pipeline.output;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.model.DownloadEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTelemetryWriterTest {

    @TempDir
    Path tempDir;

    private PluginBuildsProperties properties;
    private CsvTelemetryWriter writer;

    @BeforeEach
    void setUp() {
        properties = new PluginBuildsProperties();
        properties.getTelemetry().getCsv().setOutputDir(tempDir.resolve("telemetry").toString());
        writer = new CsvTelemetryWriter(properties);
    }

    private static DownloadEvent event(String id, Instant at) {
        return DownloadEvent.builder()
                .id(id)
                .pluginId("demo-plugin")
                .versionId("v-1")
                .version("1.0.0")
                .ipHash("fec52565aa0cf18f")
                .userAgent("desktop, beta")
                .timestamp(at)
                .build();
    }

    @Test
    void writesHeaderOnceAndOneRowPerEvent() throws Exception {
        writer.write(event("e1", Instant.parse("2026-03-01T10:00:00Z")));
        writer.write(event("e2", Instant.parse("2026-03-01T23:59:59Z")));

        Path file = tempDir.resolve("telemetry").resolve("downloads_2026-03-01.csv");
        List<String> lines = Files.readAllLines(file);

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("\"id\",\"plugin_id\"");
        assertThat(lines.get(1))
                .startsWith("\"e1\",\"demo-plugin\",\"v-1\",\"1.0.0\",\"\",\"fec52565aa0cf18f\"")
                .contains("\"desktop, beta\"");
    }

    @Test
    void startsNewFileEachUtcDay() {
        writer.write(event("e1", Instant.parse("2026-03-01T23:59:59Z")));
        writer.write(event("e2", Instant.parse("2026-03-02T00:00:01Z")));

        assertThat(tempDir.resolve("telemetry").resolve("downloads_2026-03-01.csv")).exists();
        assertThat(tempDir.resolve("telemetry").resolve("downloads_2026-03-02.csv")).exists();
    }

    @Test
    void headerCanBeDisabled() throws Exception {
        properties.getTelemetry().getCsv().setIncludeHeader(false);

        writer.write(event("e1", Instant.parse("2026-03-01T10:00:00Z")));

        assertThat(Files.readAllLines(tempDir.resolve("telemetry").resolve("downloads_2026-03-01.csv")))
                .hasSize(1);
    }
}
