package com.pluginmarket.pipeline.output;

import com.opencsv.CSVWriter;
import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.model.DownloadEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Appends download events to one CSV file per UTC day.
 *
 * Output path pattern: {outputDir}/downloads_{yyyy-MM-dd}.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvTelemetryWriter {

    private final PluginBuildsProperties properties;

    static final String[] HEADERS = {
            "id", "plugin_id", "version_id", "version",
            "requester_id", "ip_hash", "user_agent", "timestamp"
    };

    public synchronized void write(DownloadEvent event) {
        Path outputDir = Paths.get(properties.getTelemetry().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        LocalDate day = event.getTimestamp().atOffset(ZoneOffset.UTC).toLocalDate();
        Path outputPath = outputDir.resolve(String.format("downloads_%s.csv", day));
        boolean newFile = !Files.exists(outputPath);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getTelemetry().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(event));

        } catch (IOException e) {
            log.error("Failed to append download event to {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(DownloadEvent e) {
        return new String[]{
                str(e.getId()),
                str(e.getPluginId()),
                str(e.getVersionId()),
                str(e.getVersion()),
                str(e.getRequesterId()),
                str(e.getIpHash()),
                str(e.getUserAgent()),
                str(e.getTimestamp())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create telemetry directory: " + dir, e);
        }
    }
}
