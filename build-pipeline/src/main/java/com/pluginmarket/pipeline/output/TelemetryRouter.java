package com.pluginmarket.pipeline.output;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.config.PluginBuildsProperties.Telemetry.TelemetryMode;
import com.pluginmarket.pipeline.model.DownloadEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes download events to the configured sink(s): JDBC, CSV or BOTH.
 */
@Component
@RequiredArgsConstructor
public class TelemetryRouter {

    private final JdbcTelemetryWriter jdbcTelemetryWriter;
    private final CsvTelemetryWriter csvTelemetryWriter;
    private final PluginBuildsProperties properties;

    /**
     * @return whether the event counts as a new download. Only the JDBC sink
     *         can recognise repeats; CSV-only mode counts everything.
     */
    public boolean write(DownloadEvent event) {
        TelemetryMode mode = properties.getTelemetry().getMode();

        return switch (mode) {
            case JDBC -> jdbcTelemetryWriter.write(event);
            case CSV -> {
                csvTelemetryWriter.write(event);
                yield true;
            }
            case BOTH -> {
                boolean counted = jdbcTelemetryWriter.write(event);
                csvTelemetryWriter.write(event);
                yield counted;
            }
        };
    }

    public boolean usesJdbc() {
        return properties.getTelemetry().getMode() != TelemetryMode.CSV;
    }
}
