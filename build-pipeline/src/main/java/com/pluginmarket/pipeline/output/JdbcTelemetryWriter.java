package com.pluginmarket.pipeline.output;

import com.pluginmarket.pipeline.config.PluginBuildsProperties;
import com.pluginmarket.pipeline.model.DownloadEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcTelemetryWriter {

    private final JdbcTemplate jdbcTemplate;
    private final PluginBuildsProperties properties;

    public void ensureSchema() {
        log.info("Ensuring download_events schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS download_events
            (
                id           VARCHAR(36) PRIMARY KEY,
                plugin_id    VARCHAR(255) NOT NULL,
                version_id   VARCHAR(36),
                version      VARCHAR(100),
                requester_id VARCHAR(255),
                ip_hash      VARCHAR(16),
                user_agent   VARCHAR(1024),
                created_at   TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_download_events_dedup ON download_events (version_id, ip_hash, created_at)");
    }

    /**
     * Appends the event unless the same IP hash already downloaded the same
     * version within the duplicate window.
     *
     * @return true if a row was written
     */
    public boolean write(DownloadEvent event) {
        if (event.getIpHash() != null && event.getVersionId() != null) {
            Timestamp since = Timestamp.from(
                    event.getTimestamp().minus(properties.getTelemetry().getDuplicateWindow()));
            Integer recent = jdbcTemplate.queryForObject("""
                    SELECT COUNT(*) FROM download_events
                     WHERE version_id = ? AND ip_hash = ? AND created_at > ?
                    """, Integer.class, event.getVersionId(), event.getIpHash(), since);
            if (recent != null && recent > 0) {
                log.debug("Skipping repeat download of version {} from {}", event.getVersionId(), event.getIpHash());
                return false;
            }
        }

        jdbcTemplate.update("""
                INSERT INTO download_events
                (id, plugin_id, version_id, version, requester_id, ip_hash, user_agent, created_at)
                VALUES (?,?,?,?,?,?,?,?)
                """,
                event.getId(),
                event.getPluginId(),
                event.getVersionId(),
                event.getVersion(),
                event.getRequesterId(),
                event.getIpHash(),
                truncate(event.getUserAgent(), 1024),
                Timestamp.from(event.getTimestamp()));
        return true;
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
