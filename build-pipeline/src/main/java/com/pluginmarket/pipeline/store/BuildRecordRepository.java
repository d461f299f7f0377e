package com.pluginmarket.pipeline.store;

import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.BuildStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC storage for build records.
 *
 * Status changes are a single conditional UPDATE keyed on the expected current
 * status, so a reader sees either the old row or the new one and two writers
 * can never both win the same transition.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class BuildRecordRepository {

    private static final String COLUMNS = """
            id, plugin_id, version, status, source_event_id, source_tag, source_release_name,
            source_archive_url, prerelease, changelog, plugin_subpath, error_message, version_id,
            created_at, updated_at
            """;

    private static final RowMapper<BuildRecord> ROW_MAPPER = (rs, rowNum) -> BuildRecord.builder()
            .id(rs.getString("id"))
            .pluginId(rs.getString("plugin_id"))
            .version(rs.getString("version"))
            .status(BuildStatus.fromValue(rs.getString("status")))
            .sourceEventId(rs.getObject("source_event_id", Long.class))
            .sourceTag(rs.getString("source_tag"))
            .sourceReleaseName(rs.getString("source_release_name"))
            .sourceArchiveUrl(rs.getString("source_archive_url"))
            .prerelease(rs.getBoolean("prerelease"))
            .changelog(rs.getString("changelog"))
            .pluginSubpath(rs.getString("plugin_subpath"))
            .errorMessage(rs.getString("error_message"))
            .versionId(rs.getString("version_id"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring plugin_builds schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS plugin_builds
            (
                seq                 BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                id                  VARCHAR(36) NOT NULL UNIQUE,
                plugin_id           VARCHAR(255) NOT NULL,
                version             VARCHAR(100) NOT NULL,
                status              VARCHAR(16) NOT NULL,
                source_event_id     BIGINT,
                source_tag          VARCHAR(255),
                source_release_name VARCHAR(255),
                source_archive_url  VARCHAR(2048),
                prerelease          BOOLEAN DEFAULT FALSE NOT NULL,
                changelog           VARCHAR,
                plugin_subpath      VARCHAR(512),
                error_message       VARCHAR,
                version_id          VARCHAR(36),
                created_at          TIMESTAMP NOT NULL,
                updated_at          TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_plugin_builds_plugin ON plugin_builds (plugin_id, created_at)");
    }

    public void insert(BuildRecord build) {
        jdbcTemplate.update("INSERT INTO plugin_builds (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                build.getId(),
                build.getPluginId(),
                build.getVersion(),
                build.getStatus().value(),
                build.getSourceEventId(),
                build.getSourceTag(),
                build.getSourceReleaseName(),
                build.getSourceArchiveUrl(),
                build.isPrerelease(),
                build.getChangelog(),
                build.getPluginSubpath(),
                build.getErrorMessage(),
                build.getVersionId(),
                Timestamp.from(build.getCreatedAt()),
                Timestamp.from(build.getUpdatedAt()));
    }

    public Optional<BuildRecord> findById(String buildId) {
        List<BuildRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM plugin_builds WHERE id = ?", ROW_MAPPER, buildId);
        return rows.stream().findFirst();
    }

    public Optional<BuildRecord> findLatestByPlugin(String pluginId) {
        return findRecentByPlugin(pluginId, 1).stream().findFirst();
    }

    /** Newest first; insertion order breaks ties on identical timestamps */
    public List<BuildRecord> findRecentByPlugin(String pluginId, int limit) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                 FROM plugin_builds
                WHERE plugin_id = ?
                ORDER BY created_at DESC, seq DESC
                LIMIT ?
                """, ROW_MAPPER, pluginId, limit);
    }

    /** Non-terminal records whose status last changed before the cutoff */
    public List<BuildRecord> findUnfinishedNotUpdatedSince(Instant cutoff) {
        return jdbcTemplate.query("SELECT " + COLUMNS + """
                 FROM plugin_builds
                WHERE status IN (?, ?)
                  AND updated_at < ?
                ORDER BY updated_at ASC
                """, ROW_MAPPER,
                BuildStatus.PENDING.value(), BuildStatus.BUILDING.value(), Timestamp.from(cutoff));
    }

    /**
     * Compare-and-set on status.
     *
     * @return false if the record was not in {@code expected} any more
     */
    public boolean transition(String buildId, BuildStatus expected, BuildStatus target,
                              String errorMessage, Instant now) {
        int updated = jdbcTemplate.update("""
                UPDATE plugin_builds
                   SET status = ?, error_message = ?, updated_at = ?
                 WHERE id = ? AND status = ?
                """,
                target.value(), errorMessage, Timestamp.from(now), buildId, expected.value());
        return updated == 1;
    }

    public void linkVersion(String buildId, String versionId) {
        jdbcTemplate.update("UPDATE plugin_builds SET version_id = ? WHERE id = ?", versionId, buildId);
    }
}
