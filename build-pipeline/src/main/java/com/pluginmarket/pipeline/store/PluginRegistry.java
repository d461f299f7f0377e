package com.pluginmarket.pipeline.store;

import com.pluginmarket.pipeline.model.Plugin;
import com.pluginmarket.pipeline.model.PluginVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plugin metadata, repository links and published versions.
 * Browsing and authoring live elsewhere; this covers what the build
 * pipeline reads and writes.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PluginRegistry {

    private static final RowMapper<Plugin> PLUGIN_MAPPER = (rs, rowNum) -> Plugin.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .authorId(rs.getString("author_id"))
            .repositoryId(rs.getObject("repository_id", Long.class))
            .repositoryFullName(rs.getString("repository_full_name"))
            .pluginSubpath(rs.getString("plugin_subpath"))
            .currentVersion(rs.getString("current_version"))
            .downloads(rs.getLong("downloads"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();

    private static final RowMapper<PluginVersion> VERSION_MAPPER = (rs, rowNum) -> PluginVersion.builder()
            .id(rs.getString("id"))
            .pluginId(rs.getString("plugin_id"))
            .version(rs.getString("version"))
            .downloadUrl(rs.getString("download_url"))
            .checksum(rs.getString("checksum"))
            .fileSize(rs.getObject("file_size", Long.class))
            .latest(rs.getBoolean("is_latest"))
            .prerelease(rs.getBoolean("is_prerelease"))
            .changelog(rs.getString("changelog"))
            .downloads(rs.getLong("downloads"))
            .publishedAt(rs.getTimestamp("published_at").toInstant())
            .build();

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring plugin registry schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS plugins
            (
                id                   VARCHAR(255) PRIMARY KEY,
                name                 VARCHAR(255) NOT NULL,
                author_id            VARCHAR(255),
                repository_id        BIGINT UNIQUE,
                repository_full_name VARCHAR(512),
                plugin_subpath       VARCHAR(512),
                current_version      VARCHAR(100),
                downloads            BIGINT DEFAULT 0 NOT NULL,
                created_at           TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS plugin_versions
            (
                id            VARCHAR(36) PRIMARY KEY,
                plugin_id     VARCHAR(255) NOT NULL,
                version       VARCHAR(100) NOT NULL,
                download_url  VARCHAR(2048),
                checksum      VARCHAR(128),
                file_size     BIGINT,
                is_latest     BOOLEAN DEFAULT FALSE NOT NULL,
                is_prerelease BOOLEAN DEFAULT FALSE NOT NULL,
                changelog     VARCHAR,
                downloads     BIGINT DEFAULT 0 NOT NULL,
                published_at  TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_plugin_versions_plugin ON plugin_versions (plugin_id, version)");
    }

    public Optional<Plugin> findById(String pluginId) {
        List<Plugin> rows = jdbcTemplate.query("SELECT * FROM plugins WHERE id = ?", PLUGIN_MAPPER, pluginId);
        return rows.stream().findFirst().map(this::withVersions);
    }

    public Optional<Plugin> findByRepositoryId(long repositoryId) {
        List<Plugin> rows = jdbcTemplate.query(
                "SELECT * FROM plugins WHERE repository_id = ?", PLUGIN_MAPPER, repositoryId);
        return rows.stream().findFirst().map(this::withVersions);
    }

    /**
     * Registers a plugin and links it to its source repository.
     */
    public void register(Plugin plugin) {
        jdbcTemplate.update("""
                INSERT INTO plugins
                (id, name, author_id, repository_id, repository_full_name, plugin_subpath,
                 current_version, downloads, created_at)
                VALUES (?,?,?,?,?,?,?,?,?)
                """,
                plugin.getId(),
                plugin.getName() != null ? plugin.getName() : plugin.getId(),
                plugin.getAuthorId(),
                plugin.getRepositoryId(),
                plugin.getRepositoryFullName(),
                plugin.getPluginSubpath(),
                plugin.getCurrentVersion(),
                plugin.getDownloads(),
                Timestamp.from(plugin.getCreatedAt() != null ? plugin.getCreatedAt() : Instant.now()));
        log.info("Registered plugin {} for repository {}", plugin.getId(), plugin.getRepositoryFullName());
    }

    /**
     * Publishes a built version. A stable release becomes the latest version
     * and the plugin's current version; a prerelease does neither.
     */
    public PluginVersion publishVersion(PluginVersion version, Instant now) {
        String versionId = UUID.randomUUID().toString();

        if (version.isLatest()) {
            jdbcTemplate.update(
                    "UPDATE plugin_versions SET is_latest = FALSE WHERE plugin_id = ? AND is_latest = TRUE",
                    version.getPluginId());
        }

        jdbcTemplate.update("""
                INSERT INTO plugin_versions
                (id, plugin_id, version, download_url, checksum, file_size, is_latest, is_prerelease,
                 changelog, downloads, published_at)
                VALUES (?,?,?,?,?,?,?,?,?,0,?)
                """,
                versionId,
                version.getPluginId(),
                version.getVersion(),
                version.getDownloadUrl(),
                version.getChecksum(),
                version.getFileSize(),
                version.isLatest(),
                version.isPrerelease(),
                version.getChangelog(),
                Timestamp.from(now));

        if (version.isLatest()) {
            jdbcTemplate.update("UPDATE plugins SET current_version = ? WHERE id = ?",
                    version.getVersion(), version.getPluginId());
        }

        log.info("Published {}@{} (version id {}, latest={})",
                version.getPluginId(), version.getVersion(), versionId, version.isLatest());

        version.setId(versionId);
        version.setPublishedAt(now);
        return version;
    }

    public void incrementDownloads(String pluginId, String versionId) {
        jdbcTemplate.update("UPDATE plugins SET downloads = downloads + 1 WHERE id = ?", pluginId);
        if (versionId != null) {
            jdbcTemplate.update("UPDATE plugin_versions SET downloads = downloads + 1 WHERE id = ?", versionId);
        }
    }

    private Plugin withVersions(Plugin plugin) {
        plugin.setVersions(jdbcTemplate.query(
                "SELECT * FROM plugin_versions WHERE plugin_id = ? ORDER BY published_at DESC",
                VERSION_MAPPER, plugin.getId()));
        return plugin;
    }
}
