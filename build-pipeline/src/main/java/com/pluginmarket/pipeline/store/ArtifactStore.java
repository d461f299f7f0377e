package com.pluginmarket.pipeline.store;

import com.pluginmarket.pipeline.model.Artifact;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of download locations for published versions.
 */
@Repository
@RequiredArgsConstructor
public class ArtifactStore {

    private static final RowMapper<Artifact> ARTIFACT_MAPPER = (rs, rowNum) -> new Artifact(
            rs.getString("download_url"),
            rs.getString("version"),
            rs.getString("checksum"));

    private final JdbcTemplate jdbcTemplate;

    /**
     * @param version exact version string, or null for the plugin's latest stable version
     */
    public Optional<Artifact> findArtifact(String pluginId, String version) {
        List<Artifact> rows;
        if (version != null && !version.isBlank()) {
            rows = jdbcTemplate.query("""
                    SELECT download_url, version, checksum FROM plugin_versions
                     WHERE plugin_id = ? AND version = ?
                     ORDER BY published_at DESC
                     LIMIT 1
                    """, ARTIFACT_MAPPER, pluginId, version);
        } else {
            rows = jdbcTemplate.query("""
                    SELECT download_url, version, checksum FROM plugin_versions
                     WHERE plugin_id = ? AND is_latest = TRUE
                     ORDER BY published_at DESC
                     LIMIT 1
                    """, ARTIFACT_MAPPER, pluginId);
        }
        return rows.stream().findFirst();
    }
}
