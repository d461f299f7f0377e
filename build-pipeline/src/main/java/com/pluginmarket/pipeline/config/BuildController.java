package com.pluginmarket.pipeline.config;

import com.pluginmarket.pipeline.exception.BuildNotFoundException;
import com.pluginmarket.pipeline.exception.IllegalBuildTransitionException;
import com.pluginmarket.pipeline.exception.MalformedPayloadException;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.BuildStatusUpdate;
import com.pluginmarket.pipeline.service.BuildRecordManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class BuildController {

    static final int MAX_LIST_LIMIT = 50;

    private final BuildRecordManager buildRecordManager;
    private final PluginBuildsProperties properties;

    // ── Status polling ───────────────────────────────────────────────────────

    @GetMapping("/builds/{buildId}")
    public ResponseEntity<?> getBuild(@PathVariable String buildId) {
        try {
            return buildRecordManager.get(buildId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "Build not found", "code", "BUILD_NOT_FOUND")));
        } catch (Exception e) {
            log.error("Error getting build status for {}: {}", buildId, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to get build status", "code", "INTERNAL_ERROR"));
        }
    }

    /**
     * Recent builds for a plugin, newest first.
     *
     * GET /plugins/{id}/builds?limit=10
     */
    @GetMapping("/plugins/{pluginId}/builds")
    public ResponseEntity<?> listBuilds(@PathVariable String pluginId,
                                        @RequestParam(defaultValue = "10") int limit) {
        try {
            int clamped = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
            List<BuildRecord> builds = buildRecordManager.listRecent(pluginId, clamped);
            return ResponseEntity.ok(Map.of("builds", builds));
        } catch (Exception e) {
            log.error("Error listing builds for {}: {}", pluginId, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to get plugin builds", "code", "INTERNAL_ERROR"));
        }
    }

    // ── Builder callback ─────────────────────────────────────────────────────

    /**
     * Status report from the builder service.
     *
     * POST /builds/{buildId}/status
     * {"pluginId": "...", "status": "success", "artifact": {"downloadUrl": "...", "checksum": "..."}}
     */
    @PostMapping("/builds/{buildId}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String buildId,
                                          @RequestHeader(value = "X-Service-Key", required = false) String serviceKey,
                                          @RequestBody BuildStatusUpdate update) {
        if (!serviceKeyMatches(serviceKey)) {
            log.warn("Rejected status update for build {}: bad service key", buildId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Invalid service key", "code", "INVALID_SERVICE_KEY"));
        }

        try {
            BuildRecord updated = buildRecordManager.applyUpdate(buildId, update);
            return ResponseEntity.ok(updated);
        } catch (BuildNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Build not found", "code", "BUILD_NOT_FOUND"));
        } catch (MalformedPayloadException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage(), "code", "MALFORMED_PAYLOAD"));
        } catch (IllegalBuildTransitionException e) {
            log.warn("Rejected status update: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "code", "ILLEGAL_TRANSITION"));
        } catch (Exception e) {
            log.error("Error updating build {}: {}", buildId, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to update build", "code", "INTERNAL_ERROR"));
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Invalid JSON payload", "code", "MALFORMED_PAYLOAD"));
    }

    private boolean serviceKeyMatches(String provided) {
        String expected = properties.getBuilder().getServiceKey();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return provided != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }
}
