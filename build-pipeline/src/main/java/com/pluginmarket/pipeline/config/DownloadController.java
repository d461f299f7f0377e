package com.pluginmarket.pipeline.config;

import com.pluginmarket.pipeline.ingress.ClientAddress;
import com.pluginmarket.pipeline.model.Artifact;
import com.pluginmarket.pipeline.model.BuildRecord;
import com.pluginmarket.pipeline.model.ClientInfo;
import com.pluginmarket.pipeline.service.DownloadResolution;
import com.pluginmarket.pipeline.service.DownloadResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadResolver downloadResolver;

    /**
     * Download location for a plugin.
     *
     * GET /plugins/{id}/download?version=1.2.0
     *
     * 200 with {url, version, checksum}, or an error code: 202 BUILDING means
     * poll again later, 404 BUILD_FAILED / NO_VERSION mean there is nothing to fetch.
     */
    @GetMapping("/plugins/{pluginId}/download")
    public ResponseEntity<Map<String, Object>> download(@PathVariable String pluginId,
                                                        @RequestParam(required = false) String version,
                                                        HttpServletRequest request) {
        ClientInfo client = new ClientInfo(
                request.getHeader("X-User-Id"),
                ClientAddress.resolve(request),
                request.getHeader("User-Agent"));

        try {
            DownloadResolution resolution = downloadResolver.resolve(pluginId, version, client);
            return ResponseEntity.status(resolution.outcome().httpStatus()).body(toBody(resolution));
        } catch (Exception e) {
            log.error("Error resolving download for {}: {}", pluginId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Failed to get download URL",
                    "code", DownloadResolution.Outcome.DOWNLOAD_UNAVAILABLE.name()));
        }
    }

    private Map<String, Object> toBody(DownloadResolution resolution) {
        Map<String, Object> body = new LinkedHashMap<>();

        if (resolution.outcome() == DownloadResolution.Outcome.FOUND) {
            Artifact artifact = resolution.artifact();
            body.put("url", artifact.url());
            body.put("version", artifact.version());
            body.put("checksum", artifact.checksum());
            return body;
        }

        body.put("error", resolution.outcome().message());
        body.put("code", resolution.outcome().name());

        BuildRecord build = resolution.build();
        if (build != null) {
            body.put("buildId", build.getId());
            body.put("buildStatus", build.getStatus().value());
            if (resolution.outcome() == DownloadResolution.Outcome.BUILD_FAILED) {
                body.put("errorMessage", build.getErrorMessage());
            }
        }
        return body;
    }
}
